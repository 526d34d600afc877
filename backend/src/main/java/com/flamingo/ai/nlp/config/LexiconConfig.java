package com.flamingo.ai.nlp.config;

import com.flamingo.ai.nlp.domain.model.Lexicon;
import com.flamingo.ai.nlp.lexicon.LexiconLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Exposes the shared, read-only lexicon loaded once at startup. */
@Configuration
public class LexiconConfig {

  @Bean
  public Lexicon lexicon(LexiconLoader lexiconLoader, NlpConfig nlpConfig) {
    return lexiconLoader.load(nlpConfig.getLexicon().getLocation());
  }
}
