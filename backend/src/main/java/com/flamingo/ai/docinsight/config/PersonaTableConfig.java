package com.flamingo.ai.docinsight.config;

import com.flamingo.ai.docinsight.service.persona.PersonaPreferenceTable;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Exposes the persona preference and section-affinity table. */
@Configuration
public class PersonaTableConfig {

  @Bean
  public PersonaPreferenceTable personaPreferenceTable() {
    return PersonaPreferenceTable.defaults();
  }
}
