package com.flamingo.ai.docinsight.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Single time source, used for the processing timestamp of analysis results. */
@Configuration
public class ClockConfig {

  @Value("${docinsight.timezone:UTC}")
  private String timezone;

  @Bean
  public Clock clock() {
    String zone = timezone == null || timezone.isBlank() ? "UTC" : timezone.trim();
    return Clock.system(ZoneId.of(zone));
  }
}
