package io.b2mash.b2b.backoffice.config;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SchedulingProperties.class)
public class SchedulingConfig {

  private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

  @Bean
  public Clock schedulingClock(SchedulingProperties properties) {
    log.info(
        "Scheduling clock configured: zone={}, previewLimit={}",
        properties.zone(),
        properties.previewLimit());
    return Clock.system(properties.zone());
  }
}
