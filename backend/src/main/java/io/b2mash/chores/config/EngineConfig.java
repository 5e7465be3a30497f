package io.b2mash.chores.config;

import java.time.Clock;
import java.time.ZoneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ChoresEngineProperties.class)
public class EngineConfig {

  private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

  /** Clock for the HTTP adapter only. Engine components take "today" as a parameter. */
  @Bean
  public Clock hostClock(ChoresEngineProperties properties) {
    var zone = ZoneId.of(properties.zone());
    log.info("Deriving the default local day in zone {}", zone);
    return Clock.system(zone);
  }
}
