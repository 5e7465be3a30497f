package io.b2mash.chores.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the chores engine.
 *
 * @param zone time zone the HTTP adapter uses to derive "today" when a request omits it; the
 *     engine itself never reads a clock
 */
@ConfigurationProperties(prefix = "chores.engine")
public record ChoresEngineProperties(String zone) {

  public ChoresEngineProperties {
    zone = zone == null || zone.isBlank() ? "UTC" : zone;
  }
}
