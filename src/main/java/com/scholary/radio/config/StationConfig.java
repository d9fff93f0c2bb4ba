package com.scholary.radio.config;

import com.scholary.radio.station.StationProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the station.
 *
 * <p>Enables the StationProperties and provides the clock playback positions are measured with.
 */
@Configuration
@EnableConfigurationProperties(StationProperties.class)
public class StationConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
