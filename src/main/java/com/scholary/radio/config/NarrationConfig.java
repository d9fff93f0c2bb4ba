package com.scholary.radio.config;

import com.scholary.radio.narration.NarrationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the narration client.
 *
 * <p>Enables the NarrationProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(NarrationProperties.class)
public class NarrationConfig {}
