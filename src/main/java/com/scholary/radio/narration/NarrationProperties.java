package com.scholary.radio.narration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the text-generation and speech-synthesis services.
 *
 * <p>Both services share the base URL and the API key. The key is sent as a bearer token.
 */
@ConfigurationProperties(prefix = "narration")
@Validated
public record NarrationProperties(
    @NotBlank String baseUrl,
    @NotBlank String apiKey,
    @NotBlank String chatModel,
    @NotBlank String speechModel,
    @NotBlank String voice,
    @NotBlank String responseFormat,
    @Positive double speed,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @NotBlank String tempDir) {}
