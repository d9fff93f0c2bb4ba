package com.scholary.radio.station;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the station itself.
 *
 * <p>Where the music library lives, how the playlist is ordered and buffered, which cover to show
 * when a track has none, and whether playout starts with the application.
 */
@ConfigurationProperties(prefix = "station")
@Validated
public record StationProperties(
    @NotBlank String libraryDir,
    @NotBlank String defaultCover,
    @PositiveOrZero int prefetch,
    boolean shuffle,
    boolean autostart,
    @Positive long idleRetryMillis) {}
