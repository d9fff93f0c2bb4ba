package com.scholary.radio.ffmpeg;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the ffmpeg and ffprobe binaries.
 *
 * <p>Controls where the binaries live, where the HLS output is written and how the audio is
 * encoded. Encoding itself is entirely ffmpeg's business.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @NotBlank String hlsOutputDir,
    @Positive int hlsSegmentSeconds,
    @Positive int hlsListSize,
    @NotBlank String audioBitrate,
    @Positive int coverExtractTimeoutSeconds) {}
