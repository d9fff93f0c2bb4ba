package com.scholary.radio.api;

/**
 * What the stream is playing right now.
 *
 * <p>{@code title} and {@code artist} describe the last library track; {@code onAir} is the item
 * actually playing, which may be a narration. Times are in seconds, -1 when unknown.
 */
public record NowPlayingResponse(
    String title,
    String artist,
    String onAir,
    String kind,
    String coverUrl,
    double progress,
    double elapsedSeconds,
    double remainingSeconds,
    double durationSeconds,
    String nextTrack,
    int historySize,
    int batchSize,
    int queuedNarrations) {}
