package com.scholary.radio.track;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Keeps one track of lookahead and the rolling batch of played tracks.
 *
 * <p>Two callbacks drive it, both on the playout thread:
 *
 * <ul>
 *   <li>{@link #checkNext} runs when the playlist buffers an upcoming item. The item is resolved
 *       and its metadata becomes the next-track slot, so the upcoming track is known before it
 *       starts.
 *   <li>{@link #onMetadata} runs when a track starts playing. The track joins the batch, and when
 *       the batch is full it is handed off together with the next-track slot and cleared.
 * </ul>
 *
 * <p>The batch and the slot have a single writer, so they are not locked. The slot is volatile
 * because the HTTP layer reads it.
 */
@Component
public class TrackHistoryTracker {

  private static final Logger LOGGER = LoggerFactory.getLogger(TrackHistoryTracker.class);

  private final TrackResolver trackResolver;
  private final BatchListener batchListener;
  private final NowPlayingState nowPlaying;
  private final int batchSize;

  private final List<TrackMetadata> history = new ArrayList<>();
  private volatile TrackMetadata nextTrack;

  public TrackHistoryTracker(
      TrackResolver trackResolver,
      BatchListener batchListener,
      NowPlayingState nowPlaying,
      @Value("${narration.batchSize:4}") int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
    }
    this.trackResolver = trackResolver;
    this.batchListener = batchListener;
    this.nowPlaying = nowPlaying;
    this.batchSize = batchSize;
  }

  /**
   * Lookahead hook: resolve the candidate and remember it as the next track.
   *
   * @param candidate the item the playlist is about to buffer
   * @return the resolved item, or empty if it cannot be located
   */
  public Optional<PlayoutRequest> checkNext(PlayoutRequest candidate) {
    try {
      PlayoutRequest resolved = trackResolver.resolve(candidate);
      nextTrack = resolved.metadata();
      LOGGER.debug("Next track resolved: {}", resolved.displayTitle());
      return Optional.of(resolved);
    } catch (TrackResolutionException e) {
      LOGGER.warn("Skipping upcoming item: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * A track started playing.
   *
   * @param metadata the metadata of the track now on air
   */
  public void onMetadata(TrackMetadata metadata) {
    nowPlaying.update(metadata);
    history.add(metadata);
    LOGGER.info(
        "Now playing: {} by {} ({}/{})",
        metadata.title(),
        metadata.artist(),
        history.size(),
        batchSize);

    if (history.size() >= batchSize) {
      List<TrackMetadata> batch = List.copyOf(history);
      history.clear();
      try {
        batchListener.onBatchReady(batch, nextTrack);
      } catch (RuntimeException e) {
        LOGGER.error("Batch hand-off failed, dropping batch of {} tracks", batch.size(), e);
      }
    }
  }

  public Optional<TrackMetadata> nextTrack() {
    return Optional.ofNullable(nextTrack);
  }

  public int historySize() {
    return history.size();
  }

  public int batchSize() {
    return batchSize;
  }
}
