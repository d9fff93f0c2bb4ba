package com.scholary.radio.playout;

import com.scholary.radio.track.PlayoutRequest;
import java.util.List;
import java.util.Optional;

/**
 * Picks the next item from a list of sources in priority order.
 *
 * <p>The first source with an item ready wins. The selector is only consulted when the item on air
 * has finished, so a source that becomes ready mid-item waits for the boundary; nothing is ever cut
 * off.
 */
public class TrackSensitiveFallback implements RequestSource {

  private final List<RequestSource> sources;
  private RequestSource lastSource;

  public TrackSensitiveFallback(List<RequestSource> sources) {
    if (sources.isEmpty()) {
      throw new IllegalArgumentException("At least one source is required");
    }
    this.sources = List.copyOf(sources);
  }

  @Override
  public Optional<PlayoutRequest> next() {
    for (RequestSource source : sources) {
      Optional<PlayoutRequest> request = source.next();
      if (request.isPresent()) {
        lastSource = source;
        return request;
      }
    }
    lastSource = null;
    return Optional.empty();
  }

  /** Passes the notification on to the source the item came from. */
  @Override
  public void onTrackStarted(PlayoutRequest request) {
    if (lastSource != null) {
      lastSource.onTrackStarted(request);
    }
  }
}
