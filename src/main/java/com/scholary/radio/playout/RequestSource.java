package com.scholary.radio.playout;

import com.scholary.radio.track.PlayoutRequest;
import java.util.Optional;

/**
 * Something the playout loop can take items from.
 *
 * <p>Asked only at item boundaries.
 */
public interface RequestSource {

  /** The next item, or empty if this source has nothing ready. */
  Optional<PlayoutRequest> next();

  /** Called when an item taken from this source goes on air. */
  default void onTrackStarted(PlayoutRequest request) {}
}
