package com.scholary.radio.track;

import java.util.List;

/** Receives each completed history batch. Implementations must return quickly. */
@FunctionalInterface
public interface BatchListener {

  /**
   * @param history the tracks of the batch, oldest first
   * @param next the resolved upcoming track, or null if nothing has been resolved yet
   */
  void onBatchReady(List<TrackMetadata> history, TrackMetadata next);
}
