package com.scholary.radio.playout;

import com.scholary.radio.track.PlayoutRequest;
import java.io.IOException;

/**
 * The output stage. Plays one item at a time.
 *
 * <p>Decoding, encoding and delivery are entirely the sink's business.
 */
public interface PlayoutSink {

  /**
   * Play an item, returning once it has finished playing.
   *
   * @param request the item to play
   * @throws IOException if the item could not be played
   * @throws InterruptedException if playout was stopped
   */
  void play(PlayoutRequest request) throws IOException, InterruptedException;

  /** Abort whatever is playing. */
  default void stop() {}
}
