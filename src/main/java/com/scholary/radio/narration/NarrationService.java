package com.scholary.radio.narration;

import com.scholary.radio.track.PlayoutRequest;
import com.scholary.radio.track.TrackMetadata;
import java.util.List;

/**
 * Interface for narration generation.
 *
 * <p>This abstraction allows us to swap text and speech providers without changing the scheduler.
 */
public interface NarrationService {

  /**
   * Generate a narration from a prompt.
   *
   * <p>Blocks for the duration of both service calls.
   *
   * @param prompt the instruction for the text-generation service
   * @return a playable request for the synthesized narration
   * @throws NarrationException if either service call fails
   */
  PlayoutRequest generateNarration(String prompt);

  /**
   * Generate a narration about a batch of played tracks and the upcoming one.
   *
   * @param history the played tracks, oldest first
   * @param next the upcoming track, or null
   * @return a playable request for the synthesized narration
   * @throws NarrationException if either service call fails
   */
  default PlayoutRequest generateNarration(List<TrackMetadata> history, TrackMetadata next) {
    return generateNarration(NarrationPrompt.build(history, next));
  }
}
