package com.scholary.radio.narration;

import com.scholary.radio.track.TrackMetadata;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the instruction sent to the text-generation service.
 *
 * <p>Each track is rendered as {@code "<title> by <artist>"}; the played tracks are joined with
 * {@code ", "}. Both renderings are embedded in a fixed template.
 */
public final class NarrationPrompt {

  private static final String TEMPLATE =
      "You are the host of a music radio station. The last songs played were: %s. "
          + "Write a short, entertaining narration of about 200 words about these songs, "
          + "mentioning their style, the year they came out, the instruments that stand out "
          + "and their cultural context. Write it to be read aloud, with no stage directions "
          + "or emoji. %s";

  private static final String INTRODUCE_NEXT =
      "Finish by introducing the next song, which is %s.";

  private static final String NO_NEXT = "Finish by inviting the listeners to stay tuned.";

  private NarrationPrompt() {}

  public static String build(List<TrackMetadata> history, TrackMetadata next) {
    String played =
        history.stream().map(NarrationPrompt::describe).collect(Collectors.joining(", "));
    String closing = next == null ? NO_NEXT : String.format(INTRODUCE_NEXT, describe(next));
    return String.format(TEMPLATE, played, closing);
  }

  public static String describe(TrackMetadata track) {
    return track.title() + " by " + track.artist();
  }
}
