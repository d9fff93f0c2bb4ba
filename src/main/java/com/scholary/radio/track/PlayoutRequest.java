package com.scholary.radio.track;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A playable item handed to the output stage.
 *
 * <p>Library tracks start unresolved ({@code metadata == null}) and are resolved by the lookahead
 * hook before they play. Narrations are created by the generation client with a fixed title.
 */
public record PlayoutRequest(Path file, Kind kind, String title, TrackMetadata metadata) {

  public enum Kind {
    TRACK,
    NARRATION
  }

  public PlayoutRequest {
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(kind, "kind");
  }

  public static PlayoutRequest track(Path file) {
    return new PlayoutRequest(file, Kind.TRACK, null, null);
  }

  public static PlayoutRequest narration(Path file, String title) {
    return new PlayoutRequest(file, Kind.NARRATION, title, null);
  }

  public boolean isResolved() {
    return metadata != null;
  }

  public PlayoutRequest withMetadata(TrackMetadata resolved) {
    return new PlayoutRequest(file, kind, title, resolved);
  }

  /** Title shown while the item plays. */
  public String displayTitle() {
    if (title != null) {
      return title;
    }
    if (metadata != null && !metadata.title().isEmpty()) {
      return metadata.title();
    }
    return file.getFileName().toString();
  }
}
