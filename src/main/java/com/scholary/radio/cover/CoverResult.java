package com.scholary.radio.cover;

import java.nio.file.Path;

/**
 * Outcome of a cover extraction.
 *
 * <p>Falling back to the default cover is an expected outcome (most streams have tracks without
 * art), so it is a value here rather than an exception.
 */
public record CoverResult(Outcome outcome, Path path, String reason) {

  public enum Outcome {
    EXTRACTED,
    DEFAULT
  }

  public static CoverResult extracted(Path path) {
    return new CoverResult(Outcome.EXTRACTED, path, null);
  }

  public static CoverResult fallback(Path defaultCover, String reason) {
    return new CoverResult(Outcome.DEFAULT, defaultCover, reason);
  }

  public boolean isDefault() {
    return outcome == Outcome.DEFAULT;
  }
}
