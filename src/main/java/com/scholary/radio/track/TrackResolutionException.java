package com.scholary.radio.track;

/**
 * Exception thrown when a playlist candidate cannot be located or opened.
 *
 * <p>The lookahead hook catches it and skips the candidate.
 */
public class TrackResolutionException extends RuntimeException {

  public TrackResolutionException(String message) {
    super(message);
  }

  public TrackResolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
