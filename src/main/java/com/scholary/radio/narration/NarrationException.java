package com.scholary.radio.narration;

/**
 * Exception thrown when a narration cannot be generated.
 *
 * <p>This covers error statuses from either service and transport failures. It only ever aborts
 * the one narration being generated.
 */
public class NarrationException extends RuntimeException {

  public NarrationException(String message) {
    super(message);
  }

  public NarrationException(String message, Throwable cause) {
    super(message, cause);
  }
}
