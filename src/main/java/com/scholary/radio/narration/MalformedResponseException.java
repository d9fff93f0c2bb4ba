package com.scholary.radio.narration;

/** The text-generation service answered 200 with a body we cannot use. */
public class MalformedResponseException extends NarrationException {

  public MalformedResponseException(String message) {
    super(message);
  }

  public MalformedResponseException(String message, Throwable cause) {
    super(message, cause);
  }
}
