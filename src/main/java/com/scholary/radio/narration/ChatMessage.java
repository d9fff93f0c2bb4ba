package com.scholary.radio.narration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** One message of a chat-completion exchange. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessage(String role, String content) {

  public static ChatMessage system(String content) {
    return new ChatMessage("system", content);
  }

  public static ChatMessage user(String content) {
    return new ChatMessage("user", content);
  }
}
