package com.scholary.radio.narration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Response of the chat-completion call.
 *
 * <p>Only the parts we read are mapped. Some gateways answer 200 with an {@code error} object
 * instead of choices, so that is mapped too.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatCompletionResponse(List<Choice> choices, ApiError error) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Choice(ChatMessage message) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ApiError(String message, String type) {}
}
