package com.scholary.radio.narration;

import java.util.List;

/** Request body of the chat-completion call. */
public record ChatCompletionRequest(String model, List<ChatMessage> messages) {}
