package com.scholary.radio.narration;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Request body of the speech-synthesis call. */
public record SpeechRequest(
    String model,
    String input,
    String voice,
    @JsonProperty("response_format") String responseFormat,
    double speed) {}
