package com.scholary.radio.narration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.radio.logging.StructuredLogger;
import com.scholary.radio.track.PlayoutRequest;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodySubscribers;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the text-generation and speech-synthesis services.
 *
 * <p>A narration takes two calls. The chat-completion call turns the prompt into narration text;
 * the speech call turns that text into audio, which is streamed straight into a temporary file as
 * it arrives. The file is then wrapped as a playout request.
 *
 * <p>Nothing is retried: a failed narration is simply skipped and the next batch gets a new one.
 */
@Component
public class NarrationClient implements NarrationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(NarrationClient.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public static final String NARRATION_TITLE = "AI DJ Narration";

  static final String SYSTEM_PROMPT = "You are a helpful assistant.";

  private final HttpClient httpClient;
  private final NarrationProperties properties;
  private final ObjectMapper objectMapper;
  private final Path tempDir;

  @Autowired
  public NarrationClient(NarrationProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build());
  }

  NarrationClient(NarrationProperties properties, ObjectMapper objectMapper, HttpClient httpClient) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = httpClient;
    this.tempDir = Paths.get(properties.tempDir());

    try {
      Files.createDirectories(this.tempDir);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create narration temp directory: " + tempDir, e);
    }

    LOGGER.info(
        "Initialized narration client: baseUrl={}, chatModel={}, speechModel={}, voice={}",
        properties.baseUrl(),
        properties.chatModel(),
        properties.speechModel(),
        properties.voice());
  }

  @Override
  public PlayoutRequest generateNarration(String prompt) {
    String text = complete(prompt);
    LOGGER.debug("Narration text ({} chars): {}", text.length(), text);
    Path audio = synthesize(text);
    return PlayoutRequest.narration(audio, NARRATION_TITLE);
  }

  /**
   * Ask the text-generation service for the narration text.
   *
   * @param prompt the user prompt
   * @return the content of the single completion choice
   * @throws NarrationException if the service answers with an error status
   * @throws MalformedResponseException if the body is not a usable completion
   */
  String complete(String prompt) {
    ChatCompletionRequest body =
        new ChatCompletionRequest(
            properties.chatModel(),
            List.of(ChatMessage.system(SYSTEM_PROMPT), ChatMessage.user(prompt)));

    HttpRequest request = jsonPost("/v1/chat/completions", body);
    long start = System.currentTimeMillis();
    HttpResponse<String> response =
        send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    structuredLogger.logServiceCall(
        "chat-completion", response.statusCode(), System.currentTimeMillis() - start);

    if (response.statusCode() != 200) {
      throw new NarrationException(
          String.format(
              "Chat completion returned status %d: %s", response.statusCode(), response.body()));
    }

    return extractContent(response.body());
  }

  private String extractContent(String body) {
    ChatCompletionResponse completion;
    try {
      completion = objectMapper.readValue(body, ChatCompletionResponse.class);
    } catch (JsonProcessingException e) {
      throw new MalformedResponseException("Chat completion body is not valid JSON", e);
    }

    if (completion == null) {
      throw new MalformedResponseException("Chat completion body is empty");
    }
    if (completion.error() != null) {
      throw new MalformedResponseException(
          "Chat completion returned an error: " + completion.error().message());
    }
    if (completion.choices() == null || completion.choices().size() != 1) {
      int count = completion.choices() == null ? 0 : completion.choices().size();
      throw new MalformedResponseException("Expected exactly one completion choice, got " + count);
    }

    ChatMessage message = completion.choices().get(0).message();
    if (message == null || message.content() == null || message.content().isBlank()) {
      throw new MalformedResponseException("Completion choice has no content");
    }
    return message.content().trim();
  }

  /**
   * Synthesize speech and stream it into a new temporary file.
   *
   * <p>The audio is written to the file as it arrives. If the call fails part way the partial file
   * is left in place.
   *
   * @param text the narration text
   * @return the audio file
   * @throws NarrationException if the service answers with an error status, the stream breaks, or
   *     the call does not complete within the read timeout
   */
  Path synthesize(String text) {
    SpeechRequest body =
        new SpeechRequest(
            properties.speechModel(),
            text,
            properties.voice(),
            properties.responseFormat(),
            properties.speed());

    Path file =
        tempDir.resolve(
            String.format("narration-%s.%s", UUID.randomUUID(), properties.responseFormat()));

    // Audio goes to the file; an error body is kept as text for the exception.
    BodyHandler<String> handler =
        info ->
            info.statusCode() == 200
                ? BodySubscribers.mapping(BodySubscribers.ofFile(file), Path::toString)
                : BodySubscribers.ofString(StandardCharsets.UTF_8);

    HttpRequest request = jsonPost("/v1/audio/speech", body);
    long start = System.currentTimeMillis();
    HttpResponse<String> response = send(request, handler);
    structuredLogger.logServiceCall(
        "speech", response.statusCode(), System.currentTimeMillis() - start);

    if (response.statusCode() != 200) {
      throw new NarrationException(
          String.format(
              "Speech synthesis returned status %d: %s", response.statusCode(), response.body()));
    }
    LOGGER.debug("Speech written: file={}", file.getFileName());
    return file;
  }

  private HttpRequest jsonPost(String path, Object body) {
    String json;
    try {
      json = objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new NarrationException("Failed to encode request body for " + path, e);
    }

    return HttpRequest.newBuilder()
        .uri(URI.create(properties.baseUrl() + path))
        .timeout(Duration.ofSeconds(properties.readTimeout()))
        .header("Authorization", "Bearer " + properties.apiKey())
        .header("Content-Type", "application/json")
        .POST(BodyPublishers.ofString(json, StandardCharsets.UTF_8))
        .build();
  }

  /**
   * Send a request and wait for the complete response, body included.
   *
   * <p>The request timeout only covers the wait for response headers, so the whole exchange is
   * bounded here as well. A call that runs over is cancelled.
   */
  private <T> HttpResponse<T> send(HttpRequest request, BodyHandler<T> handler) {
    LOGGER.debug("Sending request to {}", request.uri());
    CompletableFuture<HttpResponse<T>> call = httpClient.sendAsync(request, handler);
    try {
      return call.get(properties.readTimeout(), TimeUnit.SECONDS);
    } catch (TimeoutException e) {
      call.cancel(true);
      throw new NarrationException(
          String.format(
              "Request to %s did not complete within %ds",
              request.uri(), properties.readTimeout()),
          e);
    } catch (ExecutionException e) {
      throw new NarrationException("Request to " + request.uri() + " failed", e.getCause());
    } catch (InterruptedException e) {
      call.cancel(true);
      Thread.currentThread().interrupt();
      throw new NarrationException("Request to " + request.uri() + " interrupted", e);
    }
  }
}
