package com.scholary.radio.ffmpeg;

import com.scholary.radio.playout.PlayoutSink;
import com.scholary.radio.track.PlayoutRequest;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Plays items into a single HLS playlist with ffmpeg.
 *
 * <p>Each item is read in real time ({@code -re}), so {@link #play} returns when the item has been
 * on air for its whole length. Successive ffmpeg runs append to the same playlist
 * ({@code append_list}) so listeners see one continuous stream.
 */
@Component
public class FfmpegHlsSink implements PlayoutSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegHlsSink.class);

  static final String PLAYLIST_NAME = "stream.m3u8";

  private final FfmpegProperties properties;
  private final Path outputDir;

  private volatile Process process;

  public FfmpegHlsSink(FfmpegProperties properties) {
    this.properties = properties;
    this.outputDir = Paths.get(properties.hlsOutputDir());

    try {
      Files.createDirectories(outputDir);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create HLS output directory: " + outputDir, e);
    }
    LOGGER.info("Initialized HLS sink: output={}", outputDir.resolve(PLAYLIST_NAME));
  }

  @Override
  public void play(PlayoutRequest request) throws IOException, InterruptedException {
    List<String> command = buildCommand(request.file());
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Process started =
        new ProcessBuilder(command).redirectOutput(ProcessBuilder.Redirect.DISCARD).start();
    process = started;

    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(started.getErrorStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        LOGGER.warn("ffmpeg: {}", line);
      }
    }

    try {
      int exitCode = started.waitFor();
      if (exitCode != 0 && process != null) {
        throw new IOException(
            String.format("ffmpeg exited with code %d for %s", exitCode, request.file()));
      }
    } catch (InterruptedException e) {
      started.destroyForcibly();
      throw e;
    } finally {
      process = null;
    }
  }

  @Override
  public void stop() {
    Process running = process;
    process = null;
    if (running != null) {
      running.destroy();
    }
  }

  List<String> buildCommand(Path input) {
    return List.of(
        properties.ffmpegPath(),
        "-hide_banner",
        "-loglevel",
        "error",
        "-re",
        "-i",
        input.toString(),
        "-vn",
        "-map",
        "0:a:0",
        "-c:a",
        "aac",
        "-b:a",
        properties.audioBitrate(),
        "-f",
        "hls",
        "-hls_time",
        String.valueOf(properties.hlsSegmentSeconds()),
        "-hls_list_size",
        String.valueOf(properties.hlsListSize()),
        "-hls_flags",
        "append_list+delete_segments+omit_endlist",
        "-strftime",
        "1",
        "-hls_segment_filename",
        outputDir.resolve("segment-%s.ts").toString(),
        outputDir.resolve(PLAYLIST_NAME).toString());
  }
}
