package com.scholary.radio.ffmpeg;

import com.scholary.radio.track.MetadataReader;
import com.scholary.radio.track.TrackMetadata;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import net.bramp.ffmpeg.FFprobe;
import net.bramp.ffmpeg.probe.FFmpegFormat;
import net.bramp.ffmpeg.probe.FFmpegProbeResult;
import net.bramp.ffmpeg.probe.FFmpegStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads track metadata with ffprobe and pulls embedded cover art with ffmpeg.
 *
 * <p>Tags and duration come from the container format section of the probe result. A cover is an
 * attached picture, which ffprobe reports as a video stream; its bytes are copied out with
 * {@code ffmpeg -map 0:v:0 -c copy -f image2pipe -} and the MIME type is derived from the codec.
 */
@Component
public class FfprobeMetadataReader implements MetadataReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfprobeMetadataReader.class);

  private static final Map<String, String> CODEC_MIME_TYPES =
      Map.of(
          "mjpeg", "image/jpeg",
          "png", "image/png",
          "gif", "image/gif",
          "bmp", "image/bmp",
          "webp", "image/webp");

  private final FfmpegProperties properties;
  private final FFprobe ffprobe;

  public FfprobeMetadataReader(FfmpegProperties properties) throws IOException {
    this.properties = properties;
    this.ffprobe = new FFprobe(properties.ffprobePath());
    LOGGER.info("Initialized ffprobe metadata reader: ffprobe={}", properties.ffprobePath());
  }

  @Override
  public TrackMetadata read(Path file) throws IOException {
    FFmpegProbeResult probe = ffprobe.probe(file.toString());

    Map<String, String> tags = new HashMap<>();
    tags.put(TrackMetadata.FILENAME, file.getFileName().toString());

    FFmpegFormat format = probe.getFormat();
    if (format != null) {
      if (format.duration > 0) {
        tags.put(TrackMetadata.DURATION, String.valueOf(format.duration));
      }
      if (format.tags != null) {
        putTag(tags, TrackMetadata.TITLE, format.tags, "title", "TITLE");
        putTag(tags, TrackMetadata.ARTIST, format.tags, "artist", "ARTIST");
        putTag(tags, TrackMetadata.ALBUM, format.tags, "album", "ALBUM");
        putTag(tags, TrackMetadata.GENRE, format.tags, "genre", "GENRE");
        putTag(tags, TrackMetadata.YEAR, format.tags, "date", "DATE", "year", "YEAR");
      }
    }

    TrackMetadata metadata = TrackMetadata.of(tags);

    Optional<FFmpegStream> coverStream = findCoverStream(probe.getStreams());
    if (coverStream.isPresent()) {
      String codec = coverStream.get().codec_name;
      String mimeType = CODEC_MIME_TYPES.getOrDefault(codec, "image/" + codec);
      byte[] cover = extractCover(file);
      if (cover.length > 0) {
        metadata = metadata.withCover(cover, mimeType);
      }
    }

    LOGGER.debug(
        "Read metadata: file={}, title={}, artist={}, cover={}",
        file.getFileName(),
        metadata.title(),
        metadata.artist(),
        metadata.hasCover());
    return metadata;
  }

  private Optional<FFmpegStream> findCoverStream(List<FFmpegStream> streams) {
    if (streams == null) {
      return Optional.empty();
    }
    return streams.stream()
        .filter(stream -> stream.codec_type == FFmpegStream.CodecType.VIDEO)
        .filter(stream -> stream.codec_name != null)
        .findFirst();
  }

  /**
   * Copy the first picture stream out of the file.
   *
   * <p>ffmpeg writes into a scratch file rather than a pipe, so the timeout applies even when it
   * hangs. Returns an empty array when ffmpeg fails or times out; a missing cover is not an error.
   */
  byte[] extractCover(Path file) throws IOException {
    Path output = Files.createTempFile("cover-extract-", ".img");
    try {
      List<String> command =
          List.of(
              properties.ffmpegPath(),
              "-v",
              "error",
              "-i",
              file.toString(),
              "-map",
              "0:v:0",
              "-c",
              "copy",
              "-f",
              "image2pipe",
              "-");

      LOGGER.debug("Executing: {}", String.join(" ", command));

      Process process =
          new ProcessBuilder(command)
              .redirectOutput(output.toFile())
              .redirectError(ProcessBuilder.Redirect.DISCARD)
              .start();

      try {
        if (!process.waitFor(properties.coverExtractTimeoutSeconds(), TimeUnit.SECONDS)) {
          process.destroyForcibly();
          LOGGER.warn("Cover extraction timed out: file={}", file.getFileName());
          return new byte[0];
        }
      } catch (InterruptedException e) {
        process.destroyForcibly();
        Thread.currentThread().interrupt();
        throw new IOException("Cover extraction interrupted", e);
      }

      if (process.exitValue() != 0) {
        LOGGER.warn(
            "Cover extraction exited with code {}: file={}",
            process.exitValue(),
            file.getFileName());
        return new byte[0];
      }
      return Files.readAllBytes(output);
    } finally {
      Files.deleteIfExists(output);
    }
  }

  private static void putTag(
      Map<String, String> target, String name, Map<String, String> source, String... keys) {
    for (String key : keys) {
      String value = source.get(key);
      if (value != null && !value.isBlank()) {
        target.put(name, value.trim());
        return;
      }
    }
  }
}
