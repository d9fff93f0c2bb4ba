package com.scholary.radio.cover;

import com.scholary.radio.station.StationProperties;
import com.scholary.radio.track.TrackMetadata;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Maintains the current cover image of the stream.
 *
 * <p>Every extraction writes a new {@code cover-N.ext} file into a private temporary directory and
 * swaps it in as current. The file it replaces is deleted unless it is the configured default, so
 * at most one extracted cover exists on disk and the current path always names a readable file.
 *
 * <p>The directory belongs to this manager alone and is removed on {@link #close()}. The default
 * cover is never deleted.
 */
@Component
public class CoverArtManager implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(CoverArtManager.class);

  private final Path defaultCover;
  private final Path directory;
  private final AtomicLong counter = new AtomicLong();

  private Path current;

  @Autowired
  public CoverArtManager(StationProperties properties) throws IOException {
    this(Paths.get(properties.defaultCover()), Files.createTempDirectory("radio-covers-"));
  }

  public CoverArtManager(Path defaultCover, Path directory) throws IOException {
    this.defaultCover = defaultCover;
    this.directory = Files.createDirectories(directory);
    this.current = defaultCover;

    if (!Files.isReadable(defaultCover)) {
      LOGGER.warn("Default cover is not readable: {}", defaultCover);
    }
    LOGGER.info("Initialized cover manager: dir={}, default={}", directory, defaultCover);
  }

  /**
   * Make the cover of this track current.
   *
   * <p>Never throws: a track without a usable cover switches the stream to the default cover.
   *
   * @param metadata the metadata of the track now on air
   * @return what was made current
   */
  public CoverResult extract(TrackMetadata metadata) {
    if (!metadata.hasCover()) {
      LOGGER.debug("No embedded cover: {}", metadata.title());
      return useDefault("no embedded cover");
    }

    Optional<String> extension = CoverMimeTypes.extensionFor(metadata.coverMimeType());
    if (extension.isEmpty()) {
      LOGGER.warn(
          "Unrecognized cover MIME type '{}' for {}, using default cover",
          metadata.coverMimeType(),
          metadata.title());
      return useDefault("unrecognized MIME type " + metadata.coverMimeType());
    }

    Path target =
        directory.resolve(String.format("cover-%d.%s", counter.incrementAndGet(), extension.get()));
    try {
      Files.write(target, metadata.coverData());
    } catch (IOException e) {
      LOGGER.error("Failed to write cover {}, using default cover", target, e);
      deleteQuietly(target);
      return useDefault("write failed: " + e.getMessage());
    }

    swap(target);
    LOGGER.debug("Cover updated: {}", target.getFileName());
    return CoverResult.extracted(target);
  }

  /** The cover on air right now. */
  public synchronized Path current() {
    return current;
  }

  public Path defaultCover() {
    return defaultCover;
  }

  public Path directory() {
    return directory;
  }

  /** Remove the private directory and everything in it. */
  @PreDestroy
  @Override
  public synchronized void close() {
    current = defaultCover;
    if (!Files.exists(directory)) {
      return;
    }
    try (Stream<Path> files = Files.walk(directory)) {
      files.sorted(Comparator.reverseOrder()).forEach(this::deleteQuietly);
      LOGGER.info("Removed cover directory {}", directory);
    } catch (IOException e) {
      LOGGER.warn("Failed to remove cover directory {}", directory, e);
    }
  }

  private CoverResult useDefault(String reason) {
    swap(defaultCover);
    return CoverResult.fallback(defaultCover, reason);
  }

  private synchronized void swap(Path next) {
    Path previous = current;
    current = next;
    if (!previous.equals(defaultCover) && !previous.equals(next)) {
      deleteQuietly(previous);
    }
  }

  private void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete {}: {}", path, e.getMessage());
    }
  }
}
