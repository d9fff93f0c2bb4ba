package com.scholary.radio.track;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves a playout request: locates its file and reads its metadata.
 *
 * <p>A file that is missing or unreadable cannot play and fails resolution. A file whose metadata
 * cannot be read still plays, with only its file name as metadata.
 */
@Component
public class TrackResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(TrackResolver.class);

  private final MetadataReader metadataReader;

  public TrackResolver(MetadataReader metadataReader) {
    this.metadataReader = metadataReader;
  }

  /**
   * Resolve a request.
   *
   * @param request the request to resolve
   * @return the request with metadata attached
   * @throws TrackResolutionException if the file is missing or unreadable
   */
  public PlayoutRequest resolve(PlayoutRequest request) {
    if (!Files.isRegularFile(request.file()) || !Files.isReadable(request.file())) {
      throw new TrackResolutionException("File is not readable: " + request.file());
    }

    TrackMetadata metadata;
    try {
      metadata = metadataReader.read(request.file());
    } catch (IOException | RuntimeException e) {
      LOGGER.warn(
          "Could not read metadata, using file name only: file={}, error={}",
          request.file().getFileName(),
          e.getMessage());
      metadata =
          TrackMetadata.of(Map.of(TrackMetadata.FILENAME, request.file().getFileName().toString()));
    }
    return request.withMetadata(metadata);
  }
}
