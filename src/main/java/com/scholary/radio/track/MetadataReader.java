package com.scholary.radio.track;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads tags and embedded cover art from an audio file.
 *
 * <p>Kept as an interface so the ffprobe-backed reader can be replaced in tests.
 */
public interface MetadataReader {

  /**
   * Read the metadata of an audio file.
   *
   * @param file the audio file
   * @return the metadata, never null
   * @throws IOException if the file cannot be probed
   */
  TrackMetadata read(Path file) throws IOException;
}
