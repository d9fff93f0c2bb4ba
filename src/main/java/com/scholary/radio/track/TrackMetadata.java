package com.scholary.radio.track;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Metadata of a single track as read from the media file.
 *
 * <p>Tags are plain strings keyed by lower-case names ({@code title}, {@code artist}, {@code album},
 * {@code genre}, {@code year}, {@code filename}, {@code duration}). The embedded cover, if the file
 * carries one, is kept as raw bytes with the MIME type reported for it.
 *
 * <p>Instances are immutable once read.
 */
public record TrackMetadata(Map<String, String> tags, byte[] coverData, String coverMimeType) {

  public static final String TITLE = "title";
  public static final String ARTIST = "artist";
  public static final String ALBUM = "album";
  public static final String GENRE = "genre";
  public static final String YEAR = "year";
  public static final String FILENAME = "filename";
  public static final String DURATION = "duration";

  static final String UNKNOWN_ARTIST = "Unknown Artist";

  public TrackMetadata {
    Map<String, String> copy = new HashMap<>();
    if (tags != null) {
      tags.forEach(
          (key, value) -> {
            if (key != null && value != null && !value.isBlank()) {
              copy.put(key, value.trim());
            }
          });
    }
    tags = Map.copyOf(copy);
    coverData = coverData == null || coverData.length == 0 ? null : coverData.clone();
  }

  public static TrackMetadata of(Map<String, String> tags) {
    return new TrackMetadata(tags, null, null);
  }

  /** Convenience for the common title/artist pair. */
  public static TrackMetadata of(String title, String artist) {
    Map<String, String> tags = new HashMap<>();
    tags.put(TITLE, title);
    tags.put(ARTIST, artist);
    return of(tags);
  }

  public TrackMetadata withCover(byte[] data, String mimeType) {
    return new TrackMetadata(tags, data, mimeType);
  }

  /** Title tag, or the file name without extension when the tag is missing. */
  public String title() {
    String title = tags.get(TITLE);
    if (title != null) {
      return title;
    }
    String filename = filename();
    if (filename == null) {
      return "";
    }
    int dot = filename.lastIndexOf('.');
    return dot > 0 ? filename.substring(0, dot) : filename;
  }

  public String artist() {
    return tags.getOrDefault(ARTIST, UNKNOWN_ARTIST);
  }

  public String filename() {
    return tags.get(FILENAME);
  }

  public OptionalDouble durationSeconds() {
    String duration = tags.get(DURATION);
    if (duration == null) {
      return OptionalDouble.empty();
    }
    try {
      return OptionalDouble.of(Double.parseDouble(duration));
    } catch (NumberFormatException e) {
      return OptionalDouble.empty();
    }
  }

  public boolean hasCover() {
    return coverData != null;
  }

  public boolean isEmpty() {
    return tags.isEmpty() && coverData == null;
  }

  @Override
  public byte[] coverData() {
    return coverData == null ? null : coverData.clone();
  }

  /** Covers compare by content. */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TrackMetadata)) {
      return false;
    }
    TrackMetadata other = (TrackMetadata) o;
    return tags.equals(other.tags)
        && Arrays.equals(coverData, other.coverData)
        && Objects.equals(coverMimeType, other.coverMimeType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tags, Arrays.hashCode(coverData), coverMimeType);
  }

  @Override
  public String toString() {
    return "TrackMetadata[" + tags + (hasCover() ? ", cover=" + coverMimeType : "") + "]";
  }
}
