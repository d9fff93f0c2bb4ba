package com.scholary.radio.cover;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Fixed lookup from cover MIME type to file extension. */
public final class CoverMimeTypes {

  private static final Map<String, String> EXTENSIONS =
      Map.of(
          "image/jpeg", "jpg",
          "image/jpg", "jpg",
          "image/pjpeg", "jpg",
          "image/png", "png",
          "image/gif", "gif",
          "image/bmp", "bmp",
          "image/webp", "webp");

  private static final Map<String, String> CONTENT_TYPES =
      Map.of(
          "jpg", "image/jpeg",
          "png", "image/png",
          "gif", "image/gif",
          "bmp", "image/bmp",
          "webp", "image/webp");

  private CoverMimeTypes() {}

  public static Optional<String> extensionFor(String mimeType) {
    if (mimeType == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(EXTENSIONS.get(mimeType.trim().toLowerCase(Locale.ROOT)));
  }

  /** Content type to serve a cover file with, from its extension. */
  public static String contentTypeFor(String fileName) {
    int dot = fileName.lastIndexOf('.');
    String extension = dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    if (extension.equals("jpeg")) {
      extension = "jpg";
    }
    return CONTENT_TYPES.getOrDefault(extension, "application/octet-stream");
  }
}
