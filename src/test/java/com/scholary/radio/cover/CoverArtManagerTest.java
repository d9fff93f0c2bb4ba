package com.scholary.radio.cover;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.radio.track.TrackMetadata;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CoverArtManagerTest {

  private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x01};
  private static final byte[] PNG = {(byte) 0x89, 0x50, 0x4E, 0x47};

  @TempDir Path tempDir;

  private Path defaultCover;
  private CoverArtManager manager;

  @BeforeEach
  void setUp() throws IOException {
    defaultCover = Files.write(tempDir.resolve("default.png"), PNG);
    manager = new CoverArtManager(defaultCover, tempDir.resolve("covers"));
  }

  @AfterEach
  void tearDown() {
    manager.close();
  }

  @Test
  void current_shouldStartAtDefault() {
    assertThat(manager.current()).isEqualTo(defaultCover);
  }

  @Test
  void extract_shouldWriteEmbeddedCover() throws IOException {
    CoverResult result = manager.extract(withCover(JPEG, "image/jpeg"));

    assertThat(result.isDefault()).isFalse();
    assertThat(result.path().getFileName().toString()).endsWith(".jpg");
    assertThat(manager.current()).isEqualTo(result.path());
    assertThat(Files.readAllBytes(result.path())).isEqualTo(JPEG);
  }

  @Test
  void extract_shouldKeepAtMostOneExtractedFile() throws IOException {
    CoverResult first = manager.extract(withCover(JPEG, "image/jpeg"));
    assertThat(coverFiles()).containsExactly(first.path());

    CoverResult second = manager.extract(withCover(PNG, "image/png"));
    assertThat(coverFiles()).containsExactly(second.path());
    assertThat(first.path()).doesNotExist();

    CoverResult third = manager.extract(TrackMetadata.of("No Art", "Nobody"));
    assertThat(third.isDefault()).isTrue();
    assertThat(manager.current()).isEqualTo(defaultCover);
    assertThat(second.path()).doesNotExist();
    assertThat(coverFiles()).isEmpty();
    assertThat(defaultCover).exists();
  }

  @Test
  void extract_shouldReplaceFileForRepeatedTrack() throws IOException {
    TrackMetadata track = withCover(JPEG, "image/jpeg");

    CoverResult first = manager.extract(track);
    CoverResult second = manager.extract(track);

    assertThat(second.path()).isNotEqualTo(first.path());
    assertThat(first.path()).doesNotExist();
    assertThat(coverFiles()).containsExactly(second.path());
  }

  @Test
  void extract_shouldFallBackForUnknownMimeType() throws IOException {
    manager.extract(withCover(JPEG, "image/jpeg"));

    CoverResult result = manager.extract(withCover(new byte[] {1, 2}, "image/x-unknown"));

    assertThat(result.isDefault()).isTrue();
    assertThat(result.reason()).contains("image/x-unknown");
    assertThat(manager.current()).isEqualTo(defaultCover);
    assertThat(coverFiles()).isEmpty();
  }

  @Test
  void extract_shouldFallBackWhenDirectoryIsGone() throws IOException {
    Files.delete(manager.directory());

    CoverResult result = manager.extract(withCover(JPEG, "image/jpeg"));

    assertThat(result.isDefault()).isTrue();
    assertThat(manager.current()).isEqualTo(defaultCover);
  }

  @Test
  void extract_shouldNeverDeleteDefaultCover() {
    manager.extract(TrackMetadata.of("A", "B"));
    manager.extract(TrackMetadata.of("C", "D"));
    manager.extract(withCover(JPEG, "image/jpeg"));

    assertThat(defaultCover).exists();
  }

  @Test
  void close_shouldRemoveDirectory() {
    manager.extract(withCover(JPEG, "image/jpeg"));

    manager.close();

    assertThat(manager.directory()).doesNotExist();
    assertThat(manager.current()).isEqualTo(defaultCover);
    assertThat(defaultCover).exists();
  }

  private static TrackMetadata withCover(byte[] data, String mimeType) {
    return TrackMetadata.of("Song", "Artist").withCover(data, mimeType);
  }

  private List<Path> coverFiles() throws IOException {
    try (Stream<Path> files = Files.list(manager.directory())) {
      return files.collect(Collectors.toList());
    }
  }
}
