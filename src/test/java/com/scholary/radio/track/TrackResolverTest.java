package com.scholary.radio.track;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TrackResolverTest {

  @Mock private MetadataReader metadataReader;

  @TempDir Path tempDir;

  private TrackResolver resolver;

  @BeforeEach
  void setUp() {
    resolver = new TrackResolver(metadataReader);
  }

  @Test
  void resolve_shouldAttachMetadataFromReader() throws Exception {
    Path file = Files.write(tempDir.resolve("song.mp3"), new byte[] {1, 2, 3});
    TrackMetadata metadata = TrackMetadata.of("So What", "Miles Davis");
    when(metadataReader.read(file)).thenReturn(metadata);

    PlayoutRequest resolved = resolver.resolve(PlayoutRequest.track(file));

    assertThat(resolved.isResolved()).isTrue();
    assertThat(resolved.metadata()).isEqualTo(metadata);
    assertThat(resolved.displayTitle()).isEqualTo("So What");
  }

  @Test
  void resolve_shouldFailForMissingFile() {
    Path missing = tempDir.resolve("missing.mp3");

    assertThatThrownBy(() -> resolver.resolve(PlayoutRequest.track(missing)))
        .isInstanceOf(TrackResolutionException.class)
        .hasMessageContaining("missing.mp3");
    verifyNoInteractions(metadataReader);
  }

  @Test
  void resolve_shouldFailForDirectory() {
    assertThatThrownBy(() -> resolver.resolve(PlayoutRequest.track(tempDir)))
        .isInstanceOf(TrackResolutionException.class);
  }

  @Test
  void resolve_shouldFallBackToFileNameWhenMetadataReadFails() throws Exception {
    Path file = Files.write(tempDir.resolve("Take Five.flac"), new byte[] {1});
    when(metadataReader.read(file)).thenThrow(new IOException("ffprobe failed"));

    PlayoutRequest resolved = resolver.resolve(PlayoutRequest.track(file));

    assertThat(resolved.metadata().filename()).isEqualTo("Take Five.flac");
    assertThat(resolved.metadata().title()).isEqualTo("Take Five");
    assertThat(resolved.metadata().artist()).isEqualTo("Unknown Artist");
  }
}
