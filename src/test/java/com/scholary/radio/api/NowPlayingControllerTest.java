package com.scholary.radio.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.scholary.radio.cover.CoverArtManager;
import com.scholary.radio.playout.PlayoutEngine;
import com.scholary.radio.schedule.InjectionQueue;
import com.scholary.radio.station.StationOrchestrator;
import com.scholary.radio.track.NowPlayingState;
import com.scholary.radio.track.PlayoutRequest;
import com.scholary.radio.track.TrackHistoryTracker;
import com.scholary.radio.track.TrackMetadata;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@ExtendWith(MockitoExtension.class)
class NowPlayingControllerTest {

  private static final byte[] PNG = {(byte) 0x89, 0x50, 0x4E, 0x47};

  @Mock private StationOrchestrator orchestrator;
  @Mock private PlayoutEngine engine;
  @Mock private TrackHistoryTracker tracker;

  @TempDir Path tempDir;

  private NowPlayingState nowPlaying;
  private InjectionQueue queue;
  private CoverArtManager coverArtManager;
  private NowPlayingController controller;

  @BeforeEach
  void setUp() throws Exception {
    nowPlaying = new NowPlayingState();
    queue = new InjectionQueue();
    Path defaultCover = Files.write(tempDir.resolve("default.png"), PNG);
    coverArtManager = new CoverArtManager(defaultCover, tempDir.resolve("covers"));
    when(orchestrator.engine()).thenReturn(engine);
    controller =
        new NowPlayingController(nowPlaying, coverArtManager, tracker, queue, orchestrator);
  }

  @AfterEach
  void tearDown() {
    coverArtManager.close();
  }

  @Test
  void nowPlaying_shouldReportDisplayState() {
    nowPlaying.update(TrackMetadata.of("So What", "Miles Davis"));
    queue.push(PlayoutRequest.narration(tempDir.resolve("n.mp3"), "AI DJ Narration"));
    PlayoutRequest onAir =
        PlayoutRequest.track(tempDir.resolve("so-what.mp3"))
            .withMetadata(TrackMetadata.of("So What", "Miles Davis"));
    when(engine.current()).thenReturn(Optional.of(onAir));
    when(engine.progress()).thenReturn(0.5);
    when(engine.elapsedSeconds()).thenReturn(60.0);
    when(engine.remainingSeconds()).thenReturn(60.0);
    when(engine.durationSeconds()).thenReturn(120.0);
    when(tracker.nextTrack()).thenReturn(Optional.of(TrackMetadata.of("Naima", "John Coltrane")));
    when(tracker.historySize()).thenReturn(2);
    when(tracker.batchSize()).thenReturn(4);

    NowPlayingResponse response = controller.nowPlaying();

    assertThat(response.title()).isEqualTo("So What");
    assertThat(response.artist()).isEqualTo("Miles Davis");
    assertThat(response.onAir()).isEqualTo("So What");
    assertThat(response.kind()).isEqualTo("TRACK");
    assertThat(response.coverUrl()).isEqualTo("/api/now-playing/cover");
    assertThat(response.progress()).isEqualTo(0.5);
    assertThat(response.nextTrack()).isEqualTo("Naima by John Coltrane");
    assertThat(response.historySize()).isEqualTo(2);
    assertThat(response.batchSize()).isEqualTo(4);
    assertThat(response.queuedNarrations()).isEqualTo(1);
  }

  @Test
  void cover_shouldServeCurrentCover() {
    coverArtManager.extract(
        TrackMetadata.of("A", "B").withCover(new byte[] {(byte) 0xFF, (byte) 0xD8}, "image/jpeg"));

    ResponseEntity<byte[]> response = controller.cover();

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.IMAGE_JPEG);
    assertThat(response.getBody()).containsExactly(0xFF, 0xD8);
  }

  @Test
  void cover_shouldServeDefaultCover() {
    ResponseEntity<byte[]> response = controller.cover();

    assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.IMAGE_PNG);
    assertThat(response.getBody()).isEqualTo(PNG);
  }

  @Test
  void cover_shouldReturnNotFoundWhenDefaultIsMissing() throws Exception {
    Files.delete(coverArtManager.defaultCover());

    assertThat(controller.cover().getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }
}
