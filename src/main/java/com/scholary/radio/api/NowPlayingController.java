package com.scholary.radio.api;

import com.scholary.radio.cover.CoverArtManager;
import com.scholary.radio.cover.CoverMimeTypes;
import com.scholary.radio.narration.NarrationPrompt;
import com.scholary.radio.playout.PlayoutEngine;
import com.scholary.radio.schedule.InjectionQueue;
import com.scholary.radio.station.StationOrchestrator;
import com.scholary.radio.track.NowPlayingState;
import com.scholary.radio.track.PlayoutRequest;
import com.scholary.radio.track.TrackHistoryTracker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for on-screen display.
 *
 * <p>Exposes the live display values (title, artist, cover, playback position) that overlays and
 * players poll.
 */
@RestController
@Tag(name = "Now playing", description = "Live display state of the stream")
public class NowPlayingController {

  private static final Logger LOGGER = LoggerFactory.getLogger(NowPlayingController.class);

  static final String COVER_PATH = "/api/now-playing/cover";

  private final NowPlayingState nowPlaying;
  private final CoverArtManager coverArtManager;
  private final TrackHistoryTracker tracker;
  private final InjectionQueue injectionQueue;
  private final PlayoutEngine engine;

  public NowPlayingController(
      NowPlayingState nowPlaying,
      CoverArtManager coverArtManager,
      TrackHistoryTracker tracker,
      InjectionQueue injectionQueue,
      StationOrchestrator orchestrator) {
    this.nowPlaying = nowPlaying;
    this.coverArtManager = coverArtManager;
    this.tracker = tracker;
    this.injectionQueue = injectionQueue;
    this.engine = orchestrator.engine();
  }

  @GetMapping("/api/now-playing")
  @Operation(summary = "Now playing", description = "Title, artist, cover and playback position")
  public NowPlayingResponse nowPlaying() {
    Optional<PlayoutRequest> current = engine.current();
    return new NowPlayingResponse(
        nowPlaying.title(),
        nowPlaying.artist(),
        current.map(PlayoutRequest::displayTitle).orElse(null),
        current.map(request -> request.kind().name()).orElse(null),
        COVER_PATH,
        engine.progress(),
        engine.elapsedSeconds(),
        engine.remainingSeconds(),
        engine.durationSeconds(),
        tracker.nextTrack().map(NarrationPrompt::describe).orElse(null),
        tracker.historySize(),
        tracker.batchSize(),
        injectionQueue.size());
  }

  @GetMapping(COVER_PATH)
  @Operation(summary = "Current cover", description = "The cover image on air")
  public ResponseEntity<byte[]> cover() {
    Path cover = coverArtManager.current();
    try {
      byte[] data = Files.readAllBytes(cover);
      return ResponseEntity.ok()
          .contentType(
              MediaType.parseMediaType(
                  CoverMimeTypes.contentTypeFor(cover.getFileName().toString())))
          .body(data);
    } catch (IOException e) {
      LOGGER.warn("Cover not readable: {}", cover);
      return ResponseEntity.notFound().build();
    }
  }
}
