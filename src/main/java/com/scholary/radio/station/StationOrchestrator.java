package com.scholary.radio.station;

import com.scholary.radio.cover.CoverArtManager;
import com.scholary.radio.playout.DirectoryPlaylist;
import com.scholary.radio.playout.PlayoutEngine;
import com.scholary.radio.playout.PlayoutSink;
import com.scholary.radio.playout.TrackSensitiveFallback;
import com.scholary.radio.schedule.InjectionQueue;
import com.scholary.radio.track.TrackHistoryTracker;
import com.scholary.radio.track.TrackResolver;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Wires the station together and owns its playout loop.
 *
 * <p>The playlist's lookahead hook is the history tracker; its metadata events go to the tracker
 * and the cover manager. Generated narrations take priority over the playlist at every item
 * boundary.
 */
@Component
public class StationOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(StationOrchestrator.class);

  private final PlayoutEngine engine;
  private final boolean autostart;

  public StationOrchestrator(
      DirectoryPlaylist playlist,
      InjectionQueue injectionQueue,
      TrackHistoryTracker tracker,
      CoverArtManager coverArtManager,
      PlayoutSink sink,
      TrackResolver trackResolver,
      Clock clock,
      StationProperties properties) {

    playlist.setLookaheadHook(tracker::checkNext);
    playlist.addMetadataListener(tracker::onMetadata);
    playlist.addMetadataListener(coverArtManager::extract);

    this.engine =
        new PlayoutEngine(
            new TrackSensitiveFallback(List.of(injectionQueue, playlist)),
            sink,
            trackResolver,
            clock,
            properties.idleRetryMillis());
    this.autostart = properties.autostart();
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    if (autostart) {
      engine.start();
    } else {
      LOGGER.info("Autostart disabled, playout not started");
    }
  }

  @PreDestroy
  public void shutdown() {
    engine.stop();
  }

  public PlayoutEngine engine() {
    return engine;
  }
}
