package com.scholary.radio.playout;

import com.scholary.radio.logging.StructuredLogger;
import com.scholary.radio.track.PlayoutRequest;
import com.scholary.radio.track.TrackResolutionException;
import com.scholary.radio.track.TrackResolver;
import java.io.IOException;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The playout loop.
 *
 * <p>A single thread takes the next item from the selector, announces it to its source (which is
 * where metadata callbacks run) and hands it to the sink, which blocks until the item is over.
 * Callbacks therefore run serially and in playback order, and the selector is only ever consulted
 * at item boundaries.
 *
 * <p>Also answers elapsed/remaining/duration queries about the item on air.
 */
public class PlayoutEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(PlayoutEngine.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final RequestSource selector;
  private final PlayoutSink sink;
  private final TrackResolver trackResolver;
  private final Clock clock;
  private final long idleRetryMillis;

  private volatile boolean running;
  private volatile Thread thread;

  private volatile PlayoutRequest current;
  private volatile long startedAtMillis;
  private volatile double durationSeconds = -1;

  public PlayoutEngine(
      RequestSource selector,
      PlayoutSink sink,
      TrackResolver trackResolver,
      Clock clock,
      long idleRetryMillis) {
    this.selector = selector;
    this.sink = sink;
    this.trackResolver = trackResolver;
    this.clock = clock;
    this.idleRetryMillis = idleRetryMillis;
  }

  public synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    thread = new Thread(this::loop, "playout");
    thread.start();
    LOGGER.info("Playout started");
  }

  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    sink.stop();
    Thread playout = thread;
    playout.interrupt();
    try {
      playout.join(5000);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    LOGGER.info("Playout stopped");
  }

  public boolean isRunning() {
    return running;
  }

  private void loop() {
    while (running && !Thread.currentThread().isInterrupted()) {
      boolean played;
      try {
        played = playNext();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (RuntimeException e) {
        LOGGER.error("Playout iteration failed, retrying in {}ms", idleRetryMillis, e);
        played = false;
      }

      if (!played) {
        try {
          Thread.sleep(idleRetryMillis);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          break;
        }
      }
    }
  }

  /**
   * Play one item.
   *
   * @return false if no source had anything to play
   * @throws InterruptedException if playout was stopped
   */
  public boolean playNext() throws InterruptedException {
    Optional<PlayoutRequest> next = selector.next();
    if (next.isEmpty()) {
      LOGGER.debug("Nothing to play, retrying in {}ms", idleRetryMillis);
      return false;
    }

    PlayoutRequest request = next.get();
    if (!request.isResolved()) {
      try {
        request = trackResolver.resolve(request);
      } catch (TrackResolutionException e) {
        LOGGER.error("Cannot play {}: {}", request.file(), e.getMessage());
        return true;
      }
    }

    current = request;
    startedAtMillis = clock.millis();
    durationSeconds = request.metadata().durationSeconds().orElse(-1);
    structuredLogger.logItemStarted(
        request.kind().name(), request.displayTitle(), durationSeconds);

    selector.onTrackStarted(request);

    try {
      sink.play(request);
    } catch (IOException e) {
      LOGGER.error("Output failed for {}", request.file(), e);
      Thread.sleep(idleRetryMillis);
    }
    return true;
  }

  public Optional<PlayoutRequest> current() {
    return Optional.ofNullable(current);
  }

  public double elapsedSeconds() {
    if (current == null) {
      return 0;
    }
    return Math.max(0, clock.millis() - startedAtMillis) / 1000.0;
  }

  /** Duration of the item on air, or -1 when unknown. */
  public double durationSeconds() {
    return durationSeconds;
  }

  /** Seconds left of the item on air, or -1 when its duration is unknown. */
  public double remainingSeconds() {
    if (durationSeconds < 0) {
      return -1;
    }
    return Math.max(0, durationSeconds - elapsedSeconds());
  }

  /** Fraction of the item on air already played, in [0, 1]; 0 when unknown. */
  public double progress() {
    if (durationSeconds <= 0) {
      return 0;
    }
    return Math.min(1.0, elapsedSeconds() / durationSeconds);
  }
}
