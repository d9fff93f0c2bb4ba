package com.scholary.radio.playout;

import com.scholary.radio.station.StationProperties;
import com.scholary.radio.track.LookaheadHook;
import com.scholary.radio.track.PlayoutRequest;
import com.scholary.radio.track.TrackMetadata;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * The main playlist: every audio file under the library directory, round after round.
 *
 * <p>Each round is a fresh scan of the directory, optionally shuffled. The playlist keeps
 * {@code prefetch} items buffered beyond the one on air; every candidate passes through the
 * lookahead hook before it is buffered, so an item's metadata is known before it plays.
 *
 * <p>When an item goes on air its metadata is published to the registered listeners, in
 * registration order, on the playout thread.
 */
@Component
public class DirectoryPlaylist implements RequestSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryPlaylist.class);

  static final Set<String> AUDIO_EXTENSIONS =
      Set.of("mp3", "flac", "ogg", "oga", "opus", "m4a", "aac", "wav");

  private final Path libraryDir;
  private final int prefetch;
  private final boolean shuffle;
  private final Random random;

  private final Deque<PlayoutRequest> buffer = new ArrayDeque<>();
  private final Deque<Path> round = new ArrayDeque<>();
  private final List<Consumer<TrackMetadata>> metadataListeners = new CopyOnWriteArrayList<>();
  private volatile LookaheadHook lookaheadHook = LookaheadHook.ACCEPT_ALL;
  private int lastScanSize;

  @Autowired
  public DirectoryPlaylist(StationProperties properties) {
    this(Paths.get(properties.libraryDir()), properties.prefetch(), properties.shuffle(), new Random());
  }

  public DirectoryPlaylist(Path libraryDir, int prefetch, boolean shuffle, Random random) {
    this.libraryDir = libraryDir;
    this.prefetch = prefetch;
    this.shuffle = shuffle;
    this.random = random;
    LOGGER.info(
        "Initialized playlist: dir={}, prefetch={}, shuffle={}", libraryDir, prefetch, shuffle);
  }

  public void setLookaheadHook(LookaheadHook lookaheadHook) {
    this.lookaheadHook = lookaheadHook;
  }

  public void addMetadataListener(Consumer<TrackMetadata> listener) {
    metadataListeners.add(listener);
  }

  @Override
  public synchronized Optional<PlayoutRequest> next() {
    fill(1);
    PlayoutRequest head = buffer.poll();
    if (head == null) {
      return Optional.empty();
    }
    fill(prefetch);
    return Optional.of(head);
  }

  @Override
  public void onTrackStarted(PlayoutRequest request) {
    TrackMetadata metadata =
        request.isResolved()
            ? request.metadata()
            : TrackMetadata.of(
                Map.of(TrackMetadata.FILENAME, request.file().getFileName().toString()));

    for (Consumer<TrackMetadata> listener : metadataListeners) {
      try {
        listener.accept(metadata);
      } catch (RuntimeException e) {
        LOGGER.error("Metadata listener failed for {}", request.file().getFileName(), e);
      }
    }
  }

  /** Items buffered beyond the one on air. */
  public synchronized int buffered() {
    return buffer.size();
  }

  private void fill(int target) {
    int rejected = 0;
    while (buffer.size() < target) {
      Optional<Path> candidate = nextCandidate();
      if (candidate.isEmpty()) {
        return;
      }
      Optional<PlayoutRequest> accepted =
          lookaheadHook.check(PlayoutRequest.track(candidate.get()));
      if (accepted.isPresent()) {
        buffer.add(accepted.get());
      } else if (++rejected > lastScanSize) {
        LOGGER.warn("Every candidate in {} was rejected, giving up for now", libraryDir);
        return;
      }
    }
  }

  private Optional<Path> nextCandidate() {
    if (round.isEmpty()) {
      startRound();
    }
    return Optional.ofNullable(round.poll());
  }

  private void startRound() {
    List<Path> files;
    try (Stream<Path> walk = Files.walk(libraryDir)) {
      files =
          walk.filter(Files::isRegularFile)
              .filter(DirectoryPlaylist::isAudioFile)
              .sorted()
              .collect(Collectors.toList());
    } catch (IOException | UncheckedIOException e) {
      // walk reports errors inside the tree (unreadable or vanished subdirectory) unchecked
      LOGGER.error("Failed to scan library {}: {}", libraryDir, e.getMessage());
      files = List.of();
    }

    if (shuffle) {
      Collections.shuffle(files, random);
    }
    lastScanSize = files.size();
    round.addAll(files);

    if (files.isEmpty()) {
      LOGGER.warn("No audio files found in {}", libraryDir);
    } else {
      LOGGER.info("Starting playlist round: {} files", files.size());
    }
  }

  private static boolean isAudioFile(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 && AUDIO_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
  }
}
