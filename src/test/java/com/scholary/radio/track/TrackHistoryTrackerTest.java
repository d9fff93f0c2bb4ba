package com.scholary.radio.track;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TrackHistoryTrackerTest {

  @Mock private TrackResolver trackResolver;
  @Mock private BatchListener batchListener;
  @Captor private ArgumentCaptor<List<TrackMetadata>> batch;

  private NowPlayingState nowPlaying;
  private TrackHistoryTracker tracker;

  @BeforeEach
  void setUp() {
    nowPlaying = new NowPlayingState();
    tracker = new TrackHistoryTracker(trackResolver, batchListener, nowPlaying, 4);
  }

  @Test
  void onMetadata_shouldTriggerOncePerFourTracks() {
    for (int i = 1; i <= 3; i++) {
      tracker.onMetadata(TrackMetadata.of("Song " + i, "Artist " + i));
    }
    verify(batchListener, never()).onBatchReady(anyList(), any());
    assertThat(tracker.historySize()).isEqualTo(3);

    tracker.onMetadata(TrackMetadata.of("Song 4", "Artist 4"));

    verify(batchListener, times(1)).onBatchReady(anyList(), any());
    assertThat(tracker.historySize()).isZero();
  }

  @Test
  void onMetadata_shouldHandOffBatchInPlayOrder() {
    List<String> titles = List.of("A", "B", "C", "D");
    titles.forEach(title -> tracker.onMetadata(TrackMetadata.of(title, "X")));

    verify(batchListener).onBatchReady(batch.capture(), isNull());
    assertThat(batch.getValue()).extracting(TrackMetadata::title).containsExactlyElementsOf(titles);
  }

  @Test
  void onMetadata_shouldTriggerTwiceForNineTracksAndKeepRemainder() {
    for (int i = 0; i < 9; i++) {
      tracker.onMetadata(TrackMetadata.of("Song " + i, "Artist"));
      assertThat(tracker.historySize()).isLessThan(4);
    }

    verify(batchListener, times(2)).onBatchReady(anyList(), any());
    assertThat(tracker.historySize()).isEqualTo(1);
  }

  @Test
  void onMetadata_shouldPassResolvedNextTrack() throws Exception {
    Path upcoming = Path.of("/music/next.mp3");
    TrackMetadata nextMetadata = TrackMetadata.of("Next", "Someone");
    PlayoutRequest candidate = PlayoutRequest.track(upcoming);
    when(trackResolver.resolve(candidate)).thenReturn(candidate.withMetadata(nextMetadata));

    tracker.checkNext(candidate);
    for (int i = 0; i < 4; i++) {
      tracker.onMetadata(TrackMetadata.of("Song " + i, "Artist"));
    }

    verify(batchListener).onBatchReady(anyList(), eq(nextMetadata));
  }

  @Test
  void onMetadata_shouldUpdateNowPlaying() {
    tracker.onMetadata(TrackMetadata.of("Blue in Green", "Miles Davis"));

    assertThat(nowPlaying.title()).isEqualTo("Blue in Green");
    assertThat(nowPlaying.artist()).isEqualTo("Miles Davis");
  }

  @Test
  void onMetadata_shouldSurviveListenerFailure() {
    doThrow(new IllegalStateException("boom")).when(batchListener).onBatchReady(anyList(), any());

    for (int i = 0; i < 4; i++) {
      tracker.onMetadata(TrackMetadata.of("Song " + i, "Artist"));
    }

    assertThat(tracker.historySize()).isZero();
    tracker.onMetadata(TrackMetadata.of("Song 5", "Artist"));
    assertThat(tracker.historySize()).isEqualTo(1);
  }

  @Test
  void checkNext_shouldReturnResolvedRequestAndRememberIt() {
    PlayoutRequest candidate = PlayoutRequest.track(Path.of("/music/a.mp3"));
    TrackMetadata metadata = TrackMetadata.of("A", "B");
    when(trackResolver.resolve(candidate)).thenReturn(candidate.withMetadata(metadata));

    Optional<PlayoutRequest> result = tracker.checkNext(candidate);

    assertThat(result).isPresent();
    assertThat(result.get().metadata()).isEqualTo(metadata);
    assertThat(result.get().metadata().isEmpty()).isFalse();
    assertThat(tracker.nextTrack()).contains(metadata);
  }

  @Test
  void checkNext_shouldRejectUnresolvableCandidate() {
    PlayoutRequest candidate = PlayoutRequest.track(Path.of("/music/missing.mp3"));
    when(trackResolver.resolve(candidate))
        .thenThrow(new TrackResolutionException("File is not readable"));

    Optional<PlayoutRequest> result = tracker.checkNext(candidate);

    assertThat(result).isEmpty();
    assertThat(tracker.nextTrack()).isEmpty();
  }

  @Test
  void constructor_shouldRejectNonPositiveBatchSize() {
    assertThatThrownBy(() -> new TrackHistoryTracker(trackResolver, batchListener, nowPlaying, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
