package com.scholary.radio.track;

import org.springframework.stereotype.Component;

/**
 * Title and artist of the track on air, for on-screen display.
 *
 * <p>Last write wins; readers on other threads see the latest pair written by the playout thread.
 */
@Component
public class NowPlayingState {

  private volatile String title = "";
  private volatile String artist = "";

  public void update(TrackMetadata metadata) {
    this.title = metadata.title();
    this.artist = metadata.artist();
  }

  public String title() {
    return title;
  }

  public String artist() {
    return artist;
  }
}
