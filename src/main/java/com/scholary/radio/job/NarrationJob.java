package com.scholary.radio.job;

import java.time.Instant;
import java.util.List;

/**
 * One narration generation, from the batch that triggered it to its outcome.
 *
 * <p>Updated by the worker that runs it and read by the HTTP layer, so the mutable fields are
 * volatile.
 */
public class NarrationJob {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }

  private final String jobId;
  private final long sequence;
  private final List<String> tracks;
  private final String nextTrack;
  private final Instant createdAt;

  private volatile Status status;
  private volatile Instant finishedAt;
  private volatile String audioFile;
  private volatile String error;

  public NarrationJob(String jobId, long sequence, List<String> tracks, String nextTrack) {
    this.jobId = jobId;
    this.sequence = sequence;
    this.tracks = List.copyOf(tracks);
    this.nextTrack = nextTrack;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
  }

  public String getJobId() {
    return jobId;
  }

  /** Position of the triggering batch; completion order may differ. */
  public long getSequence() {
    return sequence;
  }

  public List<String> getTracks() {
    return tracks;
  }

  public String getNextTrack() {
    return nextTrack;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public Instant getFinishedAt() {
    return finishedAt;
  }

  public String getAudioFile() {
    return audioFile;
  }

  public String getError() {
    return error;
  }

  public void markProcessing() {
    this.status = Status.PROCESSING;
  }

  public void markCompleted(String audioFile) {
    this.audioFile = audioFile;
    this.finishedAt = Instant.now();
    this.status = Status.COMPLETED;
  }

  public void markFailed(String error) {
    this.error = error;
    this.finishedAt = Instant.now();
    this.status = Status.FAILED;
  }
}
