package com.scholary.radio.api;

import com.scholary.radio.job.NarrationJob;
import java.time.Instant;
import java.util.List;

/**
 * Response for a narration job query.
 *
 * <p>Shows the batch that triggered the job, its state and, once finished, the audio file or the
 * error.
 */
public record NarrationJobResponse(
    String jobId,
    long sequence,
    NarrationJob.Status status,
    List<String> tracks,
    String nextTrack,
    Instant createdAt,
    Instant finishedAt,
    String audioFile,
    String error) {

  public static NarrationJobResponse from(NarrationJob job) {
    return new NarrationJobResponse(
        job.getJobId(),
        job.getSequence(),
        job.getStatus(),
        job.getTracks(),
        job.getNextTrack(),
        job.getCreatedAt(),
        job.getFinishedAt(),
        job.getAudioFile(),
        job.getError());
  }
}
