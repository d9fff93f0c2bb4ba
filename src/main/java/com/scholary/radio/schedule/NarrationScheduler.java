package com.scholary.radio.schedule;

import com.scholary.radio.job.NarrationJob;
import com.scholary.radio.job.NarrationJobRepository;
import com.scholary.radio.logging.StructuredLogger;
import com.scholary.radio.narration.MalformedResponseException;
import com.scholary.radio.narration.NarrationException;
import com.scholary.radio.narration.NarrationPrompt;
import com.scholary.radio.narration.NarrationService;
import com.scholary.radio.track.BatchListener;
import com.scholary.radio.track.PlayoutRequest;
import com.scholary.radio.track.TrackMetadata;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Turns completed history batches into narrations on the injection queue.
 *
 * <p>Each batch becomes a {@link NarrationJob} that runs on the narration executor, never on the
 * calling thread. A successful job pushes its segment onto the {@link InjectionQueue}; a failed
 * one is logged and dropped. Jobs are independent, so a slow job neither blocks later ones nor
 * keeps them from reaching the queue first.
 */
@Service
public class NarrationScheduler implements BatchListener {

  private static final Logger LOGGER = LoggerFactory.getLogger(NarrationScheduler.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final NarrationService narrationService;
  private final InjectionQueue injectionQueue;
  private final NarrationJobRepository jobRepository;
  private final Executor executor;
  private final AtomicLong sequence = new AtomicLong();

  public NarrationScheduler(
      NarrationService narrationService,
      InjectionQueue injectionQueue,
      NarrationJobRepository jobRepository,
      @Qualifier("narrationExecutor") Executor executor) {
    this.narrationService = narrationService;
    this.injectionQueue = injectionQueue;
    this.jobRepository = jobRepository;
    this.executor = executor;
  }

  @Override
  public void onBatchReady(List<TrackMetadata> history, TrackMetadata next) {
    schedule(history, next);
  }

  /**
   * Start a narration for a batch.
   *
   * @param history the played tracks, oldest first
   * @param next the upcoming track, or null
   * @return completes with the queued request, or empty if the narration was dropped; never
   *     completes exceptionally
   */
  public CompletableFuture<Optional<PlayoutRequest>> schedule(
      List<TrackMetadata> history, TrackMetadata next) {

    NarrationJob job =
        new NarrationJob(
            UUID.randomUUID().toString(),
            sequence.incrementAndGet(),
            history.stream().map(NarrationPrompt::describe).collect(Collectors.toList()),
            next == null ? null : NarrationPrompt.describe(next));
    jobRepository.save(job);
    structuredLogger.logNarrationScheduled(job.getJobId(), history.size(), job.getNextTrack());

    long start = System.currentTimeMillis();
    try {
      return CompletableFuture.supplyAsync(() -> run(job, history, next), executor)
          .handle((request, error) -> complete(job, request, error, start));
    } catch (RejectedExecutionException e) {
      job.markFailed("Narration executor is saturated");
      structuredLogger.logNarrationFailed(job.getJobId(), "Rejected", e.getMessage());
      return CompletableFuture.completedFuture(Optional.empty());
    }
  }

  private PlayoutRequest run(NarrationJob job, List<TrackMetadata> history, TrackMetadata next) {
    job.markProcessing();
    return narrationService.generateNarration(history, next);
  }

  private Optional<PlayoutRequest> complete(
      NarrationJob job, PlayoutRequest request, Throwable error, long start) {
    try {
      if (error != null) {
        Throwable cause = error instanceof CompletionException ? error.getCause() : error;
        job.markFailed(cause.getMessage());
        structuredLogger.logNarrationFailed(job.getJobId(), errorType(cause), cause.getMessage());
        if (!(cause instanceof NarrationException)) {
          LOGGER.error("Unexpected narration failure: jobId={}", job.getJobId(), cause);
        }
        return Optional.empty();
      }

      injectionQueue.push(request);
      job.markCompleted(request.file().toString());
      structuredLogger.logNarrationInjected(
          job.getJobId(),
          request.file().getFileName().toString(),
          System.currentTimeMillis() - start,
          injectionQueue.size());
      return Optional.of(request);
    } catch (RuntimeException e) {
      LOGGER.error("Failed to complete narration job {}", job.getJobId(), e);
      return Optional.empty();
    }
  }

  private static String errorType(Throwable cause) {
    if (cause instanceof MalformedResponseException) {
      return "MalformedResponse";
    }
    if (cause instanceof NarrationException) {
      return "ServiceError";
    }
    return cause.getClass().getSimpleName();
  }
}
