package com.scholary.radio.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log narration pipeline events with structured fields that the log
 * pattern (or a JSON encoder) can pick up.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a batch of tracks handed to the scheduler. */
  public void logNarrationScheduled(String jobId, int batchSize, String nextTrack) {
    try {
      MDC.put("event_type", "narration_scheduled");
      MDC.put("jobId", jobId);
      MDC.put("batchSize", String.valueOf(batchSize));

      logger.info(
          "Narration scheduled: jobId={}, batchSize={}, next={}", jobId, batchSize, nextTrack);
    } finally {
      clearEventFields();
    }
  }

  /** Log a call to one of the external services. */
  public void logServiceCall(String service, int status, long elapsedMs) {
    try {
      MDC.put("event_type", "service_call");
      MDC.put("service", service);
      MDC.put("status", String.valueOf(status));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.debug("Service call: service={}, status={}, elapsed={}ms", service, status, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a narration that was generated and queued for playout. */
  public void logNarrationInjected(String jobId, String file, long elapsedMs, int queueSize) {
    try {
      MDC.put("event_type", "narration_injected");
      MDC.put("jobId", jobId);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));
      MDC.put("queueSize", String.valueOf(queueSize));

      logger.info(
          "Narration injected: jobId={}, file={}, elapsed={}ms, queued={}",
          jobId,
          file,
          elapsedMs,
          queueSize);
    } finally {
      clearEventFields();
    }
  }

  /** Log a narration that was dropped. */
  public void logNarrationFailed(String jobId, String errorType, String message) {
    try {
      MDC.put("event_type", "narration_failed");
      MDC.put("jobId", jobId);
      MDC.put("errorType", errorType);

      logger.error(
          "Narration failed: jobId={}, error={}, message={}", jobId, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log an item starting on air. */
  public void logItemStarted(String kind, String title, double durationSeconds) {
    try {
      MDC.put("event_type", "item_started");
      MDC.put("kind", kind);
      MDC.put("durationSeconds", String.valueOf(durationSeconds));

      logger.info("On air: kind={}, title={}, duration={}s", kind, title, durationSeconds);
    } finally {
      clearEventFields();
    }
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("jobId");
    MDC.remove("batchSize");
    MDC.remove("service");
    MDC.remove("status");
    MDC.remove("elapsedMs");
    MDC.remove("queueSize");
    MDC.remove("errorType");
    MDC.remove("kind");
    MDC.remove("durationSeconds");
  }
}
