package com.scholary.narrator.logging;

import com.scholary.narrator.steplog.StepEvent;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method sets an {@code event_type} plus event-specific fields for the duration of one log
 * line, so job lifecycle events can be filtered by field in the log store.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a job accepted into the queue. */
  public void logJobEnqueued(String jobId, String owner, int queuePosition) {
    try {
      MDC.put("event_type", "job_enqueued");
      MDC.put("jobId", jobId);
      MDC.put("owner", owner);
      MDC.put("queuePosition", String.valueOf(queuePosition));

      logger.info("Job enqueued: jobId={}, owner={}, position={}", jobId, owner, queuePosition);
    } finally {
      clearEventFields();
      MDC.remove("jobId");
      MDC.remove("owner");
    }
  }

  /** Log a submission turned away because the queue is full. */
  public void logJobRejected(String owner, int active, int maxQueueSize) {
    try {
      MDC.put("event_type", "job_rejected");
      MDC.put("owner", owner);
      MDC.put("active", String.valueOf(active));
      MDC.put("maxQueueSize", String.valueOf(maxQueueSize));

      logger.warn("Job rejected: owner={}, active={}/{}", owner, active, maxQueueSize);
    } finally {
      clearEventFields();
      MDC.remove("owner");
    }
  }

  /** Log a queued job handed to an executor. */
  public void logJobPromoted(String jobId, int running, int maxConcurrent) {
    try {
      MDC.put("event_type", "job_promoted");
      MDC.put("jobId", jobId);
      MDC.put("running", String.valueOf(running));
      MDC.put("maxConcurrent", String.valueOf(maxConcurrent));

      logger.info("Job promoted: jobId={}, running={}/{}", jobId, running, maxConcurrent);
    } finally {
      clearEventFields();
      MDC.remove("jobId");
    }
  }

  /** Log a step event; failures at warn, everything else at debug. */
  public void logStepEvent(String jobId, StepEvent event) {
    try {
      MDC.put("event_type", "step_event");
      MDC.put("step", event.step().wireName());
      MDC.put("status", event.status().wireName());

      switch (event.status()) {
        case FAILED -> logger.warn(
            "Step failed: jobId={}, step={}, message={}",
            jobId,
            event.step().wireName(),
            event.message());
        case WAITING -> logger.info(
            "Step waiting: jobId={}, step={}, detail={}",
            jobId,
            event.step().wireName(),
            event.detail());
        default -> logger.debug(
            "Step {}: jobId={}, step={}, message={}",
            event.status().wireName(),
            jobId,
            event.step().wireName(),
            event.message());
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log a job that finished every stage. */
  public void logJobCompleted(String jobId, long durationMs) {
    try {
      MDC.put("event_type", "job_completed");
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info("Job completed: jobId={}, duration={}ms", jobId, durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a job that stopped on a failed step. */
  public void logJobFailed(String jobId, String step, String message) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("step", step);

      logger.error("Job failed: jobId={}, step={}, message={}", jobId, step, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log a successful queue reorder. */
  public void logQueueReordered(int queued) {
    try {
      MDC.put("event_type", "queue_reordered");
      MDC.put("queued", String.valueOf(queued));

      logger.info("Queue reordered: {} queued jobs", queued);
    } finally {
      clearEventFields();
    }
  }

  /** Log a post-completion action. */
  public void logPostAction(String jobId, String action, int artifacts) {
    try {
      MDC.put("event_type", "post_action");
      MDC.put("jobId", jobId);
      MDC.put("action", action);

      logger.info(
          "Post action finished: jobId={}, action={}, artifacts={}", jobId, action, artifacts);
    } finally {
      clearEventFields();
      MDC.remove("jobId");
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String owner) {
    MDC.put("jobId", jobId);
    MDC.put("owner", owner);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("owner");
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("queuePosition");
    MDC.remove("active");
    MDC.remove("maxQueueSize");
    MDC.remove("running");
    MDC.remove("maxConcurrent");
    MDC.remove("step");
    MDC.remove("status");
    MDC.remove("durationMs");
    MDC.remove("queued");
    MDC.remove("action");
  }
}
