package com.scholary.narrator.steplog;

import java.time.Instant;

/**
 * Latest recorded progress entry for one step of one job.
 *
 * <p>Events are immutable; the step log replaces the entry for a key rather than appending.
 */
public record StepEvent(
    StepKey step, StepStatus status, String message, String detail, Instant timestamp) {

  public static StepEvent of(StepKey step, StepStatus status, String message) {
    return new StepEvent(step, status, message, null, Instant.now());
  }

  public static StepEvent of(StepKey step, StepStatus status, String message, String detail) {
    return new StepEvent(step, status, message, detail, Instant.now());
  }
}
