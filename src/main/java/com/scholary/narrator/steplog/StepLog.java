package com.scholary.narrator.steplog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Step log of one job, keyed by step.
 *
 * <p>An event for a step that is already present replaces the earlier entry in place, so the log
 * keeps first-appearance order and never holds two entries for the same key. When a new event
 * becomes running or waiting, any other entry still marked active is a leftover from a step the
 * executor has moved past; the log rejects such an event instead of showing two active steps.
 */
public class StepLog {

  private final Map<StepKey, StepEvent> entries = new LinkedHashMap<>();

  public StepLog() {}

  public StepLog(List<StepEvent> events) {
    events.forEach(this::upsert);
  }

  /**
   * Record {@code event} under its step.
   *
   * @return the entry it replaced, if any
   */
  public synchronized Optional<StepEvent> upsert(StepEvent event) {
    if (event.status().isActive()) {
      for (StepEvent existing : entries.values()) {
        if (existing.step() != event.step() && existing.status().isActive()) {
          throw new IllegalStateException(
              "Step " + existing.step().wireName() + " is still " + existing.status().wireName());
        }
      }
    }
    return Optional.ofNullable(entries.put(event.step(), event));
  }

  /** Put back the entry an {@link #upsert} replaced, or drop the step if it was new. */
  public synchronized void revert(StepKey step, Optional<StepEvent> previous) {
    if (previous.isPresent()) {
      entries.put(step, previous.get());
    } else {
      entries.remove(step);
    }
  }

  public synchronized Optional<StepEvent> get(StepKey step) {
    return Optional.ofNullable(entries.get(step));
  }

  /** Copy of the log in canonical order. */
  public synchronized List<StepEvent> snapshot() {
    return new ArrayList<>(entries.values());
  }

  public synchronized int size() {
    return entries.size();
  }
}
