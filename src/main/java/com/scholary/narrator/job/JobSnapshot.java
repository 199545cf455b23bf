package com.scholary.narrator.job;

import com.scholary.narrator.steplog.StepEvent;
import java.time.Instant;
import java.util.List;

/** Serializable copy of a {@link Job}, used for the state file and API responses. */
public record JobSnapshot(
    String jobId,
    String owner,
    JobStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    String error,
    List<StepEvent> steps,
    JobResult result,
    JobSpec spec,
    boolean speakerSubmitted,
    String customName,
    String note,
    List<String> tags,
    boolean published) {

  public JobSnapshot {
    steps = steps == null ? List.of() : List.copyOf(steps);
    tags = tags == null ? List.of() : List.copyOf(tags);
  }
}
