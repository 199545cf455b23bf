package com.scholary.narrator.job;

import java.util.List;

/**
 * Everything the service writes to its state file: scheduler settings, queue order and every job.
 */
public record PipelineState(Settings settings, List<String> queueOrder, List<JobSnapshot> jobs) {

  public record Settings(boolean parallelEnabled, int maxConcurrent, List<String> tags) {

    public Settings {
      tags = tags == null ? List.of() : List.copyOf(tags);
    }
  }

  public PipelineState {
    queueOrder = queueOrder == null ? List.of() : List.copyOf(queueOrder);
    jobs = jobs == null ? List.of() : List.copyOf(jobs);
  }
}
