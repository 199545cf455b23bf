package com.scholary.narrator.steplog;

import com.fasterxml.jackson.annotation.JsonValue;

/** Status of one pipeline step as shown in a job's step log. */
public enum StepStatus {
  PENDING("pending"),
  RUNNING("running"),
  WAITING("waiting"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String wireName;

  StepStatus(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /** Running and waiting steps are the ones still holding the executor's attention. */
  public boolean isActive() {
    return this == RUNNING || this == WAITING;
  }
}
