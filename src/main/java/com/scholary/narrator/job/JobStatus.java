package com.scholary.narrator.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle status of a pipeline job. Transitions only move forward. */
public enum JobStatus {
  QUEUED("queued"),
  RUNNING("running"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String wireName;

  JobStatus(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static JobStatus fromWireName(String value) {
    for (JobStatus status : values()) {
      if (status.wireName.equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job status: " + value);
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  public boolean isActive() {
    return this == QUEUED || this == RUNNING;
  }
}
