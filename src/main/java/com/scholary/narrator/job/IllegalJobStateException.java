package com.scholary.narrator.job;

/** An operation was asked of a job whose status does not allow it. */
public class IllegalJobStateException extends RuntimeException {

  private final String jobId;
  private final JobStatus status;

  public IllegalJobStateException(String jobId, JobStatus status, String message) {
    super(message);
    this.jobId = jobId;
    this.status = status;
  }

  public String getJobId() {
    return jobId;
  }

  public JobStatus getStatus() {
    return status;
  }
}
