package com.scholary.narrator.job;

import com.scholary.narrator.steplog.StepLog;
import java.time.Instant;
import java.util.List;

/**
 * One end-to-end run of the pipeline for one submitted source.
 *
 * <p>Status and result are written only by the step executor that owns the job, and by
 * post-completion actions once it has completed. Name, note, tags and published are user
 * metadata and may change at any time. All accessors are synchronized because executor threads,
 * request threads and the state writer read the same instance.
 */
public class Job {

  private final String jobId;
  private final String owner;
  private final JobSpec spec;
  private final Instant createdAt;
  private final StepLog stepLog;

  private JobStatus status;
  private Instant startedAt;
  private Instant finishedAt;
  private String error;
  private JobResult result;
  private boolean speakerSubmitted;

  private String customName;
  private String note;
  private List<String> tags = List.of();
  private boolean published;

  public Job(String jobId, String owner, JobSpec spec, Instant createdAt) {
    this(jobId, owner, spec, createdAt, JobStatus.QUEUED, new StepLog());
  }

  Job(
      String jobId,
      String owner,
      JobSpec spec,
      Instant createdAt,
      JobStatus status,
      StepLog stepLog) {
    this.jobId = jobId;
    this.owner = owner;
    this.spec = spec;
    this.createdAt = createdAt;
    this.status = status;
    this.stepLog = stepLog;
  }

  public String getJobId() {
    return jobId;
  }

  public String getOwner() {
    return owner;
  }

  public JobSpec getSpec() {
    return spec;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public StepLog getStepLog() {
    return stepLog;
  }

  public boolean isSpeakerRequired() {
    return spec.speakerRequired();
  }

  public synchronized JobStatus getStatus() {
    return status;
  }

  public synchronized boolean isTerminal() {
    return status.isTerminal();
  }

  public synchronized Instant getStartedAt() {
    return startedAt;
  }

  public synchronized Instant getFinishedAt() {
    return finishedAt;
  }

  public synchronized String getError() {
    return error;
  }

  public synchronized JobResult getResult() {
    return result;
  }

  public synchronized boolean isSpeakerSubmitted() {
    return speakerSubmitted;
  }

  public synchronized void markRunning(Instant now) {
    requireStatus(JobStatus.QUEUED, JobStatus.RUNNING);
    status = JobStatus.RUNNING;
    startedAt = now;
  }

  /** Undo {@link #markRunning} for a promotion that could not be persisted. */
  public synchronized void revertToQueued() {
    requireStatus(JobStatus.RUNNING, JobStatus.QUEUED);
    status = JobStatus.QUEUED;
    startedAt = null;
  }

  public synchronized void markCompleted(JobResult jobResult, Instant now) {
    requireStatus(JobStatus.RUNNING, JobStatus.COMPLETED);
    if (jobResult == null) {
      throw new IllegalArgumentException("A completed job must carry a result");
    }
    status = JobStatus.COMPLETED;
    result = jobResult;
    finishedAt = now;
  }

  public synchronized void markFailed(String message, Instant now) {
    requireStatus(JobStatus.RUNNING, JobStatus.FAILED);
    status = JobStatus.FAILED;
    error = message;
    finishedAt = now;
  }

  /** Replace the result of a completed job; used by post-completion actions. */
  public synchronized void updateResult(JobResult jobResult) {
    if (status != JobStatus.COMPLETED) {
      throw new IllegalStateException("Job " + jobId + " is " + status.wireName());
    }
    result = jobResult;
  }

  public synchronized void markSpeakerSubmitted() {
    speakerSubmitted = true;
  }

  public synchronized String getCustomName() {
    return customName;
  }

  public synchronized void setCustomName(String customName) {
    this.customName = customName;
  }

  public synchronized String getNote() {
    return note;
  }

  public synchronized void setNote(String note) {
    this.note = note;
  }

  public synchronized List<String> getTags() {
    return tags;
  }

  public synchronized void setTags(List<String> tags) {
    this.tags = List.copyOf(tags);
  }

  public synchronized boolean isPublished() {
    return published;
  }

  public synchronized void setPublished(boolean published) {
    this.published = published;
  }

  public synchronized JobSnapshot toSnapshot() {
    return new JobSnapshot(
        jobId,
        owner,
        status,
        createdAt,
        startedAt,
        finishedAt,
        error,
        stepLog.snapshot(),
        result,
        spec,
        speakerSubmitted,
        customName,
        note,
        tags,
        published);
  }

  public static Job fromSnapshot(JobSnapshot snapshot) {
    Job job =
        new Job(
            snapshot.jobId(),
            snapshot.owner(),
            snapshot.spec(),
            snapshot.createdAt(),
            snapshot.status(),
            new StepLog(snapshot.steps()));
    job.startedAt = snapshot.startedAt();
    job.finishedAt = snapshot.finishedAt();
    job.error = snapshot.error();
    job.result = snapshot.result();
    job.speakerSubmitted = snapshot.speakerSubmitted();
    job.customName = snapshot.customName();
    job.note = snapshot.note();
    job.tags = List.copyOf(snapshot.tags());
    job.published = snapshot.published();
    return job;
  }

  private void requireStatus(JobStatus expected, JobStatus target) {
    if (status != expected) {
      throw new IllegalStateException(
          String.format(
              "Job %s cannot move from %s to %s", jobId, status.wireName(), target.wireName()));
    }
  }
}
