package com.scholary.narrator.api;

import com.scholary.narrator.job.JobParameters;
import com.scholary.narrator.job.JobResult;
import com.scholary.narrator.job.JobSnapshot;
import com.scholary.narrator.job.JobStatus;
import com.scholary.narrator.job.SourceSpec;
import com.scholary.narrator.service.JobView;
import com.scholary.narrator.steplog.StepEvent;
import java.time.Instant;
import java.util.List;

/**
 * A job as returned by the API.
 *
 * <p>{@code steps} is left out of listings unless requested; {@code queuePosition} is 0-based and
 * only present while the job is queued.
 */
public record JobResponse(
    String jobId,
    JobStatus status,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    String error,
    SourceSpec source,
    JobParameters parameters,
    boolean speakerRequired,
    boolean speakerSubmitted,
    boolean waitingForSpeakers,
    Integer queuePosition,
    List<StepEvent> steps,
    JobResult result,
    String customName,
    String note,
    List<String> tags,
    boolean published) {

  public static JobResponse from(JobView view, boolean includeSteps) {
    JobSnapshot job = view.job();
    return new JobResponse(
        job.jobId(),
        job.status(),
        job.createdAt(),
        job.startedAt(),
        job.finishedAt(),
        job.error(),
        job.spec().source(),
        job.spec().parameters(),
        job.spec().speakerRequired(),
        job.speakerSubmitted(),
        view.waitingForSpeakers(),
        view.queuePosition(),
        includeSteps ? job.steps() : null,
        job.result(),
        job.customName(),
        job.note(),
        job.tags(),
        job.published());
  }
}
