package com.scholary.narrator.api;

import com.scholary.narrator.config.AsyncConfig;
import com.scholary.narrator.job.Job;
import com.scholary.narrator.service.JobListing;
import com.scholary.narrator.service.JobView;
import com.scholary.narrator.service.PipelineService;
import com.scholary.narrator.service.PostCompletionService;
import com.scholary.narrator.steplog.JobEventStream;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Map;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * REST API for pipeline jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting, listing, inspecting and deleting jobs
 *   <li>Streaming a job's step events as Server-Sent Events
 *   <li>Submitting speaker configurations to jobs waiting for them
 *   <li>Queue reordering and job metadata
 *   <li>Post-completion audio actions
 * </ul>
 *
 * <p>Jobs belong to the caller named by the optional {@value #OWNER_HEADER} header; other callers'
 * jobs answer 404.
 */
@RestController
@RequestMapping("/api/pipeline")
@Tag(name = "Pipeline", description = "Job submission, progress and post-completion actions")
public class PipelineController {

  static final String OWNER_HEADER = "X-Owner-Id";

  private final PipelineService pipelineService;
  private final PostCompletionService postCompletionService;
  private final Executor streamExecutor;

  public PipelineController(
      PipelineService pipelineService,
      PostCompletionService postCompletionService,
      @Qualifier(AsyncConfig.STREAM_EXECUTOR) Executor streamExecutor) {
    this.pipelineService = pipelineService;
    this.postCompletionService = postCompletionService;
    this.streamExecutor = streamExecutor;
  }

  @PostMapping("/start")
  @Operation(
      summary = "Start a pipeline job",
      description =
          "Queue a job for a YouTube URL, a direct audio URL or a local audio file. "
              + "Answers 429 when the queue is full.")
  public JobResponse start(
      @RequestBody PipelineStartRequest request,
      @RequestHeader(name = OWNER_HEADER, required = false) String owner) {
    Job job = pipelineService.submit(request.toSpec(), owner);
    return JobResponse.from(pipelineService.get(job.getJobId(), owner), true);
  }

  @GetMapping("/jobs")
  @Operation(summary = "List the caller's jobs")
  public JobListResponse list(
      @RequestParam(name = "include_steps", defaultValue = "false") boolean includeSteps,
      @RequestHeader(name = OWNER_HEADER, required = false) String owner) {
    JobListing listing = pipelineService.list(owner);
    return new JobListResponse(
        listing.jobs().stream().map(view -> JobResponse.from(view, includeSteps)).toList(),
        listing.settings().effectiveMaxConcurrent(),
        listing.settings().parallelEnabled(),
        listing.settings().maxQueueSize());
  }

  @GetMapping("/jobs/{jobId}")
  @Operation(summary = "Get a job with its step log")
  public JobResponse get(
      @PathVariable String jobId,
      @RequestHeader(name = OWNER_HEADER, required = false) String owner) {
    return JobResponse.from(pipelineService.get(jobId, owner), true);
  }

  /**
   * Stream a job's step events.
   *
   * <p>Sends the backlog, then live events, each as a {@code progress} event, and finally one
   * {@code done} event. A finished job's stream ends right after its backlog. Idle streams get
   * a keepalive comment from {@link StreamKeepalive}.
   */
  @GetMapping(path = "/jobs/{jobId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  @Operation(summary = "Stream step events of a job as Server-Sent Events")
  public SseEmitter stream(
      @PathVariable String jobId,
      @RequestHeader(name = OWNER_HEADER, required = false) String owner) {
    JobEventStream events = pipelineService.subscribe(jobId, owner);
    SseEmitter emitter = new SseEmitter(0L);
    emitter.onCompletion(events::close);
    emitter.onTimeout(events::close);
    emitter.onError(error -> events.close());
    events.start(streamExecutor, new SseEventSink(jobId, emitter));
    return emitter;
  }

  @PostMapping("/jobs/{jobId}/speakers")
  @Operation(
      summary = "Submit speaker configuration",
      description =
          "Resume a job waiting at the speaker-config stage. Answers 409 if the job is not "
              + "waiting and 400 if the configuration is invalid; the job keeps waiting then.")
  public JobResponse submitSpeakers(
      @PathVariable String jobId,
      @Valid @RequestBody SpeakerSubmission submission,
      @RequestHeader(name = OWNER_HEADER, required = false) String owner) {
    return JobResponse.from(
        pipelineService.resumeWithSpeakers(jobId, owner, submission.speakersJson()), true);
  }

  @GetMapping("/jobs/{jobId}/speakers-template")
  @Operation(summary = "Suggested speaker configuration derived from the polished text")
  public SpeakerTemplateResponse speakersTemplate(
      @PathVariable String jobId,
      @RequestHeader(name = OWNER_HEADER, required = false) String owner) {
    return SpeakerTemplateResponse.from(pipelineService.speakerTemplate(jobId, owner));
  }

  @PostMapping("/queue/reorder")
  @Operation(summary = "Reorder queued jobs")
  public Map<String, Object> reorder(@Valid @RequestBody ReorderRequest request) {
    pipelineService.reorderQueue(request.jobIds());
    return Map.of("status", "ok", "job_ids", request.jobIds());
  }

  @PostMapping("/jobs/{jobId}/metadata")
  @Operation(summary = "Update name, note, tags or published flag of a job")
  public JobResponse updateMetadata(
      @PathVariable String jobId,
      @Valid @RequestBody MetadataUpdateRequest request,
      @RequestHeader(name = OWNER_HEADER, required = false) String owner) {
    return JobResponse.from(
        pipelineService.updateMetadata(jobId, owner, request.toUpdate()), false);
  }

  @DeleteMapping("/jobs/{jobId}")
  @Operation(summary = "Delete a job record")
  public ResponseEntity<Void> delete(
      @PathVariable String jobId,
      @RequestHeader(name = OWNER_HEADER, required = false) String owner) {
    pipelineService.delete(jobId, owner);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/jobs/{jobId}/summary-audio")
  @Operation(summary = "Synthesize the summary with the job's narrator voice")
  public JobResponse summaryAudio(
      @PathVariable String jobId,
      @RequestHeader(name = OWNER_HEADER, required = false) String owner) {
    postCompletionService.generateSummaryAudio(jobId, ownerOrDefault(owner));
    return JobResponse.from(pipelineService.get(jobId, owner), false);
  }

  @PostMapping("/jobs/{jobId}/merge-audio")
  @Operation(summary = "Concatenate intro, summary audio and main audio")
  public JobResponse mergeAudio(
      @PathVariable String jobId,
      @RequestHeader(name = OWNER_HEADER, required = false) String owner) {
    postCompletionService.mergeFinalAudio(jobId, ownerOrDefault(owner));
    return JobResponse.from(pipelineService.get(jobId, owner), false);
  }

  @PostMapping("/jobs/{jobId}/tts")
  @Operation(summary = "Regenerate the main audio with a new speaker configuration")
  public JobResponse regenerateAudio(
      @PathVariable String jobId,
      @Valid @RequestBody SpeakerSubmission submission,
      @RequestHeader(name = OWNER_HEADER, required = false) String owner) {
    postCompletionService.regenerateAudio(
        jobId, ownerOrDefault(owner), submission.speakersJson());
    return JobResponse.from(pipelineService.get(jobId, owner), false);
  }

  private static String ownerOrDefault(String owner) {
    return owner == null || owner.isBlank() ? PipelineService.DEFAULT_OWNER : owner.strip();
  }
}
