package com.scholary.narrator.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.scholary.narrator.job.IllegalJobStateException;
import com.scholary.narrator.job.Job;
import com.scholary.narrator.job.JobNotFoundException;
import com.scholary.narrator.job.JobRepository;
import com.scholary.narrator.job.JobResult;
import com.scholary.narrator.job.JobSpec;
import com.scholary.narrator.job.JobStatus;
import com.scholary.narrator.job.SourceSpec;
import com.scholary.narrator.job.SpeakerClips;
import com.scholary.narrator.job.ValidationException;
import com.scholary.narrator.scheduler.QueueFullException;
import com.scholary.narrator.scheduler.SchedulerSettings;
import com.scholary.narrator.service.JobListing;
import com.scholary.narrator.service.JobView;
import com.scholary.narrator.service.PipelineService;
import com.scholary.narrator.service.PostCompletionService;
import com.scholary.narrator.speaker.SpeakerInputException;
import com.scholary.narrator.steplog.EventBroadcaster;
import com.scholary.narrator.steplog.StepEvent;
import com.scholary.narrator.steplog.StepKey;
import com.scholary.narrator.steplog.StepStatus;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.http.converter.ResourceHttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class PipelineControllerTest {

  private static final SchedulerSettings SETTINGS =
      new SchedulerSettings(false, 2, 1, 10, List.of("news"));

  @TempDir Path tempDir;

  private PipelineService pipelineService;
  private PostCompletionService postCompletionService;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    pipelineService = mock(PipelineService.class);
    postCompletionService = mock(PostCompletionService.class);
    ObjectMapper objectMapper =
        Jackson2ObjectMapperBuilder.json()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new PipelineController(pipelineService, postCompletionService, Runnable::run),
                new SettingsController(pipelineService),
                new ArtifactController(pipelineService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .setMessageConverters(
                new StringHttpMessageConverter(StandardCharsets.UTF_8),
                new ResourceHttpMessageConverter(),
                new MappingJackson2HttpMessageConverter(objectMapper))
            .build();
  }

  @Test
  void start_shouldQueueJobForCaller() throws Exception {
    Job job = newJob("job-1", "alice");
    when(pipelineService.submit(any(JobSpec.class), eq("alice"))).thenReturn(job);
    when(pipelineService.get("job-1", "alice"))
        .thenReturn(new JobView(job.toSnapshot(), 0, false));

    mockMvc
        .perform(
            post("/api/pipeline/start")
                .header(PipelineController.OWNER_HEADER, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"audio_url\": \"https://cdn.example.com/ep.mp3\", \"speed\": 1.2}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.job_id").value("job-1"))
        .andExpect(jsonPath("$.status").value("queued"))
        .andExpect(jsonPath("$.queue_position").value(0))
        .andExpect(jsonPath("$.source.audio_url").value("https://cdn.example.com/ep.mp3"));
  }

  @Test
  void start_shouldMapQueueFullTo429AndValidationTo400() throws Exception {
    when(pipelineService.submit(any(JobSpec.class), isNull()))
        .thenThrow(new QueueFullException(3))
        .thenThrow(new ValidationException("audio_path must be an existing .mp3 or .wav file"));

    mockMvc
        .perform(
            post("/api/pipeline/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"audio_path\": \"/tmp/a.mp3\"}"))
        .andExpect(status().isTooManyRequests())
        .andExpect(jsonPath("$.error_code").value("queue_full"))
        .andExpect(jsonPath("$.message").value("Queue is full (max 3 active jobs)"))
        .andExpect(jsonPath("$.timestamp").exists());
    mockMvc
        .perform(
            post("/api/pipeline/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"audio_path\": \"/tmp/a.txt\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error_code").value("validation_error"));
  }

  @Test
  void list_shouldOmitStepsUnlessRequested() throws Exception {
    Job job = newJob("job-1", "local");
    job.getStepLog().upsert(StepEvent.of(StepKey.ACQUISITION, StepStatus.RUNNING, "Preparing"));
    when(pipelineService.list(null))
        .thenReturn(new JobListing(List.of(new JobView(job.toSnapshot(), null, false)), SETTINGS));

    mockMvc
        .perform(get("/api/pipeline/jobs"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.max_concurrent").value(1))
        .andExpect(jsonPath("$.parallel_enabled").value(false))
        .andExpect(jsonPath("$.jobs[0].job_id").value("job-1"))
        .andExpect(jsonPath("$.jobs[0].steps").doesNotExist());
    mockMvc
        .perform(get("/api/pipeline/jobs").param("include_steps", "true"))
        .andExpect(jsonPath("$.jobs[0].steps[0].step").value("acquisition"))
        .andExpect(jsonPath("$.jobs[0].steps[0].status").value("running"));
  }

  @Test
  void get_shouldAnswer404ForUnknownJob() throws Exception {
    when(pipelineService.get("missing", null)).thenThrow(new JobNotFoundException("missing"));

    mockMvc
        .perform(get("/api/pipeline/jobs/missing"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error_code").value("job_not_found"));
  }

  @Test
  void stream_shouldSendBacklogThenDone() throws Exception {
    Job job = newJob("job-1", "local");
    job.markRunning(Instant.now());
    job.getStepLog()
        .upsert(StepEvent.of(StepKey.ACQUISITION, StepStatus.COMPLETED, "Copied local audio"));
    job.markCompleted(
        new JobResult(
            "/runs/job-1",
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            SpeakerClips.NONE,
            Map.of()),
        Instant.now());
    EventBroadcaster broadcaster = new EventBroadcaster(mock(JobRepository.class));
    when(pipelineService.subscribe("job-1", null)).thenReturn(broadcaster.subscribe(job));

    MvcResult result =
        mockMvc
            .perform(get("/api/pipeline/jobs/job-1/stream"))
            .andExpect(request().asyncStarted())
            .andReturn();

    String body = result.getResponse().getContentAsString();
    assertThat(body).contains("event:progress").contains("Copied local audio");
    assertThat(body.indexOf("event:done")).isGreaterThan(body.indexOf("event:progress"));
  }

  @Test
  void stream_shouldPushLiveEventsAndKeepalivesToOpenResponse() throws Exception {
    Job job = newJob("job-1", "local");
    job.markRunning(Instant.now());
    EventBroadcaster broadcaster = new EventBroadcaster(mock(JobRepository.class));
    when(pipelineService.subscribe("job-1", null)).thenReturn(broadcaster.subscribe(job));

    MvcResult result =
        mockMvc
            .perform(get("/api/pipeline/jobs/job-1/stream"))
            .andExpect(request().asyncStarted())
            .andReturn();
    broadcaster.keepalive();
    broadcaster.append(job, StepEvent.of(StepKey.TRANSCRIPTION, StepStatus.RUNNING, "Listening"));
    broadcaster.complete("job-1");

    String body = result.getResponse().getContentAsString();
    assertThat(body).startsWith(":keepalive");
    assertThat(body.indexOf("Listening")).isLessThan(body.indexOf("event:done"));
  }

  @Test
  void submitSpeakers_shouldMapConflictAndInvalidInput() throws Exception {
    when(pipelineService.resumeWithSpeakers(eq("job-1"), isNull(), any()))
        .thenThrow(
            new IllegalJobStateException(
                "job-1", JobStatus.COMPLETED, "Job job-1 is not waiting for speaker input"))
        .thenThrow(new SpeakerInputException("Speaker configs must be a non-empty list"));

    mockMvc
        .perform(
            post("/api/pipeline/jobs/job-1/speakers")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"speakers_json\": \"[]\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error_code").value("illegal_job_state"));
    mockMvc
        .perform(
            post("/api/pipeline/jobs/job-1/speakers")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"speakers_json\": \"[]\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Speaker configs must be a non-empty list"));
    mockMvc
        .perform(
            post("/api/pipeline/jobs/job-1/speakers")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"speakers_json\": \"\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void reorderAndDelete_shouldDelegateToService() throws Exception {
    mockMvc
        .perform(
            post("/api/pipeline/queue/reorder")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"job_ids\": [\"b\", \"a\"]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"));
    verify(pipelineService).reorderQueue(List.of("b", "a"));

    mockMvc
        .perform(delete("/api/pipeline/jobs/job-1").header(PipelineController.OWNER_HEADER, "bob"))
        .andExpect(status().isNoContent());
    verify(pipelineService).delete("job-1", "bob");
  }

  @Test
  void summaryAudio_shouldUseDefaultOwner() throws Exception {
    Job job = newJob("job-1", "local");
    when(pipelineService.get("job-1", null)).thenReturn(new JobView(job.toSnapshot(), null, false));

    mockMvc.perform(post("/api/pipeline/jobs/job-1/summary-audio")).andExpect(status().isOk());

    verify(postCompletionService).generateSummaryAudio("job-1", PipelineService.DEFAULT_OWNER);
  }

  @Test
  void settings_shouldReadAndPatch() throws Exception {
    when(pipelineService.settings()).thenReturn(SETTINGS);
    when(pipelineService.updateSettings(true, 3, null))
        .thenReturn(new SchedulerSettings(true, 3, 3, 10, List.of("news")));

    mockMvc
        .perform(get("/api/settings"))
        .andExpect(jsonPath("$.max_concurrent").value(2))
        .andExpect(jsonPath("$.effective_max_concurrent").value(1))
        .andExpect(jsonPath("$.tags[0]").value("news"));
    mockMvc
        .perform(
            patch("/api/settings")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"parallel_enabled\": true, \"max_concurrent\": 3}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.effective_max_concurrent").value(3));
  }

  @Test
  void download_shouldServeResolvedArtifact() throws Exception {
    Path file = Files.writeString(tempDir.resolve("summary.txt"), "Un resume.");
    when(pipelineService.resolveArtifact("job-1/summary.txt")).thenReturn(file);
    when(pipelineService.resolveArtifact("../etc/passwd"))
        .thenThrow(new ValidationException("Path is outside the runs directory: ../etc/passwd"));

    mockMvc
        .perform(get("/api/artifacts/download").param("path", "job-1/summary.txt"))
        .andExpect(status().isOk())
        .andExpect(header().string("Content-Disposition", "attachment; filename=\"summary.txt\""))
        .andExpect(content().string("Un resume."));
    mockMvc
        .perform(get("/api/artifacts/download").param("path", "../etc/passwd"))
        .andExpect(status().isBadRequest());
  }

  private static Job newJob(String id, String owner) {
    return new Job(
        id,
        owner,
        new JobSpec(SourceSpec.audioUrl("https://cdn.example.com/ep.mp3"), null, false),
        Instant.now());
  }
}
