package com.scholary.narrator.executor;

import com.scholary.narrator.job.Job;
import com.scholary.narrator.job.JobRepository;
import com.scholary.narrator.job.JobResult;
import com.scholary.narrator.job.JobStatus;
import com.scholary.narrator.job.PersistenceException;
import com.scholary.narrator.logging.StructuredLogger;
import com.scholary.narrator.objectstore.ArtifactPublisher;
import com.scholary.narrator.objectstore.ObjectStoreException;
import com.scholary.narrator.speaker.SpeakerConfig;
import com.scholary.narrator.stage.AcquiredAudio;
import com.scholary.narrator.stage.AudioArtifact;
import com.scholary.narrator.stage.PipelineStages;
import com.scholary.narrator.stage.SpeakerSetup;
import com.scholary.narrator.stage.SpeakerSource;
import com.scholary.narrator.stage.Stage;
import com.scholary.narrator.stage.StageContext;
import com.scholary.narrator.stage.StageException;
import com.scholary.narrator.stage.StageOutput;
import com.scholary.narrator.stage.TextArtifact;
import com.scholary.narrator.stage.TranscriptArtifact;
import com.scholary.narrator.steplog.EventBroadcaster;
import com.scholary.narrator.steplog.StepEvent;
import com.scholary.narrator.steplog.StepKey;
import com.scholary.narrator.steplog.StepStatus;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one job through the stage sequence.
 *
 * <p>Each stage is announced as running, invoked with the previous output, and recorded as
 * completed with its artifact path. The first failure is recorded against the step that raised
 * it, fails the job with the same message, and ends the run. A job that needs speaker input parks
 * at the speaker-config stage on a future until the configuration arrives; it keeps its slot while
 * parked.
 *
 * <p>Every event and status change is persisted before the next stage starts. Whatever happens,
 * the event stream is closed and {@code onFinished} runs exactly once so the scheduler can free
 * the slot.
 */
public class StepExecutor implements Runnable {

  private static final Logger LOGGER = LoggerFactory.getLogger(StepExecutor.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final Job job;
  private final PipelineStages stages;
  private final EventBroadcaster broadcaster;
  private final JobRepository repository;
  private final SpeakerInputGate gate;
  private final ArtifactPublisher publisher;
  private final Path runsDir;
  private final Clock clock;
  private final Runnable onFinished;

  private StepKey currentStep;

  StepExecutor(
      Job job,
      PipelineStages stages,
      EventBroadcaster broadcaster,
      JobRepository repository,
      SpeakerInputGate gate,
      ArtifactPublisher publisher,
      Path runsDir,
      Clock clock,
      Runnable onFinished) {
    this.job = job;
    this.stages = stages;
    this.broadcaster = broadcaster;
    this.repository = repository;
    this.gate = gate;
    this.publisher = publisher;
    this.runsDir = runsDir;
    this.clock = clock;
    this.onFinished = onFinished;
  }

  @Override
  public void run() {
    StructuredLogger.setJobContext(job.getJobId(), job.getOwner());
    try {
      JobResult result = execute();
      complete(result);
    } catch (StageException e) {
      fail(e.getMessage());
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected failure in step {}", stepName(), e);
      fail(describe(e));
    } finally {
      try {
        broadcaster.complete(job.getJobId());
      } finally {
        StructuredLogger.clearJobContext();
        onFinished.run();
      }
    }
  }

  private JobResult execute() {
    Path runDir = runsDir.resolve(job.getJobId());
    try {
      Files.createDirectories(runDir);
    } catch (IOException e) {
      throw new StageException("Could not create run directory: " + e.getMessage(), e);
    }
    StageContext context =
        new StageContext(job.getJobId(), runDir, runsDir, job.getSpec().parameters());

    AcquiredAudio audio =
        runStage(
            StepKey.ACQUISITION,
            "Preparing audio source",
            stages.acquisition(),
            job.getSpec().source(),
            context);
    TranscriptArtifact transcript =
        runStage(
            StepKey.TRANSCRIPTION,
            "Transcribing audio with speaker diarization",
            stages.transcription(),
            audio,
            context);
    TextArtifact translated =
        runStage(
            StepKey.TRANSLATION,
            "Translating transcript",
            stages.translation(),
            transcript,
            context);
    TextArtifact polished =
        runStage(StepKey.POLISH, "Polishing translation", stages.polish(), translated, context);
    TextArtifact summary =
        runStage(StepKey.SUMMARY, "Generating summary", stages.summary(), polished, context);

    SpeakerSetup speakers =
        job.isSpeakerRequired()
            ? awaitSpeakerInput(polished, context)
            : runStage(
                StepKey.SPEAKER_CONFIG,
                "Detecting speaker profiles",
                stages.speakerConfig(),
                new SpeakerSource(polished, transcript, audio),
                context);

    AudioArtifact dialogue =
        runStage(
            StepKey.SYNTHESIS,
            "Generating multi-speaker audio",
            stages.synthesis(),
            speakers,
            context);

    return new JobResult(
        runDir.toAbsolutePath().toString(),
        absolute(audio.path()),
        absolute(transcript.path()),
        absolute(translated.path()),
        absolute(polished.path()),
        absolute(summary.path()),
        absolute(speakers.path()),
        absolute(dialogue.path()),
        null,
        null,
        speakers.clips(),
        Map.of());
  }

  private <I, O extends StageOutput> O runStage(
      StepKey step, String message, Stage<I, O> stage, I input, StageContext context) {
    currentStep = step;
    emit(step, StepStatus.RUNNING, message, null);
    O output = stage.invoke(input, context);
    if (output == null) {
      throw new StageException("Stage " + step.wireName() + " produced no output");
    }
    emit(step, StepStatus.COMPLETED, output.summary(), context.relativize(output.path()));
    return output;
  }

  private SpeakerSetup awaitSpeakerInput(TextArtifact polished, StageContext context) {
    currentStep = StepKey.SPEAKER_CONFIG;
    List<String> tags = stages.speakerConfig().detectTags(polished.text());
    List<String> expected = tags.isEmpty() ? List.of("[SPEAKER0]") : tags;

    CompletableFuture<List<SpeakerConfig>> input =
        gate.await(job.getJobId(), expected, stages.speakerConfig().suggest(polished.text()));
    List<SpeakerConfig> speakers;
    try {
      emit(
          StepKey.SPEAKER_CONFIG,
          StepStatus.WAITING,
          "Awaiting manual speaker JSON",
          expected.size() + " speakers detected: " + String.join(", ", expected));
      speakers = input.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StageException("Interrupted while waiting for speaker input", e);
    } catch (ExecutionException e) {
      throw new StageException("Speaker input failed: " + e.getCause().getMessage(), e);
    } finally {
      gate.release(job.getJobId());
    }

    emit(
        StepKey.SPEAKER_INPUT,
        StepStatus.COMPLETED,
        "Speaker configuration received",
        speakers.size() + " speakers configured");
    emit(StepKey.SPEAKER_CONFIG, StepStatus.RUNNING, "Using provided speaker configs", null);
    SpeakerSetup setup = stages.speakerConfig().write(context.runDir(), polished.text(), speakers);
    emit(
        StepKey.SPEAKER_CONFIG,
        StepStatus.COMPLETED,
        setup.summary(),
        context.relativize(setup.path()));
    return setup;
  }

  private void complete(JobResult result) {
    Map<String, String> urls = Map.of();
    try {
      urls = publisher.publish(job.getJobId(), result);
    } catch (ObjectStoreException e) {
      LOGGER.warn("Artifacts kept local only, publishing failed: {}", e.getMessage(), e);
    }
    Instant now = clock.instant();
    job.markCompleted(result.withUrls(urls), now);
    repository.update(job);
    STRUCTURED_LOGGER.logJobCompleted(
        job.getJobId(), Duration.between(job.getStartedAt(), now).toMillis());
  }

  private void fail(String message) {
    if (job.getStatus() != JobStatus.RUNNING) {
      LOGGER.error("Job already {} when failure was reported: {}", job.getStatus(), message);
      return;
    }
    if (currentStep != null) {
      try {
        emit(currentStep, StepStatus.FAILED, message, null);
      } catch (PersistenceException e) {
        LOGGER.error("Could not record failure of step {}", stepName(), e);
      }
    }
    job.markFailed(message, clock.instant());
    try {
      repository.update(job);
    } catch (PersistenceException e) {
      LOGGER.error("Could not persist failed job", e);
    }
    STRUCTURED_LOGGER.logJobFailed(job.getJobId(), stepName(), message);
  }

  private void emit(StepKey step, StepStatus status, String message, String detail) {
    StepEvent event = StepEvent.of(step, status, message, detail);
    broadcaster.append(job, event);
    STRUCTURED_LOGGER.logStepEvent(job.getJobId(), event);
  }

  private String stepName() {
    return currentStep == null ? "none" : currentStep.wireName();
  }

  private static String describe(RuntimeException e) {
    return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
  }

  private static String absolute(Path path) {
    return path.toAbsolutePath().toString();
  }
}
