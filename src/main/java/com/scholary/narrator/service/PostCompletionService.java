package com.scholary.narrator.service;

import com.scholary.narrator.job.IllegalJobStateException;
import com.scholary.narrator.job.Job;
import com.scholary.narrator.job.JobNotFoundException;
import com.scholary.narrator.job.JobRepository;
import com.scholary.narrator.job.JobResult;
import com.scholary.narrator.job.JobStatus;
import com.scholary.narrator.job.ValidationException;
import com.scholary.narrator.logging.StructuredLogger;
import com.scholary.narrator.objectstore.ArtifactPublisher;
import com.scholary.narrator.objectstore.ObjectStoreException;
import com.scholary.narrator.speaker.SpeakerConfig;
import com.scholary.narrator.speaker.SpeakerConfigParser;
import com.scholary.narrator.speaker.SpeakerProfileDeriver;
import com.scholary.narrator.stage.AudioMerger;
import com.scholary.narrator.stage.RemoteSynthesisStage;
import com.scholary.narrator.stage.SpeakerConfigStage;
import com.scholary.narrator.stage.SpeakerSetup;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Actions on a completed job: narrate the summary, merge the final programme, re-synthesize the
 * dialogue with other voices.
 *
 * <p>Actions on the same job run one at a time. Each writes a fixed file name in the run
 * directory, so repeating an action replaces its previous output. Only the job's result changes;
 * its status stays completed.
 */
public class PostCompletionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(PostCompletionService.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String SUMMARY_AUDIO = "summary_audio.wav";
  static final String FINAL_AUDIO = "final_audio.wav";
  static final String DIALOGUE_AUDIO = "audio.wav";

  private final JobRepository repository;
  private final RemoteSynthesisStage synthesis;
  private final SpeakerConfigStage speakerConfigStage;
  private final SpeakerConfigParser parser;
  private final SpeakerProfileDeriver deriver;
  private final AudioMerger merger;
  private final ArtifactPublisher publisher;
  private final List<Path> introAssets;
  private final ConcurrentMap<String, JobLock> locks = new ConcurrentHashMap<>();

  public PostCompletionService(
      JobRepository repository,
      RemoteSynthesisStage synthesis,
      SpeakerConfigStage speakerConfigStage,
      SpeakerConfigParser parser,
      SpeakerProfileDeriver deriver,
      AudioMerger merger,
      ArtifactPublisher publisher,
      List<Path> introAssets) {
    this.repository = repository;
    this.synthesis = synthesis;
    this.speakerConfigStage = speakerConfigStage;
    this.parser = parser;
    this.deriver = deriver;
    this.merger = merger;
    this.publisher = publisher;
    this.introAssets = List.copyOf(introAssets);
  }

  /** Narrate {@code summary.txt} with the default narrator voice into {@code summary_audio.wav}. */
  public Job generateSummaryAudio(String jobId, String owner) {
    return withCompletedJob(
        jobId,
        owner,
        "summary_audio",
        (job, result) -> {
          String summary = readText(result.summaryPath());
          Path output = Path.of(result.runDir()).resolve(SUMMARY_AUDIO);
          Path audio =
              synthesis.synthesize(
                  SpeakerConfigStage.dialogue(summary),
                  List.of(deriver.defaultNarrator()),
                  job.getSpec().parameters().speed(),
                  output);
          return current -> current.withSummaryAudioPath(audio.toAbsolutePath().toString());
        });
  }

  /**
   * Concatenate the intro assets, the summary narration and the dialogue into {@code
   * final_audio.wav}.
   *
   * @throws IllegalJobStateException if the summary audio has not been generated
   */
  public Job mergeFinalAudio(String jobId, String owner) {
    return withCompletedJob(
        jobId,
        owner,
        "merge_audio",
        (job, result) -> {
          if (result.summaryAudioPath() == null
              || !Files.isRegularFile(Path.of(result.summaryAudioPath()))) {
            throw new IllegalJobStateException(
                jobId, job.getStatus(), "Generate the summary audio before merging");
          }
          List<Path> inputs = new ArrayList<>();
          for (Path asset : introAssets) {
            if (!Files.isRegularFile(asset)) {
              throw new ValidationException("Intro asset not found: " + asset);
            }
            inputs.add(asset);
          }
          inputs.add(Path.of(result.summaryAudioPath()));
          inputs.add(Path.of(result.audioPath()));
          Path output = Path.of(result.runDir()).resolve(FINAL_AUDIO);
          merger.merge(inputs, output);
          return current -> current.withMergedAudioPath(output.toAbsolutePath().toString());
        });
  }

  /**
   * Replace the speaker configuration and re-synthesize the dialogue.
   *
   * @throws com.scholary.narrator.speaker.SpeakerInputException if the configuration is invalid
   */
  public Job regenerateAudio(String jobId, String owner, String speakersJson) {
    return withCompletedJob(
        jobId,
        owner,
        "regenerate_audio",
        (job, result) -> {
          String polished = readText(result.polishedPath());
          List<SpeakerConfig> speakers =
              parser.parse(speakersJson, speakerConfigStage.detectTags(polished));
          Path runDir = Path.of(result.runDir());
          SpeakerSetup setup = speakerConfigStage.write(runDir, polished, speakers);
          Path audio =
              synthesis.synthesize(
                  setup.dialogueText(),
                  setup.speakers(),
                  job.getSpec().parameters().speed(),
                  runDir.resolve(DIALOGUE_AUDIO));
          return current ->
              current.withAudio(
                  setup.path().toAbsolutePath().toString(), audio.toAbsolutePath().toString());
        });
  }

  /** Produces the change to apply to the result once the action's files are written. */
  @FunctionalInterface
  private interface Action {
    UnaryOperator<JobResult> run(Job job, JobResult result);
  }

  /** Per-job lock, dropped from the map once its last user is done. */
  private static final class JobLock {
    private final ReentrantLock lock = new ReentrantLock();
    private int users;
  }

  private Job withCompletedJob(String jobId, String owner, String name, Action action) {
    JobLock jobLock = acquire(jobId);
    try {
      Job job =
          repository
              .findById(jobId)
              .filter(candidate -> candidate.getOwner().equals(owner))
              .orElseThrow(() -> new JobNotFoundException(jobId));
      if (job.getStatus() != JobStatus.COMPLETED || job.getResult() == null) {
        throw new IllegalJobStateException(
            jobId, job.getStatus(), "Job " + jobId + " is " + job.getStatus().wireName());
      }

      UnaryOperator<JobResult> change = action.run(job, job.getResult());
      JobResult updated = change.apply(job.getResult());
      updated = updated.withUrls(publish(jobId, updated));
      job.updateResult(updated);
      repository.update(job);
      STRUCTURED_LOGGER.logPostAction(jobId, name, updated.artifacts().size());
      return job;
    } finally {
      release(jobId, jobLock);
    }
  }

  private JobLock acquire(String jobId) {
    JobLock jobLock =
        locks.compute(
            jobId,
            (id, existing) -> {
              JobLock entry = existing == null ? new JobLock() : existing;
              entry.users++;
              return entry;
            });
    jobLock.lock.lock();
    return jobLock;
  }

  private void release(String jobId, JobLock jobLock) {
    jobLock.lock.unlock();
    locks.computeIfPresent(jobId, (id, entry) -> --entry.users == 0 ? null : entry);
  }

  int heldLocks() {
    return locks.size();
  }

  private Map<String, String> publish(String jobId, JobResult result) {
    try {
      return publisher.publish(jobId, result);
    } catch (ObjectStoreException e) {
      LOGGER.warn("Artifacts kept local only, publishing failed: {}", e.getMessage(), e);
      return Map.of();
    }
  }

  private static String readText(String path) {
    try {
      return Files.readString(Path.of(path), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not read " + path, e);
    }
  }
}
