package com.scholary.narrator.service;

import com.scholary.narrator.executor.SpeakerInputGate;
import com.scholary.narrator.job.IllegalJobStateException;
import com.scholary.narrator.job.Job;
import com.scholary.narrator.job.JobNotFoundException;
import com.scholary.narrator.job.JobParameters;
import com.scholary.narrator.job.JobRepository;
import com.scholary.narrator.job.JobResult;
import com.scholary.narrator.job.JobSnapshot;
import com.scholary.narrator.job.JobSpec;
import com.scholary.narrator.job.JobStatus;
import com.scholary.narrator.job.SourceSpec;
import com.scholary.narrator.job.ValidationException;
import com.scholary.narrator.scheduler.PipelineScheduler;
import com.scholary.narrator.scheduler.SchedulerSettings;
import com.scholary.narrator.stage.SpeakerConfigStage;
import com.scholary.narrator.steplog.EventBroadcaster;
import com.scholary.narrator.steplog.JobEventStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Entry point for every pipeline operation exposed over HTTP.
 *
 * <p>Validates requests before anything is created, hides other owners' jobs behind {@link
 * JobNotFoundException}, and combines job records with the scheduler's view of them.
 */
public class PipelineService {

  public static final String DEFAULT_OWNER = "local";

  private final PipelineScheduler scheduler;
  private final JobRepository repository;
  private final EventBroadcaster broadcaster;
  private final SpeakerInputGate gate;
  private final SpeakerConfigStage speakerConfigStage;
  private final Path runsDir;

  public PipelineService(
      PipelineScheduler scheduler,
      JobRepository repository,
      EventBroadcaster broadcaster,
      SpeakerInputGate gate,
      SpeakerConfigStage speakerConfigStage,
      Path runsDir) {
    this.scheduler = scheduler;
    this.repository = repository;
    this.broadcaster = broadcaster;
    this.gate = gate;
    this.speakerConfigStage = speakerConfigStage;
    this.runsDir = runsDir.toAbsolutePath().normalize();
  }

  /**
   * Validate and enqueue a job.
   *
   * @throws ValidationException if the source is missing, ambiguous or unusable
   * @throws com.scholary.narrator.scheduler.QueueFullException if the queue is full
   */
  public Job submit(JobSpec spec, String owner) {
    validate(spec);
    return scheduler.submit(spec, ownerOrDefault(owner));
  }

  /**
   * The caller's jobs: queued in queue order, then running by start time, then finished jobs
   * newest first.
   */
  public JobListing list(String owner) {
    String caller = ownerOrDefault(owner);
    List<JobView> views = new ArrayList<>();
    for (Job job : repository.findAll()) {
      if (job.getOwner().equals(caller)) {
        views.add(view(job));
      }
    }
    views.sort(LISTING_ORDER);
    return new JobListing(views, scheduler.settings());
  }

  public JobView get(String jobId, String owner) {
    return view(find(jobId, owner));
  }

  /** Backlog plus live events of the job, ending with one done marker. */
  public JobEventStream subscribe(String jobId, String owner) {
    return broadcaster.subscribe(find(jobId, owner));
  }

  /**
   * Hand a speaker configuration to a job parked at the speaker-config stage.
   *
   * @throws IllegalJobStateException if the job is not waiting for speaker input
   * @throws com.scholary.narrator.speaker.SpeakerInputException if the configuration is invalid;
   *     the job keeps waiting
   */
  public JobView resumeWithSpeakers(String jobId, String owner, String speakersJson) {
    Job job = find(jobId, owner);
    if (job.getStatus() != JobStatus.RUNNING || !gate.resume(jobId, speakersJson)) {
      throw new IllegalJobStateException(
          jobId, job.getStatus(), "Job " + jobId + " is not waiting for speaker input");
    }
    job.markSpeakerSubmitted();
    repository.update(job);
    return view(job);
  }

  /**
   * Suggested speakers for a job: while it waits for input, the profiles derived from its
   * polished text; once completed, the same derivation for regenerating audio.
   */
  public SpeakerTemplate speakerTemplate(String jobId, String owner) {
    Job job = find(jobId, owner);
    Optional<SpeakerInputGate.PendingInput> pending = gate.pending(jobId);
    if (pending.isPresent()) {
      return new SpeakerTemplate(
          jobId, pending.get().expectedTags(), pending.get().suggested());
    }
    JobResult result = job.getResult();
    if (job.getStatus() != JobStatus.COMPLETED || result == null) {
      throw new IllegalJobStateException(
          jobId, job.getStatus(), "Job " + jobId + " has no polished text yet");
    }
    String text = readText(Path.of(result.polishedPath()));
    return new SpeakerTemplate(
        jobId, speakerConfigStage.detectTags(text), speakerConfigStage.suggest(text));
  }

  public void reorderQueue(List<String> jobIds) {
    scheduler.reorder(jobIds);
  }

  public SchedulerSettings settings() {
    return scheduler.settings();
  }

  public SchedulerSettings updateSettings(
      Boolean parallelEnabled, Integer maxConcurrent, List<String> tags) {
    return scheduler.updateSettings(parallelEnabled, maxConcurrent, tags);
  }

  /**
   * Edit name, note, tags or published flag. When the tag registry is non-empty, only registered
   * tags are accepted.
   */
  public JobView updateMetadata(String jobId, String owner, MetadataUpdate update) {
    Job job = find(jobId, owner);
    if (update.tags() != null) {
      List<String> registry = scheduler.settings().tags();
      List<String> cleaned = new ArrayList<>();
      for (String tag : update.tags()) {
        if (tag == null || tag.isBlank()) {
          continue;
        }
        String stripped = tag.strip();
        if (!registry.isEmpty() && !registry.contains(stripped)) {
          throw new ValidationException("Unknown tag: " + stripped);
        }
        if (!cleaned.contains(stripped)) {
          cleaned.add(stripped);
        }
      }
      job.setTags(cleaned);
    }
    if (update.customName() != null) {
      job.setCustomName(update.customName().isBlank() ? null : update.customName().strip());
    }
    if (update.note() != null) {
      job.setNote(update.note().isBlank() ? null : update.note());
    }
    if (update.published() != null) {
      job.setPublished(update.published());
    }
    repository.update(job);
    return view(job);
  }

  /**
   * Remove a job's record. Subscribers of a queued job are told it is done. A running job is
   * neither signalled nor interrupted: its executor, parked on speaker input or not, keeps its slot
   * until it finishes on its own.
   */
  public void delete(String jobId, String owner) {
    find(jobId, owner);
    Job removed = scheduler.delete(jobId);
    if (removed.getStatus() == JobStatus.QUEUED) {
      broadcaster.complete(jobId);
    }
  }

  /**
   * Resolve a run-relative artifact path.
   *
   * @throws ValidationException if the path is blank or leaves the runs directory
   * @throws ArtifactNotFoundException if no file exists there
   */
  public Path resolveArtifact(String relativePath) {
    if (relativePath == null || relativePath.isBlank()) {
      throw new ValidationException("path is required");
    }
    Path resolved;
    try {
      resolved = runsDir.resolve(relativePath).normalize();
    } catch (InvalidPathException e) {
      throw new ValidationException("Invalid path: " + relativePath);
    }
    if (!resolved.startsWith(runsDir)) {
      throw new ValidationException("Path is outside the runs directory: " + relativePath);
    }
    if (!Files.isRegularFile(resolved)) {
      throw new ArtifactNotFoundException(relativePath);
    }
    return resolved;
  }

  private Job find(String jobId, String owner) {
    return repository
        .findById(jobId)
        .filter(job -> job.getOwner().equals(ownerOrDefault(owner)))
        .orElseThrow(() -> new JobNotFoundException(jobId));
  }

  private JobView view(Job job) {
    OptionalInt position = scheduler.queuePosition(job.getJobId());
    return new JobView(
        job.toSnapshot(),
        position.isPresent() ? position.getAsInt() : null,
        gate.isWaiting(job.getJobId()));
  }

  static void validate(JobSpec spec) {
    SourceSpec source = spec == null ? null : spec.source();
    if (source == null || source.count() != 1) {
      throw new ValidationException("Provide exactly one of youtube_url, audio_url or audio_path");
    }
    switch (source.kind()) {
      case YOUTUBE -> {
        if (!isHttpUrl(source.youtubeUrl())) {
          throw new ValidationException("youtube_url must be an http(s) URL");
        }
      }
      case AUDIO_URL -> {
        if (!isHttpUrl(source.audioUrl()) || !hasAudioExtension(urlPath(source.audioUrl()))) {
          throw new ValidationException(
              "audio_url must be an http(s) URL ending with .mp3 or .wav");
        }
      }
      case AUDIO_PATH -> {
        if (!hasAudioExtension(source.audioPath()) || !isRegularFile(source.audioPath())) {
          throw new ValidationException("audio_path must be an existing .mp3 or .wav file");
        }
      }
    }
    JobParameters parameters = spec.parameters();
    if (parameters.chunkLength() <= 0) {
      throw new ValidationException("chunk_length must be positive");
    }
    if (parameters.speed() <= 0) {
      throw new ValidationException("speed must be positive");
    }
  }

  private static boolean isHttpUrl(String value) {
    try {
      URI uri = new URI(value.strip());
      String scheme = uri.getScheme();
      return uri.getHost() != null
          && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
    } catch (URISyntaxException e) {
      return false;
    }
  }

  private static String urlPath(String value) {
    try {
      String path = new URI(value.strip()).getPath();
      return path == null ? "" : path;
    } catch (URISyntaxException e) {
      return "";
    }
  }

  private static boolean hasAudioExtension(String value) {
    String lower = value.strip().toLowerCase(Locale.ROOT);
    return lower.endsWith(".mp3") || lower.endsWith(".wav");
  }

  private static boolean isRegularFile(String value) {
    try {
      return Files.isRegularFile(Path.of(value.strip()));
    } catch (InvalidPathException e) {
      return false;
    }
  }

  private static String readText(Path path) {
    try {
      return Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not read " + path, e);
    }
  }

  private static String ownerOrDefault(String owner) {
    return owner == null || owner.isBlank() ? DEFAULT_OWNER : owner.strip();
  }

  private static final Comparator<JobView> LISTING_ORDER =
      (left, right) -> {
        JobSnapshot a = left.job();
        JobSnapshot b = right.job();
        int byRank = Integer.compare(rank(a.status()), rank(b.status()));
        if (byRank != 0) {
          return byRank;
        }
        return switch (a.status()) {
          case QUEUED -> Integer.compare(position(left), position(right));
          case RUNNING -> orEpoch(a.startedAt()).compareTo(orEpoch(b.startedAt()));
          case COMPLETED, FAILED -> finishedOrCreated(b).compareTo(finishedOrCreated(a));
        };
      };

  private static int rank(JobStatus status) {
    return switch (status) {
      case QUEUED -> 0;
      case RUNNING -> 1;
      case COMPLETED, FAILED -> 2;
    };
  }

  private static int position(JobView view) {
    return view.queuePosition() == null ? Integer.MAX_VALUE : view.queuePosition();
  }

  private static Instant orEpoch(Instant instant) {
    return instant == null ? Instant.EPOCH : instant;
  }

  private static Instant finishedOrCreated(JobSnapshot job) {
    return job.finishedAt() == null ? job.createdAt() : job.finishedAt();
  }
}
