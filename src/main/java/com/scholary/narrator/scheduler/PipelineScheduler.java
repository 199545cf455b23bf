package com.scholary.narrator.scheduler;

import com.scholary.narrator.executor.StepExecutorFactory;
import com.scholary.narrator.job.Job;
import com.scholary.narrator.job.JobNotFoundException;
import com.scholary.narrator.job.JobRepository;
import com.scholary.narrator.job.JobSpec;
import com.scholary.narrator.job.JobStatus;
import com.scholary.narrator.job.PersistenceException;
import com.scholary.narrator.job.PipelineState;
import com.scholary.narrator.logging.StructuredLogger;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admits jobs, keeps the queue order and promotes queued jobs while slots are free.
 *
 * <p>One lock guards the queue, the set of running ids and the limits, so two promotions can
 * never claim the same slot and a reorder never interleaves with a promotion. A running job holds
 * its slot until its executor reports back, including while it waits for speaker input and after
 * its record has been deleted.
 */
public class PipelineScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineScheduler.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  public static final int MIN_CONCURRENT = 1;
  public static final int MAX_CONCURRENT = 5;

  private final ReentrantLock lock = new ReentrantLock();
  private final List<String> queue = new ArrayList<>();
  private final Set<String> running = new HashSet<>();

  private final JobRepository repository;
  private final StepExecutorFactory executorFactory;
  private final Executor taskExecutor;
  private final Clock clock;
  private final int maxQueueSize;

  private boolean parallelEnabled;
  private int maxConcurrent;
  private List<String> tags;

  public PipelineScheduler(
      JobRepository repository,
      StepExecutorFactory executorFactory,
      Executor taskExecutor,
      Clock clock,
      int maxQueueSize) {
    this.repository = repository;
    this.executorFactory = executorFactory;
    this.taskExecutor = taskExecutor;
    this.clock = clock;
    this.maxQueueSize = maxQueueSize;
    PipelineState.Settings settings = repository.getSettings();
    this.parallelEnabled = settings.parallelEnabled();
    this.maxConcurrent = clamp(settings.maxConcurrent());
    this.tags = settings.tags();
  }

  /**
   * Reload persisted state: jobs that were running are failed by the repository, queued jobs go
   * back into the queue in their stored order, then free slots are filled.
   */
  @PostConstruct
  public void recover() {
    lock.lock();
    try {
      Optional<PipelineState> state = repository.recover(clock.instant());
      if (state.isEmpty()) {
        return;
      }
      PipelineState.Settings settings = repository.getSettings();
      parallelEnabled = settings.parallelEnabled();
      maxConcurrent = clamp(settings.maxConcurrent());
      tags = settings.tags();

      Set<String> order = new LinkedHashSet<>();
      for (String jobId : state.get().queueOrder()) {
        repository
            .findById(jobId)
            .filter(job -> job.getStatus() == JobStatus.QUEUED)
            .ifPresent(job -> order.add(jobId));
      }
      repository.findAll().stream()
          .filter(job -> job.getStatus() == JobStatus.QUEUED)
          .filter(job -> !order.contains(job.getJobId()))
          .sorted(Comparator.comparing(Job::getCreatedAt))
          .forEach(job -> order.add(job.getJobId()));
      queue.clear();
      queue.addAll(order);
      LOGGER.info("Re-queued {} jobs after restart", queue.size());
      persistState();
      promote();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Admit a new job.
   *
   * @throws QueueFullException if queued plus running jobs already reach the limit
   */
  public Job submit(JobSpec spec, String owner) {
    lock.lock();
    try {
      int active = queue.size() + running.size();
      if (active >= maxQueueSize) {
        STRUCTURED_LOGGER.logJobRejected(owner, active, maxQueueSize);
        throw new QueueFullException(maxQueueSize);
      }
      Job job = new Job(UUID.randomUUID().toString(), owner, spec, clock.instant());
      List<String> newOrder = new ArrayList<>(queue);
      newOrder.add(job.getJobId());
      repository.insert(job, newOrder);
      queue.add(job.getJobId());
      STRUCTURED_LOGGER.logJobEnqueued(job.getJobId(), owner, queue.size() - 1);
      promote();
      return job;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Replace the queue order.
   *
   * @throws QueueOrderException unless {@code orderedIds} is exactly the set of queued ids
   */
  public void reorder(List<String> orderedIds) {
    lock.lock();
    try {
      Set<String> requested = new LinkedHashSet<>(orderedIds);
      if (requested.size() != orderedIds.size()) {
        throw new QueueOrderException("Job ids must not repeat");
      }
      if (!requested.equals(new HashSet<>(queue))) {
        throw new QueueOrderException("Job ids must match the queued jobs exactly");
      }
      List<String> previous = new ArrayList<>(queue);
      queue.clear();
      queue.addAll(orderedIds);
      try {
        persistState();
      } catch (PersistenceException e) {
        queue.clear();
        queue.addAll(previous);
        throw e;
      }
      STRUCTURED_LOGGER.logQueueReordered(queue.size());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Change the limits and tag registry; null leaves a value unchanged. Raising the limit promotes
   * immediately, lowering it never stops running jobs.
   */
  public SchedulerSettings updateSettings(
      Boolean newParallelEnabled, Integer newMaxConcurrent, List<String> newTags) {
    lock.lock();
    try {
      boolean previousParallel = parallelEnabled;
      int previousMax = maxConcurrent;
      List<String> previousTags = tags;
      if (newParallelEnabled != null) {
        parallelEnabled = newParallelEnabled;
      }
      if (newMaxConcurrent != null) {
        maxConcurrent = clamp(newMaxConcurrent);
      }
      if (newTags != null) {
        tags = normalizeTags(newTags);
      }
      try {
        persistState();
      } catch (PersistenceException e) {
        parallelEnabled = previousParallel;
        maxConcurrent = previousMax;
        tags = previousTags;
        throw e;
      }
      LOGGER.info(
          "Scheduler settings updated: parallelEnabled={}, maxConcurrent={}",
          parallelEnabled,
          maxConcurrent);
      promote();
      return settingsLocked();
    } finally {
      lock.unlock();
    }
  }

  public SchedulerSettings settings() {
    lock.lock();
    try {
      return settingsLocked();
    } finally {
      lock.unlock();
    }
  }

  /** Zero-based position of a queued job; empty if the job is not queued. */
  public OptionalInt queuePosition(String jobId) {
    lock.lock();
    try {
      int index = queue.indexOf(jobId);
      return index < 0 ? OptionalInt.empty() : OptionalInt.of(index);
    } finally {
      lock.unlock();
    }
  }

  public List<String> queuedIds() {
    lock.lock();
    try {
      return List.copyOf(queue);
    } finally {
      lock.unlock();
    }
  }

  public int runningCount() {
    lock.lock();
    try {
      return running.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Remove a job's record. A queued job leaves the queue; a running job keeps its slot until its
   * executor finishes.
   *
   * @return the removed job as it was at deletion
   * @throws JobNotFoundException if the job does not exist
   */
  public Job delete(String jobId) {
    lock.lock();
    try {
      Job job = repository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
      queue.remove(jobId);
      repository.delete(jobId);
      persistState();
      LOGGER.info("Job deleted: jobId={}, status={}", jobId, job.getStatus());
      return job;
    } finally {
      lock.unlock();
    }
  }

  /** Called by an executor when its job has reached a terminal state. */
  void onJobFinished(String jobId) {
    lock.lock();
    try {
      running.remove(jobId);
      promote();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Fill free slots from the head of the queue. A promotion whose write fails is undone and the
   * job stays at the head of the queue until the next submission, finished job or settings change
   * promotes again; the failure is logged, never thrown.
   */
  private void promote() {
    int limit = effectiveMaxConcurrent();
    while (running.size() < limit && !queue.isEmpty()) {
      String jobId = queue.remove(0);
      Optional<Job> candidate = repository.findById(jobId);
      if (candidate.isEmpty() || candidate.get().getStatus() != JobStatus.QUEUED) {
        LOGGER.warn("Dropping stale queue entry: jobId={}", jobId);
        continue;
      }
      Job job = candidate.get();
      job.markRunning(clock.instant());
      try {
        repository.updateWithQueueOrder(job, queue);
      } catch (PersistenceException e) {
        job.revertToQueued();
        queue.add(0, jobId);
        LOGGER.error("Promotion of job {} could not be persisted; it stays queued", jobId, e);
        return;
      }
      running.add(jobId);
      STRUCTURED_LOGGER.logJobPromoted(jobId, running.size(), limit);
      taskExecutor.execute(executorFactory.create(job, () -> onJobFinished(jobId)));
    }
  }

  private void persistState() {
    repository.updateSchedulerState(
        new PipelineState.Settings(parallelEnabled, maxConcurrent, tags), queue);
  }

  private SchedulerSettings settingsLocked() {
    return new SchedulerSettings(
        parallelEnabled, maxConcurrent, effectiveMaxConcurrent(), maxQueueSize, tags);
  }

  private int effectiveMaxConcurrent() {
    return parallelEnabled ? maxConcurrent : 1;
  }

  static int clamp(int requested) {
    return Math.max(MIN_CONCURRENT, Math.min(MAX_CONCURRENT, requested));
  }

  private static List<String> normalizeTags(List<String> raw) {
    Set<String> cleaned = new LinkedHashSet<>();
    for (String tag : raw) {
      if (tag != null && !tag.isBlank()) {
        cleaned.add(tag.strip());
      }
    }
    return List.copyOf(cleaned);
  }
}
