package com.scholary.narrator.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.narrator.steplog.StepEvent;
import com.scholary.narrator.steplog.StepStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repository for pipeline jobs.
 *
 * <p>Jobs live in a Caffeine cache weighted so that only terminal jobs count against the
 * retention limit: queued and running jobs weigh nothing and are never evicted, finished ones are
 * dropped once more than {@code retainedJobs} of them accumulate. Every mutation is written
 * through to the {@link JobStateStore} before the call returns.
 *
 * <p>Status changes alter a job's weight, so callers must pass every changed job back through
 * {@link #update(Job)} to have it re-weighed and persisted.
 */
public class JobRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRepository.class);

  static final String INTERRUPTED_MESSAGE = "Interrupted by service restart";

  private final Cache<String, Job> cache;
  private final JobStateStore stateStore;

  private PipelineState.Settings settings;
  private List<String> queueOrder = List.of();

  public JobRepository(JobStateStore stateStore, int retainedJobs, PipelineState.Settings initial) {
    this.stateStore = stateStore;
    this.settings = initial;
    this.cache =
        Caffeine.newBuilder()
            .maximumWeight(retainedJobs)
            .<String, Job>weigher((id, job) -> job.isTerminal() ? 1 : 0)
            .executor(Runnable::run)
            .build();
  }

  /**
   * Load the stored state, failing any job that was running when the service stopped.
   *
   * @return the stored settings and queue order, or empty if there was no stored state
   */
  public synchronized Optional<PipelineState> recover(Instant now) {
    Optional<PipelineState> stored = stateStore.load();
    if (stored.isEmpty()) {
      return Optional.empty();
    }
    PipelineState state = stored.get();
    int interrupted = 0;
    for (JobSnapshot snapshot : state.jobs()) {
      Job job = Job.fromSnapshot(snapshot);
      if (job.getStatus() == JobStatus.RUNNING) {
        job.getStepLog().snapshot().stream()
            .filter(event -> event.status().isActive())
            .forEach(
                event ->
                    job.getStepLog()
                        .upsert(
                            StepEvent.of(event.step(), StepStatus.FAILED, INTERRUPTED_MESSAGE)));
        job.markFailed(INTERRUPTED_MESSAGE, now);
        interrupted++;
      }
      cache.put(job.getJobId(), job);
    }
    if (state.settings() != null) {
      settings = state.settings();
    }
    queueOrder = state.queueOrder();
    LOGGER.info(
        "Recovered {} jobs from state file ({} interrupted, {} queued)",
        state.jobs().size(),
        interrupted,
        queueOrder.size());
    persist();
    return Optional.of(state);
  }

  /**
   * Store a new job together with the queue order that now includes it. Nothing is kept if the
   * write fails.
   */
  public synchronized void insert(Job job, List<String> newQueueOrder) {
    List<String> previousOrder = queueOrder;
    cache.put(job.getJobId(), job);
    queueOrder = List.copyOf(newQueueOrder);
    try {
      persist();
    } catch (PersistenceException e) {
      cache.invalidate(job.getJobId());
      queueOrder = previousOrder;
      throw e;
    }
  }

  /**
   * Persist changes to a stored job.
   *
   * @return false if the job has been deleted, in which case nothing is written
   */
  public synchronized boolean update(Job job) {
    Job present = cache.asMap().computeIfPresent(job.getJobId(), (id, existing) -> job);
    if (present == null) {
      return false;
    }
    persist();
    return true;
  }

  public Optional<Job> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public List<Job> findAll() {
    return new ArrayList<>(cache.asMap().values());
  }

  public synchronized Optional<Job> delete(String jobId) {
    Job removed = cache.asMap().remove(jobId);
    if (removed != null) {
      persist();
    }
    return Optional.ofNullable(removed);
  }

  /**
   * Persist a freshly promoted job together with the queue order that no longer holds it, in one
   * write. Nothing is kept if the write fails.
   *
   * @return false if the job has been deleted, in which case nothing is written
   */
  public synchronized boolean updateWithQueueOrder(Job job, List<String> newQueueOrder) {
    if (cache.asMap().computeIfPresent(job.getJobId(), (id, existing) -> job) == null) {
      return false;
    }
    List<String> previousOrder = queueOrder;
    queueOrder = List.copyOf(newQueueOrder);
    try {
      persist();
    } catch (PersistenceException e) {
      queueOrder = previousOrder;
      throw e;
    }
    return true;
  }

  /** Record scheduler settings and queue order alongside the jobs; unchanged if the write fails. */
  public synchronized void updateSchedulerState(
      PipelineState.Settings newSettings, List<String> newQueueOrder) {
    PipelineState.Settings previousSettings = settings;
    List<String> previousOrder = queueOrder;
    settings = newSettings;
    queueOrder = List.copyOf(newQueueOrder);
    try {
      persist();
    } catch (PersistenceException e) {
      settings = previousSettings;
      queueOrder = previousOrder;
      throw e;
    }
  }

  public synchronized PipelineState.Settings getSettings() {
    return settings;
  }

  private void persist() {
    List<JobSnapshot> snapshots = new ArrayList<>();
    for (Job job : cache.asMap().values()) {
      snapshots.add(job.toSnapshot());
    }
    stateStore.save(new PipelineState(settings, queueOrder, snapshots));
  }
}
