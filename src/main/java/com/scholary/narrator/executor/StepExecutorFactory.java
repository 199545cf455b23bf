package com.scholary.narrator.executor;

import com.scholary.narrator.job.Job;
import com.scholary.narrator.job.JobRepository;
import com.scholary.narrator.objectstore.ArtifactPublisher;
import com.scholary.narrator.stage.PipelineStages;
import com.scholary.narrator.steplog.EventBroadcaster;
import java.nio.file.Path;
import java.time.Clock;

/** Creates one {@link StepExecutor} per promoted job. */
public class StepExecutorFactory {

  private final PipelineStages stages;
  private final EventBroadcaster broadcaster;
  private final JobRepository repository;
  private final SpeakerInputGate gate;
  private final ArtifactPublisher publisher;
  private final Path runsDir;
  private final Clock clock;

  public StepExecutorFactory(
      PipelineStages stages,
      EventBroadcaster broadcaster,
      JobRepository repository,
      SpeakerInputGate gate,
      ArtifactPublisher publisher,
      Path runsDir,
      Clock clock) {
    this.stages = stages;
    this.broadcaster = broadcaster;
    this.repository = repository;
    this.gate = gate;
    this.publisher = publisher;
    this.runsDir = runsDir;
    this.clock = clock;
  }

  /**
   * @param job a job already marked running
   * @param onFinished called once when the executor is done, whatever the outcome
   */
  public StepExecutor create(Job job, Runnable onFinished) {
    return new StepExecutor(
        job, stages, broadcaster, repository, gate, publisher, runsDir, clock, onFinished);
  }
}
