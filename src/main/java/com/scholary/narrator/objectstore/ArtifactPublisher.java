package com.scholary.narrator.objectstore;

import com.scholary.narrator.job.JobResult;
import java.util.Map;

/** Makes a job's artifacts downloadable outside the service. */
public interface ArtifactPublisher {

  /**
   * Publish every artifact of {@code result}.
   *
   * @return artifact name to download link; empty when publishing is disabled
   * @throws ObjectStoreException if an upload fails
   */
  Map<String, String> publish(String jobId, JobResult result);

  static ArtifactPublisher disabled() {
    return (jobId, result) -> Map.of();
  }
}
