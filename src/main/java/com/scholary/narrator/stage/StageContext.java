package com.scholary.narrator.stage;

import com.scholary.narrator.job.JobParameters;
import java.nio.file.Path;

/**
 * What every stage of one job needs besides its input.
 *
 * @param jobId the job being executed
 * @param runDir directory holding this job's artifacts
 * @param runsDir root of all run directories; artifact paths are reported relative to it
 * @param parameters the submitted stage parameters
 */
public record StageContext(String jobId, Path runDir, Path runsDir, JobParameters parameters) {

  public Path resolve(String fileName) {
    return runDir.resolve(fileName);
  }

  /** Path of an artifact relative to the runs root, or the absolute path if outside it. */
  public String relativize(Path artifact) {
    Path absolute = artifact.toAbsolutePath().normalize();
    Path root = runsDir.toAbsolutePath().normalize();
    if (absolute.startsWith(root)) {
      return root.relativize(absolute).toString().replace('\\', '/');
    }
    return absolute.toString();
  }
}
