package com.scholary.narrator.api;

import com.scholary.narrator.job.JobParameters;
import com.scholary.narrator.job.JobSpec;
import com.scholary.narrator.job.SourceSpec;

/**
 * Request to start a pipeline job.
 *
 * <p>Exactly one of {@code youtubeUrl}, {@code audioUrl} or {@code audioPath} must be given; the
 * service rejects anything else with 400. Omitted parameters take their defaults. With {@code
 * manualSpeakers} the job stops at the speaker-config stage until a configuration is submitted.
 */
public record PipelineStartRequest(
    String youtubeUrl,
    String audioUrl,
    String audioPath,
    String provider,
    String modelName,
    String language,
    Integer chunkLength,
    Double speed,
    Boolean manualSpeakers,
    String ytCookiesFile,
    String ytCookiesFromBrowser,
    String ytUserAgent,
    String ytProxy) {

  public JobSpec toSpec() {
    return new JobSpec(
        new SourceSpec(youtubeUrl, audioUrl, audioPath),
        new JobParameters(
            provider,
            modelName,
            language,
            chunkLength,
            speed,
            ytCookiesFile,
            ytCookiesFromBrowser,
            ytUserAgent,
            ytProxy),
        Boolean.TRUE.equals(manualSpeakers));
  }
}
