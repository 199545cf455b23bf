package com.scholary.narrator.job;

/**
 * Parameters handed to every stage of a job.
 *
 * <p>The yt* fields are passed through to the acquisition service untouched.
 */
public record JobParameters(
    String provider,
    String modelName,
    String language,
    Integer chunkLength,
    Double speed,
    String ytCookiesFile,
    String ytCookiesFromBrowser,
    String ytUserAgent,
    String ytProxy) {

  public JobParameters {
    if (provider == null || provider.isBlank()) {
      provider = "openai";
    }
    if (language == null || language.isBlank()) {
      language = "fr";
    }
    if (chunkLength == null) {
      chunkLength = 30;
    }
    if (speed == null) {
      speed = 1.0;
    }
  }

  public static JobParameters defaults() {
    return new JobParameters(null, null, null, null, null, null, null, null, null);
  }
}
