package com.scholary.narrator.job;

/** Everything a submission asks for: the source, stage parameters and the speaker mode. */
public record JobSpec(SourceSpec source, JobParameters parameters, boolean speakerRequired) {

  public JobSpec {
    if (parameters == null) {
      parameters = JobParameters.defaults();
    }
  }
}
