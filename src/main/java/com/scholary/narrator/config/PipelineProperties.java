package com.scholary.narrator.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the pipeline core.
 *
 * <p>{@code maxConcurrent} and {@code parallelEnabled} are only the initial scheduler settings;
 * once changed at runtime the persisted values win. The executor pool must be at least as large
 * as the highest concurrency the scheduler allows.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @Positive int maxQueueSize,
    @Min(1) @Max(5) int maxConcurrent,
    boolean parallelEnabled,
    @Min(5) int executorThreads,
    @NotBlank String runsDir,
    @NotBlank String stateFile,
    @Positive int retainedJobs,
    @Positive int minExcerptLength,
    @NotBlank String synthesisLanguage,
    @NotBlank String voicePromptsDir,
    List<String> introAssets,
    @NotBlank String narratorInstruct) {

  public PipelineProperties {
    introAssets = introAssets == null ? List.of() : List.copyOf(introAssets);
  }
}
