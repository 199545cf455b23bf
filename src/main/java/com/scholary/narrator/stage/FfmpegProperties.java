package com.scholary.narrator.stage;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>{@code binary} is looked up on the PATH unless absolute; merged audio is resampled to {@code
 * sampleRate} so inputs from different sources can be concatenated. Speaker reference clips are
 * written as mono at {@code clipSampleRate}.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String binary, @Positive int sampleRate, @Positive int clipSampleRate) {}
