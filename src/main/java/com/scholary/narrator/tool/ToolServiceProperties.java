package com.scholary.narrator.tool;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the remote processing services.
 *
 * <p>Services are keyed by kind ({@code acquisition}, {@code asr}, {@code translate}, {@code
 * tts}); timeouts are in seconds and shared by all of them.
 */
@ConfigurationProperties(prefix = "tools")
@Validated
public record ToolServiceProperties(
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @NotEmpty Map<String, @Valid Endpoint> services) {

  public record Endpoint(@NotBlank String baseUrl) {}
}
