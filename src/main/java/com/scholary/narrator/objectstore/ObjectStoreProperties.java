package com.scholary.narrator.objectstore;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings under {@code objectstore.*}.
 *
 * <p>Nothing is uploaded unless {@code enabled} is true. Objects are stored under {@code
 * [keyPrefix/]jobId/fileName}; links stay valid for {@code urlTtlDays}, at most the seven days a
 * SigV4 signature allows.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    boolean enabled,
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess,
    String keyPrefix,
    @Positive @Max(7) int urlTtlDays) {

  /** The key prefix without surrounding slashes; empty when unset. */
  public String normalizedKeyPrefix() {
    if (keyPrefix == null) {
      return "";
    }
    String trimmed = keyPrefix.strip();
    int start = 0;
    int end = trimmed.length();
    while (start < end && trimmed.charAt(start) == '/') {
      start++;
    }
    while (end > start && trimmed.charAt(end - 1) == '/') {
      end--;
    }
    return trimmed.substring(start, end);
  }
}
