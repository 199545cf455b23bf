package com.scholary.narrator.api;

import com.scholary.narrator.scheduler.SchedulerSettings;
import java.util.List;

public record SettingsResponse(
    boolean parallelEnabled,
    int maxConcurrent,
    int effectiveMaxConcurrent,
    int maxQueueSize,
    List<String> tags) {

  public static SettingsResponse from(SchedulerSettings settings) {
    return new SettingsResponse(
        settings.parallelEnabled(),
        settings.maxConcurrent(),
        settings.effectiveMaxConcurrent(),
        settings.maxQueueSize(),
        settings.tags());
  }
}
