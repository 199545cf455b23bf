package com.scholary.narrator.api;

import java.util.List;

/**
 * Partial settings update. Null fields are left unchanged; {@code maxConcurrent} is clamped to
 * 1..5.
 */
public record SettingsUpdateRequest(
    Boolean parallelEnabled, Integer maxConcurrent, List<String> tags) {}
