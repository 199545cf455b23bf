package com.scholary.narrator.scheduler;

import java.util.List;

/**
 * Current scheduler limits.
 *
 * @param parallelEnabled whether more than one job may run at once
 * @param maxConcurrent configured concurrency, used only when parallel is enabled
 * @param effectiveMaxConcurrent the limit promotion actually applies
 * @param maxQueueSize limit on queued plus running jobs
 * @param tags the tag registry offered for job metadata
 */
public record SchedulerSettings(
    boolean parallelEnabled,
    int maxConcurrent,
    int effectiveMaxConcurrent,
    int maxQueueSize,
    List<String> tags) {}
