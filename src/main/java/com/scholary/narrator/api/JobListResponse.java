package com.scholary.narrator.api;

import java.util.List;

/** The caller's jobs with the scheduler limits currently in force. */
public record JobListResponse(
    List<JobResponse> jobs, int maxConcurrent, boolean parallelEnabled, int maxQueueSize) {}
