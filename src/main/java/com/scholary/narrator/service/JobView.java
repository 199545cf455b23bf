package com.scholary.narrator.service;

import com.scholary.narrator.job.JobSnapshot;

/**
 * A consistent copy of a job together with the scheduler facts that are not stored on it.
 *
 * @param job the job as captured when the view was built
 * @param queuePosition zero-based position while queued, otherwise null
 * @param waitingForSpeakers whether the executor is parked on speaker input right now
 */
public record JobView(JobSnapshot job, Integer queuePosition, boolean waitingForSpeakers) {}
