package com.scholary.narrator.service;

import com.scholary.narrator.scheduler.SchedulerSettings;
import java.util.List;

/** The caller's jobs, queued first in queue order, plus the limits in force. */
public record JobListing(List<JobView> jobs, SchedulerSettings settings) {}
