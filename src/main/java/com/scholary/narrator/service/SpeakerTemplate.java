package com.scholary.narrator.service;

import com.scholary.narrator.speaker.SpeakerConfig;
import java.util.List;

/** Suggested speaker configuration for a job, and the tags any submission must cover. */
public record SpeakerTemplate(
    String jobId, List<String> detectedTags, List<SpeakerConfig> speakers) {}
