package com.scholary.narrator.api;

import com.scholary.narrator.service.SpeakerTemplate;
import com.scholary.narrator.speaker.SpeakerConfig;
import java.util.List;

public record SpeakerTemplateResponse(
    String jobId, List<String> detectedTags, List<SpeakerConfig> speakers) {

  public static SpeakerTemplateResponse from(SpeakerTemplate template) {
    return new SpeakerTemplateResponse(
        template.jobId(), template.detectedTags(), template.speakers());
  }
}
