package com.scholary.narrator.stage;

import com.scholary.narrator.job.SpeakerClips;
import com.scholary.narrator.speaker.SpeakerConfig;
import java.nio.file.Path;
import java.util.List;

/**
 * Speaker configuration written for synthesis, together with the dialogue it applies to.
 *
 * @param path the {@code speakers.json} file
 * @param speakers one configuration per speaker tag
 * @param dialogueText dialogue normalized to one {@code [TAG]text} line per utterance
 * @param clips reference clips the configuration points at; empty for user-supplied speakers
 */
public record SpeakerSetup(
    Path path, List<SpeakerConfig> speakers, String dialogueText, SpeakerClips clips)
    implements StageOutput {

  public SpeakerSetup {
    speakers = List.copyOf(speakers);
    clips = clips == null ? SpeakerClips.NONE : clips;
  }

  @Override
  public String summary() {
    return "Speaker configs saved";
  }
}
