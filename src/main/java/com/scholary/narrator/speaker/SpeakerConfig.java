package com.scholary.narrator.speaker;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Voice configuration for one speaker tag, in the shape the synthesis service consumes.
 *
 * <p>A derived profile carries {@code design_text} and {@code design_instruct}; a user-supplied
 * one usually carries {@code ref_audio} and {@code ref_text} instead.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SpeakerConfig(
    @JsonProperty("speaker_tag") String speakerTag,
    @JsonProperty("design_text") String designText,
    @JsonProperty("design_instruct") String designInstruct,
    @JsonProperty("ref_audio") String refAudio,
    @JsonProperty("ref_text") String refText,
    @JsonProperty("language") String language) {

  public static SpeakerConfig designed(
      String speakerTag, String designText, String designInstruct, String language) {
    return new SpeakerConfig(speakerTag, designText, designInstruct, null, null, language);
  }

  /** The same voice, cloned from a reference recording and its transcript. */
  public SpeakerConfig withReference(String audioPath, String transcript) {
    return new SpeakerConfig(
        speakerTag, designText, designInstruct, audioPath, transcript, language);
  }
}
