package com.scholary.narrator.steplog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;

/**
 * Keys of the fixed stage sequence, in execution order, plus the {@code speaker-input} pseudo-step
 * recorded when a user supplies speaker configuration.
 */
public enum StepKey {
  ACQUISITION("acquisition"),
  TRANSCRIPTION("transcription"),
  TRANSLATION("translation"),
  POLISH("polish"),
  SUMMARY("summary"),
  SPEAKER_CONFIG("speaker-config"),
  SYNTHESIS("synthesis"),
  SPEAKER_INPUT("speaker-input");

  /** The automatic chain, without the pseudo-step. */
  public static final List<StepKey> SEQUENCE =
      List.of(ACQUISITION, TRANSCRIPTION, TRANSLATION, POLISH, SUMMARY, SPEAKER_CONFIG, SYNTHESIS);

  private final String wireName;

  StepKey(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static StepKey fromWireName(String value) {
    for (StepKey key : values()) {
      if (key.wireName.equals(value)) {
        return key;
      }
    }
    throw new IllegalArgumentException("Unknown step key: " + value);
  }
}
