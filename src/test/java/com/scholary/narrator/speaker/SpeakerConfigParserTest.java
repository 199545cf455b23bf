package com.scholary.narrator.speaker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SpeakerConfigParserTest {

  private static final List<String> TWO_SPEAKERS = List.of("[SPEAKER0]", "[SPEAKER1]");

  @TempDir Path voicePrompts;

  private SpeakerConfigParser parser;

  @BeforeEach
  void setUp() {
    parser = new SpeakerConfigParser(new ObjectMapper(), voicePrompts, "Chinese");
  }

  @Test
  void parse_shouldAcceptArrayAndNormalizeTags() {
    List<SpeakerConfig> configs =
        parser.parse(
            """
            [
              {"speaker_tag": "speaker1", "design_text": "Hi", "design_instruct": "calm"},
              {"speaker_tag": "[SPEAKER0]", "design_text": "Yo", "language": "English"}
            ]
            """,
            TWO_SPEAKERS);

    assertThat(configs)
        .extracting(SpeakerConfig::speakerTag)
        .containsExactly("[SPEAKER1]", "[SPEAKER0]");
    assertThat(configs.get(0).language()).isEqualTo("Chinese");
    assertThat(configs.get(1).language()).isEqualTo("English");
  }

  @Test
  void parse_shouldAcceptWrappedObjectAndDefaultToSingleSpeaker() {
    List<SpeakerConfig> configs =
        parser.parse("{\"speakers\": [{\"speaker_tag\": \"SPEAKER0\"}]}", List.of());

    assertThat(configs)
        .singleElement()
        .extracting(SpeakerConfig::speakerTag)
        .isEqualTo("[SPEAKER0]");
  }

  @Test
  void parse_shouldResolveReferenceAudioAgainstVoicePrompts() throws Exception {
    Files.writeString(voicePrompts.resolve("host.wav"), "RIFF");

    List<SpeakerConfig> configs =
        parser.parse(
            "[{\"speaker_tag\": \"[SPEAKER0]\", \"ref_audio\": \"host.wav\", "
                + "\"ref_text\": \"hello\"}]",
            List.of("[SPEAKER0]"));

    assertThat(configs.get(0).refAudio())
        .isEqualTo(voicePrompts.resolve("host.wav").toAbsolutePath().normalize().toString());
  }

  @Test
  void parse_shouldRejectMissingReferenceAudio() {
    assertThatThrownBy(
            () ->
                parser.parse(
                    "[{\"speaker_tag\": \"[SPEAKER0]\", \"ref_audio\": \"missing.wav\"}]",
                    List.of("[SPEAKER0]")))
        .isInstanceOf(SpeakerInputException.class)
        .hasMessageContaining("Reference audio not found");
  }

  @Test
  void parse_shouldRejectMalformedInput() {
    assertThatThrownBy(() -> parser.parse("not json", TWO_SPEAKERS))
        .isInstanceOf(SpeakerInputException.class)
        .hasMessage("Invalid JSON for speaker configs");
    assertThatThrownBy(() -> parser.parse("[]", TWO_SPEAKERS))
        .hasMessage("Speaker configs must be a non-empty list");
    assertThatThrownBy(() -> parser.parse("[1, 2]", TWO_SPEAKERS))
        .hasMessage("Each speaker config must be an object");
    assertThatThrownBy(() -> parser.parse("[{\"design_text\": \"x\"}]", TWO_SPEAKERS))
        .hasMessageContaining("speaker_tag");
  }

  @Test
  void parse_shouldRejectTagMismatch() {
    assertThatThrownBy(
            () -> parser.parse("[{\"speaker_tag\": \"[SPEAKER0]\"}]", TWO_SPEAKERS))
        .isInstanceOf(SpeakerInputException.class)
        .hasMessageContaining("missing: [[SPEAKER1]]");
    assertThatThrownBy(
            () ->
                parser.parse(
                    "[{\"speaker_tag\": \"[SPEAKER0]\"}, {\"speaker_tag\": \"speaker0\"}]",
                    TWO_SPEAKERS))
        .hasMessageContaining("Duplicate speaker_tag");
  }
}
