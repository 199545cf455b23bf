package com.scholary.narrator.stage;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.narrator.job.JobParameters;
import com.scholary.narrator.speaker.SpeakerClipPlanner;
import com.scholary.narrator.speaker.SpeakerConfig;
import com.scholary.narrator.speaker.SpeakerProfileDeriver;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SpeakerConfigStageTest {

  private static final String DIALOGUE =
      "[SPEAKER0]Bonjour a tous.\n[SPEAKER1]Merci de nous ecouter aujourd'hui.";

  @TempDir Path runDir;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final List<String> cut = new ArrayList<>();

  @Test
  void invoke_shouldWriteDerivedProfiles() throws Exception {
    SpeakerSetup setup = stage(this::writeClip).invoke(source(DIALOGUE, "{}"), context());

    assertThat(setup.path()).isEqualTo(runDir.resolve("speakers.json"));
    assertThat(setup.summary()).isEqualTo("Speaker configs saved");
    JsonNode written = objectMapper.readTree(setup.path().toFile());
    assertThat(written).hasSize(2);
    assertThat(written.get(1).get("speaker_tag").asText()).isEqualTo("[SPEAKER1]");
    assertThat(written.get(1).has("ref_audio")).isFalse();
    assertThat(setup.clips().isEmpty()).isTrue();
    assertThat(cut).isEmpty();
  }

  @Test
  void invoke_shouldFallBackToNarratorForUntaggedText() {
    SpeakerSetup setup =
        stage(this::writeClip).invoke(source("Line one.\n\nLine two.", "{}"), context());

    assertThat(setup.speakers())
        .singleElement()
        .satisfies(speaker -> assertThat(speaker.designInstruct()).isEqualTo("Narrator."));
    assertThat(setup.dialogueText()).isEqualTo("[SPEAKER0]Line one.\n[SPEAKER0]Line two.");
  }

  @Test
  void invoke_shouldPointProfilesAtExtractedClips() throws Exception {
    String transcript =
        "{\"segments\": ["
            + "{\"speaker\": \"SPEAKER_01\", \"start\": 30.0, \"end\": 52.0, \"text\": \"Merci\"},"
            + "{\"speaker\": \"SPEAKER_00\", \"start\": 0.0, \"end\": 4.0, \"text\": \"Salut\"},"
            + "{\"speaker\": \"SPEAKER_00\", \"start\": 5.0, \"end\": 25.0, \"text\": \"Bonjour\"}"
            + "]}";

    SpeakerSetup setup = stage(this::writeClip).invoke(source(DIALOGUE, transcript), context());

    assertThat(cut).containsExactly("speaker0.wav 5.0-25.0", "speaker1.wav 30.0-52.0");
    SpeakerConfig host = setup.speakers().get(0);
    assertThat(host.refAudio())
        .isEqualTo(runDir.resolve("speaker0.wav").toAbsolutePath().toString());
    assertThat(host.refText()).isEqualTo("Bonjour");
    assertThat(setup.speakers().get(1).refText()).isEqualTo("Merci");
    assertThat(setup.clips().audioPaths()).containsOnlyKeys("[SPEAKER0]", "[SPEAKER1]");
    assertThat(setup.clips().candidates().get("[SPEAKER0]")).hasSize(2);
    JsonNode written = objectMapper.readTree(setup.path().toFile());
    assertThat(written.get(0).get("ref_audio").asText()).isEqualTo(host.refAudio());
  }

  @Test
  void invoke_shouldKeepVoiceDesignWhenClipCannotBeCut() {
    String transcript =
        "{\"speaker_segments\": ["
            + "{\"speaker\": \"SPEAKER_00\", \"start\": 0.0, \"end\": 18.0},"
            + "{\"speaker\": \"SPEAKER_01\", \"start\": 18.0, \"end\": 40.0}"
            + "]}";
    ClipExtractor failsForSecond =
        (source, start, end, output) -> {
          if (output.getFileName().toString().equals("speaker1.wav")) {
            throw new StageException("ffmpeg clip extraction failed with exit code 1: bad input");
          }
          writeClip(source, start, end, output);
        };

    SpeakerSetup setup = stage(failsForSecond).invoke(source(DIALOGUE, transcript), context());

    assertThat(setup.speakers().get(0).refAudio()).endsWith("speaker0.wav");
    assertThat(setup.speakers().get(0).refText()).isNull();
    assertThat(setup.speakers().get(1).refAudio()).isNull();
    assertThat(setup.speakers().get(1).designInstruct()).isNotBlank();
    assertThat(setup.clips().audioPaths()).containsOnlyKeys("[SPEAKER0]");
    assertThat(setup.clips().candidates()).containsOnlyKeys("[SPEAKER0]", "[SPEAKER1]");
  }

  @Test
  void write_shouldStoreSuppliedProfilesWithoutClips() throws Exception {
    List<SpeakerConfig> speakers =
        List.of(SpeakerConfig.designed("[SPEAKER0]", "Salut", "Warm host", "French"));

    SpeakerSetup setup = stage(this::writeClip).write(runDir, "[SPEAKER0]Salut", speakers);

    assertThat(setup.clips().isEmpty()).isTrue();
    assertThat(objectMapper.readTree(setup.path().toFile()).get(0).get("design_instruct").asText())
        .isEqualTo("Warm host");
  }

  private SpeakerConfigStage stage(ClipExtractor extractor) {
    return new SpeakerConfigStage(
        new SpeakerProfileDeriver(12, "French", "Narrator."),
        new SpeakerClipPlanner(),
        extractor,
        objectMapper);
  }

  private SpeakerSource source(String polished, String transcript) {
    try {
      JsonNode parsed = objectMapper.readTree(transcript);
      return new SpeakerSource(
          new TextArtifact(runDir.resolve("polished.txt"), polished, "saved"),
          new TranscriptArtifact(runDir.resolve("transcript.json"), parsed),
          new AcquiredAudio(runDir.resolve("in.mp3"), "Copied"));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private void writeClip(Path source, double start, double end, Path output) {
    cut.add(output.getFileName() + " " + start + "-" + end);
    try {
      Files.writeString(output, "RIFF");
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private StageContext context() {
    return new StageContext("job-1", runDir, runDir.getParent(), JobParameters.defaults());
  }
}
