package com.scholary.narrator.stage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.scholary.narrator.job.JobParameters;
import com.scholary.narrator.job.SpeakerClips;
import com.scholary.narrator.speaker.SpeakerConfig;
import com.scholary.narrator.tool.ToolResult;
import com.scholary.narrator.tool.ToolService;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Transcription, text prompt and synthesis stages against a mocked tool service. */
@ExtendWith(MockitoExtension.class)
class RemoteStagesTest {

  @TempDir Path runDir;

  @Mock private ToolService toolService;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private StageContext context;

  @BeforeEach
  void setUp() {
    context = new StageContext("job-1", runDir, runDir.getParent(), JobParameters.defaults());
  }

  @Test
  void transcription_shouldNormalizeSegmentsAndWriteTranscript() throws Exception {
    String payload =
        "{\"language\": \"fr\", \"segments\": ["
            + "{\"text\": \" Bonjour \", \"speaker\": \"SPEAKER1\", \"start\": 0, \"end\": 1.5},"
            + "{\"text\": \"   \"},"
            + "{\"text\": \"Salut\"}],"
            + "\"speaker_segments\": ["
            + "{\"speaker\": \"SPEAKER_00\", \"start\": 0.0, \"end\": 12.25},"
            + "{\"speaker\": \"SPEAKER_01\", \"start\": 3}]}";
    when(toolService.call(eq("asr"), eq("transcribe_audio"), anyMap()))
        .thenReturn(new ToolResult(true, TextNode.valueOf(payload), null, null));

    TranscriptArtifact artifact =
        new RemoteTranscriptionStage(toolService, objectMapper)
            .invoke(new AcquiredAudio(runDir.resolve("in.mp3"), "Copied"), context);

    JsonNode segments = artifact.transcript().get("segments");
    assertThat(segments).hasSize(2);
    assertThat(segments.get(0).get("text").asText()).isEqualTo("Bonjour");
    assertThat(segments.get(0).get("speaker").asText()).isEqualTo("SPEAKER1");
    assertThat(segments.get(0).get("end").asDouble()).isEqualTo(1.5);
    assertThat(segments.get(1).get("speaker").asText()).isEqualTo("SPEAKER0");
    JsonNode turns = artifact.transcript().get("speaker_segments");
    assertThat(turns).hasSize(1);
    assertThat(turns.get(0).get("speaker").asText()).isEqualTo("SPEAKER_00");
    assertThat(turns.get(0).get("end").asDouble()).isEqualTo(12.25);
    assertThat(artifact.path()).isEqualTo(runDir.resolve("transcript.json"));
    assertThat(objectMapper.readTree(artifact.path().toFile())).isEqualTo(artifact.transcript());

    @SuppressWarnings("unchecked")
    ArgumentCaptor<Map<String, Object>> arguments = ArgumentCaptor.forClass(Map.class);
    verify(toolService).call(eq("asr"), eq("transcribe_audio"), arguments.capture());
    assertThat(arguments.getValue())
        .containsEntry("language", "fr")
        .containsEntry("chunk_length", 30)
        .containsEntry("output_format", "json");
  }

  @Test
  void translation_shouldSendTranscriptAndSummarizeSpeakers() throws Exception {
    when(toolService.call(eq("translate"), eq("translate_json"), anyMap()))
        .thenReturn(
            new ToolResult(
                true, TextNode.valueOf("[SPEAKER0]Hello\n[SPEAKER1]Hi\n"), null, null));
    TranscriptArtifact transcript =
        new TranscriptArtifact(runDir.resolve("transcript.json"), objectMapper.createObjectNode());

    TextArtifact translated = new TranslationStage(toolService).invoke(transcript, context);

    assertThat(translated.summary())
        .isEqualTo("Translation saved (speakers: 2 | [SPEAKER0], [SPEAKER1])");
    assertThat(Files.readString(runDir.resolve("translated.txt"), StandardCharsets.UTF_8))
        .isEqualTo("[SPEAKER0]Hello\n[SPEAKER1]Hi");
    @SuppressWarnings("unchecked")
    ArgumentCaptor<Map<String, Object>> arguments = ArgumentCaptor.forClass(Map.class);
    verify(toolService).call(eq("translate"), eq("translate_json"), arguments.capture());
    assertThat(arguments.getValue())
        .containsEntry("prompt_type", "translate")
        .containsEntry("provider", "openai")
        .containsKey("input_json");
  }

  @Test
  void polish_shouldFailWhenPromptReturnsNoText() {
    when(toolService.call(eq("translate"), eq("translate_text"), anyMap()))
        .thenReturn(new ToolResult(true, TextNode.valueOf("  "), null, null));

    assertThatThrownBy(
            () ->
                new PolishStage(toolService)
                    .invoke(new TextArtifact(runDir.resolve("t.txt"), "x", "saved"), context))
        .isInstanceOf(StageException.class)
        .hasMessage("The polish prompt returned no text");
  }

  @Test
  void synthesis_shouldRequireAudioFile() throws Exception {
    Path output = runDir.resolve("audio.wav");
    SpeakerSetup setup =
        new SpeakerSetup(
            runDir.resolve("speakers.json"),
            List.of(SpeakerConfig.designed("[SPEAKER0]", "Hi", "calm", "French")),
            "[SPEAKER0]Bonjour",
            SpeakerClips.NONE);
    when(toolService.call(eq("tts"), eq("clone_voice"), anyMap()))
        .thenReturn(new ToolResult(true, null, null, null))
        .thenAnswer(
            invocation -> {
              Files.writeString(output, "RIFF");
              return new ToolResult(true, null, null, null);
            });
    RemoteSynthesisStage stage = new RemoteSynthesisStage(toolService, objectMapper);

    assertThatThrownBy(() -> stage.invoke(setup, context))
        .isInstanceOf(StageException.class)
        .hasMessageContaining("produced no audio");

    AudioArtifact audio = stage.invoke(setup, context);
    assertThat(audio.path()).isEqualTo(output);
    assertThat(audio.summary()).isEqualTo("Audio generated");
  }
}
