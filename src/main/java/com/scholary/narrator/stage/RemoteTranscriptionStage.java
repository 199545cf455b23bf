package com.scholary.narrator.stage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.narrator.tool.ToolInvocationException;
import com.scholary.narrator.tool.ToolResult;
import com.scholary.narrator.tool.ToolService;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transcribes the source audio with speaker diarization via the {@code transcribe_audio} tool and
 * writes {@code transcript.json}.
 *
 * <p>The stored transcript keeps only segments with text; segments without a speaker are assigned
 * {@code SPEAKER0}. Timed {@code speaker_segments}, when the service returns them, are kept for
 * cutting speaker reference clips.
 */
public class RemoteTranscriptionStage implements Stage<AcquiredAudio, TranscriptArtifact> {

  static final String SERVICE = "asr";
  static final String TOOL = "transcribe_audio";
  static final String FILE_NAME = "transcript.json";

  private final ToolService toolService;
  private final ObjectMapper objectMapper;

  public RemoteTranscriptionStage(ToolService toolService, ObjectMapper objectMapper) {
    this.toolService = toolService;
    this.objectMapper = objectMapper;
  }

  @Override
  public TranscriptArtifact invoke(AcquiredAudio audio, StageContext context) {
    Map<String, Object> arguments = new LinkedHashMap<>();
    arguments.put("audio_path", audio.path().toAbsolutePath().toString());
    arguments.put("language", context.parameters().language());
    arguments.put("chunk_length", context.parameters().chunkLength());
    arguments.put("output_format", "json");

    ToolResult result;
    try {
      result = toolService.call(SERVICE, TOOL, arguments);
    } catch (ToolInvocationException e) {
      throw new StageException(e.getMessage(), e);
    }

    ObjectNode transcript = normalize(readPayload(result.result()));
    Path target = context.resolve(FILE_NAME);
    try {
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), transcript);
    } catch (IOException e) {
      throw new StageException("Could not write transcript: " + e.getMessage(), e);
    }
    return new TranscriptArtifact(target, transcript);
  }

  private JsonNode readPayload(JsonNode payload) {
    if (payload != null && payload.isTextual()) {
      try {
        return objectMapper.readTree(payload.asText());
      } catch (JsonProcessingException e) {
        throw new StageException("Transcription returned unreadable JSON", e);
      }
    }
    return payload;
  }

  private ObjectNode normalize(JsonNode payload) {
    ObjectNode transcript = objectMapper.createObjectNode();
    ArrayNode segments = transcript.putArray("segments");
    if (payload == null || !payload.isObject()) {
      return transcript;
    }
    if (payload.hasNonNull("language")) {
      transcript.put("language", payload.get("language").asText());
    }
    for (JsonNode segment : payload.path("segments")) {
      String text = segment.path("text").asText("").strip();
      if (text.isEmpty()) {
        continue;
      }
      ObjectNode entry = segments.addObject();
      entry.put("text", text);
      entry.put("speaker", segment.path("speaker").asText("SPEAKER0"));
      if (segment.hasNonNull("start") && segment.hasNonNull("end")) {
        entry.put("start", segment.get("start").asDouble());
        entry.put("end", segment.get("end").asDouble());
      }
    }
    for (JsonNode turn : payload.path("speaker_segments")) {
      String speaker = turn.path("speaker").asText("").strip();
      if (speaker.isEmpty() || !turn.path("start").isNumber() || !turn.path("end").isNumber()) {
        continue;
      }
      ArrayNode turns =
          transcript.has("speaker_segments")
              ? (ArrayNode) transcript.get("speaker_segments")
              : transcript.putArray("speaker_segments");
      ObjectNode entry = turns.addObject();
      entry.put("speaker", speaker);
      entry.put("start", turn.get("start").asDouble());
      entry.put("end", turn.get("end").asDouble());
    }
    return transcript;
  }
}
