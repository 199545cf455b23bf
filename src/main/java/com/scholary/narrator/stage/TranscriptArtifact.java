package com.scholary.narrator.stage;

import com.fasterxml.jackson.databind.JsonNode;
import java.nio.file.Path;

/**
 * Diarized transcript as returned by the transcription service.
 *
 * @param path the {@code transcript.json} file
 * @param transcript the parsed JSON, always an object
 */
public record TranscriptArtifact(Path path, JsonNode transcript) implements StageOutput {

  @Override
  public String summary() {
    return "Transcription saved";
  }
}
