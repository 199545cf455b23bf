package com.scholary.narrator.stage;

import com.scholary.narrator.speaker.SpeakerTranscript;
import com.scholary.narrator.tool.ToolService;
import java.util.List;
import java.util.Map;

/** Translates the diarized transcript into speaker-tagged text ({@code translated.txt}). */
public class TranslationStage extends TextPromptStage<TranscriptArtifact> {

  public TranslationStage(ToolService toolService) {
    super(toolService, "translate_json", "translate", "translated.txt");
  }

  @Override
  protected Map<String, Object> inputArguments(TranscriptArtifact transcript) {
    return Map.of("input_json", transcript.transcript().toString());
  }

  @Override
  protected String summarize(String text) {
    List<String> tags = SpeakerTranscript.parse(text).tags();
    int count = tags.isEmpty() ? 1 : tags.size();
    String listed = tags.isEmpty() ? "[SPEAKER0]" : String.join(", ", tags);
    return String.format("Translation saved (speakers: %d | %s)", count, listed);
  }
}
