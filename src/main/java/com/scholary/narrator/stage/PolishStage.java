package com.scholary.narrator.stage;

import com.scholary.narrator.tool.ToolService;
import java.util.Map;

/** Smooths the translated dialogue while keeping its speaker tags ({@code polished.txt}). */
public class PolishStage extends TextPromptStage<TextArtifact> {

  public PolishStage(ToolService toolService) {
    super(toolService, "translate_text", "polish", "polished.txt");
  }

  @Override
  protected Map<String, Object> inputArguments(TextArtifact translated) {
    return Map.of("text", translated.text());
  }

  @Override
  protected String summarize(String text) {
    return "Polished text saved";
  }
}
