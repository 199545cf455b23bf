package com.scholary.narrator.stage;

import com.scholary.narrator.tool.ToolService;
import java.util.Map;

/** Summarizes the polished dialogue ({@code summary.txt}). */
public class SummaryStage extends TextPromptStage<TextArtifact> {

  public SummaryStage(ToolService toolService) {
    super(toolService, "translate_text", "summary", "summary.txt");
  }

  @Override
  protected Map<String, Object> inputArguments(TextArtifact polished) {
    return Map.of("text", polished.text());
  }

  @Override
  protected String summarize(String text) {
    return "Summary saved";
  }
}
