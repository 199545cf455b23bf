package com.scholary.narrator.stage;

import com.scholary.narrator.tool.ToolInvocationException;
import com.scholary.narrator.tool.ToolResult;
import com.scholary.narrator.tool.ToolService;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base for stages that send text to the language service with a prompt type and store the
 * returned text in the run directory.
 *
 * @param <I> the previous stage's output
 */
public abstract class TextPromptStage<I> implements Stage<I, TextArtifact> {

  static final String SERVICE = "translate";

  private final ToolService toolService;
  private final String toolName;
  private final String promptType;
  private final String fileName;

  protected TextPromptStage(
      ToolService toolService, String toolName, String promptType, String fileName) {
    this.toolService = toolService;
    this.toolName = toolName;
    this.promptType = promptType;
    this.fileName = fileName;
  }

  /** Tool arguments carrying the input; provider, model and prompt type are added here. */
  protected abstract Map<String, Object> inputArguments(I input);

  /** Completion message for the stored text. */
  protected abstract String summarize(String text);

  @Override
  public TextArtifact invoke(I input, StageContext context) {
    Map<String, Object> arguments = new LinkedHashMap<>(inputArguments(input));
    arguments.put("provider", context.parameters().provider());
    arguments.put("model_name", context.parameters().modelName());
    arguments.put("prompt_type", promptType);

    ToolResult result;
    try {
      result = toolService.call(SERVICE, toolName, arguments);
    } catch (ToolInvocationException e) {
      throw new StageException(e.getMessage(), e);
    }

    String text = result.resultText().strip();
    if (text.isEmpty()) {
      throw new StageException("The " + promptType + " prompt returned no text");
    }
    Path target = context.resolve(fileName);
    try {
      Files.writeString(target, text, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new StageException("Could not write " + fileName + ": " + e.getMessage(), e);
    }
    return new TextArtifact(target, text, summarize(text));
  }
}
