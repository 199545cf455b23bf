package com.scholary.narrator.stage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.narrator.speaker.SpeakerConfig;
import com.scholary.narrator.tool.ToolInvocationException;
import com.scholary.narrator.tool.ToolResult;
import com.scholary.narrator.tool.ToolService;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Renders dialogue to speech with the synthesis service's {@code clone_voice} tool.
 *
 * <p>The tool writes the audio itself; the stage only checks that the file exists afterwards.
 */
public class RemoteSynthesisStage implements Stage<SpeakerSetup, AudioArtifact> {

  static final String SERVICE = "tts";
  static final String TOOL = "clone_voice";
  static final String FILE_NAME = "audio.wav";

  private final ToolService toolService;
  private final ObjectMapper objectMapper;

  public RemoteSynthesisStage(ToolService toolService, ObjectMapper objectMapper) {
    this.toolService = toolService;
    this.objectMapper = objectMapper;
  }

  @Override
  public AudioArtifact invoke(SpeakerSetup setup, StageContext context) {
    Path audio =
        synthesize(
            setup.dialogueText(),
            setup.speakers(),
            context.parameters().speed(),
            context.resolve(FILE_NAME));
    return new AudioArtifact(audio, "Audio generated");
  }

  /**
   * Synthesize {@code text} into {@code output}.
   *
   * @return the file the service wrote, normally {@code output}
   * @throws StageException if the call fails or no audio file appears
   */
  public Path synthesize(String text, List<SpeakerConfig> speakers, double speed, Path output) {
    String speakersJson;
    try {
      speakersJson = objectMapper.writeValueAsString(speakers);
    } catch (JsonProcessingException e) {
      throw new StageException("Could not encode speaker configs", e);
    }

    Map<String, Object> arguments = new LinkedHashMap<>();
    arguments.put("text", text);
    arguments.put("speaker_configs_json", speakersJson);
    arguments.put("speed", speed);
    arguments.put("output_path", output.toAbsolutePath().toString());

    ToolResult result;
    try {
      result = toolService.call(SERVICE, TOOL, arguments);
    } catch (ToolInvocationException e) {
      throw new StageException(e.getMessage(), e);
    }

    if (Files.isRegularFile(output)) {
      return output;
    }
    Optional<Path> reported = result.textField("output_path").map(Path::of);
    if (reported.isPresent() && Files.isRegularFile(reported.get())) {
      return reported.get();
    }
    throw new StageException("Voice generation produced no audio at " + output);
  }
}
