package com.scholary.narrator.stage;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Concatenates audio with ffmpeg's concat filter.
 *
 * <p>Inputs may differ in codec and sample rate: every input is decoded, concatenated as audio
 * only, and written at the configured sample rate.
 */
@Component
public class FfmpegAudioMerger implements AudioMerger {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioMerger.class);

  private final FfmpegProperties properties;

  public FfmpegAudioMerger(FfmpegProperties properties) {
    this.properties = properties;
  }

  @Override
  public void merge(List<Path> inputs, Path output) {
    if (inputs.isEmpty()) {
      throw new StageException("Nothing to merge into " + output.getFileName());
    }
    List<String> command = buildCommand(inputs, output);
    LOGGER.info("Merging {} audio files into {}", inputs.size(), output);
    LOGGER.debug("Executing: {}", String.join(" ", command));

    FfmpegProcess.run(command, "merge");
  }

  List<String> buildCommand(List<Path> inputs, Path output) {
    List<String> command = new ArrayList<>();
    command.add(properties.binary());
    command.add("-y");
    command.add("-hide_banner");
    StringBuilder filter = new StringBuilder();
    for (int i = 0; i < inputs.size(); i++) {
      command.add("-i");
      command.add(inputs.get(i).toString());
      filter.append('[').append(i).append(":a]");
    }
    filter.append("concat=n=").append(inputs.size()).append(":v=0:a=1[out]");
    command.add("-filter_complex");
    command.add(filter.toString());
    command.add("-map");
    command.add("[out]");
    command.add("-ar");
    command.add(String.valueOf(properties.sampleRate()));
    command.add(output.toString());
    return command;
  }
}
