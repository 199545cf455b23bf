package com.scholary.narrator.stage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Cuts speaker reference clips with ffmpeg, as mono audio at the configured clip sample rate. */
@Component
public class FfmpegClipExtractor implements ClipExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegClipExtractor.class);

  private final FfmpegProperties properties;

  public FfmpegClipExtractor(FfmpegProperties properties) {
    this.properties = properties;
  }

  @Override
  public void extract(Path source, double startSeconds, double endSeconds, Path output) {
    try {
      Files.createDirectories(output.toAbsolutePath().getParent());
    } catch (IOException e) {
      throw new StageException("Could not create clip directory: " + e.getMessage(), e);
    }
    List<String> command = buildCommand(source, startSeconds, endSeconds, output);
    LOGGER.debug("Executing: {}", String.join(" ", command));
    FfmpegProcess.run(command, "clip extraction");
  }

  List<String> buildCommand(Path source, double startSeconds, double endSeconds, Path output) {
    return List.of(
        properties.binary(),
        "-y",
        "-loglevel",
        "error",
        "-ss",
        String.valueOf(Math.max(startSeconds, 0)),
        "-to",
        String.valueOf(Math.max(endSeconds, 0)),
        "-i",
        source.toString(),
        "-ac",
        "1",
        "-ar",
        String.valueOf(properties.clipSampleRate()),
        output.toString());
  }
}
