package com.scholary.narrator.stage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/** Runs one ffmpeg command to completion, keeping its output for the error message. */
final class FfmpegProcess {

  private FfmpegProcess() {}

  /**
   * @param action what the command does, used in error messages
   * @throws StageException if ffmpeg cannot be started, exits non-zero or is interrupted
   */
  static void run(List<String> command, String action) {
    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectErrorStream(true);
    try {
      Process process = pb.start();
      String log = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
      int exitCode = process.waitFor();
      if (exitCode != 0) {
        throw new StageException(
            String.format("ffmpeg %s failed with exit code %d: %s", action, exitCode, tail(log)));
      }
    } catch (IOException e) {
      throw new StageException("ffmpeg " + action + " failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StageException("ffmpeg " + action + " interrupted", e);
    }
  }

  private static String tail(String log) {
    String trimmed = log.strip();
    return trimmed.length() <= 500 ? trimmed : trimmed.substring(trimmed.length() - 500);
  }
}
