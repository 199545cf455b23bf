package com.scholary.narrator.stage;

import java.nio.file.Path;

/** Cuts a stretch out of an audio file. */
public interface ClipExtractor {

  /**
   * @param source audio to cut from
   * @param startSeconds offset of the first sample kept
   * @param endSeconds offset where the clip ends
   * @param output file to write, replaced if it exists
   * @throws StageException if the clip cannot be written
   */
  void extract(Path source, double startSeconds, double endSeconds, Path output);
}
