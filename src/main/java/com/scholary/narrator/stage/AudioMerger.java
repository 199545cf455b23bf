package com.scholary.narrator.stage;

import java.nio.file.Path;
import java.util.List;

/** Concatenates audio files in order into one output file. */
public interface AudioMerger {

  /**
   * @param inputs files to concatenate, in playback order; at least one
   * @param output file to write, replaced if it exists
   * @throws StageException if the merge fails
   */
  void merge(List<Path> inputs, Path output);
}
