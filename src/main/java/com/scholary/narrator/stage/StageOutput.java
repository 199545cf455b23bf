package com.scholary.narrator.stage;

import java.nio.file.Path;

/** Output of a stage that produced a file. */
public interface StageOutput {

  /** The artifact the stage wrote. */
  Path path();

  /** One-line description shown as the step's completion message. */
  String summary();
}
