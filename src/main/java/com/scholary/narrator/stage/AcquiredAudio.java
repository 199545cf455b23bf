package com.scholary.narrator.stage;

import java.nio.file.Path;

/** Source audio placed in the run directory. */
public record AcquiredAudio(Path path, String summary) implements StageOutput {}
