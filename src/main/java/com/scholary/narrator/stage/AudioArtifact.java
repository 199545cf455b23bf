package com.scholary.narrator.stage;

import java.nio.file.Path;

/** Synthesized or merged audio. */
public record AudioArtifact(Path path, String summary) implements StageOutput {}
