package com.scholary.narrator.stage;

import java.nio.file.Path;

/** A text file produced by a prompt stage, with its content. */
public record TextArtifact(Path path, String text, String summary) implements StageOutput {}
