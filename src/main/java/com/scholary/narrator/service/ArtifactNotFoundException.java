package com.scholary.narrator.service;

/** No artifact exists at the requested run-relative path. */
public class ArtifactNotFoundException extends RuntimeException {

  public ArtifactNotFoundException(String path) {
    super("Artifact not found: " + path);
  }
}
