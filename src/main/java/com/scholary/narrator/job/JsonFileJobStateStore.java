package com.scholary.narrator.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the pipeline state in a single JSON file.
 *
 * <p>Each save writes a sibling temp file and moves it over the target, so a crash mid-write
 * leaves the previous state intact.
 */
public class JsonFileJobStateStore implements JobStateStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileJobStateStore.class);

  private final Path stateFile;
  private final ObjectMapper objectMapper;

  public JsonFileJobStateStore(Path stateFile, ObjectMapper objectMapper) {
    this.stateFile = stateFile;
    this.objectMapper = objectMapper;
    LOGGER.info("Using job state file: {}", stateFile.toAbsolutePath());
  }

  @Override
  public Optional<PipelineState> load() {
    if (!Files.exists(stateFile)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(stateFile.toFile(), PipelineState.class));
    } catch (IOException e) {
      throw new PersistenceException("Failed to read job state from " + stateFile, e);
    }
  }

  @Override
  public synchronized void save(PipelineState state) {
    try {
      Path parent = stateFile.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path temp = stateFile.resolveSibling(stateFile.getFileName() + ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
      Files.move(
          temp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new PersistenceException("Failed to write job state to " + stateFile, e);
    }
  }
}
