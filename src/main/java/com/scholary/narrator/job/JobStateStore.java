package com.scholary.narrator.job;

import java.util.Optional;

/**
 * Durable storage for the pipeline state.
 *
 * <p>Implementations write synchronously; when {@link #save} returns the state is durable.
 */
public interface JobStateStore {

  /**
   * Read the last saved state.
   *
   * @return the state, or empty if nothing has been saved yet
   * @throws PersistenceException if the stored state cannot be read
   */
  Optional<PipelineState> load();

  /**
   * Replace the stored state.
   *
   * @throws PersistenceException if the write fails
   */
  void save(PipelineState state);
}
