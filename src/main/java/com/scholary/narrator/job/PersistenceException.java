package com.scholary.narrator.job;

/**
 * Thrown when job state cannot be written to or read from the state file.
 *
 * <p>Fatal to the operation that triggered the write; the job keeps its last durably written
 * state.
 */
public class PersistenceException extends RuntimeException {

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
