package com.scholary.narrator.stage;

/**
 * A stage could not produce its output.
 *
 * <p>The message is shown to users as the failure reason of the step and the job, so it carries
 * the collaborator's own error text.
 */
public class StageException extends RuntimeException {

  public StageException(String message) {
    super(message);
  }

  public StageException(String message, Throwable cause) {
    super(message, cause);
  }
}
