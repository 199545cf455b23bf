package com.scholary.narrator.speaker;

/**
 * A speaker configuration was malformed or did not match the detected speakers.
 *
 * <p>Raised back to the submitter; the waiting job is left untouched.
 */
public class SpeakerInputException extends RuntimeException {

  public SpeakerInputException(String message) {
    super(message);
  }

  public SpeakerInputException(String message, Throwable cause) {
    super(message, cause);
  }
}
