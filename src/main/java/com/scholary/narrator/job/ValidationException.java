package com.scholary.narrator.job;

/** A request was malformed or ambiguous and was rejected before anything changed. */
public class ValidationException extends RuntimeException {

  public ValidationException(String message) {
    super(message);
  }
}
