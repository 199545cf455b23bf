package com.scholary.narrator.scheduler;

import com.scholary.narrator.job.ValidationException;

/** A reorder request did not name exactly the currently queued jobs. */
public class QueueOrderException extends ValidationException {

  public QueueOrderException(String message) {
    super(message);
  }
}
