package com.scholary.narrator.scheduler;

/** Admission refused: queued plus running jobs already reach the queue limit. */
public class QueueFullException extends RuntimeException {

  private final int maxQueueSize;

  public QueueFullException(int maxQueueSize) {
    super(String.format("Queue is full (max %d active jobs)", maxQueueSize));
    this.maxQueueSize = maxQueueSize;
  }

  public int getMaxQueueSize() {
    return maxQueueSize;
  }
}
