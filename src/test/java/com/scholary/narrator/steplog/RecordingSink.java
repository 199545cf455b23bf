package com.scholary.narrator.steplog;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/** Collects what an event stream pushes and notices overlapping calls. */
public class RecordingSink implements JobEventStream.Sink {

  private final List<JobEventStream.Item> items = new CopyOnWriteArrayList<>();
  private final AtomicInteger keepalives = new AtomicInteger();
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicBoolean overlapped = new AtomicBoolean();
  private volatile Exception failure;

  @Override
  public void send(JobEventStream.Item item) {
    enter();
    try {
      items.add(item);
    } finally {
      inFlight.decrementAndGet();
    }
  }

  @Override
  public void keepalive() {
    enter();
    try {
      keepalives.incrementAndGet();
    } finally {
      inFlight.decrementAndGet();
    }
  }

  @Override
  public void failed(Exception cause) {
    failure = cause;
  }

  public List<StepEvent> events() {
    return items.stream()
        .filter(item -> !item.isDone())
        .map(JobEventStream.Item::event)
        .toList();
  }

  public long doneCount() {
    return items.stream().filter(JobEventStream.Item::isDone).count();
  }

  public boolean isDone() {
    return !items.isEmpty() && items.get(items.size() - 1).isDone();
  }

  public int keepalives() {
    return keepalives.get();
  }

  public boolean overlapped() {
    return overlapped.get();
  }

  public Exception failure() {
    return failure;
  }

  private void enter() {
    if (inFlight.incrementAndGet() > 1) {
      overlapped.set(true);
    }
  }
}
