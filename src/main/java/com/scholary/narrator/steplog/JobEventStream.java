package com.scholary.narrator.steplog;

import java.io.IOException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One subscriber's view of a job's step events.
 *
 * <p>Items arrive in the order the executor produced them: first the backlog, then live events,
 * then exactly one {@link Item#done()} marker. Once {@link #start started}, the stream pushes
 * items to its {@link Sink} on the given executor. A drain task runs only while items are
 * pending, so an idle subscriber holds no thread, and at most one drain runs at a time, so the
 * sink sees one call after another.
 */
public class JobEventStream implements AutoCloseable {

  /** A step event or the terminal marker. */
  public record Item(StepEvent event) {

    private static final Item DONE = new Item(null);

    public static Item done() {
      return DONE;
    }

    public boolean isDone() {
      return event == null;
    }
  }

  /** Receives a stream's items. Calls never overlap. */
  public interface Sink {

    void send(Item item) throws IOException;

    void keepalive() throws IOException;

    /** Delivery stopped because {@code send} or {@code keepalive} threw. */
    void failed(Exception cause);
  }

  private final String jobId;
  private final Queue<Item> items = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean draining = new AtomicBoolean();
  private final AtomicBoolean keepaliveDue = new AtomicBoolean();
  private final Consumer<JobEventStream> onClose;
  private volatile Executor executor;
  private volatile Sink sink;
  private volatile boolean finished;

  JobEventStream(String jobId, Consumer<JobEventStream> onClose) {
    this.jobId = jobId;
    this.onClose = onClose;
  }

  public String getJobId() {
    return jobId;
  }

  /**
   * Push pending and future items to {@code sink}, running each drain on {@code executor}.
   *
   * @throws IllegalStateException if the stream was already started
   */
  public void start(Executor executor, Sink sink) {
    if (this.sink != null) {
      throw new IllegalStateException("Event stream of job " + jobId + " already started");
    }
    this.executor = executor;
    this.sink = sink;
    schedule();
  }

  public boolean isFinished() {
    return finished;
  }

  @Override
  public void close() {
    finished = true;
    items.clear();
    onClose.accept(this);
  }

  void offer(Item item) {
    items.offer(item);
    schedule();
  }

  /** Send a keepalive comment, unless an item goes out first. */
  void keepalive() {
    keepaliveDue.set(true);
    schedule();
  }

  private void schedule() {
    Sink target = sink;
    if (target == null || finished || !draining.compareAndSet(false, true)) {
      return;
    }
    try {
      executor.execute(() -> drain(target));
    } catch (RejectedExecutionException e) {
      draining.set(false);
      stop(target, e);
      onClose.accept(this);
    }
  }

  private void drain(Sink target) {
    try {
      Item item;
      while (!finished && (item = items.poll()) != null) {
        keepaliveDue.set(false);
        if (item.isDone()) {
          finished = true;
        }
        target.send(item);
      }
      if (!finished && keepaliveDue.getAndSet(false)) {
        target.keepalive();
      }
    } catch (IOException | RuntimeException e) {
      stop(target, e);
    } finally {
      draining.set(false);
    }
    if (finished) {
      onClose.accept(this);
    } else if (!items.isEmpty() || keepaliveDue.get()) {
      schedule();
    }
  }

  private void stop(Sink target, Exception cause) {
    finished = true;
    items.clear();
    target.failed(cause);
  }
}
