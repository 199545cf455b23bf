package com.scholary.narrator.steplog;

import com.scholary.narrator.job.Job;
import com.scholary.narrator.job.JobRepository;
import com.scholary.narrator.job.PersistenceException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maintains each job's step log and fans its events out to live subscribers.
 *
 * <p>Per job there is one channel whose lock covers three things: upserting into the step log,
 * delivering to subscribers, and registering a new subscriber together with its backlog
 * snapshot. Holding that lock across all three is what lets a late subscriber see every event
 * exactly once: each event is either part of its backlog or delivered live, never both.
 *
 * <p>Delivery only enqueues; each {@link JobEventStream} pushes to its client on its own executor.
 */
public class EventBroadcaster {

  private static final Logger LOGGER = LoggerFactory.getLogger(EventBroadcaster.class);

  private final JobRepository repository;
  private final ConcurrentMap<String, Channel> channels = new ConcurrentHashMap<>();

  public EventBroadcaster(JobRepository repository) {
    this.repository = repository;
  }

  /**
   * Upsert an event into the job's step log, persist the job, then deliver the event to every
   * live subscriber.
   *
   * @throws PersistenceException if the job cannot be written; the step log is then left as it
   *     was and the event is not delivered
   */
  public void append(Job job, StepEvent event) {
    Channel channel = channel(job.getJobId());
    synchronized (channel) {
      Optional<StepEvent> previous = job.getStepLog().upsert(event);
      try {
        repository.update(job);
      } catch (PersistenceException e) {
        job.getStepLog().revert(event.step(), previous);
        throw e;
      }
      for (JobEventStream subscriber : channel.subscribers) {
        subscriber.offer(new JobEventStream.Item(event));
      }
    }
  }

  /**
   * Attach a subscriber. It receives the current backlog, then live events, then one done
   * marker once the job is terminal.
   */
  public JobEventStream subscribe(Job job) {
    String jobId = job.getJobId();
    Channel channel = channel(jobId);
    synchronized (channel) {
      JobEventStream stream = new JobEventStream(jobId, closed -> unsubscribe(channel, closed));
      for (StepEvent event : job.getStepLog().snapshot()) {
        stream.offer(new JobEventStream.Item(event));
      }
      if (channel.done || job.isTerminal()) {
        stream.offer(JobEventStream.Item.done());
        if (channel.subscribers.isEmpty()) {
          channels.remove(jobId, channel);
        }
      } else {
        channel.subscribers.add(stream);
      }
      LOGGER.debug("Subscriber attached: jobId={}, live={}", jobId, channel.subscribers.size());
      return stream;
    }
  }

  /** Send the done marker to every subscriber of the job and drop its channel. */
  public void complete(String jobId) {
    Channel channel = channel(jobId);
    synchronized (channel) {
      channel.done = true;
      for (JobEventStream subscriber : channel.subscribers) {
        subscriber.offer(JobEventStream.Item.done());
      }
      channel.subscribers.clear();
      channels.remove(jobId, channel);
    }
  }

  /** Ask every live subscriber to send a keepalive comment. */
  public void keepalive() {
    for (Channel channel : channels.values()) {
      for (JobEventStream subscriber : channel.subscribers) {
        subscriber.keepalive();
      }
    }
  }

  int subscriberCount(String jobId) {
    Channel channel = channels.get(jobId);
    if (channel == null) {
      return 0;
    }
    synchronized (channel) {
      return channel.subscribers.size();
    }
  }

  private Channel channel(String jobId) {
    return channels.computeIfAbsent(jobId, id -> new Channel());
  }

  private void unsubscribe(Channel channel, JobEventStream stream) {
    synchronized (channel) {
      channel.subscribers.remove(stream);
    }
  }

  private static final class Channel {
    private final List<JobEventStream> subscribers = new CopyOnWriteArrayList<>();
    private boolean done;
  }
}
