package com.scholary.narrator.executor;

import com.scholary.narrator.speaker.SpeakerConfig;
import com.scholary.narrator.speaker.SpeakerConfigParser;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rendezvous between an executor parked at the speaker-config stage and the request that
 * supplies the speaker configuration.
 *
 * <p>The executor registers the tags it expects and blocks on the returned future. A resume
 * validates the payload on the caller's thread: an invalid payload is thrown back to the caller
 * and the future stays pending, a valid one completes it exactly once.
 */
public class SpeakerInputGate {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpeakerInputGate.class);

  /** What a parked job expects, and what it suggests as a starting point. */
  public record PendingInput(
      List<String> expectedTags,
      List<SpeakerConfig> suggested,
      CompletableFuture<List<SpeakerConfig>> future) {}

  private final SpeakerConfigParser parser;
  private final ConcurrentMap<String, PendingInput> pending = new ConcurrentHashMap<>();

  public SpeakerInputGate(SpeakerConfigParser parser) {
    this.parser = parser;
  }

  /** Register a job as waiting. The caller must {@link #release} it when done waiting. */
  public CompletableFuture<List<SpeakerConfig>> await(
      String jobId, List<String> expectedTags, List<SpeakerConfig> suggested) {
    PendingInput input =
        new PendingInput(
            List.copyOf(expectedTags), List.copyOf(suggested), new CompletableFuture<>());
    if (pending.putIfAbsent(jobId, input) != null) {
      throw new IllegalStateException("Job " + jobId + " is already waiting for speaker input");
    }
    return input.future();
  }

  public Optional<PendingInput> pending(String jobId) {
    return Optional.ofNullable(pending.get(jobId));
  }

  public boolean isWaiting(String jobId) {
    PendingInput input = pending.get(jobId);
    return input != null && !input.future().isDone();
  }

  /**
   * Validate a speaker configuration and wake the waiting executor.
   *
   * @return false if the job is not waiting (or another resume got there first)
   * @throws com.scholary.narrator.speaker.SpeakerInputException if the payload is invalid
   */
  public boolean resume(String jobId, String speakersJson) {
    PendingInput input = pending.get(jobId);
    if (input == null) {
      return false;
    }
    List<SpeakerConfig> speakers = parser.parse(speakersJson, input.expectedTags());
    boolean resumed = input.future().complete(speakers);
    if (resumed) {
      LOGGER.info("Speaker input accepted: jobId={}, speakers={}", jobId, speakers.size());
    }
    return resumed;
  }

  public void release(String jobId) {
    pending.remove(jobId);
  }
}
