package com.scholary.narrator.api;

import com.scholary.narrator.steplog.JobEventStream;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Writes a job's event stream to an SSE response: each step event as {@code progress}, the done
 * marker as {@code done} followed by completing the response, keepalives as comments.
 */
class SseEventSink implements JobEventStream.Sink {

  private static final Logger LOGGER = LoggerFactory.getLogger(SseEventSink.class);

  private final String jobId;
  private final SseEmitter emitter;

  SseEventSink(String jobId, SseEmitter emitter) {
    this.jobId = jobId;
    this.emitter = emitter;
  }

  @Override
  public void send(JobEventStream.Item item) throws IOException {
    if (item.isDone()) {
      emitter.send(SseEmitter.event().name("done").data(Map.of("job_id", jobId)));
      emitter.complete();
      return;
    }
    emitter.send(
        SseEmitter.event().name("progress").data(item.event(), MediaType.APPLICATION_JSON));
  }

  @Override
  public void keepalive() throws IOException {
    emitter.send(SseEmitter.event().comment("keepalive"));
  }

  @Override
  public void failed(Exception cause) {
    LOGGER.debug("Event stream client went away: jobId={}, reason={}", jobId, cause.getMessage());
    emitter.completeWithError(cause);
  }
}
