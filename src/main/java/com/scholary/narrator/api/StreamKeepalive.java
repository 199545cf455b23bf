package com.scholary.narrator.api;

import com.scholary.narrator.steplog.EventBroadcaster;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Sends a keepalive comment to every open event stream so idle proxies keep the connection. */
@Component
public class StreamKeepalive {

  private final EventBroadcaster broadcaster;

  public StreamKeepalive(EventBroadcaster broadcaster) {
    this.broadcaster = broadcaster;
  }

  @Scheduled(
      fixedRateString = "${pipeline.stream-keepalive-ms:15000}",
      initialDelayString = "${pipeline.stream-keepalive-ms:15000}")
  public void ping() {
    broadcaster.keepalive();
  }
}
