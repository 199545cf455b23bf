package com.scholary.narrator.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.narrator.job.JobResult;
import com.scholary.narrator.job.SpeakerClips;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ObjectStoreArtifactPublisherTest {

  @TempDir Path runDir;

  private ObjectStoreClient client;

  @BeforeEach
  void setUp() {
    client = mock(ObjectStoreClient.class);
    when(client.presignDownload(eq("artifacts"), anyString(), anyString(), any()))
        .thenAnswer(
            invocation -> new URL("http://store.local/artifacts/" + invocation.getArgument(1)));
  }

  @Test
  void publish_shouldUploadExistingArtifactsUnderJobId() throws Exception {
    Path polished = Files.writeString(runDir.resolve("polished.txt"), "Bonjour");
    Path audio = Files.write(runDir.resolve("audio.wav"), new byte[] {1, 2, 3});

    Map<String, String> urls =
        publisher("").publish("job-1", result(null, polished.toString(), audio.toString()));

    assertThat(urls)
        .containsEntry("polished", "http://store.local/artifacts/job-1/polished.txt")
        .containsEntry("audio", "http://store.local/artifacts/job-1/audio.wav")
        .hasSize(2);
    verify(client).uploadFile("artifacts", "job-1/audio.wav", audio, "audio/wav");
    verify(client)
        .uploadFile("artifacts", "job-1/polished.txt", polished, "text/plain; charset=utf-8");
    verify(client).presignDownload("artifacts", "job-1/audio.wav", "audio.wav", Duration.ofDays(7));
  }

  @Test
  void publish_shouldPrefixKeysAndCheckBucketOnce() throws Exception {
    Path audio = Files.write(runDir.resolve("audio.wav"), new byte[] {1});
    ObjectStoreArtifactPublisher publisher = publisher("narrator/prod");

    publisher.publish("job-1", result(null, null, audio.toString()));
    publisher.publish("job-1", result(null, null, audio.toString()));

    verify(client, times(2))
        .uploadFile("artifacts", "narrator/prod/job-1/audio.wav", audio, "audio/wav");
    verify(client, times(1)).ensureBucket("artifacts");
  }

  @Test
  void publish_shouldSkipArtifactsNoLongerOnDisk() {
    String missing = runDir.resolve("gone.json").toString();

    assertThat(publisher("").publish("job-2", result(missing, null, null))).isEmpty();
    verify(client, never()).uploadFile(anyString(), anyString(), any(), anyString());
    verify(client, never()).ensureBucket(anyString());
  }

  @Test
  void publish_shouldPropagateUploadFailure() throws Exception {
    Path audio = Files.write(runDir.resolve("audio.wav"), new byte[] {1});
    doThrow(new ObjectStoreException("denied", new RuntimeException()))
        .when(client)
        .uploadFile(anyString(), anyString(), any(), anyString());

    assertThatThrownBy(() -> publisher("").publish("job-3", result(null, null, audio.toString())))
        .isInstanceOf(ObjectStoreException.class)
        .hasMessage("denied");
  }

  @Test
  void contentType_shouldFollowExtension() {
    assertThat(ObjectStoreArtifactPublisher.contentType(Path.of("a.MP3"))).isEqualTo("audio/mpeg");
    assertThat(ObjectStoreArtifactPublisher.contentType(Path.of("t.json")))
        .isEqualTo("application/json");
    assertThat(ObjectStoreArtifactPublisher.contentType(Path.of("x.bin")))
        .isEqualTo("application/octet-stream");
  }

  @Test
  void normalizedKeyPrefix_shouldTrimSlashes() {
    assertThat(properties(" /narrator/prod/ ").normalizedKeyPrefix()).isEqualTo("narrator/prod");
    assertThat(properties(null).normalizedKeyPrefix()).isEmpty();
    assertThat(properties("///").normalizedKeyPrefix()).isEmpty();
  }

  private ObjectStoreArtifactPublisher publisher(String prefix) {
    return new ObjectStoreArtifactPublisher(client, "artifacts", prefix, Duration.ofDays(7));
  }

  private JobResult result(String transcriptPath, String polishedPath, String audioPath) {
    return new JobResult(
        runDir.toString(),
        null,
        transcriptPath,
        null,
        polishedPath,
        null,
        null,
        audioPath,
        null,
        null,
        SpeakerClips.NONE,
        null);
  }

  private static ObjectStoreProperties properties(String prefix) {
    return new ObjectStoreProperties(
        true, "http://localhost:9000", "key", "secret", "artifacts", null, true, prefix, 7);
  }
}
