package com.scholary.narrator.objectstore;

import com.scholary.narrator.job.JobResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uploads artifacts under {@code [prefix/]jobId/fileName} and returns presigned links to them.
 *
 * <p>Re-publishing after a post-completion action overwrites the same keys. The bucket is created
 * on first use if it is missing.
 */
public class ObjectStoreArtifactPublisher implements ArtifactPublisher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreArtifactPublisher.class);

  private final ObjectStoreClient client;
  private final String bucket;
  private final String keyPrefix;
  private final Duration urlTtl;
  private volatile boolean bucketReady;

  public ObjectStoreArtifactPublisher(
      ObjectStoreClient client, String bucket, String keyPrefix, Duration urlTtl) {
    this.client = client;
    this.bucket = bucket;
    this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    this.urlTtl = urlTtl;
  }

  @Override
  public Map<String, String> publish(String jobId, JobResult result) {
    Map<String, String> urls = new LinkedHashMap<>();
    for (Map.Entry<String, String> artifact : result.artifacts().entrySet()) {
      Path file = Path.of(artifact.getValue());
      if (!Files.isRegularFile(file)) {
        LOGGER.warn("Skipping missing artifact: jobId={}, artifact={}", jobId, file);
        continue;
      }
      prepareBucket();
      String fileName = file.getFileName().toString();
      String key = objectKey(jobId, fileName);
      client.uploadFile(bucket, key, file, contentType(file));
      urls.put(artifact.getKey(), client.presignDownload(bucket, key, fileName, urlTtl).toString());
    }
    LOGGER.info("Published {} artifacts: jobId={}", urls.size(), jobId);
    return urls;
  }

  String objectKey(String jobId, String fileName) {
    String key = jobId + "/" + fileName;
    return keyPrefix.isEmpty() ? key : keyPrefix + "/" + key;
  }

  private void prepareBucket() {
    if (!bucketReady) {
      client.ensureBucket(bucket);
      bucketReady = true;
    }
  }

  static String contentType(Path file) {
    String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".wav")) {
      return "audio/wav";
    }
    if (name.endsWith(".mp3")) {
      return "audio/mpeg";
    }
    if (name.endsWith(".json")) {
      return "application/json";
    }
    if (name.endsWith(".txt")) {
      return "text/plain; charset=utf-8";
    }
    return "application/octet-stream";
  }
}
