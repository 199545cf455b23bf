package com.scholary.narrator.objectstore;

import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;

/**
 * The object storage operations artifact publishing relies on. Implementations throw {@link
 * ObjectStoreException} on failure.
 */
public interface ObjectStoreClient {

  /** Create {@code bucket} unless it already exists. */
  void ensureBucket(String bucket);

  /**
   * Upload a local file, replacing any object stored under the same key.
   *
   * @param contentType MIME type stored with the object
   */
  void uploadFile(String bucket, String key, Path file, String contentType);

  /**
   * A temporary link that downloads the object as an attachment named {@code fileName}.
   *
   * @param ttl how long the link stays valid
   */
  URL presignDownload(String bucket, String key, String fileName, Duration ttl);
}
