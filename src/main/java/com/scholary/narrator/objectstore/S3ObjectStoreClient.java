package com.scholary.narrator.objectstore;

import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

/**
 * {@link ObjectStoreClient} backed by AWS SDK v2, usable against S3 and MinIO alike.
 *
 * <p>The endpoint override and path-style flag select between the two. The SDK retries transient
 * failures on its own; whatever still fails is rethrown as {@link ObjectStoreException}.
 */
public class S3ObjectStoreClient implements ObjectStoreClient, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Connecting to object store: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    AwsCredentialsProvider credentials =
        StaticCredentialsProvider.create(
            AwsBasicCredentials.create(properties.accessKey(), properties.secretKey()));
    Region region =
        properties.region() == null || properties.region().isBlank()
            ? Region.US_EAST_1
            : Region.of(properties.region());
    URI endpoint = URI.create(properties.endpoint());

    this.s3Client =
        S3Client.builder()
            .region(region)
            .credentialsProvider(credentials)
            .endpointOverride(endpoint)
            .forcePathStyle(properties.pathStyleAccess())
            .build();
    // Links must use the same addressing style as uploads.
    this.s3Presigner =
        S3Presigner.builder()
            .region(region)
            .credentialsProvider(credentials)
            .endpointOverride(endpoint)
            .serviceConfiguration(
                S3Configuration.builder()
                    .pathStyleAccessEnabled(properties.pathStyleAccess())
                    .build())
            .build();
  }

  @Override
  public void ensureBucket(String bucket) {
    try {
      s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
      LOGGER.debug("Bucket present: bucket={}", bucket);
      return;
    } catch (S3Exception e) {
      if (e.statusCode() != 404) {
        throw failure("check bucket", bucket, null, e);
      }
    } catch (SdkException e) {
      throw failure("check bucket", bucket, null, e);
    }
    LOGGER.info("Creating bucket: bucket={}", bucket);
    try {
      s3Client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
    } catch (SdkException e) {
      throw failure("create bucket", bucket, null, e);
    }
  }

  @Override
  public void uploadFile(String bucket, String key, Path file, String contentType) {
    LOGGER.debug(
        "Uploading artifact: bucket={}, key={}, file={}, contentType={}",
        bucket,
        key,
        file,
        contentType);
    try {
      s3Client.putObject(
          PutObjectRequest.builder().bucket(bucket).key(key).contentType(contentType).build(),
          RequestBody.fromFile(file));
    } catch (SdkException | UncheckedIOException e) {
      throw failure("upload", bucket, key, e);
    }
    LOGGER.info("Uploaded artifact: bucket={}, key={}", bucket, key);
  }

  @Override
  public URL presignDownload(String bucket, String key, String fileName, Duration ttl) {
    GetObjectRequest download =
        GetObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .responseContentDisposition("attachment; filename=\"" + fileName + "\"")
            .build();
    try {
      return s3Presigner
          .presignGetObject(
              GetObjectPresignRequest.builder()
                  .signatureDuration(ttl)
                  .getObjectRequest(download)
                  .build())
          .url();
    } catch (SdkException e) {
      throw failure("presign", bucket, key, e);
    }
  }

  private static ObjectStoreException failure(
      String action, String bucket, String key, RuntimeException cause) {
    String status =
        cause instanceof S3Exception ? ", statusCode=" + ((S3Exception) cause).statusCode() : "";
    String message =
        key == null
            ? String.format("Failed to %s: bucket=%s%s", action, bucket, status)
            : String.format("Failed to %s: bucket=%s, key=%s%s", action, bucket, key, status);
    LOGGER.error(message, cause);
    return new ObjectStoreException(message, cause);
  }

  @Override
  public void close() {
    LOGGER.info("Closing object store client");
    s3Client.close();
    s3Presigner.close();
  }
}
