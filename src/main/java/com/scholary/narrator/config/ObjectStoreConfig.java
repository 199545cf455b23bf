package com.scholary.narrator.config;

import com.scholary.narrator.objectstore.ArtifactPublisher;
import com.scholary.narrator.objectstore.ObjectStoreArtifactPublisher;
import com.scholary.narrator.objectstore.ObjectStoreProperties;
import com.scholary.narrator.objectstore.S3ObjectStoreClient;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>With {@code objectstore.enabled=true} artifacts are uploaded to the configured bucket and jobs
 * carry presigned links; otherwise a publisher that does nothing is used and no S3 client is
 * created.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  @ConditionalOnProperty(prefix = "objectstore", name = "enabled", havingValue = "true")
  public S3ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }

  @Bean
  @ConditionalOnProperty(prefix = "objectstore", name = "enabled", havingValue = "true")
  public ArtifactPublisher objectStoreArtifactPublisher(
      S3ObjectStoreClient client, ObjectStoreProperties properties) {
    return new ObjectStoreArtifactPublisher(
        client,
        properties.bucket(),
        properties.normalizedKeyPrefix(),
        Duration.ofDays(properties.urlTtlDays()));
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "objectstore",
      name = "enabled",
      havingValue = "false",
      matchIfMissing = true)
  public ArtifactPublisher disabledArtifactPublisher() {
    return ArtifactPublisher.disabled();
  }
}
