package com.scholary.meeting.config;

import com.scholary.meeting.objectstore.ObjectStoreClient;
import com.scholary.meeting.objectstore.ObjectStoreProperties;
import com.scholary.meeting.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Wires the ObjectStoreClient bean from the "objectstore.*" properties. The client is closed on
 * shutdown.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
