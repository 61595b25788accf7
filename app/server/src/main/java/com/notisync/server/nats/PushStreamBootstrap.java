package com.notisync.server.nats;

import com.notisync.server.config.PushNatsProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Creates or updates the push stream before the first publish. */
@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true")
@RequiredArgsConstructor
public class PushStreamBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(PushStreamBootstrap.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private final Connection connection;
  private final PushNatsProperties properties;

  @PostConstruct
  public void start() {
    try {
      final StreamConfiguration streamConfiguration =
          StreamConfiguration.builder()
              .name(properties.stream())
              .subjects(properties.streamSubjects())
              .duplicateWindow(properties.duplicateWindow())
              .build();
      upsertStream(connection.jetStreamManagement(), streamConfiguration);
      logger.info(
          "push stream ensured stream={} subjects={} duplicateWindow={}",
          properties.stream(),
          properties.streamSubjects(),
          properties.duplicateWindow());
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to ensure JetStream stream", ex);
    }
  }

  private void upsertStream(
      JetStreamManagement jetStreamManagement, StreamConfiguration streamConfiguration)
      throws IOException, JetStreamApiException {
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
  }

  private boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }
}
