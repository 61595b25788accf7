package com.notisync.device.nats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notisync.common.api.PushMessage;
import com.notisync.device.config.PushChannelNatsProperties;
import com.notisync.device.config.ServerClientProperties;
import com.notisync.device.service.PushMessagePermanentException;
import com.notisync.device.service.PushMessageReconciler;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/** Durable JetStream push consumer for this device on its user's channel. */
@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true")
public class PushChannelSubscriber {

  private static final Logger logger = LoggerFactory.getLogger(PushChannelSubscriber.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "NATS Connection is an externally managed shared resource")
  private final Connection connection;

  private final PushMessageReconciler reconciler;
  private final ObjectMapper objectMapper;
  private final PushChannelNatsProperties properties;
  private final ServerClientProperties identity;
  private final AtomicBoolean started;
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  public PushChannelSubscriber(
      Connection connection,
      PushMessageReconciler reconciler,
      ObjectMapper objectMapper,
      PushChannelNatsProperties properties,
      ServerClientProperties identity) {
    this.connection = connection;
    this.reconciler = reconciler;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.identity = identity;
    this.started = new AtomicBoolean(false);
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    final String subject = properties.subjectFor(identity.userId());
    try {
      ensureStream();
      final JetStream jetStream = connection.jetStream();
      dispatcher = connection.createDispatcher();
      subscription =
          jetStream.subscribe(
              subject, dispatcher, this::handleMessage, false, buildPushSubscribeOptions());
      logger.info(
          "push channel subscriber started subject={} stream={} durable={}",
          subject,
          properties.stream(),
          durableName());
    } catch (IOException | JetStreamApiException ex) {
      started.set(false);
      throw new IllegalStateException("failed to start push channel subscriber", ex);
    }
  }

  @PreDestroy
  public void stop() {
    if (subscription != null) {
      subscription.unsubscribe();
      subscription = null;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
  }

  void handleMessage(Message message) {
    try {
      final PushMessage pushMessage = objectMapper.readValue(message.getData(), PushMessage.class);
      reconciler.handle(pushMessage);
      message.ack();
    } catch (IOException ex) {
      logger.warn("push message unreadable; terminated error={}", ex.getMessage());
      message.term();
    } catch (PushMessagePermanentException ex) {
      logger.warn("push message rejected; terminated reason={}", ex.getMessage());
      message.term();
    } catch (DataAccessException ex) {
      logger.warn("push message not stored; will be redelivered", ex);
      message.nak();
    } catch (RuntimeException ex) {
      logger.warn("push message handling failed; will be redelivered", ex);
      message.nak();
    }
  }

  private String durableName() {
    return properties.durable() + "-" + identity.deviceId();
  }

  private void ensureStream() throws IOException, JetStreamApiException {
    final StreamConfiguration streamConfiguration =
        StreamConfiguration.builder()
            .name(properties.stream())
            .subjects(properties.streamSubjects())
            .duplicateWindow(properties.duplicateWindow())
            .build();
    final JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
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

  private PushSubscribeOptions buildPushSubscribeOptions() {
    final ConsumerConfiguration consumerConfiguration =
        ConsumerConfiguration.builder()
            .ackPolicy(AckPolicy.Explicit)
            .ackWait(properties.ackWait())
            .maxDeliver(properties.maxDeliver())
            .build();
    return PushSubscribeOptions.builder()
        .stream(properties.stream())
        .durable(durableName())
        .configuration(consumerConfiguration)
        .build();
  }
}
