/*
 * Where: device push channel subscriber test
 * What: start() wires handleMessage onto the per-user subject and acks, terms or naks per outcome
 * Why: redelivery must only happen for failures that can succeed later
 */
package com.notisync.device.nats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notisync.common.api.PushMessage;
import com.notisync.common.api.PushMessageType;
import com.notisync.device.config.PushChannelNatsProperties;
import com.notisync.device.config.ServerClientProperties;
import com.notisync.device.service.PushMessagePermanentException;
import com.notisync.device.service.PushMessageReconciler;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.MessageHandler;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.Error;
import io.nats.client.api.StreamConfiguration;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class PushChannelSubscriberTest {

  private static final String SUBJECT = "notisync.push.user-1";
  private static final String STREAM = "notisync-push";
  private static final String PING =
      "{\"type\":\"ping\",\"data\":null,\"timestamp\":\"2026-03-02T10:00:00Z\"}";

  @Mock private Connection connection;
  @Mock private JetStream jetStream;
  @Mock private JetStreamManagement jetStreamManagement;
  @Mock private Dispatcher dispatcher;
  @Mock private JetStreamSubscription subscription;
  @Mock private PushMessageReconciler reconciler;

  @Captor private ArgumentCaptor<MessageHandler> handlerCaptor;
  @Captor private ArgumentCaptor<PushSubscribeOptions> optionsCaptor;
  @Captor private ArgumentCaptor<PushMessage> messageCaptor;

  private PushChannelSubscriber subscriber;

  @BeforeEach
  void setUp() {
    final PushChannelNatsProperties properties =
        new PushChannelNatsProperties(
            "notisync.push",
            STREAM,
            "notisync-device",
            Duration.ofMinutes(2),
            Duration.ofSeconds(30),
            10);
    final ServerClientProperties identity =
        new ServerClientProperties(null, null, null, "user-1", "device-1");
    subscriber =
        new PushChannelSubscriber(
            connection, reconciler, new ObjectMapper().findAndRegisterModules(), properties,
            identity);
  }

  @Test
  void subscribesWithDeviceDurableAndAcksHandledMessage() throws Exception {
    final Message message = mock(Message.class);
    when(message.getData()).thenReturn(PING.getBytes(StandardCharsets.UTF_8));
    startSubscriber();

    handlerCaptor.getValue().onMessage(message);

    verify(reconciler).handle(messageCaptor.capture());
    assertEquals(PushMessageType.PING, messageCaptor.getValue().type());
    verify(message).ack();
    verify(message, never()).nak();
    assertEquals("notisync-device-device-1", optionsCaptor.getValue().getDurable());
    assertEquals(STREAM, optionsCaptor.getValue().getStream());
  }

  @Test
  void termWhenPayloadUnreadable() throws Exception {
    final Message message = mock(Message.class);
    when(message.getData()).thenReturn("not-json".getBytes(StandardCharsets.UTF_8));
    startSubscriber();

    handlerCaptor.getValue().onMessage(message);

    verify(reconciler, never()).handle(any());
    verify(message).term();
    verify(message, never()).ack();
  }

  @Test
  void termWhenReconcilerRejectsMessage() throws Exception {
    final Message message = mock(Message.class);
    when(message.getData()).thenReturn(PING.getBytes(StandardCharsets.UTF_8));
    doThrow(new PushMessagePermanentException("push notification has no id or app name"))
        .when(reconciler)
        .handle(any());
    startSubscriber();

    handlerCaptor.getValue().onMessage(message);

    verify(message).term();
    verify(message, never()).nak();
  }

  @Test
  void nakWhenStoreFails() throws Exception {
    final Message message = mock(Message.class);
    when(message.getData()).thenReturn(PING.getBytes(StandardCharsets.UTF_8));
    doThrow(new DataAccessResourceFailureException("db down")).when(reconciler).handle(any());
    startSubscriber();

    handlerCaptor.getValue().onMessage(message);

    verify(message).nak();
    verify(message, never()).ack();
  }

  @Test
  void createsStreamWhenMissing() throws Exception {
    when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);
    when(connection.jetStream()).thenReturn(jetStream);
    when(connection.createDispatcher()).thenReturn(dispatcher);
    when(jetStreamManagement.updateStream(any(StreamConfiguration.class)))
        .thenThrow(new StreamNotFoundException());
    when(jetStream.subscribe(
            eq(SUBJECT), eq(dispatcher), any(MessageHandler.class), eq(false),
            any(PushSubscribeOptions.class)))
        .thenReturn(subscription);

    subscriber.start();

    final ArgumentCaptor<StreamConfiguration> streamCaptor =
        ArgumentCaptor.forClass(StreamConfiguration.class);
    verify(jetStreamManagement).addStream(streamCaptor.capture());
    assertEquals(STREAM, streamCaptor.getValue().getName());
    assertEquals("notisync.push.>", streamCaptor.getValue().getSubjects().get(0));
  }

  private void startSubscriber() throws Exception {
    when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);
    when(connection.jetStream()).thenReturn(jetStream);
    when(connection.createDispatcher()).thenReturn(dispatcher);
    when(jetStream.subscribe(
            eq(SUBJECT), eq(dispatcher), handlerCaptor.capture(), eq(false),
            optionsCaptor.capture()))
        .thenReturn(subscription);
    subscriber.start();
  }

  private static final class StreamNotFoundException extends JetStreamApiException {

    private StreamNotFoundException() {
      super(Error.JsBadRequestErr);
    }

    @Override
    public int getApiErrorCode() {
      return 10059;
    }

    @Override
    public int getErrorCode() {
      return 404;
    }
  }
}
