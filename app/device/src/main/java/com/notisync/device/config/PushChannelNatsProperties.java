/*
 * Where: device configuration binding
 * What: JetStream subject, stream and consumer settings for the push channel
 * Why: each device needs its own durable so deliveries survive restarts
 */
package com.notisync.device.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notisync.push-nats")
@Validated
public record PushChannelNatsProperties(
    @NotBlank String subjectPrefix,
    @NotBlank String stream,
    @NotBlank String durable,
    @NotNull Duration duplicateWindow,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxDeliver) {

  @AssertTrue(message = "notisync.push-nats.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return isPositiveDuration(duplicateWindow);
  }

  @AssertTrue(message = "notisync.push-nats.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    return isPositiveDuration(ackWait);
  }

  /** Per-user subject; every device of the user gets its own durable on it. */
  public String subjectFor(String userId) {
    return subjectPrefix + "." + userId;
  }

  public String streamSubjects() {
    return subjectPrefix + ".>";
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
