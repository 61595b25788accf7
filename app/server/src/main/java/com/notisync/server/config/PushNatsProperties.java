/*
 * Where: server configuration binding
 * What: JetStream stream and subject settings for push fan-out
 * Why: Nats-Msg-Id de-duplication only works inside the stream's duplicate window
 */
package com.notisync.server.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notisync.push-nats")
@Validated
public record PushNatsProperties(
    @NotBlank String subjectPrefix, @NotBlank String stream, @NotNull Duration duplicateWindow) {

  @AssertTrue(message = "notisync.push-nats.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return duplicateWindow != null && !duplicateWindow.isZero() && !duplicateWindow.isNegative();
  }

  public String subjectFor(String userId) {
    return subjectPrefix + "." + userId;
  }

  public String streamSubjects() {
    return subjectPrefix + ".>";
  }
}
