package com.notisync.device.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.notisync.common.model.NotificationCategory;
import com.notisync.device.model.NotificationRecord;
import com.notisync.device.model.RawCaptureEvent;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CaptureNormalizerTest {

  private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

  private final CaptureNormalizer normalizer =
      new CaptureNormalizer(Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void missingFieldsGetDefaults() {
    final NotificationRecord record =
        normalizer.normalize(
            new RawCaptureEvent(" ", " Bank ", null, "Code 1234", null, null, null));

    assertThat(record.id()).isNotBlank();
    assertThat(record.appIdentity()).isEqualTo("Bank");
    assertThat(record.sourceId()).isNull();
    assertThat(record.title()).isEmpty();
    assertThat(record.timestamp()).isEqualTo(NOW);
    assertThat(record.priority()).isEqualTo(1);
    assertThat(record.category()).isEqualTo(NotificationCategory.PERSONAL);
    assertThat(record.synced()).isFalse();
    assertThat(record.extras()).isEmpty();
  }

  @Test
  void rawPriorityIsClamped() {
    final NotificationRecord record =
        normalizer.normalize(
            new RawCaptureEvent("pkg", "App", "t", "b", NOW, 9, Map.of("channel", "alerts")));

    assertThat(record.priority()).isEqualTo(3);
    assertThat(record.extras()).containsEntry("channel", "alerts");
  }

  @Test
  void captureWithoutAppIdentityIsRejected() {
    assertThatThrownBy(
            () -> normalizer.normalize(new RawCaptureEvent(null, "  ", "t", "b", null, null, null)))
        .isInstanceOf(InvalidNotificationException.class);
  }

  @Test
  void captureWithoutTextIsRejected() {
    assertThatThrownBy(
            () ->
                normalizer.normalize(
                    new RawCaptureEvent(null, "App", " ", null, null, null, null)))
        .isInstanceOf(InvalidNotificationException.class);
  }
}
