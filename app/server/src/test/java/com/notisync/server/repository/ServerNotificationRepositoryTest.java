package com.notisync.server.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.notisync.common.api.ServerNotification;
import com.notisync.common.model.NotificationCategory;
import com.notisync.server.AbstractPostgresContainerTest;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ServerNotificationRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-02T10:00:00Z");

  @Autowired private ServerNotificationRepository repository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
  }

  @Test
  void insertReturnsStoredRowWithExtras() {
    final Optional<ServerNotification> stored =
        repository.insertIfAbsent("user-1", notification("n-1", "c-1", BASE_TIME), BASE_TIME);

    assertThat(stored).isPresent();
    assertThat(stored.get().extras()).containsEntry("tags", List.of("otp"));
    assertThat(stored.get().category()).isEqualTo(NotificationCategory.WORK);
    assertThat(stored.get().updatedAt()).isEqualTo(BASE_TIME);
  }

  @Test
  void secondInsertWithSameClientIdIsIgnored() {
    repository.insertIfAbsent("user-1", notification("n-1", "c-1", BASE_TIME), BASE_TIME);

    final Optional<ServerNotification> again =
        repository.insertIfAbsent("user-1", notification("n-2", "c-1", BASE_TIME), BASE_TIME);

    assertThat(again).isEmpty();
    assertThat(repository.findByClientId("user-1", "c-1").orElseThrow().id()).isEqualTo("n-1");
  }

  @Test
  void clientIdsAreScopedPerUser() {
    repository.insertIfAbsent("user-1", notification("n-1", "c-1", BASE_TIME), BASE_TIME);

    final Optional<ServerNotification> other =
        repository.insertIfAbsent("user-2", notification("n-2", "c-1", BASE_TIME), BASE_TIME);

    assertThat(other).isPresent();
    assertThat(repository.findById("user-1", "n-2")).isEmpty();
  }

  @Test
  void updateFlagsBumpsUpdatedAt() {
    repository.insertIfAbsent("user-1", notification("n-1", "c-1", BASE_TIME), BASE_TIME);
    final Instant later = BASE_TIME.plusSeconds(30);

    final ServerNotification updated =
        repository.updateFlags("user-1", "n-1", true, false, later).orElseThrow();

    assertThat(updated.isRead()).isTrue();
    assertThat(updated.isDismissed()).isFalse();
    assertThat(updated.updatedAt()).isEqualTo(later);
    assertThat(repository.updateFlags("user-2", "n-1", true, true, later)).isEmpty();
  }

  @Test
  void listIsNewestFirstAndLimited() {
    repository.insertIfAbsent("user-1", notification("n-1", "c-1", BASE_TIME), BASE_TIME);
    repository.insertIfAbsent(
        "user-1", notification("n-2", "c-2", BASE_TIME.plusSeconds(60)), BASE_TIME);
    repository.insertIfAbsent(
        "user-1", notification("n-3", "c-3", BASE_TIME.plusSeconds(120)), BASE_TIME);

    assertThat(repository.findByUser("user-1", 2))
        .extracting(ServerNotification::id)
        .containsExactly("n-3", "n-2");
  }

  private ServerNotification notification(String id, String clientId, Instant timestamp) {
    return new ServerNotification(
        id,
        clientId,
        "device-1",
        "Slack",
        "com.slack.android",
        "Standup",
        "in 5 minutes",
        NotificationCategory.WORK,
        2,
        timestamp,
        Map.of("tags", List.of("otp")),
        false,
        false,
        BASE_TIME);
  }
}
