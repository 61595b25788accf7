package com.notisync.device.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.notisync.common.rules.DefaultRules;
import com.notisync.common.rules.KeywordFilterConditions;
import com.notisync.common.rules.Rule;
import com.notisync.common.rules.RuleAction;
import com.notisync.common.rules.RuleType;
import com.notisync.device.AbstractPostgresContainerTest;
import com.notisync.device.model.RuleTriggerStats;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DeviceRuleRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-02T10:00:00Z");

  @Autowired private DeviceRuleRepository repository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM rules", new MapSqlParameterSource());
  }

  @Test
  void defaultRulesRoundTripInPriorityOrder() {
    final List<Rule> defaults = DefaultRules.create(BASE_TIME);
    defaults.forEach(repository::save);

    final List<Rule> loaded = repository.findAll();

    assertThat(repository.count()).isEqualTo(defaults.size());
    assertThat(loaded).extracting(Rule::id).first().isEqualTo("default-system-block");
    assertThat(loaded).isSortedAccordingTo((a, b) -> Integer.compare(b.priority(), a.priority()));
    assertThat(repository.findById("default-otp-high-priority").orElseThrow().actions())
        .contains(new RuleAction.AddTag("otp"));
  }

  @Test
  void saveUpdatesExistingRule() {
    repository.save(keywordRule(10, true));

    repository.save(keywordRule(40, false));

    final Rule loaded = repository.findById("rule-sale").orElseThrow();
    assertThat(loaded.priority()).isEqualTo(40);
    assertThat(loaded.enabled()).isFalse();
    assertThat(loaded.conditions()).isInstanceOf(KeywordFilterConditions.class);
  }

  @Test
  void undecodableRowsAreSkipped() {
    repository.save(keywordRule(10, true));
    jdbcTemplate.update(
        """
        INSERT INTO rules (id, name, type, priority, enabled, conditions, actions, schema_version,
                           created_at, updated_at)
        VALUES ('broken', 'Broken', 'no_such_type', 5, TRUE, '{}'::jsonb, '[]'::jsonb, 2,
                now(), now())
        """,
        new MapSqlParameterSource());

    assertThat(repository.findAll()).extracting(Rule::id).containsExactly("rule-sale");
  }

  @Test
  void triggersAreCounted() {
    repository.save(keywordRule(10, true));

    repository.recordTriggers(List.of("rule-sale"), BASE_TIME);
    repository.recordTriggers(List.of("rule-sale"), BASE_TIME.plusSeconds(30));

    final RuleTriggerStats stats = repository.findTriggerStats().get(0);
    assertThat(stats.ruleId()).isEqualTo("rule-sale");
    assertThat(stats.triggerCount()).isEqualTo(2);
    assertThat(stats.lastTriggered()).isEqualTo(BASE_TIME.plusSeconds(30));
  }

  @Test
  void deleteReportsWhetherRuleExisted() {
    repository.save(keywordRule(10, true));

    assertThat(repository.delete("rule-sale")).isTrue();
    assertThat(repository.delete("rule-sale")).isFalse();
  }

  private static Rule keywordRule(int priority, boolean enabled) {
    return new Rule(
        "rule-sale",
        "Mute sales",
        RuleType.KEYWORD_FILTER,
        priority,
        enabled,
        new KeywordFilterConditions(List.of("sale"), List.of(), false, true, true),
        List.of(new RuleAction.SetDismissed(true)),
        BASE_TIME,
        BASE_TIME);
  }
}
