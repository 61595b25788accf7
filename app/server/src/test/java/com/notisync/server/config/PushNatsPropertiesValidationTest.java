package com.notisync.server.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PushNatsPropertiesValidationTest {

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void validationPassesWhenAllFieldsValid() {
    final PushNatsProperties properties =
        new PushNatsProperties("notisync.push", "notisync-push", Duration.ofMinutes(2));

    assertTrue(validator.validate(properties).isEmpty());
    assertEquals("notisync.push.user-1", properties.subjectFor("user-1"));
  }

  @Test
  void validationFailsWhenDuplicateWindowIsNegative() {
    final PushNatsProperties properties =
        new PushNatsProperties("notisync.push", "notisync-push", Duration.ofSeconds(-1));

    assertFalse(validator.validate(properties).isEmpty());
  }

  @Test
  void validationFailsWhenStreamIsBlank() {
    final PushNatsProperties properties =
        new PushNatsProperties("notisync.push", "", Duration.ofMinutes(2));

    assertFalse(validator.validate(properties).isEmpty());
  }
}
