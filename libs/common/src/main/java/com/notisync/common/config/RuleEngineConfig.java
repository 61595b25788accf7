/*
 * Where: shared configuration
 * What: registers the rule evaluator and rule codec as beans
 * Why: the device pipeline and the server authority must evaluate rules with the same code
 */
package com.notisync.common.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notisync.common.rules.RuleCodec;
import com.notisync.common.rules.RuleEvaluator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RuleEngineConfig {

  @Bean
  public RuleEvaluator ruleEvaluator() {
    return RuleEvaluator.withDefaultMatchers();
  }

  @Bean
  public RuleCodec ruleCodec(ObjectMapper objectMapper) {
    return new RuleCodec(objectMapper);
  }
}
