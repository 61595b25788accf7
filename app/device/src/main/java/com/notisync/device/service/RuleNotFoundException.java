package com.notisync.device.service;

public class RuleNotFoundException extends RuntimeException {

  public RuleNotFoundException(String ruleId) {
    super("rule not found: " + ruleId);
  }
}
