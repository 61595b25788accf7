package com.notisync.server.service;

public class RuleNotFoundException extends RuntimeException {

  public RuleNotFoundException(String id) {
    super("rule not found: " + id);
  }
}
