package com.notisync.common.rules;

/** A rule document or rule definition that can never be evaluated. */
public class InvalidRuleException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public InvalidRuleException(String message) {
    super(message);
  }

  public InvalidRuleException(String message, Throwable cause) {
    super(message, cause);
  }
}
