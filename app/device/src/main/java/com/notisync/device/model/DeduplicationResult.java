package com.notisync.device.model;

public record DeduplicationResult(boolean capture, String reason) {

  public static DeduplicationResult accepted(String reason) {
    return new DeduplicationResult(true, reason);
  }

  public static DeduplicationResult duplicate(String reason) {
    return new DeduplicationResult(false, reason);
  }
}
