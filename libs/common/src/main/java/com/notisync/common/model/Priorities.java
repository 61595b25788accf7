package com.notisync.common.model;

public final class Priorities {

  public static final int MIN = 0;
  public static final int MAX = 3;
  public static final int DEFAULT = 1;

  private Priorities() {}

  public static int clamp(int priority) {
    return Math.max(MIN, Math.min(MAX, priority));
  }
}
