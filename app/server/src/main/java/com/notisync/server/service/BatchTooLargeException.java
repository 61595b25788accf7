package com.notisync.server.service;

public class BatchTooLargeException extends IllegalArgumentException {

  public BatchTooLargeException(int size, int maxBatchSize) {
    super("batch size " + size + " exceeds limit " + maxBatchSize);
  }
}
