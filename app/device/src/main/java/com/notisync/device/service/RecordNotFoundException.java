package com.notisync.device.service;

public class RecordNotFoundException extends RuntimeException {

  public RecordNotFoundException(String recordId) {
    super("notification not found: " + recordId);
  }
}
