package com.notisync.server.service;

public class NotificationNotFoundException extends RuntimeException {

  public NotificationNotFoundException(String id) {
    super("notification not found: " + id);
  }
}
