package com.notisync.device.service;

/** A capture that cannot become a record; it is never persisted or enqueued. */
public class InvalidNotificationException extends IllegalArgumentException {

  public InvalidNotificationException(String message) {
    super(message);
  }
}
