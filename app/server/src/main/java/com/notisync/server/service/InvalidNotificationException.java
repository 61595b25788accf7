package com.notisync.server.service;

public class InvalidNotificationException extends IllegalArgumentException {

  public InvalidNotificationException(String message) {
    super(message);
  }
}
