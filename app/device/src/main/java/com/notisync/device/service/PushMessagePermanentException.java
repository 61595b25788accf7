package com.notisync.device.service;

/** A push message that can never be applied; redelivery would fail the same way. */
public class PushMessagePermanentException extends RuntimeException {

  public PushMessagePermanentException(String message) {
    super(message);
  }

  public PushMessagePermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
