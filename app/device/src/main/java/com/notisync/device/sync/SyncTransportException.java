/*
 * Where: device sync layer
 * What: a failed call to the server of record
 * Why: the engine counts an attempt for every reason and buckets stats by it
 */
package com.notisync.device.sync;

public class SyncTransportException extends RuntimeException {

  public enum Reason {
    TIMEOUT,
    UNREACHABLE,
    SERVER_ERROR,
    REJECTED,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public SyncTransportException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public SyncTransportException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  public boolean isNetworkFailure() {
    return reason == Reason.TIMEOUT || reason == Reason.UNREACHABLE;
  }
}
