package com.notisync.server.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  INVALID_RULE,
  INVALID_NOTIFICATION,
  BATCH_TOO_LARGE,
  NOT_FOUND
}
