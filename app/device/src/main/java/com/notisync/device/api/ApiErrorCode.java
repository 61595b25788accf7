package com.notisync.device.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  INVALID_RULE,
  INVALID_NOTIFICATION,
  NOT_FOUND
}
