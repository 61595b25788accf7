/*
 * Where: server configuration binding
 * What: request limits for the notification endpoints
 * Why: oversized batches and fields are rejected before they reach the database
 */
package com.notisync.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notisync.server-api")
public record ServerApiProperties(
    Integer maxBatchSize,
    Integer titleMaxLength,
    Integer bodyMaxLength,
    Integer appNameMaxLength,
    Integer listLimit) {

  private static final int DEFAULT_MAX_BATCH_SIZE = 100;
  private static final int DEFAULT_TITLE_MAX_LENGTH = 500;
  private static final int DEFAULT_BODY_MAX_LENGTH = 2000;
  private static final int DEFAULT_APP_NAME_MAX_LENGTH = 255;
  private static final int DEFAULT_LIST_LIMIT = 200;

  public ServerApiProperties {
    maxBatchSize = positiveOrDefault(maxBatchSize, DEFAULT_MAX_BATCH_SIZE);
    titleMaxLength = positiveOrDefault(titleMaxLength, DEFAULT_TITLE_MAX_LENGTH);
    bodyMaxLength = positiveOrDefault(bodyMaxLength, DEFAULT_BODY_MAX_LENGTH);
    appNameMaxLength = positiveOrDefault(appNameMaxLength, DEFAULT_APP_NAME_MAX_LENGTH);
    listLimit = positiveOrDefault(listLimit, DEFAULT_LIST_LIMIT);
  }

  public static ServerApiProperties defaults() {
    return new ServerApiProperties(null, null, null, null, null);
  }

  private static int positiveOrDefault(Integer value, int defaultValue) {
    return value == null || value <= 0 ? defaultValue : value;
  }
}
