/*
 * Where: device configuration binding
 * What: deduplication window, key fields and fuzzy matching settings
 * Why: the same listener can fire several times for one logical notification
 */
package com.notisync.device.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notisync.dedup")
public record DeduplicationProperties(
    Boolean enabled,
    Duration window,
    List<String> fields,
    Boolean fuzzyMatching,
    Double similarityThreshold,
    Integer maxEntries) {

  public DeduplicationProperties {
    enabled = enabled == null || enabled;
    window = window == null ? Duration.ofSeconds(5) : window;
    fields =
        fields == null || fields.isEmpty()
            ? List.of("appIdentity", "title", "body")
            : List.copyOf(fields);
    fuzzyMatching = fuzzyMatching != null && fuzzyMatching;
    similarityThreshold = similarityThreshold == null ? 0.8 : similarityThreshold;
    maxEntries = maxEntries == null ? 1000 : maxEntries;
  }

  public static DeduplicationProperties defaults() {
    return new DeduplicationProperties(null, null, null, null, null, null);
  }
}
