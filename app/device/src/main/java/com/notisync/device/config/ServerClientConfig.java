/*
 * Where: device configuration
 * What: RestClient bound to the server of record with identity headers and timeouts
 * Why: every server call carries a fixed request timeout
 */
package com.notisync.device.config;

import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class ServerClientConfig {

  public static final String USER_ID_HEADER = "X-User-Id";
  public static final String DEVICE_ID_HEADER = "X-Device-Id";

  @Bean
  RestClient serverRestClient(RestClient.Builder builder, ServerClientProperties properties) {
    final ClientHttpRequestFactorySettings settings =
        ClientHttpRequestFactorySettings.DEFAULTS
            .withConnectTimeout(properties.connectTimeout())
            .withReadTimeout(properties.requestTimeout());
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(ClientHttpRequestFactories.get(settings))
        .defaultHeader(USER_ID_HEADER, properties.userId())
        .defaultHeader(DEVICE_ID_HEADER, properties.deviceId())
        .build();
  }
}
