/*
 * Where: device sync layer
 * What: HTTP client for the server of record
 * Why: maps every transport failure onto one retry-eligible exception type
 */
package com.notisync.device.sync;

import com.notisync.common.api.BatchCreateRequest;
import com.notisync.common.api.BatchCreateResponse;
import com.notisync.common.api.CreateNotificationResponse;
import com.notisync.common.api.NotificationPayload;
import com.notisync.common.api.StatusUpdateRequest;
import com.notisync.common.api.StatusUpdateResponse;
import com.notisync.common.model.StatusAction;
import com.notisync.device.config.NetworkProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Service
public class RestNotificationServerClient implements NotificationServerClient {

  private static final Logger logger = LoggerFactory.getLogger(RestNotificationServerClient.class);

  private final RestClient serverRestClient;
  private final NetworkProperties networkProperties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component")
  public RestNotificationServerClient(
      RestClient serverRestClient, NetworkProperties networkProperties) {
    this.serverRestClient = serverRestClient;
    this.networkProperties = networkProperties;
  }

  @Override
  public CreateNotificationResponse createNotification(NotificationPayload payload) {
    final CreateNotificationResponse response =
        call(
            "createNotification",
            () ->
                serverRestClient
                    .post()
                    .uri("/v1/notifications")
                    .body(payload)
                    .retrieve()
                    .body(CreateNotificationResponse.class));
    if (response == null || isBlank(response.id())) {
      throw new SyncTransportException(
          SyncTransportException.Reason.INVALID_RESPONSE, "create response has no server id");
    }
    return response;
  }

  @Override
  public BatchCreateResponse batchCreate(List<NotificationPayload> payloads) {
    final BatchCreateResponse response =
        call(
            "batchCreate",
            () ->
                serverRestClient
                    .post()
                    .uri("/v1/notifications/batch")
                    .body(new BatchCreateRequest(payloads))
                    .retrieve()
                    .body(BatchCreateResponse.class));
    if (response == null
        || response.results() == null
        || response.results().size() != payloads.size()) {
      throw new SyncTransportException(
          SyncTransportException.Reason.INVALID_RESPONSE,
          "batch response does not match request size=" + payloads.size());
    }
    return response;
  }

  @Override
  public StatusUpdateResult updateStatus(
      String serverId, StatusAction action, Instant clientUpdatedAt) {
    return call(
        "updateStatus",
        () ->
            serverRestClient
                .put()
                .uri("/v1/notifications/{id}", serverId)
                .body(new StatusUpdateRequest(action, clientUpdatedAt))
                .exchange(
                    (request, response) -> {
                      final HttpStatusCode status = response.getStatusCode();
                      if (status.value() == 409) {
                        final StatusUpdateResponse body =
                            response.bodyTo(StatusUpdateResponse.class);
                        if (body == null || body.serverVersion() == null) {
                          throw new SyncTransportException(
                              SyncTransportException.Reason.INVALID_RESPONSE,
                              "conflict response has no server version");
                        }
                        return StatusUpdateResult.conflict(body.serverVersion());
                      }
                      if (status.isError()) {
                        throw statusFailure("updateStatus", status.value());
                      }
                      final StatusUpdateResponse body = response.bodyTo(StatusUpdateResponse.class);
                      return StatusUpdateResult.ok(body == null ? null : body.serverVersion());
                    }));
  }

  @Override
  public boolean isReachable() {
    try {
      serverRestClient
          .get()
          .uri(networkProperties.healthPath())
          .retrieve()
          .toBodilessEntity();
      return true;
    } catch (RestClientException ex) {
      logger.debug("server health probe failed error={}", ex.getMessage());
      return false;
    }
  }

  private <T> T call(String operation, Supplier<T> request) {
    try {
      return request.get();
    } catch (RestClientResponseException ex) {
      throw statusFailure(operation, ex.getStatusCode().value(), ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(operation, ex);
    } catch (SyncTransportException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("server response parse failed operation={}", operation, ex);
      throw new SyncTransportException(
          SyncTransportException.Reason.INVALID_RESPONSE, operation + " response parse failed", ex);
    }
  }

  private SyncTransportException statusFailure(String operation, int status) {
    return statusFailure(operation, status, null);
  }

  private SyncTransportException statusFailure(String operation, int status, Throwable cause) {
    logger.warn("server call failed operation={} status={}", operation, status);
    final SyncTransportException.Reason reason =
        status >= 500
            ? SyncTransportException.Reason.SERVER_ERROR
            : SyncTransportException.Reason.REJECTED;
    return new SyncTransportException(reason, operation + " failed with status " + status, cause);
  }

  private SyncTransportException mapResourceException(
      String operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("server call timed out operation={}", operation);
      return new SyncTransportException(
          SyncTransportException.Reason.TIMEOUT, operation + " timed out", ex);
    }
    logger.warn("server unreachable operation={} error={}", operation, ex.getMessage());
    return new SyncTransportException(
        SyncTransportException.Reason.UNREACHABLE, operation + " connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
