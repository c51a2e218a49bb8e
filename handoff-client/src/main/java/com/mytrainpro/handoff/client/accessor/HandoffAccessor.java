package com.mytrainpro.handoff.client.accessor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mytrainpro.handoff.client.config.ReconciliationConfig;
import com.mytrainpro.handoff.client.exceptions.HandoffAccessorException;
import com.mytrainpro.handoff.client.model.ServerConnectionInfo;
import com.mytrainpro.handoff.model.LogMasks;
import com.mytrainpro.handoff.model.pending.PendingConsumeRequest;
import com.mytrainpro.handoff.model.pending.PendingConsumeResponse;
import com.mytrainpro.handoff.model.pending.PendingLookupRequest;
import com.mytrainpro.handoff.model.pending.PendingLookupResponse;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP access to the server's pending-session endpoints.
 */
@Singleton
public class HandoffAccessor {

  private static final Logger log = LoggerFactory.getLogger(HandoffAccessor.class);

  static final String LOOKUP_PATH = "auth/pending/lookup";
  static final String CONSUME_PATH = "auth/pending/consume";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ServerConnectionInfo connectionInfo;
  private final Duration requestTimeout;

  @Inject
  public HandoffAccessor(final ReconciliationConfig config,
                         final HttpClient httpClient,
                         final ObjectMapper objectMapper,
                         final ServerConnectionInfo connectionInfo) {
    log.info("HandoffAccessor({})", connectionInfo);
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.connectionInfo = connectionInfo;
    this.requestTimeout = config.requestTimeout();
  }

  /**
   * Asks whether a live pending session exists for the device.
   *
   * @param deviceId the device id
   * @return the lookup answer; {@code found=false} is a normal answer
   * @throws HandoffAccessorException on transport failure or a non-2xx response
   */
  public PendingLookupResponse lookup(final String deviceId) {
    log.trace("lookup()");
    return post(LOOKUP_PATH, new PendingLookupRequest(deviceId), PendingLookupResponse.class);
  }

  /**
   * Consumes a pending session.
   *
   * @param sessionHandle the handle
   * @return the consume answer; every status, not just {@code ok}, is a normal answer
   * @throws HandoffAccessorException on transport failure or a non-2xx response
   */
  public PendingConsumeResponse consume(final String sessionHandle) {
    log.trace("consume(sessionHandle={})", LogMasks.mask(sessionHandle));
    return post(CONSUME_PATH, new PendingConsumeRequest(sessionHandle), PendingConsumeResponse.class);
  }

  private <T> T post(final String path, final Object body, final Class<T> responseType) {
    final URI uri = connectionInfo.resolve(path);
    try {
      final String requestBody = objectMapper.writeValueAsString(body);
      final HttpRequest httpRequest = HttpRequest.newBuilder()
          .uri(uri)
          .timeout(requestTimeout)
          .header("Content-Type", "application/json")
          .header("Accept", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(requestBody))
          .build();

      final HttpResponse<String> httpResponse = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      final int status = httpResponse.statusCode();
      if (status < 200 || status >= 300) {
        throw new HandoffAccessorException("HTTP " + status + " from " + uri);
      }
      return objectMapper.readValue(httpResponse.body(), responseType);
    } catch (IOException e) {
      throw new HandoffAccessorException("HTTP request failed: " + uri, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new HandoffAccessorException("HTTP request interrupted: " + uri, e);
    }
  }
}
