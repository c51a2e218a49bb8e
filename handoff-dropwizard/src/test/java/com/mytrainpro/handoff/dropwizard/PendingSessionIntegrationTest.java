package com.mytrainpro.handoff.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mytrainpro.handoff.model.HandoffJson;
import com.mytrainpro.handoff.server.auth.InternalApiKey;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Integration tests for the pending-session endpoints over real HTTP.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class PendingSessionIntegrationTest {

  static final DropwizardAppExtension<HandoffConfiguration> APP =
      new DropwizardAppExtension<>(
          HandoffApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private static final String INTERNAL_KEY = "test-internal-key";

  private final ObjectMapper mapper = HandoffJson.newObjectMapper();
  private HttpClient httpClient;
  private String deviceId;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newHttpClient();
    deviceId = "device-" + UUID.randomUUID();
  }

  private String baseUrl() {
    return "http://localhost:" + APP.getLocalPort();
  }

  private HttpResponse<String> post(String path, String json) throws Exception {
    return postInternal(path, json, null);
  }

  private HttpResponse<String> postInternal(String path, String json, String internalKey) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + path))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(json));
    if (internalKey != null) {
      builder.header(InternalApiKey.HEADER, internalKey);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private String create(String userId) throws Exception {
    HttpResponse<String> response = postInternal("/auth/pending/create",
        "{\"deviceId\":\"" + deviceId + "\",\"userId\":\"" + userId + "\"}", INTERNAL_KEY);
    assertThat(response.statusCode()).as(response.body()).isEqualTo(200);
    return mapper.readTree(response.body()).get("sessionHandle").asText();
  }

  private JsonNode postOk(String path, String json) throws Exception {
    HttpResponse<String> response = post(path, json);
    assertThat(response.statusCode()).as(response.body()).isEqualTo(200);
    return mapper.readTree(response.body());
  }

  @Test
  void createLookupConsume_fullLifecycle() throws Exception {
    HttpResponse<String> createdResponse = postInternal("/auth/pending/create",
        "{\"deviceId\":\"" + deviceId + "\",\"userId\":\"user-1\"}", INTERNAL_KEY);
    assertThat(createdResponse.statusCode()).isEqualTo(200);
    JsonNode created = mapper.readTree(createdResponse.body());
    String handle = created.get("sessionHandle").asText();
    assertThat(created.get("expiresAt").asText()).endsWith("Z");

    JsonNode lookup = postOk("/auth/pending/lookup", "{\"deviceId\":\"" + deviceId + "\"}");
    assertThat(lookup.get("found").asBoolean()).isTrue();
    assertThat(lookup.get("sessionHandle").asText()).isEqualTo(handle);
    assertThat(lookup.get("userId").asText()).isEqualTo("user-1");

    JsonNode consumed = postOk("/auth/pending/consume", "{\"sessionHandle\":\"" + handle + "\"}");
    assertThat(consumed.get("status").asText()).isEqualTo("ok");
    assertThat(consumed.get("appSession").get("userId").asText()).isEqualTo("user-1");
    assertThat(consumed.get("appSession").get("cookieName").asText()).isEqualTo("mtp_session");

    JsonNode again = postOk("/auth/pending/consume", "{\"sessionHandle\":\"" + handle + "\"}");
    assertThat(again.get("status").asText()).isEqualTo("already_consumed");
    assertThat(again.has("appSession")).isFalse();

    JsonNode afterConsume = postOk("/auth/pending/lookup", "{\"deviceId\":\"" + deviceId + "\"}");
    assertThat(afterConsume.get("found").asBoolean()).isFalse();
  }

  @Test
  void lookup_nothingPending_returnsFoundFalse() throws Exception {
    JsonNode lookup = postOk("/auth/pending/lookup", "{\"deviceId\":\"" + deviceId + "\"}");

    assertThat(lookup.get("found").asBoolean()).isFalse();
    assertThat(lookup.has("sessionHandle")).isFalse();
  }

  @Test
  void consume_unknownHandle_returnsNotFoundWith200() throws Exception {
    JsonNode consumed = postOk("/auth/pending/consume", "{\"sessionHandle\":\"forged-handle\"}");

    assertThat(consumed.get("status").asText()).isEqualTo("not_found");
  }

  @Test
  void create_missingUserId_returns400() throws Exception {
    HttpResponse<String> response = postInternal("/auth/pending/create",
        "{\"deviceId\":\"" + deviceId + "\"}", INTERNAL_KEY);

    assertThat(response.statusCode()).isEqualTo(400);
  }

  @Test
  void create_anonymousCaller_rejectedAndNoSessionMinted() throws Exception {
    HttpResponse<String> anonymous = post("/auth/pending/create",
        "{\"deviceId\":\"" + deviceId + "\",\"userId\":\"victim-admin\"}");
    HttpResponse<String> wrongKey = postInternal("/auth/pending/create",
        "{\"deviceId\":\"" + deviceId + "\",\"userId\":\"victim-admin\"}", "guessed-key");

    assertThat(anonymous.statusCode()).isEqualTo(401);
    assertThat(wrongKey.statusCode()).isEqualTo(401);
    assertThat(postOk("/auth/pending/lookup", "{\"deviceId\":\"" + deviceId + "\"}").get("found").asBoolean())
        .isFalse();
  }

  @Test
  void create_secondLogin_supersedesFirstHandle() throws Exception {
    String first = create("user-1");
    String second = create("user-1");

    assertThat(postOk("/auth/pending/consume", "{\"sessionHandle\":\"" + first + "\"}").get("status").asText())
        .isEqualTo("expired");
    assertThat(postOk("/auth/pending/consume", "{\"sessionHandle\":\"" + second + "\"}").get("status").asText())
        .isEqualTo("ok");
  }

  @Test
  void consume_concurrentRequests_exactlyOneOk() throws Exception {
    String handle = create("user-1");
    int callers = 8;
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<String>> futures = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          return postOk("/auth/pending/consume", "{\"sessionHandle\":\"" + handle + "\"}")
              .get("status").asText();
        }));
      }
      start.countDown();

      List<String> statuses = new ArrayList<>();
      for (Future<String> future : futures) {
        statuses.add(future.get(30, TimeUnit.SECONDS));
      }
      assertThat(statuses).containsOnlyOnce("ok");
      assertThat(statuses).filteredOn("already_consumed"::equals).hasSize(callers - 1);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void callbackComplete_validToken_returnsDeepLink() throws Exception {
    JsonNode response = postOk("/auth/callback/complete",
        "{\"deviceId\":\"" + deviceId + "\",\"provider\":\"google\",\"idToken\":\"valid:user-9\"}");

    String handle = response.get("sessionHandle").asText();
    assertThat(response.get("deepLink").asText())
        .isEqualTo("mytrainpro://auth/callback?session=" + handle + "&userId=user-9");
  }

  @Test
  void callbackComplete_rejectedToken_returns401() throws Exception {
    HttpResponse<String> response = post("/auth/callback/complete",
        "{\"deviceId\":\"" + deviceId + "\",\"provider\":\"apple\",\"idToken\":\"forged\"}");

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(postOk("/auth/pending/lookup", "{\"deviceId\":\"" + deviceId + "\"}").get("found").asBoolean())
        .isFalse();
  }

  @Test
  void healthCheck_reportsPendingStore() throws Exception {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create("http://localhost:" + APP.getAdminPort() + "/healthcheck"))
        .GET()
        .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    assertThat(response.body()).contains("pending-session-store");
  }
}
