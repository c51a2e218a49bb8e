package com.mytrainpro.handoff.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mytrainpro.handoff.client.accessor.HandoffAccessor;
import com.mytrainpro.handoff.client.config.ReconciliationConfig;
import com.mytrainpro.handoff.client.deeplink.DeepLinkReceiver;
import com.mytrainpro.handoff.client.deeplink.HandoffTrigger;
import com.mytrainpro.handoff.client.guard.IdempotencyGuard;
import com.mytrainpro.handoff.client.manager.HandoffEvent;
import com.mytrainpro.handoff.client.manager.HandoffManager;
import com.mytrainpro.handoff.client.manager.HandoffState;
import com.mytrainpro.handoff.client.model.ServerConnectionInfo;
import com.mytrainpro.handoff.client.poller.ReconciliationPoller;
import com.mytrainpro.handoff.client.poller.Sleeper;
import com.mytrainpro.handoff.client.storage.DeviceIdProvider;
import com.mytrainpro.handoff.client.storage.InMemoryKeyValueStore;
import com.mytrainpro.handoff.model.HandoffJson;
import com.mytrainpro.handoff.model.pending.AppSession;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Drives the app-side handoff client against a running server: OAuth callback in the "browser",
 * then deep link and foreground reconciliation in the "app".
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class HandoffFlowIntegrationTest {

  static final DropwizardAppExtension<HandoffConfiguration> APP =
      new DropwizardAppExtension<>(
          HandoffApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private final ObjectMapper mapper = HandoffJson.newObjectMapper();
  private final Sleeper noWait = d -> { };

  private HttpClient httpClient;
  private InMemoryKeyValueStore appStorage;
  private List<AppSession> restored;
  private List<HandoffEvent> events;
  private HandoffManager manager;
  private String deviceId;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newHttpClient();
    appStorage = new InMemoryKeyValueStore();
    restored = new CopyOnWriteArrayList<>();
    events = new CopyOnWriteArrayList<>();
    manager = newAppProcess();
    deviceId = new DeviceIdProvider(appStorage).deviceId();
  }

  private HandoffManager newAppProcess() {
    ReconciliationConfig config = ReconciliationConfig.defaults();
    HandoffAccessor accessor = new HandoffAccessor(config, httpClient, mapper,
        new ServerConnectionInfo(URI.create(baseUrl())));
    ReconciliationPoller poller = new ReconciliationPoller(config, accessor, Runnable::run, noWait);
    HandoffManager created = new HandoffManager(config, accessor, new DeepLinkReceiver(config),
        new IdempotencyGuard(appStorage), poller, new DeviceIdProvider(appStorage), restored::add, noWait);
    created.addListener(events::add);
    return created;
  }

  private String baseUrl() {
    return "http://localhost:" + APP.getLocalPort();
  }

  private String browserCompletesLogin(String userId) throws Exception {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/auth/callback/complete"))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString("{\"deviceId\":\"" + deviceId
            + "\",\"provider\":\"google\",\"idToken\":\"valid:" + userId + "\"}"))
        .build();
    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    assertThat(response.statusCode()).isEqualTo(200);
    return mapper.readTree(response.body()).get("deepLink").asText();
  }

  private HttpResponse<String> callWithToken(String method, String path, String token) throws Exception {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + path))
        .header("Authorization", "Bearer " + token)
        .method(method, HttpRequest.BodyPublishers.noBody())
        .build();
    return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
  }

  private List<HandoffState> states() {
    List<HandoffState> states = new ArrayList<>();
    events.forEach(e -> states.add(e.state()));
    return states;
  }

  @Test
  void deepLink_signsAppIn() throws Exception {
    String deepLink = browserCompletesLogin("user-1");

    manager.onLaunchUrl(deepLink);

    assertThat(states()).containsExactly(HandoffState.HANDOFF_PENDING, HandoffState.HANDOFF_COMPLETE);
    assertThat(restored).hasSize(1);
    HttpResponse<String> whoAmI = callWithToken("GET", "/api/whoami", restored.get(0).token());
    assertThat(whoAmI.statusCode()).isEqualTo(200);
    assertThat(whoAmI.body()).contains("user-1");
  }

  @Test
  void lostDeepLink_foregroundReconciliationSignsAppIn() throws Exception {
    browserCompletesLogin("user-2");

    manager.onForeground();

    assertThat(states()).containsExactly(HandoffState.HANDOFF_PENDING, HandoffState.HANDOFF_COMPLETE);
    assertThat(events.get(1).trigger()).isEqualTo(HandoffTrigger.RECONCILIATION);
    assertThat(restored).extracting(AppSession::userId).containsExactly("user-2");
  }

  @Test
  void deepLinkAndForegroundBothFire_appAuthenticatesExactlyOnce() throws Exception {
    String deepLink = browserCompletesLogin("user-3");

    manager.onLaunchUrl(deepLink);
    manager.onForeground();
    manager.onLaunchUrl(deepLink);

    assertThat(restored).hasSize(1);
    assertThat(states()).containsOnlyOnce(HandoffState.HANDOFF_COMPLETE);
  }

  @Test
  void twoAppProcessesRace_secondSeesAlreadyConsumed() throws Exception {
    String deepLink = browserCompletesLogin("user-4");
    // a second process with its own storage does not share the guard
    InMemoryKeyValueStore otherStorage = new InMemoryKeyValueStore();
    List<HandoffEvent> otherEvents = new ArrayList<>();
    ReconciliationConfig config = ReconciliationConfig.defaults();
    HandoffAccessor accessor = new HandoffAccessor(config, httpClient, mapper,
        new ServerConnectionInfo(URI.create(baseUrl())));
    HandoffManager other = new HandoffManager(config, accessor, new DeepLinkReceiver(config),
        new IdempotencyGuard(otherStorage),
        new ReconciliationPoller(config, accessor, Runnable::run, noWait),
        new DeviceIdProvider(otherStorage), restored::add, noWait);
    other.addListener(otherEvents::add);

    manager.onLaunchUrl(deepLink);
    other.onLaunchUrl(deepLink);

    assertThat(restored).hasSize(1);
    assertThat(otherEvents).extracting(HandoffEvent::state)
        .containsExactly(HandoffState.HANDOFF_PENDING, HandoffState.HANDOFF_NOOP);
  }

  @Test
  void killedMidConsume_stickyLinkBlocked_newLoginRecovers() throws Exception {
    String firstLink = browserCompletesLogin("user-5");
    String firstHandle = firstLink.substring(firstLink.indexOf("session=") + 8, firstLink.indexOf('&'));
    // the previous process marked the handle and died before the response
    new IdempotencyGuard(appStorage).markProcessing(firstHandle);
    HandoffManager relaunched = newAppProcess();

    relaunched.onLaunchUrl(firstLink);
    assertThat(restored).isEmpty();

    String secondLink = browserCompletesLogin("user-5");
    relaunched.onLaunchUrl(secondLink);

    assertThat(restored).extracting(AppSession::userId).containsExactly("user-5");
  }

  @Test
  void logout_revokesSession() throws Exception {
    manager.onLaunchUrl(browserCompletesLogin("user-6"));
    String token = restored.get(0).token();

    assertThat(callWithToken("GET", "/auth/session", token).body()).contains("user-6");
    assertThat(callWithToken("POST", "/auth/session/logout", token).statusCode()).isEqualTo(204);
    manager.logout();

    assertThat(callWithToken("GET", "/api/whoami", token).statusCode()).isEqualTo(401);
  }
}
