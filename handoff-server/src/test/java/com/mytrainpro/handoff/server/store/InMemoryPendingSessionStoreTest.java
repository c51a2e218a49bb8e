package com.mytrainpro.handoff.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mytrainpro.handoff.server.store.ConsumeResult.Outcome;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryPendingSessionStoreTest {

  private static final Duration TTL = Duration.ofMinutes(5);
  private static final Instant START = Instant.parse("2026-01-01T10:00:00Z");

  private MutableClock clock;
  private InMemoryPendingSessionStore store;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    store = new InMemoryPendingSessionStore(clock, TTL, 100, new SecureRandom());
  }

  @Test
  void create_thenLookup_returnsLiveRecord() {
    PendingSession created = store.create("device-1", "user-1");

    assertThat(created.expiresAt()).isEqualTo(START.plus(TTL));
    assertThat(created.consumedAt()).isNull();
    assertThat(store.lookup("device-1"))
        .hasValueSatisfying(s -> {
          assertThat(s.sessionHandle()).isEqualTo(created.sessionHandle());
          assertThat(s.userId()).isEqualTo("user-1");
        });
  }

  @Test
  void create_handlesAreUrlSafeAndDistinct() {
    String first = store.create("device-1", "user-1").sessionHandle();
    String second = store.create("device-2", "user-1").sessionHandle();

    assertThat(first).isNotEqualTo(second);
    assertThat(first).matches("[A-Za-z0-9_-]{43}");
  }

  @Test
  void lookup_unknownDevice_returnsEmpty() {
    assertThat(store.lookup("nobody")).isEmpty();
  }

  @Test
  void consume_liveRecord_succeedsOnce() {
    PendingSession created = store.create("device-1", "user-1");

    ConsumeResult first = store.consume(created.sessionHandle());
    ConsumeResult second = store.consume(created.sessionHandle());

    assertThat(first.outcome()).isEqualTo(Outcome.CONSUMED);
    assertThat(first.session().consumedAt()).isEqualTo(START);
    assertThat(second.outcome()).isEqualTo(Outcome.ALREADY_CONSUMED);
    assertThat(second.session().consumedAt()).isEqualTo(START);
  }

  @Test
  void consume_makesRecordInvisibleToLookup() {
    PendingSession created = store.create("device-1", "user-1");
    store.consume(created.sessionHandle());

    assertThat(store.lookup("device-1")).isEmpty();
  }

  @Test
  void consume_unknownHandle_returnsNotFound() {
    ConsumeResult result = store.consume("never-issued");

    assertThat(result.outcome()).isEqualTo(Outcome.NOT_FOUND);
    assertThat(result.session()).isNull();
  }

  @Test
  void create_supersedesEarlierLiveRecord() {
    PendingSession older = store.create("device-1", "user-1");
    clock.advance(Duration.ofSeconds(10));
    PendingSession newer = store.create("device-1", "user-1");

    assertThat(store.lookup("device-1"))
        .map(PendingSession::sessionHandle)
        .contains(newer.sessionHandle());
    assertThat(store.consume(older.sessionHandle()).outcome()).isEqualTo(Outcome.EXPIRED);
    assertThat(store.consume(newer.sessionHandle()).outcome()).isEqualTo(Outcome.CONSUMED);
  }

  @Test
  void create_doesNotTouchOtherDevices() {
    PendingSession other = store.create("device-2", "user-2");
    store.create("device-1", "user-1");

    assertThat(store.lookup("device-2")).isPresent();
    assertThat(store.consume(other.sessionHandle()).outcome()).isEqualTo(Outcome.CONSUMED);
  }

  @Test
  void ttl_expiresRecordForLookupAndConsume() {
    PendingSession created = store.create("device-1", "user-1");

    clock.advance(TTL.minusSeconds(1));
    assertThat(store.lookup("device-1")).isPresent();

    clock.advance(Duration.ofSeconds(1));
    assertThat(store.lookup("device-1")).isEmpty();
    assertThat(store.consume(created.sessionHandle()).outcome()).isEqualTo(Outcome.EXPIRED);
  }

  @Test
  void consume_alreadyConsumedWinsOverExpired() {
    PendingSession created = store.create("device-1", "user-1");
    store.consume(created.sessionHandle());
    clock.advance(TTL.plusMinutes(1));

    assertThat(store.consume(created.sessionHandle()).outcome()).isEqualTo(Outcome.ALREADY_CONSUMED);
  }

  @Test
  void consume_concurrentCallers_exactlyOneWins() throws Exception {
    PendingSession created = store.create("device-1", "user-1");
    int callers = 32;
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<ConsumeResult>> futures = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          return store.consume(created.sessionHandle());
        }));
      }
      start.countDown();

      int consumed = 0;
      int alreadyConsumed = 0;
      for (Future<ConsumeResult> future : futures) {
        Outcome outcome = future.get(10, TimeUnit.SECONDS).outcome();
        if (outcome == Outcome.CONSUMED) {
          consumed++;
        } else if (outcome == Outcome.ALREADY_CONSUMED) {
          alreadyConsumed++;
        }
      }
      assertThat(consumed).isEqualTo(1);
      assertThat(alreadyConsumed).isEqualTo(callers - 1);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void create_concurrentForOneDevice_leavesExactlyOneLiveRecord() throws Exception {
    int callers = 16;
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<PendingSession>> futures = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          return store.create("device-1", "user-1");
        }));
      }
      start.countDown();

      int live = 0;
      for (Future<PendingSession> future : futures) {
        String handle = future.get(10, TimeUnit.SECONDS).sessionHandle();
        if (store.consume(handle).outcome() == Outcome.CONSUMED) {
          live++;
        }
      }
      assertThat(live).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void purgeExpired_removesOnlyRecordsBeforeCutoff() {
    PendingSession consumed = store.create("device-1", "user-1");
    store.consume(consumed.sessionHandle());
    clock.advance(Duration.ofMinutes(1));
    store.create("device-2", "user-2");

    // device-1 record expires at START+5m, device-2 at START+6m
    int removed = store.purgeExpired(START.plus(TTL).plusSeconds(30));

    assertThat(removed).isEqualTo(1);
    assertThat(store.size()).isEqualTo(1);
    assertThat(store.consume(consumed.sessionHandle()).outcome()).isEqualTo(Outcome.NOT_FOUND);
    assertThat(store.lookup("device-2")).isPresent();
  }

  @Test
  void purgeExpired_retainsConsumedRecordsWithinWindow() {
    PendingSession created = store.create("device-1", "user-1");
    store.consume(created.sessionHandle());

    assertThat(store.purgeExpired(START)).isZero();
    assertThat(store.consume(created.sessionHandle()).outcome()).isEqualTo(Outcome.ALREADY_CONSUMED);
  }

  @Test
  void create_atCapacity_throwsIllegalState() {
    InMemoryPendingSessionStore small =
        new InMemoryPendingSessionStore(clock, TTL, 2, new SecureRandom());
    small.create("device-1", "user-1");
    small.create("device-2", "user-2");

    assertThatThrownBy(() -> small.create("device-3", "user-3"))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void create_concurrentAtCapacity_neverOvershootsCap() throws Exception {
    int cap = 5;
    int callers = 32;
    InMemoryPendingSessionStore small =
        new InMemoryPendingSessionStore(clock, TTL, cap, new SecureRandom());
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Boolean>> futures = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        String device = "device-" + i;
        futures.add(pool.submit(() -> {
          start.await();
          try {
            small.create(device, "user");
            return true;
          } catch (IllegalStateException e) {
            return false;
          }
        }));
      }
      start.countDown();

      int created = 0;
      for (Future<Boolean> future : futures) {
        if (future.get(10, TimeUnit.SECONDS)) {
          created++;
        }
      }
      assertThat(created).isEqualTo(cap);
      assertThat(small.size()).isEqualTo(cap);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void purgeExpired_freesCapacity() {
    InMemoryPendingSessionStore small =
        new InMemoryPendingSessionStore(clock, TTL, 1, new SecureRandom());
    small.create("device-1", "user-1");
    clock.advance(TTL.plusSeconds(1));

    assertThat(small.purgeExpired(clock.instant())).isEqualTo(1);
    assertThat(small.create("device-2", "user-2").userId()).isEqualTo("user-2");
  }

  @Test
  void constructor_nonPositiveTtl_throws() {
    assertThatThrownBy(() -> new InMemoryPendingSessionStore(Duration.ZERO, 10))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
