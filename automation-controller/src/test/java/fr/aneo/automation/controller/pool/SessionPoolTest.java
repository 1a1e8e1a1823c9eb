/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package fr.aneo.automation.controller.pool;

import fr.aneo.automation.controller.testutils.FakeEngine;
import fr.aneo.automation.controller.testutils.FakeEngine.FakeHandle;
import fr.aneo.automation.controller.testutils.FakeTicker;
import fr.aneo.automation.domain.CapacityExceededException;
import fr.aneo.automation.domain.EngineCreationFailedException;
import fr.aneo.automation.domain.SessionId;
import fr.aneo.automation.domain.SessionNotFoundException;
import fr.aneo.automation.domain.engine.InstanceConfig;
import fr.aneo.automation.domain.engine.SessionOptions;
import fr.aneo.automation.domain.seed.SeedRegistry;
import fr.aneo.automation.domain.seed.SessionSeed;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionPoolTest {

  private FakeEngine engine;
  private FakeTicker ticker;
  private SeedRegistry seedRegistry;
  private SessionPool pool;

  @BeforeEach
  void setUp() {
    engine = new FakeEngine();
    ticker = new FakeTicker();
    seedRegistry = new SeedRegistry(new SessionSeed(42L));
  }

  @AfterEach
  void tearDown() {
    if (pool != null) {
      pool.close();
    }
  }

  @Test
  @DisplayName("create should register a new in-use session bound to its reconciled seeds")
  void create_should_register_a_new_in_use_session_bound_to_its_reconciled_seeds() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT, MemoryEstimator.perSession(150));

    // When
    var sessionId = pool.create(SessionOptions.DEFAULT);

    // Then
    assertThat(sessionId.asString()).isEqualTo("ctx_000001");
    var info = pool.describe(sessionId).orElseThrow();
    assertThat(info.inUse()).isTrue();
    assertThat(info.actualIdentity()).isEqualTo(1);
    assertThat(info.identityKey()).isEqualTo("ctx_42_1");
    assertThat(seedRegistry.isReconciled(sessionId)).isTrue();
    assertThat(engine.createdConfigs).singleElement()
                                     .satisfies(config -> {
                                       assertThat(config.sessionId()).isEqualTo(sessionId);
                                       assertThat(config.seeds().identityKey()).isEqualTo("ctx_42_1");
                                     });
  }

  @Test
  @DisplayName("create should rebind seeds when engine assigns a different identity")
  void create_should_rebind_seeds_when_engine_assigns_a_different_identity() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT, MemoryEstimator.perSession(150));
    engine.assignIdentitiesWith(predicted -> predicted + 10);

    // When
    var sessionId = pool.create(SessionOptions.DEFAULT);

    // Then
    var info = pool.describe(sessionId).orElseThrow();
    assertThat(info.predictedIdentity()).isEqualTo(1);
    assertThat(info.actualIdentity()).isEqualTo(11);
    assertThat(info.identityKey()).isEqualTo("ctx_42_11");
    assertThat(seedRegistry.lookup(11)).isPresent();
    assertThat(seedRegistry.lookup(1)).isEmpty();
  }

  @Test
  @DisplayName("create should destroy the new instance when its identity is held by another session")
  void create_should_destroy_the_new_instance_when_its_identity_is_held_by_another_session() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT, MemoryEstimator.perSession(150));
    engine.assignIdentitiesWith(predicted -> 7);
    var first = pool.create(SessionOptions.DEFAULT);

    // When/Then
    assertThatThrownBy(() -> pool.create(SessionOptions.DEFAULT))
      .isInstanceOf(EngineCreationFailedException.class)
      .hasMessageContaining("already claimed");
    assertThat(engine.destroyedHandles).hasSize(1);
    assertThat(pool.listSessions()).extracting(SessionInfo::sessionId).containsExactly(first);
    assertThat(pool.stats().pendingCreations()).isZero();
    assertThat(seedRegistry.size()).isEqualTo(1);
  }

  @Test
  @DisplayName("create should release its reservation when the engine fails")
  void create_should_release_its_reservation_when_the_engine_fails() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT.withMaxSessions(1), MemoryEstimator.perSession(150));
    engine.failNextCreation(new RuntimeException("engine crashed"));

    // When
    assertThatThrownBy(() -> pool.create(SessionOptions.DEFAULT))
      .isInstanceOf(EngineCreationFailedException.class)
      .hasMessageContaining("engine crashed");

    // Then
    assertThat(pool.size()).isZero();
    assertThat(pool.stats().pendingCreations()).isZero();
    assertThat(seedRegistry.size()).isZero();
    assertThat(pool.create(SessionOptions.DEFAULT)).isNotNull();
  }

  @Test
  @DisplayName("create should fail with capacity exceeded when full of in-use sessions")
  void create_should_fail_with_capacity_exceeded_when_full_of_in_use_sessions() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT.withMaxSessions(2), MemoryEstimator.perSession(150));
    pool.create(SessionOptions.DEFAULT);
    pool.create(SessionOptions.DEFAULT);

    // When/Then
    assertThatThrownBy(() -> pool.create(SessionOptions.DEFAULT))
      .isInstanceOf(CapacityExceededException.class);
    assertThat(pool.size()).isEqualTo(2);
    assertThat(engine.destroyedHandles).isEmpty();
  }

  @Test
  @DisplayName("create should evict the oldest idle session when full")
  void create_should_evict_the_oldest_idle_session_when_full() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT.withMaxSessions(2), MemoryEstimator.perSession(150));
    var first = pool.create(SessionOptions.DEFAULT);
    var second = pool.create(SessionOptions.DEFAULT);
    pool.release(first);
    ticker.advance(Duration.ofSeconds(1));
    pool.release(second);

    // When
    var third = pool.create(SessionOptions.DEFAULT);

    // Then
    assertThat(pool.listSessions()).extracting(SessionInfo::sessionId).containsExactly(second, third);
    assertThat(engine.destroyedHandles).containsExactly(new FakeHandle(1));
  }

  @Test
  @DisplayName("create should admit a session again once a full pool is released and closed")
  void create_should_admit_a_session_again_once_a_full_pool_is_released_and_closed() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT.withMaxSessions(1), MemoryEstimator.perSession(150));
    var first = pool.create(SessionOptions.DEFAULT);

    // When
    assertThatThrownBy(() -> pool.create(SessionOptions.DEFAULT)).isInstanceOf(CapacityExceededException.class);
    pool.release(first);
    pool.close(first);
    var second = pool.create(SessionOptions.DEFAULT);

    // Then
    assertThat(second).isNotEqualTo(first);
    assertThat(pool.size()).isEqualTo(1);
    assertThat(engine.destroyedHandles).hasSize(1);
  }

  @Test
  @Timeout(10)
  @DisplayName("concurrent creations should never exceed the session limit")
  void concurrent_creations_should_never_exceed_the_session_limit() throws Exception {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT.withMaxSessions(5), MemoryEstimator.perSession(150));
    var executor = Executors.newFixedThreadPool(8);
    var start = new CountDownLatch(1);
    var created = new AtomicInteger();
    var rejected = new AtomicInteger();

    try {
      // When
      List<Future<?>> futures = new ArrayList<>();
      IntStream.range(0, 20).forEach(i -> futures.add(executor.submit(() -> {
        start.await();
        try {
          pool.create(SessionOptions.DEFAULT);
          created.incrementAndGet();
        } catch (CapacityExceededException e) {
          rejected.incrementAndGet();
        }
        return null;
      })));
      start.countDown();
      for (var future : futures) {
        future.get(5, SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    // Then
    assertThat(created.get()).isEqualTo(5);
    assertThat(rejected.get()).isEqualTo(15);
    assertThat(pool.size()).isEqualTo(5);
    assertThat(engine.createdConfigs).hasSize(5);
  }

  @Test
  @DisplayName("acquire should hand out an idle session and mark it in use")
  void acquire_should_hand_out_an_idle_session_and_mark_it_in_use() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT, MemoryEstimator.perSession(150));
    pool.create(SessionOptions.DEFAULT);
    var idle = pool.create(SessionOptions.DEFAULT);
    pool.release(idle);

    // When
    var acquired = pool.acquire();

    // Then
    assertThat(acquired).contains(idle);
    assertThat(pool.describe(idle).orElseThrow().inUse()).isTrue();
    assertThat(pool.acquire()).isEmpty();
  }

  @Test
  @DisplayName("release should ignore unknown sessions")
  void release_should_ignore_unknown_sessions() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT, MemoryEstimator.perSession(150));

    // When
    pool.release(SessionId.from("ctx_999999"));

    // Then
    assertThat(pool.size()).isZero();
  }

  @Test
  @DisplayName("close should fail for unknown sessions")
  void close_should_fail_for_unknown_sessions() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT, MemoryEstimator.perSession(150));

    // When/Then
    assertThatThrownBy(() -> pool.close(SessionId.from("ctx_999999")))
      .isInstanceOf(SessionNotFoundException.class);
  }

  @Test
  @DisplayName("get handle should return the engine handle and refresh last use")
  void get_handle_should_return_the_engine_handle_and_refresh_last_use() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT, MemoryEstimator.perSession(150));
    var sessionId = pool.create(SessionOptions.DEFAULT);
    ticker.advance(Duration.ofSeconds(30));

    // When
    var handle = pool.getHandle(sessionId);

    // Then
    assertThat(handle).contains(new FakeHandle(1));
    assertThat(pool.describe(sessionId).orElseThrow().idleFor()).isZero();
    assertThat(pool.getHandle(SessionId.from("ctx_999999"))).isEmpty();
  }

  @Test
  @Timeout(10)
  @DisplayName("close should defer the teardown until in-flight operations have ended")
  void close_should_defer_the_teardown_until_in_flight_operations_have_ended() throws Exception {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT.withCloseDrain(200, Duration.ofMillis(10)), MemoryEstimator.perSession(150));
    var sessionId = pool.create(SessionOptions.DEFAULT);
    var completed = new AtomicInteger();
    var completedAtDestroy = new AtomicInteger(-1);
    engine.onDestroy(handle -> completedAtDestroy.set(completed.get()));

    var executor = Executors.newFixedThreadPool(5);
    try {
      for (int i = 0; i < 5; i++) {
        var scope = pool.beginOperation(sessionId);
        executor.submit(() -> {
          try {
            Thread.sleep(200);
            completed.incrementAndGet();
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          } finally {
            scope.close();
          }
        });
      }

      // When
      pool.close(sessionId);

      // Then
      assertThat(pool.contains(sessionId)).isFalse();
      assertThat(pool.pendingTeardownCount()).isEqualTo(1);
      assertThat(engine.destroyedHandles).isEmpty();
      while (pool.finishPendingTeardowns() == 0) {
        Thread.sleep(10);
      }
    } finally {
      executor.shutdown();
      executor.awaitTermination(5, SECONDS);
    }

    assertThat(completedAtDestroy.get()).isEqualTo(5);
    assertThat(pool.pendingTeardownCount()).isZero();
    assertThat(engine.destroyedHandles).containsExactly(new FakeHandle(1));
    assertThat(pool.contains(sessionId)).isFalse();
    assertThat(seedRegistry.bundleOf(sessionId)).isEmpty();
  }

  @Test
  @Timeout(5)
  @DisplayName("close should destroy the instance once the drain budget is exhausted")
  void close_should_destroy_the_instance_once_the_drain_budget_is_exhausted() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT.withCloseDrain(3, Duration.ofMillis(5)), MemoryEstimator.perSession(150));
    var sessionId = pool.create(SessionOptions.DEFAULT);
    var stuck = pool.beginOperation(sessionId);

    // When
    pool.close(sessionId);
    int destroyedWithinBudget = pool.finishPendingTeardowns();
    ticker.advance(Duration.ofMillis(15));
    int destroyedAfterBudget = pool.finishPendingTeardowns();

    // Then
    assertThat(destroyedWithinBudget).isZero();
    assertThat(destroyedAfterBudget).isEqualTo(1);
    assertThat(engine.destroyedHandles).hasSize(1);
    assertThatThrownBy(stuck::handle).isInstanceOf(SessionNotFoundException.class);
    stuck.close();
  }

  @Test
  @DisplayName("close of the pool should destroy sessions whose teardown was deferred")
  void close_of_the_pool_should_destroy_sessions_whose_teardown_was_deferred() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT.withCloseDrain(2, Duration.ofMillis(5)), MemoryEstimator.perSession(150));
    var sessionId = pool.create(SessionOptions.DEFAULT);
    var stuck = pool.beginOperation(sessionId);
    pool.close(sessionId);

    // When
    pool.close();

    // Then
    assertThat(engine.destroyedHandles).containsExactly(new FakeHandle(1));
    assertThat(pool.pendingTeardownCount()).isZero();
    assertThat(seedRegistry.size()).isZero();
    stuck.close();
  }

  @Test
  @DisplayName("prewarm should create idle sessions up to the free capacity")
  void prewarm_should_create_idle_sessions_up_to_the_free_capacity() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT.withMaxSessions(3), MemoryEstimator.perSession(150));
    pool.create(SessionOptions.DEFAULT);

    // When
    int created = pool.prewarm(5, SessionOptions.DEFAULT);

    // Then
    assertThat(created).isEqualTo(2);
    assertThat(pool.size()).isEqualTo(3);
    assertThat(pool.stats().idleSessions()).isEqualTo(2);
    assertThat(engine.destroyedHandles).isEmpty();
  }

  @Test
  @DisplayName("create should hand out a pre-warmed session before creating an instance")
  void create_should_hand_out_a_pre_warmed_session_before_creating_an_instance() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT.withMaxSessions(2), MemoryEstimator.perSession(150));
    pool.prewarm(2, SessionOptions.DEFAULT);

    // When
    var first = pool.create(SessionOptions.DEFAULT);
    var second = pool.create(SessionOptions.DEFAULT);

    // Then
    assertThat(first).isEqualTo(SessionId.from("ctx_000001"));
    assertThat(second).isEqualTo(SessionId.from("ctx_000002"));
    assertThat(engine.createdConfigs).hasSize(2);
    assertThat(pool.stats().inUseSessions()).isEqualTo(2);
    assertThatThrownBy(() -> pool.create(SessionOptions.DEFAULT)).isInstanceOf(CapacityExceededException.class);
  }

  @Test
  @DisplayName("create should not hand out a pre-warmed session created with other options")
  void create_should_not_hand_out_a_pre_warmed_session_created_with_other_options() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT, MemoryEstimator.perSession(150));
    pool.prewarm(1, SessionOptions.DEFAULT);
    var linux = new SessionOptions(true, "linux", null);

    // When
    var sessionId = pool.create(linux);

    // Then
    assertThat(sessionId).isEqualTo(SessionId.from("ctx_000002"));
    assertThat(engine.createdConfigs).extracting(InstanceConfig::options).containsExactly(SessionOptions.DEFAULT, linux);
    assertThat(pool.stats().idleSessions()).isEqualTo(1);
  }

  @Test
  @DisplayName("acquired pre-warmed sessions should no longer be handed out by create")
  void acquired_pre_warmed_sessions_should_no_longer_be_handed_out_by_create() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT, MemoryEstimator.perSession(150));
    pool.prewarm(1, SessionOptions.DEFAULT);
    var acquired = pool.acquire().orElseThrow();
    pool.release(acquired);

    // When
    var created = pool.create(SessionOptions.DEFAULT);

    // Then
    assertThat(created).isNotEqualTo(acquired);
    assertThat(engine.createdConfigs).hasSize(2);
  }

  @Test
  @DisplayName("prewarm should stop at the first engine failure and reject negative counts")
  void prewarm_should_stop_at_the_first_engine_failure_and_reject_negative_counts() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT, MemoryEstimator.perSession(150));
    engine.failNextCreation(new IllegalStateException("gpu unavailable"));

    // When
    int created = pool.prewarm(3, SessionOptions.DEFAULT);

    // Then
    assertThat(created).isZero();
    assertThat(pool.stats().pendingCreations()).isZero();
    assertThat(pool.prewarm(1, SessionOptions.DEFAULT)).isEqualTo(1);
    assertThatThrownBy(() -> pool.prewarm(-1, SessionOptions.DEFAULT)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("describe should report a single session and nothing for unknown ones")
  void describe_should_report_a_single_session_and_nothing_for_unknown_ones() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT, MemoryEstimator.perSession(150));
    var sessionId = pool.create(SessionOptions.DEFAULT);
    ticker.advance(Duration.ofSeconds(2));

    // When
    var info = pool.describe(sessionId);

    // Then
    assertThat(info).hasValueSatisfying(session -> {
      assertThat(session.sessionId()).isEqualTo(sessionId);
      assertThat(session.inUse()).isTrue();
      assertThat(session.age()).isEqualTo(Duration.ofSeconds(2));
    });
    assertThat(pool.describe(SessionId.from("ctx_999999"))).isEmpty();
  }

  @Test
  @DisplayName("begin operation should fail once the session is closed")
  void begin_operation_should_fail_once_the_session_is_closed() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT, MemoryEstimator.perSession(150));
    var sessionId = pool.create(SessionOptions.DEFAULT);
    pool.close(sessionId);

    // When/Then
    assertThatThrownBy(() -> pool.beginOperation(sessionId)).isInstanceOf(SessionNotFoundException.class);
  }

  @Test
  @DisplayName("cleanup under high pressure should evict forty percent of idle sessions oldest first")
  void cleanup_under_high_pressure_should_evict_forty_percent_of_idle_sessions_oldest_first() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT.withMaxSessions(100).withMaxMemoryMb(1000), live -> 950);
    var ids = createSessions(12);
    for (int i = 0; i < 10; i++) {
      ticker.advance(Duration.ofSeconds(1));
      pool.release(ids.get(i));
    }

    // When
    int evicted = pool.cleanupUnderPressure();

    // Then
    assertThat(evicted).isEqualTo(4);
    assertThat(engine.destroyedHandles).containsExactly(new FakeHandle(1), new FakeHandle(2), new FakeHandle(3), new FakeHandle(4));
    assertThat(pool.listSessions()).extracting(SessionInfo::sessionId).containsExactlyElementsOf(ids.subList(4, 12));
    assertThat(pool.contains(ids.get(10))).isTrue();
    assertThat(pool.contains(ids.get(11))).isTrue();
  }

  @Test
  @DisplayName("cleanup under critical pressure should never evict in-use sessions")
  void cleanup_under_critical_pressure_should_never_evict_in_use_sessions() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT.withMaxMemoryMb(1000), live -> 1200);
    createSessions(3);

    // When
    int evicted = pool.cleanupUnderPressure();

    // Then
    assertThat(evicted).isZero();
    assertThat(pool.size()).isEqualTo(3);
  }

  @Test
  @DisplayName("cleanup should skip idle sessions with in-flight operations")
  void cleanup_should_skip_idle_sessions_with_in_flight_operations() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT.withMaxMemoryMb(1000), live -> 950);
    var ids = createSessions(5);
    for (var id : ids) {
      ticker.advance(Duration.ofSeconds(1));
      pool.release(id);
    }

    try (var ignored = pool.beginOperation(ids.get(0))) {
      // When
      int evicted = pool.cleanupUnderPressure();

      // Then
      assertThat(evicted).isEqualTo(2);
      assertThat(pool.contains(ids.get(0))).isTrue();
      assertThat(pool.contains(ids.get(1))).isFalse();
      assertThat(pool.contains(ids.get(2))).isFalse();
    }
  }

  @Test
  @DisplayName("cleanup under moderate pressure should evict at least one idle session")
  void cleanup_under_moderate_pressure_should_evict_at_least_one_idle_session() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT.withMaxMemoryMb(1000), live -> 800);
    var ids = createSessions(2);
    ids.forEach(pool::release);

    // When
    int evicted = pool.cleanupUnderPressure();

    // Then
    assertThat(evicted).isEqualTo(1);
    assertThat(pool.size()).isEqualTo(1);
  }

  @Test
  @DisplayName("cleanup under low pressure should only evict sessions idle beyond the timeout")
  void cleanup_under_low_pressure_should_only_evict_sessions_idle_beyond_the_timeout() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT.withMaxMemoryMb(1000).withIdleTimeout(Duration.ofSeconds(60)), live -> 500);
    var ids = createSessions(4);
    pool.release(ids.get(0));
    pool.release(ids.get(1));
    ticker.advance(Duration.ofSeconds(61));
    pool.release(ids.get(2));

    // When
    int evicted = pool.cleanupUnderPressure();

    // Then
    assertThat(evicted).isEqualTo(2);
    assertThat(pool.listSessions()).extracting(SessionInfo::sessionId).containsExactly(ids.get(2), ids.get(3));
  }

  @Test
  @DisplayName("create should run a pressure cleanup when admission would exceed the memory limit")
  void create_should_run_a_pressure_cleanup_when_admission_would_exceed_the_memory_limit() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT.withMaxMemoryMb(250), MemoryEstimator.perSession(100));
    var first = pool.create(SessionOptions.DEFAULT);
    var second = pool.create(SessionOptions.DEFAULT);
    pool.release(first);
    ticker.advance(Duration.ofSeconds(1));
    pool.release(second);

    // When
    var third = pool.create(SessionOptions.DEFAULT);

    // Then
    assertThat(pool.listSessions()).extracting(SessionInfo::sessionId).containsExactly(second, third);
    assertThat(engine.destroyedHandles).containsExactly(new FakeHandle(1));
  }

  @Test
  @DisplayName("stats should report session counts and memory pressure")
  void stats_should_report_session_counts_and_memory_pressure() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT.withMaxMemoryMb(600), MemoryEstimator.perSession(150));
    var ids = createSessions(3);
    pool.release(ids.get(0));

    // When
    var stats = pool.stats();

    // Then
    assertThat(stats.liveSessions()).isEqualTo(3);
    assertThat(stats.idleSessions()).isEqualTo(1);
    assertThat(stats.inUseSessions()).isEqualTo(2);
    assertThat(stats.estimatedMemoryMb()).isEqualTo(450);
    assertThat(stats.pressureRatio()).isEqualTo(0.75);
    assertThat(stats.pressureLevel()).isEqualTo(PressureLevel.MODERATE);
    assertThat(stats.maxMemoryMb()).isEqualTo(600);
  }

  @Test
  @DisplayName("set max sessions should only affect new admissions")
  void set_max_sessions_should_only_affect_new_admissions() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT, MemoryEstimator.perSession(150));
    createSessions(3);

    // When
    pool.setMaxSessions(2);

    // Then
    assertThat(pool.size()).isEqualTo(3);
    assertThat(pool.config().maxSessions()).isEqualTo(2);
    assertThatThrownBy(() -> pool.create(SessionOptions.DEFAULT)).isInstanceOf(CapacityExceededException.class);
    assertThatThrownBy(() -> pool.setMaxSessions(0)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("close should destroy every session and refuse later creations")
  void close_should_destroy_every_session_and_refuse_later_creations() {
    // Given
    pool = newPool(SessionPoolConfig.DEFAULT, MemoryEstimator.perSession(150));
    createSessions(2);

    // When
    pool.close();
    pool.close();

    // Then
    assertThat(engine.destroyedHandles).hasSize(2);
    assertThat(seedRegistry.size()).isZero();
    assertThatThrownBy(() -> pool.create(SessionOptions.DEFAULT))
      .isInstanceOf(IllegalStateException.class)
      .hasMessage("Session pool has been closed");
  }

  private SessionPool newPool(SessionPoolConfig config, MemoryEstimator estimator) {
    return new SessionPool(engine, seedRegistry, config, estimator, ticker);
  }

  private List<SessionId> createSessions(int count) {
    var ids = new ArrayList<SessionId>();
    for (int i = 0; i < count; i++) {
      ids.add(pool.create(SessionOptions.DEFAULT));
    }
    return ids;
  }
}
