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

import fr.aneo.automation.domain.SessionId;
import fr.aneo.automation.domain.engine.EngineHandle;
import fr.aneo.automation.domain.engine.SessionOptions;
import fr.aneo.automation.domain.seed.SeedBundle;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.Objects.requireNonNull;

/**
 * One pooled session: an engine instance plus the bookkeeping the pool needs to share and
 * reclaim it.
 * <p>
 * The engine handle is owned by the session and leaves it exactly once, through
 * {@link #takeHandle()}. After that call the session no longer references the instance, so a
 * second teardown attempt finds nothing to destroy.
 * </p>
 * <p>
 * A session created idle by pre-warming stays flagged as pre-warmed until it is first handed
 * out, by {@link #tryClaimPrewarmed()} or {@link #tryMarkInUse()}.
 * </p>
 * <p>
 * Timestamps are monotonic nanosecond readings of the pool's ticker.
 * </p>
 */
final class Session {
  private final SessionId id;
  private final int predictedIdentity;
  private final int actualIdentity;
  private final long createdAtNanos;
  private final SeedBundle fingerprint;
  private final SessionOptions options;
  private final AtomicReference<EngineHandle> engineHandle;
  private final AtomicBoolean inUse;
  private final AtomicBoolean prewarmed;
  private final AtomicLong lastUsedNanos;
  private final AtomicInteger activeOperations;

  Session(SessionId id, int predictedIdentity, int actualIdentity, long createdAtNanos, SeedBundle fingerprint, EngineHandle engineHandle,
          SessionOptions options, boolean inUse) {
    this.id = requireNonNull(id, "id must not be null");
    this.predictedIdentity = predictedIdentity;
    this.actualIdentity = actualIdentity;
    this.createdAtNanos = createdAtNanos;
    this.fingerprint = requireNonNull(fingerprint, "fingerprint must not be null");
    this.engineHandle = new AtomicReference<>(requireNonNull(engineHandle, "engineHandle must not be null"));
    this.options = requireNonNull(options, "options must not be null");
    this.inUse = new AtomicBoolean(inUse);
    this.prewarmed = new AtomicBoolean(!inUse);
    this.lastUsedNanos = new AtomicLong(createdAtNanos);
    this.activeOperations = new AtomicInteger();
  }

  SessionId id() {
    return id;
  }

  int predictedIdentity() {
    return predictedIdentity;
  }

  int actualIdentity() {
    return actualIdentity;
  }

  long createdAtNanos() {
    return createdAtNanos;
  }

  SeedBundle fingerprint() {
    return fingerprint;
  }

  SessionOptions options() {
    return options;
  }

  boolean isInUse() {
    return inUse.get();
  }

  boolean tryMarkInUse() {
    return inUse.compareAndSet(false, true);
  }

  /**
   * Marks a pre-warmed session in use. Fails once the session has been handed out.
   *
   * @return {@code true} if the caller now owns the session
   */
  boolean tryClaimPrewarmed() {
    if (!prewarmed.get() || !inUse.compareAndSet(false, true)) {
      return false;
    }
    prewarmed.set(false);
    return true;
  }

  void clearPrewarmed() {
    prewarmed.set(false);
  }

  void markIdle() {
    inUse.set(false);
  }

  long lastUsedNanos() {
    return lastUsedNanos.get();
  }

  void touch(long nowNanos) {
    lastUsedNanos.accumulateAndGet(nowNanos, Math::max);
  }

  int activeOperations() {
    return activeOperations.get();
  }

  void beginOperation() {
    activeOperations.incrementAndGet();
  }

  void endOperation() {
    if (activeOperations.decrementAndGet() < 0) {
      activeOperations.incrementAndGet();
      throw new IllegalStateException("Operation count of session " + id.asString() + " went negative");
    }
  }

  /**
   * Returns the engine handle without taking ownership.
   *
   * @return the handle, or {@code null} once it has been taken
   */
  EngineHandle handle() {
    return engineHandle.get();
  }

  /**
   * Transfers ownership of the engine handle to the caller.
   *
   * @return the handle on the first call, {@code null} on every later call
   */
  EngineHandle takeHandle() {
    return engineHandle.getAndSet(null);
  }

  boolean isEvictable() {
    return !inUse.get() && activeOperations.get() == 0;
  }
}
