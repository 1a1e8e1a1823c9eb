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

import com.google.common.base.Ticker;
import fr.aneo.automation.domain.AutomationException;
import fr.aneo.automation.domain.CapacityExceededException;
import fr.aneo.automation.domain.EngineCreationFailedException;
import fr.aneo.automation.domain.SessionId;
import fr.aneo.automation.domain.SessionNotFoundException;
import fr.aneo.automation.domain.engine.Engine;
import fr.aneo.automation.domain.engine.EngineHandle;
import fr.aneo.automation.domain.engine.EngineInstance;
import fr.aneo.automation.domain.engine.InstanceConfig;
import fr.aneo.automation.domain.engine.SessionOptions;
import fr.aneo.automation.domain.seed.SeedRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static java.util.Objects.requireNonNull;

/**
 * Thread-safe pool of engine-backed automation sessions.
 * <p>
 * The pool owns the map of live {@link Session}s. It admits new sessions within the configured
 * capacity, hands idle sessions out again, and reclaims sessions explicitly or through graduated
 * eviction when the estimated memory pressure rises.
 * </p>
 *
 * <h2>Locking</h2>
 * <p>
 * The session map is guarded by a single {@link ReentrantReadWriteLock}. Lookups and
 * iterations take the read lock; insertions and removals take the write lock. The lock is only
 * ever held for map operations: engine instance creation and teardown always run after it has
 * been released.
 * </p>
 *
 * <h2>Two-phase teardown</h2>
 * <ol>
 *   <li><strong>Extraction</strong>: under the write lock, the session is removed from the map.
 *       From then on it cannot be acquired or targeted by new operations, so its active
 *       operation count can only go down.</li>
 *   <li><strong>Teardown</strong>: outside the lock, the engine handle is taken out of the
 *       session and the instance destroyed. A closed session that still runs operations is
 *       parked instead, and {@link #finishPendingTeardowns()} destroys it once the operations
 *       have ended or the drain budget ({@link SessionPoolConfig#closeDrainRetries()} times
 *       {@link SessionPoolConfig#closeDrainInterval()}) has run out. Closing never sleeps.</li>
 * </ol>
 * <p>
 * The handle is moved out of the session with {@link Session#takeHandle()}, so exactly one
 * thread ever destroys a given instance.
 * </p>
 *
 * <h2>Admission</h2>
 * <p>
 * A creation reserves a slot under the write lock before the engine is called; live sessions
 * plus pending creations never exceed {@link SessionPoolConfig#maxSessions()}. When the pool is
 * full, the single oldest evictable session is extracted and torn down, then admission is
 * retried once. If memory would exceed the limit after admission, a pressure cleanup runs first.
 * </p>
 * <p>
 * Sessions created ahead of demand by {@link #prewarm(int, SessionOptions)} start idle and are
 * handed out by {@link #create(SessionOptions)} before any new instance is built.
 * </p>
 *
 * <h2>Threading</h2>
 * <p>
 * {@link #create(SessionOptions)} and {@link #prewarm(int, SessionOptions)} call
 * {@link Engine#createInstance(InstanceConfig)} and must therefore run on the engine-affine
 * thread. Every other method may be called from any thread.
 * </p>
 *
 * @see SessionPoolConfig
 * @see PressureLevel
 * @see OperationScope
 */
public final class SessionPool implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(SessionPool.class);

  private final Engine engine;
  private final SeedRegistry seedRegistry;
  private final MemoryEstimator memoryEstimator;
  private final Ticker ticker;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<SessionId, Session> sessions = new HashMap<>();
  private final List<PendingTeardown> pendingTeardowns = new ArrayList<>();
  private final AtomicLong sequence = new AtomicLong();
  private final AtomicInteger predictedIdentities = new AtomicInteger();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private volatile SessionPoolConfig config;
  private int pendingCreations;

  public SessionPool(Engine engine, SeedRegistry seedRegistry, SessionPoolConfig config) {
    this(engine, seedRegistry, config, MemoryEstimator.perSession(config.estimatedSessionMemoryMb()), Ticker.systemTicker());
  }

  public SessionPool(Engine engine, SeedRegistry seedRegistry, SessionPoolConfig config, MemoryEstimator memoryEstimator, Ticker ticker) {
    this.engine = requireNonNull(engine, "engine must not be null");
    this.seedRegistry = requireNonNull(seedRegistry, "seedRegistry must not be null");
    this.config = requireNonNull(config, "config must not be null");
    this.memoryEstimator = requireNonNull(memoryEstimator, "memoryEstimator must not be null");
    this.ticker = requireNonNull(ticker, "ticker must not be null");
  }

  /**
   * Hands out a pre-warmed session created with the same options, or creates a new session
   * backed by a fresh engine instance.
   * <p>
   * The session identity is predicted and its seeds registered before the engine is called. The
   * session only becomes visible once the engine has created the instance and the seeds have
   * been reconciled with the identity the engine actually assigned. The returned session is in
   * use.
   * </p>
   *
   * @param options engine creation options
   * @return the identifier of the new session
   * @throws CapacityExceededException     if the pool is full and no session could be evicted
   * @throws EngineCreationFailedException if the engine failed, or assigned an identity held by
   *                                       another live session
   * @throws IllegalStateException         if the pool has been closed
   */
  public SessionId create(SessionOptions options) {
    requireNonNull(options, "options must not be null");
    ensureNotClosed();

    var prewarmed = claimPrewarmed(options);
    if (prewarmed.isPresent()) {
      logger.info("Handing out pre-warmed session {}", prewarmed.get().asString());
      return prewarmed.get();
    }

    admit();
    return createReserved(options, true);
  }

  /**
   * Creates idle sessions ahead of demand, within the free capacity.
   * <p>
   * Pre-warming never evicts: it stops as soon as the pool is full, or at the first engine
   * failure, which is logged.
   * </p>
   *
   * @param count   the number of sessions wanted
   * @param options engine creation options of the pre-warmed sessions
   * @return the number of sessions actually created
   * @throws IllegalArgumentException if {@code count} is negative
   * @throws IllegalStateException    if the pool has been closed
   */
  public int prewarm(int count, SessionOptions options) {
    requireNonNull(options, "options must not be null");
    if (count < 0) {
      throw new IllegalArgumentException("count must not be negative, got: " + count);
    }
    ensureNotClosed();

    int created = 0;
    while (created < count && tryReserve()) {
      try {
        createReserved(options, false);
        created++;
      } catch (AutomationException e) {
        logger.warn("Pre-warming stopped after {} sessions: {}", created, e.toWireMessage());
        break;
      }
    }

    if (created < count) {
      logger.info("Pre-warmed {} of {} requested sessions", created, count);
    } else {
      logger.info("Pre-warmed {} sessions", created);
    }
    return created;
  }

  private SessionId createReserved(SessionOptions options, boolean inUse) {
    var sessionId = SessionId.ofSequence(sequence.incrementAndGet());
    int predictedIdentity = predictedIdentities.incrementAndGet();

    EngineInstance instance;
    try {
      var seeds = seedRegistry.registerPredicted(sessionId, predictedIdentity);
      instance = engine.createInstance(new InstanceConfig(sessionId, predictedIdentity, seeds, options));
      requireNonNull(instance, "engine returned no instance");
    } catch (RuntimeException e) {
      seedRegistry.unregister(sessionId);
      cancelReservation();
      throw creationFailure(sessionId, e);
    }

    Session session;
    try {
      var fingerprint = seedRegistry.reconcile(sessionId, instance.actualIdentity());
      session = new Session(sessionId, predictedIdentity, instance.actualIdentity(), ticker.read(), fingerprint, instance.handle(), options, inUse);
    } catch (RuntimeException e) {
      logger.error("Discarding new instance of session {}: {}", sessionId.asString(), e.getMessage());
      destroyInstance(sessionId, instance.handle());
      seedRegistry.unregister(sessionId);
      cancelReservation();
      throw creationFailure(sessionId, e);
    }

    boolean inserted = false;
    lock.writeLock().lock();
    try {
      pendingCreations--;
      if (!closed.get()) {
        sessions.put(sessionId, session);
        inserted = true;
      }
    } finally {
      lock.writeLock().unlock();
    }

    if (!inserted) {
      destroy(session);
      throw new IllegalStateException("Session pool was closed while session " + sessionId.asString() + " was being created");
    }

    logger.info("Created session {} (identity {}, key {})", sessionId.asString(), session.actualIdentity(), session.fingerprint().identityKey());
    return sessionId;
  }

  /**
   * Hands out any idle session, marking it in use.
   *
   * @return the acquired session, or empty if every session is in use
   */
  public Optional<SessionId> acquire() {
    lock.readLock().lock();
    try {
      for (var session : sessions.values()) {
        if (session.tryMarkInUse()) {
          session.clearPrewarmed();
          session.touch(ticker.read());
          logger.debug("Acquired idle session {}", session.id().asString());
          return Optional.of(session.id());
        }
      }
      return Optional.empty();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Marks a session idle and refreshes its last use. No-op for unknown sessions.
   *
   * @param sessionId the session to release
   */
  public void release(SessionId sessionId) {
    var session = find(sessionId);
    if (session == null) {
      logger.debug("Ignoring release of unknown session {}", sessionId == null ? null : sessionId.asString());
      return;
    }
    session.markIdle();
    session.touch(ticker.read());
  }

  /**
   * Removes a session from the pool and destroys its engine instance.
   * <p>
   * The session disappears from the pool immediately. Without in-flight operations its instance
   * is destroyed before this method returns. Otherwise the teardown is left to
   * {@link #finishPendingTeardowns()}, and this method returns without waiting.
   * </p>
   *
   * @param sessionId the session to close
   * @throws SessionNotFoundException if no session has this identifier
   */
  public void close(SessionId sessionId) {
    requireNonNull(sessionId, "sessionId must not be null");

    Session session;
    lock.writeLock().lock();
    try {
      session = sessions.remove(sessionId);
    } finally {
      lock.writeLock().unlock();
    }

    if (session == null) {
      throw new SessionNotFoundException(sessionId);
    }
    if (session.activeOperations() == 0 || !deferTeardown(session)) {
      destroy(session);
      logger.info("Closed session {}", sessionId.asString());
    }
  }

  /**
   * Destroys the closed sessions whose operations have ended or whose drain budget has run
   * out. Never blocks on operations; the command scheduler calls it once per cycle.
   *
   * @return the number of sessions destroyed
   */
  public int finishPendingTeardowns() {
    long now = ticker.read();
    var ready = new ArrayList<PendingTeardown>();

    lock.writeLock().lock();
    try {
      var iterator = pendingTeardowns.iterator();
      while (iterator.hasNext()) {
        var pending = iterator.next();
        if (pending.session().activeOperations() == 0 || now - pending.deadlineNanos() >= 0) {
          ready.add(pending);
          iterator.remove();
        }
      }
    } finally {
      lock.writeLock().unlock();
    }

    for (var pending : ready) {
      var session = pending.session();
      if (session.activeOperations() > 0) {
        logger.warn("Session {} still has {} active operations after its drain budget, tearing it down anyway",
          session.id().asString(), session.activeOperations());
      }
      destroy(session);
      logger.info("Closed session {}", session.id().asString());
    }
    return ready.size();
  }

  public int pendingTeardownCount() {
    lock.readLock().lock();
    try {
      return pendingTeardowns.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Returns the engine handle of a session and refreshes its last use.
   *
   * @param sessionId the session
   * @return the handle, or empty if the session is unknown or already torn down
   */
  public Optional<EngineHandle> getHandle(SessionId sessionId) {
    var session = find(sessionId);
    if (session == null) {
      return Optional.empty();
    }
    session.touch(ticker.read());
    return Optional.ofNullable(session.handle());
  }

  public boolean contains(SessionId sessionId) {
    return find(sessionId) != null;
  }

  /**
   * Registers an in-flight operation against a session.
   * <p>
   * The increment happens under the read lock, so it is either observed by a concurrent
   * {@link #close(SessionId)} or fails with {@link SessionNotFoundException}.
   * </p>
   *
   * @param sessionId the target session
   * @return a scope to close once the operation is over
   * @throws SessionNotFoundException if the session is unknown
   */
  public OperationScope beginOperation(SessionId sessionId) {
    requireNonNull(sessionId, "sessionId must not be null");

    lock.readLock().lock();
    try {
      var session = sessions.get(sessionId);
      if (session == null) {
        throw new SessionNotFoundException(sessionId);
      }
      session.beginOperation();
      session.touch(ticker.read());
      return new OperationScope(session);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Evicts idle sessions according to the current memory pressure.
   * <p>
   * Victims are chosen oldest last use first, among sessions that are neither in use nor running
   * an operation, and extracted in one pass under the write lock. Sessions with in-flight
   * operations are left for the next cleanup.
   * </p>
   *
   * @return the number of sessions evicted
   * @see PressureLevel
   */
  public int cleanupUnderPressure() {
    var currentConfig = config;
    long now = ticker.read();
    var victims = new ArrayList<Session>();
    PressureLevel level;
    int idleCount;

    lock.writeLock().lock();
    try {
      double ratio = pressureRatio(sessions.size(), currentConfig);
      level = PressureLevel.fromRatio(ratio);

      var idle = sessions.values().stream()
                         .filter(session -> !session.isInUse())
                         .sorted(Comparator.comparingLong(Session::lastUsedNanos))
                         .toList();
      idleCount = idle.size();

      if (level == PressureLevel.LOW) {
        long timeoutNanos = currentConfig.idleTimeout().toNanos();
        for (var session : idle) {
          if (session.isEvictable() && now - session.lastUsedNanos() > timeoutNanos) {
            victims.add(session);
          }
        }
      } else {
        int target = level.evictionCount(idleCount);
        for (var session : idle) {
          if (victims.size() >= target) break;
          if (session.isEvictable()) {
            victims.add(session);
          }
        }
      }
      victims.forEach(session -> sessions.remove(session.id()));
    } finally {
      lock.writeLock().unlock();
    }

    if (!victims.isEmpty()) {
      logger.info("Evicting {} of {} idle sessions (pressure {})", victims.size(), idleCount, level);
    }
    victims.forEach(this::destroy);
    return victims.size();
  }

  /**
   * Returns a snapshot of the pool's resource usage.
   *
   * @return the statistics
   */
  public PoolStats stats() {
    var currentConfig = config;
    lock.readLock().lock();
    try {
      int live = sessions.size();
      int inUse = (int) sessions.values().stream().filter(Session::isInUse).count();
      double ratio = pressureRatio(live, currentConfig);
      return new PoolStats(
        live,
        live - inUse,
        inUse,
        pendingCount(),
        memoryEstimator.estimateMb(live),
        ratio,
        PressureLevel.fromRatio(ratio),
        currentConfig.maxSessions(),
        currentConfig.maxMemoryMb());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Lists the live sessions, ordered by identifier.
   *
   * @return one entry per live session
   */
  public List<SessionInfo> listSessions() {
    long now = ticker.read();
    lock.readLock().lock();
    try {
      return sessions.values().stream()
                     .sorted(Comparator.comparing(session -> session.id().asString()))
                     .map(session -> infoOf(session, now))
                     .toList();
    } finally {
      lock.readLock().unlock();
    }
  }

  public Optional<SessionInfo> describe(SessionId sessionId) {
    var session = find(sessionId);
    return session == null ? Optional.empty() : Optional.of(infoOf(session, ticker.read()));
  }

  public int size() {
    lock.readLock().lock();
    try {
      return sessions.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  public SessionPoolConfig config() {
    return config;
  }

  /**
   * Changes the session limit. Existing sessions above the new limit are not evicted; only new
   * admissions are affected.
   *
   * @param maxSessions the new limit
   * @throws IllegalArgumentException if {@code maxSessions} is not positive
   */
  public void setMaxSessions(int maxSessions) {
    config = config.withMaxSessions(maxSessions);
    logger.info("Session limit set to {}", maxSessions);
  }

  /**
   * Changes the memory limit used for the pressure ratio.
   *
   * @param maxMemoryMb the new limit, in megabytes
   * @throws IllegalArgumentException if {@code maxMemoryMb} is not positive
   */
  public void setMaxMemoryMb(long maxMemoryMb) {
    config = config.withMaxMemoryMb(maxMemoryMb);
    logger.info("Memory limit set to {} MB", maxMemoryMb);
  }

  /**
   * Closes the pool and destroys every session. Later creations fail with
   * {@link IllegalStateException}. Subsequent calls have no effect.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }

    List<Session> remaining;
    lock.writeLock().lock();
    try {
      remaining = new ArrayList<>(sessions.values());
      sessions.clear();
      for (var pending : pendingTeardowns) {
        remaining.add(pending.session());
      }
      pendingTeardowns.clear();
    } finally {
      lock.writeLock().unlock();
    }

    logger.info("Shutting down session pool ({} sessions)", remaining.size());
    remaining.forEach(session -> {
      awaitDrain(session);
      destroy(session);
    });
    logger.info("Session pool shutdown complete");
  }

  private void admit() {
    var currentConfig = config;
    if (projectedMemoryMb() > currentConfig.maxMemoryMb()) {
      logger.debug("Admission would exceed the memory limit, running pressure cleanup");
      cleanupUnderPressure();
    }

    if (tryReserve()) {
      return;
    }

    var victim = extractOldestEvictable();
    if (victim.isPresent()) {
      logger.info("Pool full, evicting oldest idle session {}", victim.get().id().asString());
      destroy(victim.get());
      if (tryReserve()) {
        return;
      }
    }

    throw new CapacityExceededException("session limit of " + config.maxSessions() + " reached and no idle session can be evicted");
  }

  private boolean tryReserve() {
    lock.writeLock().lock();
    try {
      if (sessions.size() + pendingCreations >= config.maxSessions()) {
        return false;
      }
      pendingCreations++;
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  private void cancelReservation() {
    lock.writeLock().lock();
    try {
      pendingCreations--;
    } finally {
      lock.writeLock().unlock();
    }
  }

  private Optional<Session> extractOldestEvictable() {
    lock.writeLock().lock();
    try {
      var oldest = sessions.values().stream()
                           .filter(Session::isEvictable)
                           .min(Comparator.comparingLong(Session::lastUsedNanos));
      oldest.ifPresent(session -> sessions.remove(session.id()));
      return oldest;
    } finally {
      lock.writeLock().unlock();
    }
  }

  private Optional<SessionId> claimPrewarmed(SessionOptions options) {
    lock.readLock().lock();
    try {
      var candidates = sessions.values().stream()
                               .filter(session -> session.options().equals(options))
                               .sorted(Comparator.comparingLong(Session::createdAtNanos).thenComparing(session -> session.id().asString()))
                               .toList();
      for (var session : candidates) {
        if (session.tryClaimPrewarmed()) {
          session.touch(ticker.read());
          return Optional.of(session.id());
        }
      }
      return Optional.empty();
    } finally {
      lock.readLock().unlock();
    }
  }

  private boolean deferTeardown(Session session) {
    var currentConfig = config;
    long budgetNanos = currentConfig.closeDrainInterval().toNanos() * currentConfig.closeDrainRetries();

    lock.writeLock().lock();
    try {
      if (closed.get()) {
        return false;
      }
      pendingTeardowns.add(new PendingTeardown(session, ticker.read() + budgetNanos));
    } finally {
      lock.writeLock().unlock();
    }
    logger.info("Session {} closed with {} active operations, teardown deferred", session.id().asString(), session.activeOperations());
    return true;
  }

  private void destroy(Session session) {
    var handle = session.takeHandle();
    if (handle != null) {
      destroyInstance(session.id(), handle);
    }
    seedRegistry.unregister(session.id());
  }

  /**
   * Blocking drain, used only when the whole pool shuts down.
   */
  private void awaitDrain(Session session) {
    var currentConfig = config;
    long intervalMillis = currentConfig.closeDrainInterval().toMillis();
    int attempts = 0;

    while (session.activeOperations() > 0 && attempts < currentConfig.closeDrainRetries()) {
      attempts++;
      try {
        TimeUnit.MILLISECONDS.sleep(intervalMillis);
      } catch (InterruptedException e) {
        logger.warn("Interrupted while draining operations of session {}", session.id().asString());
        Thread.currentThread().interrupt();
        break;
      }
    }

    if (session.activeOperations() > 0) {
      logger.warn("Session {} still has {} active operations after {} drain checks, tearing it down anyway",
        session.id().asString(), session.activeOperations(), attempts);
    }
  }

  private void destroyInstance(SessionId sessionId, EngineHandle handle) {
    try {
      engine.destroyInstance(handle);
      logger.debug("Destroyed engine instance of session {}", sessionId.asString());
    } catch (RuntimeException e) {
      logger.error("Engine failed to destroy instance of session {}", sessionId.asString(), e);
    }
  }

  private Session find(SessionId sessionId) {
    if (sessionId == null) {
      return null;
    }
    lock.readLock().lock();
    try {
      return sessions.get(sessionId);
    } finally {
      lock.readLock().unlock();
    }
  }

  private static SessionInfo infoOf(Session session, long now) {
    return new SessionInfo(
      session.id(),
      session.predictedIdentity(),
      session.actualIdentity(),
      session.fingerprint().identityKey(),
      session.isInUse(),
      session.activeOperations(),
      Duration.ofNanos(now - session.createdAtNanos()),
      Duration.ofNanos(Math.max(0, now - session.lastUsedNanos())));
  }

  private long projectedMemoryMb() {
    return memoryEstimator.estimateMb(size() + pendingCount() + 1);
  }

  private int pendingCount() {
    lock.readLock().lock();
    try {
      return pendingCreations;
    } finally {
      lock.readLock().unlock();
    }
  }

  private double pressureRatio(int liveSessions, SessionPoolConfig currentConfig) {
    return (double) memoryEstimator.estimateMb(liveSessions) / currentConfig.maxMemoryMb();
  }

  private void ensureNotClosed() {
    if (closed.get()) {
      throw new IllegalStateException("Session pool has been closed");
    }
  }

  private static AutomationException creationFailure(SessionId sessionId, RuntimeException cause) {
    if (cause instanceof AutomationException automationException) {
      return automationException;
    }
    var message = cause.getMessage() != null ? cause.getMessage() : cause.toString();
    return new EngineCreationFailedException("could not create session " + sessionId.asString() + ": " + message, cause);
  }

  private record PendingTeardown(Session session, long deadlineNanos) {
  }
}
