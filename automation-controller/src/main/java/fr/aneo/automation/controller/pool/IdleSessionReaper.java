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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Periodically runs {@link SessionPool#cleanupUnderPressure()}.
 * <p>
 * Failures of a cleanup run are logged and never stop the schedule. Sessions evicted here
 * are torn down on the scheduler thread; the engine marshals the teardown to its own thread.
 * </p>
 */
public final class IdleSessionReaper implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(IdleSessionReaper.class);

  private final SessionPool pool;
  private final ScheduledExecutorService scheduler;
  private final Duration interval;
  private ScheduledFuture<?> task;

  public IdleSessionReaper(SessionPool pool, ScheduledExecutorService scheduler, Duration interval) {
    this.pool = requireNonNull(pool, "pool must not be null");
    this.scheduler = requireNonNull(scheduler, "scheduler must not be null");
    this.interval = requireNonNull(interval, "interval must not be null");
  }

  public synchronized void start() {
    if (task != null) {
      throw new IllegalStateException("Reaper already started");
    }
    long periodMillis = interval.toMillis();
    task = scheduler.scheduleWithFixedDelay(this::runOnce, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    logger.info("Idle session reaper started (every {} ms)", periodMillis);
  }

  void runOnce() {
    try {
      int evicted = pool.cleanupUnderPressure();
      if (evicted > 0) {
        logger.debug("Reaper evicted {} sessions", evicted);
      }
    } catch (RuntimeException e) {
      logger.error("Session cleanup failed", e);
    }
  }

  @Override
  public synchronized void close() {
    if (task != null) {
      task.cancel(false);
      task = null;
      logger.info("Idle session reaper stopped");
    }
  }
}
