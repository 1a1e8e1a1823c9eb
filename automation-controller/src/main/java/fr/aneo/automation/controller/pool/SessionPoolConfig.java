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

import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * Limits and timings of a {@link SessionPool}.
 * <p>
 * Memory figures are estimates used only to compute the pressure ratio that drives graduated
 * eviction; the pool never measures actual memory usage.
 * </p>
 *
 * <h2>Defaults</h2>
 * <table>
 *   <caption>Default values</caption>
 *   <tr><th>Setting</th><th>Default</th></tr>
 *   <tr><td>{@code maxSessions}</td><td>1000</td></tr>
 *   <tr><td>{@code maxMemoryMb}</td><td>32000</td></tr>
 *   <tr><td>{@code idleTimeout}</td><td>120 s</td></tr>
 *   <tr><td>{@code estimatedSessionMemoryMb}</td><td>150</td></tr>
 *   <tr><td>{@code cleanupInterval}</td><td>30 s</td></tr>
 *   <tr><td>{@code closeDrainRetries}</td><td>100</td></tr>
 *   <tr><td>{@code closeDrainInterval}</td><td>50 ms</td></tr>
 * </table>
 *
 * @param maxSessions              maximum number of live sessions, pending creations included
 * @param maxMemoryMb              estimated memory budget of all sessions, in megabytes
 * @param idleTimeout              idle duration after which a session is reclaimed at low pressure
 * @param estimatedSessionMemoryMb estimated cost of one session, in megabytes
 * @param cleanupInterval          period of the background pressure cleanup
 * @param closeDrainRetries        number of drain checks before a close proceeds regardless
 * @param closeDrainInterval       pause between two drain checks
 */
public record SessionPoolConfig(
  int maxSessions,
  long maxMemoryMb,
  Duration idleTimeout,
  long estimatedSessionMemoryMb,
  Duration cleanupInterval,
  int closeDrainRetries,
  Duration closeDrainInterval
) {

  public static final SessionPoolConfig DEFAULT = new SessionPoolConfig(
    1000,
    32_000,
    Duration.ofSeconds(120),
    150,
    Duration.ofSeconds(30),
    100,
    Duration.ofMillis(50));

  public SessionPoolConfig {
    requireNonNull(idleTimeout, "idleTimeout must not be null");
    requireNonNull(cleanupInterval, "cleanupInterval must not be null");
    requireNonNull(closeDrainInterval, "closeDrainInterval must not be null");

    if (maxSessions <= 0) throw new IllegalArgumentException("maxSessions must be positive, got: " + maxSessions);
    if (maxMemoryMb <= 0) throw new IllegalArgumentException("maxMemoryMb must be positive, got: " + maxMemoryMb);
    if (estimatedSessionMemoryMb <= 0) throw new IllegalArgumentException("estimatedSessionMemoryMb must be positive, got: " + estimatedSessionMemoryMb);
    if (closeDrainRetries < 0) throw new IllegalArgumentException("closeDrainRetries must be non-negative, got: " + closeDrainRetries);
    if (idleTimeout.isNegative() || idleTimeout.isZero()) throw new IllegalArgumentException("idleTimeout must be positive, got: " + idleTimeout);
    if (cleanupInterval.isNegative() || cleanupInterval.isZero()) throw new IllegalArgumentException("cleanupInterval must be positive, got: " + cleanupInterval);
    if (closeDrainInterval.isNegative()) throw new IllegalArgumentException("closeDrainInterval must be non-negative, got: " + closeDrainInterval);
  }

  public SessionPoolConfig withMaxSessions(int maxSessions) {
    return new SessionPoolConfig(maxSessions, maxMemoryMb, idleTimeout, estimatedSessionMemoryMb, cleanupInterval, closeDrainRetries, closeDrainInterval);
  }

  public SessionPoolConfig withMaxMemoryMb(long maxMemoryMb) {
    return new SessionPoolConfig(maxSessions, maxMemoryMb, idleTimeout, estimatedSessionMemoryMb, cleanupInterval, closeDrainRetries, closeDrainInterval);
  }

  public SessionPoolConfig withIdleTimeout(Duration idleTimeout) {
    return new SessionPoolConfig(maxSessions, maxMemoryMb, idleTimeout, estimatedSessionMemoryMb, cleanupInterval, closeDrainRetries, closeDrainInterval);
  }

  public SessionPoolConfig withCloseDrain(int closeDrainRetries, Duration closeDrainInterval) {
    return new SessionPoolConfig(maxSessions, maxMemoryMb, idleTimeout, estimatedSessionMemoryMb, cleanupInterval, closeDrainRetries, closeDrainInterval);
  }
}
