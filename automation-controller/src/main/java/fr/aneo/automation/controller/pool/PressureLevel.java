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

/**
 * Graduated memory pressure levels and the share of idle sessions each one evicts.
 * <p>
 * The level is derived from the pressure ratio, i.e. estimated memory divided by the configured
 * limit. {@link #LOW} evicts by idle timeout only; the other levels evict a fraction of the idle
 * sessions, oldest first.
 * </p>
 */
public enum PressureLevel {
  LOW(0.0, 0),
  MODERATE(0.75, 20),
  HIGH(0.90, 40),
  CRITICAL(1.0, 60);

  private final double threshold;
  private final int evictionPercent;

  PressureLevel(double threshold, int evictionPercent) {
    this.threshold = threshold;
    this.evictionPercent = evictionPercent;
  }

  public static PressureLevel fromRatio(double ratio) {
    if (ratio >= CRITICAL.threshold) return CRITICAL;
    if (ratio >= HIGH.threshold) return HIGH;
    if (ratio >= MODERATE.threshold) return MODERATE;
    return LOW;
  }

  /**
   * Returns how many idle sessions this level evicts.
   * <p>
   * The count is {@code floor(percent * idleCount / 100)}; {@link #MODERATE} evicts at least one session
   * when any is idle. {@link #LOW} always returns 0, its eviction being timeout based.
   * </p>
   *
   * @param idleCount number of idle sessions
   * @return the number of sessions to evict
   */
  public int evictionCount(int idleCount) {
    if (this == LOW || idleCount <= 0) {
      return 0;
    }
    int count = evictionPercent * idleCount / 100;
    return this == MODERATE ? Math.max(1, count) : count;
  }

  public double threshold() {
    return threshold;
  }
}
