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
 * Estimates the memory held by the live sessions of a pool.
 */
@FunctionalInterface
public interface MemoryEstimator {

  /**
   * @param liveSessions number of sessions currently in the pool
   * @return estimated memory, in megabytes
   */
  long estimateMb(int liveSessions);

  /**
   * Linear estimate: every session costs the same fixed amount.
   *
   * @param sessionMemoryMb the cost of one session, in megabytes
   * @return the estimator
   */
  static MemoryEstimator perSession(long sessionMemoryMb) {
    return liveSessions -> liveSessions * sessionMemoryMb;
  }
}
