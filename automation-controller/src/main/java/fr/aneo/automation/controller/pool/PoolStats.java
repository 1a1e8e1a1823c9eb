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
 * Resource statistics of a {@link SessionPool}.
 *
 * @param liveSessions      sessions currently in the pool
 * @param idleSessions      live sessions not in use
 * @param inUseSessions     live sessions in use
 * @param pendingCreations  admitted sessions whose engine instance is being created
 * @param estimatedMemoryMb estimated memory held by the live sessions
 * @param pressureRatio     estimated memory divided by the memory limit
 * @param pressureLevel     the graduated level matching the ratio
 * @param maxSessions       configured session limit
 * @param maxMemoryMb       configured memory limit
 */
public record PoolStats(
  int liveSessions,
  int idleSessions,
  int inUseSessions,
  int pendingCreations,
  long estimatedMemoryMb,
  double pressureRatio,
  PressureLevel pressureLevel,
  int maxSessions,
  long maxMemoryMb
) {
}
