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

import java.time.Duration;

/**
 * Point-in-time description of a pooled session.
 *
 * @param sessionId         the session identifier
 * @param predictedIdentity the identity predicted before the engine instance existed
 * @param actualIdentity    the identity the engine assigned
 * @param identityKey       the key the session's seeds were derived from
 * @param inUse             whether the session is currently acquired
 * @param activeOperations  number of in-flight operations
 * @param age               time since creation
 * @param idleFor           time since last use
 */
public record SessionInfo(
  SessionId sessionId,
  int predictedIdentity,
  int actualIdentity,
  String identityKey,
  boolean inUse,
  int activeOperations,
  Duration age,
  Duration idleFor
) {
}
