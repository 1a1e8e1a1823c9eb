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
package fr.aneo.automation.domain;

/**
 * Closed set of error categories reported to clients.
 * <p>
 * Each code has a stable wire name that prefixes the {@code error} string of a response,
 * so clients can branch on the category without parsing free-form messages:
 * <pre>{@code
 * {"id": 7, "error": "SessionNotFound: no session with id ctx_000003"}
 * }</pre>
 *
 * @see AutomationException
 */
public enum ErrorCode {
  /** The pool is full and eviction could not free a slot. */
  CAPACITY_EXCEEDED("CapacityExceeded"),
  /** The targeted session id is stale or was never issued. */
  SESSION_NOT_FOUND("SessionNotFound"),
  /** The engine refused or failed to create an instance. */
  ENGINE_CREATION_FAILED("EngineCreationFailed"),
  /** The command method is not part of the command set. */
  UNKNOWN_METHOD("UnknownMethod"),
  /** A caller-level wait exceeded its own deadline. */
  TIMEOUT("Timeout"),
  /** The command line is not valid JSON or lacks a required field. */
  INVALID_COMMAND("InvalidCommand"),
  /** Any failure outside the taxonomy above. */
  INTERNAL_ERROR("InternalError");

  private final String wireName;

  ErrorCode(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Returns the name used on the wire for this code.
   *
   * @return the wire name, never {@code null}
   */
  public String wireName() {
    return wireName;
  }
}
