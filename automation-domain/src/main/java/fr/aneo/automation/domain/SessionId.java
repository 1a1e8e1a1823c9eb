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

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Immutable identifier of a pooled automation session.
 * <p>
 * Session identifiers are assigned by the session pool from a monotonic counter and are unique
 * for the lifetime of the controller process. They are opaque to clients, which only echo them
 * back in the {@code context_id} field of later commands.
 */
public final class SessionId {
  private final String id;

  private SessionId(String id) {
    this.id = id;
  }

  /**
   * Returns the string representation of this session identifier, as used on the wire.
   *
   * @return the session identifier as a string
   */
  public String asString() {
    return id;
  }

  public static SessionId from(String sessionId) {
    requireNonNull(sessionId, "sessionId must not be null");
    return new SessionId(sessionId);
  }

  /**
   * Builds the identifier for the {@code sequence}-th session created by a pool.
   *
   * @param sequence the pool's creation counter value, starting at 1
   * @return the identifier, e.g. {@code ctx_000042}
   */
  public static SessionId ofSequence(long sequence) {
    return new SessionId(String.format("ctx_%06d", sequence));
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) return true;
    if (obj == null || obj.getClass() != this.getClass()) return false;
    var that = (SessionId) obj;
    return Objects.equals(this.id, that.id);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id);
  }

  @Override
  public String toString() {
    return "SessionId{" +
      "id='" + id + '\'' +
      '}';
  }
}
