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
import fr.aneo.automation.domain.SessionNotFoundException;
import fr.aneo.automation.domain.engine.EngineHandle;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An in-flight operation against a session.
 * <p>
 * Opening a scope increments the session's active operation count, closing it decrements the
 * count. Use it with try-with-resources so the decrement runs whatever the outcome of the
 * operation; while any scope is open, the pool does not tear the session down (up to the
 * close drain budget).
 * </p>
 * <pre>{@code
 * try (var scope = pool.beginOperation(sessionId)) {
 *   engine.navigate(scope.handle(), url);
 * }
 * }</pre>
 */
public final class OperationScope implements AutoCloseable {
  private final Session session;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  OperationScope(Session session) {
    this.session = session;
  }

  public SessionId sessionId() {
    return session.id();
  }

  /**
   * Returns the engine handle of the session.
   *
   * @return the handle
   * @throws SessionNotFoundException if the session was torn down while this scope was open
   */
  public EngineHandle handle() {
    var handle = session.handle();
    if (handle == null) {
      throw new SessionNotFoundException(session.id());
    }
    return handle;
  }

  public int actualIdentity() {
    return session.actualIdentity();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      session.endOperation();
    }
  }
}
