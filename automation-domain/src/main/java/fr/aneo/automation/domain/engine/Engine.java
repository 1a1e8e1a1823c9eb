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
package fr.aneo.automation.domain.engine;

/**
 * Contract of the embedded rendering engine, as seen by the control plane.
 * <p>
 * The engine runs a cooperative, non-preemptive event loop and requires most calls to be made
 * from one dedicated thread, called the <em>engine-affine</em> thread. The controller owns that
 * thread: the command scheduler runs its cycles on it and is the only caller of
 * {@link #pumpEventLoopOnce()}.
 *
 * <h2>Threading requirements</h2>
 * <table>
 *   <caption>Allowed calling threads</caption>
 *   <tr><th>Operation</th><th>Thread</th></tr>
 *   <tr><td>{@link #createInstance(InstanceConfig)}</td><td>engine-affine only</td></tr>
 *   <tr><td>{@link #destroyInstance(EngineHandle)}</td><td>any; the engine marshals the teardown</td></tr>
 *   <tr><td>{@link #pumpEventLoopOnce()}</td><td>engine-affine only</td></tr>
 *   <tr><td>{@link #sendInputEvent}, {@link #navigate}, {@link #sendSidechannelMessage}</td><td>engine-affine only</td></tr>
 *   <tr><td>{@link #getIdentifier(EngineHandle)}, {@link #isNavigationComplete(EngineHandle)}</td><td>any</td></tr>
 * </table>
 * <p>
 * Implementations are discovered with {@link java.util.ServiceLoader}.
 */
public interface Engine {

  /**
   * Creates a new engine instance.
   *
   * @param config the creation parameters, including the predicted identity and its seeds
   * @return the new instance and the identity the engine actually assigned
   * @throws RuntimeException if the engine refuses or fails to create the instance
   */
  EngineInstance createInstance(InstanceConfig config);

  /**
   * Destroys an engine instance. Best effort: must not throw for an instance that is still busy
   * or already gone.
   *
   * @param handle the handle of the instance to destroy
   */
  void destroyInstance(EngineHandle handle);

  /**
   * Runs one non-blocking iteration of the engine's event loop.
   */
  void pumpEventLoopOnce();

  void sendInputEvent(EngineHandle handle, InputEvent event);

  void navigate(EngineHandle handle, String url);

  /**
   * Sends an opaque message to the instance's in-page agent.
   *
   * @param handle  the target instance
   * @param payload the message, interpreted by the agent only
   */
  void sendSidechannelMessage(EngineHandle handle, String payload);

  /**
   * Returns the identifier the engine assigned to the instance. Read-only.
   *
   * @param handle the instance
   * @return the engine-side identifier
   */
  int getIdentifier(EngineHandle handle);

  /**
   * Reports whether the instance's last navigation finished loading. Read-only, used by
   * polling waits running on worker threads.
   *
   * @param handle the instance
   * @return {@code true} once the current page has finished loading
   */
  boolean isNavigationComplete(EngineHandle handle);
}
