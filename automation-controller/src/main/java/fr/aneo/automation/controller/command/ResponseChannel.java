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
package fr.aneo.automation.controller.command;

/**
 * Destination of the response to one command.
 * <p>
 * The channel is chosen by the transport that received the command and travels with it to
 * the thread that executes it, so each caller receives its own reply.
 * </p>
 */
@FunctionalInterface
public interface ResponseChannel {

  /**
   * Delivers one response line.
   *
   * @param responseLine the encoded response, without line terminator
   */
  void send(String responseLine);
}
