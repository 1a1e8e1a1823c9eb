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

import java.io.PrintStream;

import static java.util.Objects.requireNonNull;

/**
 * Response channel writing to a shared stream, one line per response.
 * <p>
 * Writes are serialized so that responses sent concurrently from the engine thread and from
 * workers never interleave.
 * </p>
 */
public final class SharedOutputChannel implements ResponseChannel {
  private final PrintStream out;
  private final Object writeLock = new Object();

  public SharedOutputChannel(PrintStream out) {
    this.out = requireNonNull(out, "out must not be null");
  }

  @Override
  public void send(String responseLine) {
    synchronized (writeLock) {
      out.println(responseLine);
      out.flush();
    }
  }
}
