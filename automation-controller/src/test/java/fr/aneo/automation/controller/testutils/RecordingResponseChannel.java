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
package fr.aneo.automation.controller.testutils;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import fr.aneo.automation.controller.command.ResponseChannel;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Response channel collecting every line it receives.
 */
public class RecordingResponseChannel implements ResponseChannel {
  private final List<String> lines = new CopyOnWriteArrayList<>();

  @Override
  public void send(String responseLine) {
    synchronized (this) {
      lines.add(responseLine);
      notifyAll();
    }
  }

  public List<String> lines() {
    return List.copyOf(lines);
  }

  public List<JsonObject> responses() {
    return lines.stream().map(line -> JsonParser.parseString(line).getAsJsonObject()).toList();
  }

  public Optional<JsonObject> responseFor(long id) {
    return responses().stream().filter(response -> response.get("id").getAsLong() == id).findFirst();
  }

  /**
   * Waits until at least {@code count} lines have been received.
   *
   * @return {@code true} if they arrived in time
   */
  public boolean awaitLines(int count, Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    synchronized (this) {
      while (lines.size() < count) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return false;
        }
        TimeUnit.NANOSECONDS.timedWait(this, remaining);
      }
      return true;
    }
  }
}
