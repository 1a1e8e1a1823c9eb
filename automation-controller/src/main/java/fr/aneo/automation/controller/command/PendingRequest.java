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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * An out-of-band command whose caller waits for its own reply.
 * <p>
 * The request is its own {@link ResponseChannel}: the executing thread sends the response into
 * the request, which resolves {@link #response()}. The slot resolves once; later sends are
 * dropped with a warning.
 * </p>
 */
public final class PendingRequest implements ResponseChannel {
  private static final Logger logger = LoggerFactory.getLogger(PendingRequest.class);

  private final String line;
  private final CompletableFuture<String> response = new CompletableFuture<>();
  private final AtomicBoolean resolved = new AtomicBoolean(false);

  public PendingRequest(String line) {
    this.line = requireNonNull(line, "line must not be null");
  }

  public String line() {
    return line;
  }

  public CompletableFuture<String> response() {
    return response;
  }

  @Override
  public void send(String responseLine) {
    if (resolved.compareAndSet(false, true)) {
      response.complete(responseLine);
    } else {
      logger.warn("Dropping second response for an already answered request: {}", responseLine);
    }
  }

  /**
   * Fails the request without a response, e.g. when the scheduler stops before running it.
   *
   * @param cause the reason
   */
  void abort(Throwable cause) {
    if (resolved.compareAndSet(false, true)) {
      response.completeExceptionally(cause);
    }
  }
}
