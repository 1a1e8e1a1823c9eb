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
package fr.aneo.automation.controller.transport;

import fr.aneo.automation.controller.command.CommandScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Reads newline-delimited commands from an input stream on a dedicated thread and queues them
 * on the scheduler, replying on the shared output channel.
 * <p>
 * Blank lines are ignored. The end of the stream asks the scheduler to stop once the commands
 * already queued have been dispatched; a read failure stops it immediately. Closing the
 * listener closes the stream, which ends the reader thread without stopping the scheduler.
 * </p>
 */
public final class StdinCommandListener implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(StdinCommandListener.class);

  private final InputStream input;
  private final CommandScheduler scheduler;
  private final Thread thread;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public StdinCommandListener(InputStream input, CommandScheduler scheduler) {
    this.input = requireNonNull(input, "input must not be null");
    this.scheduler = requireNonNull(scheduler, "scheduler must not be null");
    this.thread = new Thread(this::readLoop, "automation-stdin");
    this.thread.setDaemon(true);
  }

  public void start() {
    thread.start();
    logger.debug("Listening for commands on standard input");
  }

  /**
   * Waits for the reader thread to finish.
   *
   * @param timeoutMillis maximum wait
   * @throws InterruptedException if interrupted while waiting
   */
  public void join(long timeoutMillis) throws InterruptedException {
    thread.join(timeoutMillis);
  }

  private void readLoop() {
    try (var reader = new BufferedReader(new InputStreamReader(input, UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isBlank()) {
          continue;
        }
        scheduler.submit(line.strip());
      }
      logger.info("End of standard input, stopping once queued commands are dispatched");
      scheduler.requestStopWhenDrained();
    } catch (IOException e) {
      if (closed.get()) {
        logger.debug("Standard input closed, reader stopped");
        return;
      }
      logger.error("Failed to read standard input, stopping", e);
      scheduler.requestStop();
    }
  }

  /**
   * Closes the input stream. A read blocked on a stream that ignores the close keeps the daemon
   * reader thread alive until the process ends.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      input.close();
      logger.debug("Standard input listener closed");
    } catch (IOException e) {
      logger.warn("Failed to close standard input", e);
    }
  }
}
