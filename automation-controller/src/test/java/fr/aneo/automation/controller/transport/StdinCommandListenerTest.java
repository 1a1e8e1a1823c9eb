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

import fr.aneo.automation.controller.command.CommandCodec;
import fr.aneo.automation.controller.command.CommandScheduler;
import fr.aneo.automation.controller.pool.SessionPool;
import fr.aneo.automation.controller.pool.SessionPoolConfig;
import fr.aneo.automation.controller.testutils.FakeEngine;
import fr.aneo.automation.controller.testutils.RecordingResponseChannel;
import fr.aneo.automation.domain.seed.SeedRegistry;
import fr.aneo.automation.domain.seed.SessionSeed;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

@Timeout(10)
class StdinCommandListenerTest {

  private SessionPool pool;
  private RecordingResponseChannel sharedOutput;
  private CommandScheduler scheduler;

  @BeforeEach
  void setUp() {
    var engine = new FakeEngine();
    pool = new SessionPool(engine, new SeedRegistry(SessionSeed.ZERO), SessionPoolConfig.DEFAULT);
    sharedOutput = new RecordingResponseChannel();
    scheduler = new CommandScheduler(pool, engine, new CommandCodec(), sharedOutput);
  }

  @AfterEach
  void tearDown() {
    scheduler.close();
    pool.close();
  }

  @Test
  @DisplayName("should submit every non-blank line and stop the scheduler once drained at end of input")
  void should_submit_every_non_blank_line_and_stop_the_scheduler_once_drained_at_end_of_input() throws Exception {
    // Given
    var input = new ByteArrayInputStream((
      "{\"id\":1,\"method\":\"createContext\"}\n"
        + "\n"
        + "   \n"
        + "  {\"id\":2,\"method\":\"listContexts\"}  \n").getBytes(UTF_8));
    var listener = new StdinCommandListener(input, scheduler);

    // When
    listener.start();
    scheduler.run();

    // Then
    assertThat(sharedOutput.lines()).containsExactly(
      "{\"id\":1,\"result\":\"ctx_000001\"}",
      "{\"id\":2,\"result\":[\"ctx_000001\"]}");
    assertThat(scheduler.awaitTermination(Duration.ZERO)).isTrue();
    listener.join(1_000);
  }

  @Test
  @DisplayName("should stop the scheduler when standard input fails")
  void should_stop_the_scheduler_when_standard_input_fails() throws Exception {
    // Given
    var input = new InputStream() {
      @Override
      public int read() throws IOException {
        throw new IOException("stream broken");
      }
    };
    var listener = new StdinCommandListener(input, scheduler);

    // When
    listener.start();
    listener.join(5_000);

    // Then
    assertThat(scheduler.isStopRequested()).isTrue();
  }

  @Test
  @DisplayName("close should close the input stream and end the reader without stopping the scheduler")
  void close_should_close_the_input_stream_and_end_the_reader_without_stopping_the_scheduler() throws Exception {
    // Given
    var streamClosed = new CountDownLatch(1);
    var readerDone = new AtomicBoolean(false);
    var input = new InputStream() {
      @Override
      public int read() throws IOException {
        try {
          streamClosed.await();
          throw new IOException("Stream closed");
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IOException("interrupted", e);
        } finally {
          readerDone.set(true);
        }
      }

      @Override
      public void close() {
        streamClosed.countDown();
      }
    };
    var listener = new StdinCommandListener(input, scheduler);
    listener.start();

    // When
    listener.close();
    listener.close();
    listener.join(5_000);

    // Then
    assertThat(streamClosed.getCount()).isZero();
    assertThat(readerDone).isTrue();
    assertThat(scheduler.isStopRequested()).isFalse();
  }
}
