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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import fr.aneo.automation.controller.pool.SessionPool;
import fr.aneo.automation.domain.AutomationException;
import fr.aneo.automation.domain.ErrorCode;
import fr.aneo.automation.domain.engine.Engine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;

/**
 * Turns the stream of inbound command lines into correctly threaded execution against the
 * engine's cooperative event loop.
 * <p>
 * The thread calling {@link #run()} becomes the <em>engine-affine</em> thread. It runs
 * scheduling cycles until a stop is requested:
 * </p>
 * <ol>
 *   <li><strong>Drain</strong>: wait up to 10 ms when there is nothing queued and nothing in
 *       flight, give a burst 2 ms to accumulate, then take every queued command, from both the
 *       shared queue and the out-of-band queue, as one batch.</li>
 *   <li><strong>Classify and dispatch</strong>: in arrival order, engine-affine commands run
 *       synchronously on this thread; parallel commands are handed to a worker thread and not
 *       waited for.</li>
 *   <li><strong>Teardown</strong>: destroy the closed sessions whose operations have ended,
 *       see {@link SessionPool#finishPendingTeardowns()}.</li>
 *   <li><strong>Pump</strong>: call {@link Engine#pumpEventLoopOnce()} exactly once.</li>
 *   <li>When the batch was empty but parallel work is in flight, pause 1 ms.</li>
 * </ol>
 *
 * <h2>Responses</h2>
 * <p>
 * Commands submitted with {@link #submit(String)} reply on the shared output channel. Commands
 * submitted with {@link #submitForResponse(String)} reply into their own {@link PendingRequest},
 * whose future resolves for the original caller only. The response target is passed to the
 * executing thread together with the command.
 * </p>
 *
 * <h2>Shutdown</h2>
 * <p>
 * {@link #requestStop()} raises a flag checked at the top of each cycle. When the loop exits,
 * commands still queued, and any submitted later, receive an error response; in-flight
 * parallel commands are joined.
 * </p>
 */
public final class CommandScheduler implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(CommandScheduler.class);

  static final Duration IDLE_WAIT = Duration.ofMillis(10);
  static final Duration BURST_WINDOW = Duration.ofMillis(2);
  static final Duration BUSY_PAUSE = Duration.ofMillis(1);
  static final Duration WORKER_JOIN_TIMEOUT = Duration.ofSeconds(35);

  private final SessionPool pool;
  private final Engine engine;
  private final CommandCodec codec;
  private final CommandExecutor executor;
  private final ResponseChannel sharedOutput;
  private final ExecutorService workers;

  private final ReentrantLock queueLock = new ReentrantLock();
  private final Condition workAvailable = queueLock.newCondition();
  private final ArrayDeque<Inbound> commandQueue = new ArrayDeque<>();
  private final ArrayDeque<PendingRequest> outOfBandQueue = new ArrayDeque<>();
  private boolean acceptingCommands = true;

  private final AtomicBoolean stopRequested = new AtomicBoolean(false);
  private final AtomicBoolean stopWhenDrained = new AtomicBoolean(false);
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicInteger activeParallelCount = new AtomicInteger();
  private final AtomicLong pumpCount = new AtomicLong();
  private final CountDownLatch terminated = new CountDownLatch(1);

  public CommandScheduler(SessionPool pool, Engine engine, CommandCodec codec, ResponseChannel sharedOutput) {
    this(pool, engine, codec, sharedOutput, Executors.newCachedThreadPool(
      new ThreadFactoryBuilder().setNameFormat("automation-worker-%d").setDaemon(true).build()));
  }

  CommandScheduler(SessionPool pool, Engine engine, CommandCodec codec, ResponseChannel sharedOutput, ExecutorService workers) {
    this.pool = requireNonNull(pool, "pool must not be null");
    this.engine = requireNonNull(engine, "engine must not be null");
    this.codec = requireNonNull(codec, "codec must not be null");
    this.sharedOutput = requireNonNull(sharedOutput, "sharedOutput must not be null");
    this.workers = requireNonNull(workers, "workers must not be null");
    this.executor = new CommandExecutor(pool, engine, codec, this::requestStop);
  }

  /**
   * Queues a command whose response goes to the shared output channel.
   *
   * @param line the raw command line
   */
  public void submit(String line) {
    requireNonNull(line, "line must not be null");
    var inbound = new Inbound(line, sharedOutput);
    if (!enqueue(() -> commandQueue.add(inbound))) {
      logger.warn("Scheduler has stopped, answering late command with an error");
      replyShuttingDown(inbound);
    }
  }

  /**
   * Queues an out-of-band command whose response is delivered to the caller only.
   *
   * @param line the raw command line
   * @return a future resolving to the encoded response line
   */
  public CompletableFuture<String> submitForResponse(String line) {
    var request = new PendingRequest(line);
    if (!enqueue(() -> outOfBandQueue.add(request))) {
      request.abort(new IllegalStateException("Command scheduler has stopped"));
    }
    return request.response();
  }

  /**
   * Runs scheduling cycles on the calling thread until {@link #requestStop()} is called.
   *
   * @throws IllegalStateException if the scheduler is already running or has already run
   */
  public void run() {
    if (!running.compareAndSet(false, true)) {
      throw new IllegalStateException("Command scheduler already started");
    }
    logger.info("Command scheduler running on thread {}", Thread.currentThread().getName());

    try {
      while (!stopRequested.get()) {
        runCycle();
        if (stopWhenDrained.get() && isIdle()) {
          requestStop();
        }
      }
    } finally {
      answerRemaining();
      joinWorkers();
      terminated.countDown();
      logger.info("Command scheduler stopped after {} pumps", pumpCount.get());
    }
  }

  /**
   * Runs one scheduling cycle on the calling thread, which acts as the engine-affine thread.
   */
  void runCycle() {
    var batch = drain();

    for (var inbound : batch) {
      dispatch(inbound);
    }

    try {
      pool.finishPendingTeardowns();
    } catch (RuntimeException e) {
      logger.error("Deferred session teardown failed", e);
    }

    try {
      engine.pumpEventLoopOnce();
    } catch (RuntimeException e) {
      logger.error("Engine event loop pump failed", e);
    }
    pumpCount.incrementAndGet();

    if (batch.isEmpty() && activeParallelCount.get() > 0) {
      pause(BUSY_PAUSE);
    }
  }

  public void requestStop() {
    if (stopRequested.compareAndSet(false, true)) {
      logger.info("Command scheduler stop requested");
    }
    queueLock.lock();
    try {
      workAvailable.signalAll();
    } finally {
      queueLock.unlock();
    }
  }

  /**
   * Requests a stop once every queued command has been dispatched and no parallel command is
   * in flight. Used when the input stream ends.
   */
  public void requestStopWhenDrained() {
    stopWhenDrained.set(true);
    queueLock.lock();
    try {
      workAvailable.signalAll();
    } finally {
      queueLock.unlock();
    }
  }

  public boolean isStopRequested() {
    return stopRequested.get();
  }

  /**
   * Blocks until {@link #run()} has returned.
   *
   * @param timeout the maximum time to wait
   * @return {@code true} if the loop terminated in time
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  public int activeParallelCount() {
    return activeParallelCount.get();
  }

  public long pumpCount() {
    return pumpCount.get();
  }

  /**
   * Stops the loop, waits for it to exit and releases the worker threads.
   */
  @Override
  public void close() {
    requestStop();
    if (running.get()) {
      try {
        if (!awaitTermination(WORKER_JOIN_TIMEOUT.plusSeconds(5))) {
          logger.warn("Command scheduler did not stop in time");
        }
      } catch (InterruptedException e) {
        logger.warn("Interrupted while waiting for the command scheduler to stop");
        Thread.currentThread().interrupt();
      }
    } else {
      answerRemaining();
      joinWorkers();
    }
  }

  private boolean enqueue(Runnable addition) {
    queueLock.lock();
    try {
      if (!acceptingCommands) {
        return false;
      }
      addition.run();
      workAvailable.signalAll();
      return true;
    } finally {
      queueLock.unlock();
    }
  }

  private List<Inbound> drain() {
    boolean hasWork;
    queueLock.lock();
    try {
      if (isQueueEmpty() && activeParallelCount.get() == 0 && !stopRequested.get()) {
        workAvailable.await(IDLE_WAIT.toMillis(), TimeUnit.MILLISECONDS);
      }
      hasWork = !isQueueEmpty();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      requestStop();
      return List.of();
    } finally {
      queueLock.unlock();
    }

    if (!hasWork) {
      return List.of();
    }
    pause(BURST_WINDOW);

    var batch = new ArrayList<Inbound>();
    queueLock.lock();
    try {
      batch.addAll(commandQueue);
      commandQueue.clear();
      outOfBandQueue.forEach(request -> batch.add(new Inbound(request.line(), request)));
      outOfBandQueue.clear();
    } finally {
      queueLock.unlock();
    }
    logger.trace("Drained {} commands", batch.size());
    return batch;
  }

  private boolean isIdle() {
    queueLock.lock();
    try {
      return isQueueEmpty() && activeParallelCount.get() == 0;
    } finally {
      queueLock.unlock();
    }
  }

  private boolean isQueueEmpty() {
    return commandQueue.isEmpty() && outOfBandQueue.isEmpty();
  }

  private void dispatch(Inbound inbound) {
    var decoded = codec.decode(inbound.line());
    if (decoded instanceof DecodedLine.Rejected rejected) {
      executor.reject(rejected, inbound.replyTo());
      return;
    }

    var command = ((DecodedLine.Valid) decoded).command();
    if (command.kind().isEngineAffine()) {
      executor.execute(command, inbound.replyTo());
      return;
    }

    activeParallelCount.incrementAndGet();
    try {
      workers.execute(() -> {
        try {
          executor.execute(command, inbound.replyTo());
        } finally {
          activeParallelCount.decrementAndGet();
        }
      });
    } catch (RejectedExecutionException e) {
      activeParallelCount.decrementAndGet();
      logger.error("Worker pool rejected command {}", command.id(), e);
      inbound.replyTo().send(codec.encodeError(command.id(), new AutomationException(ErrorCode.INTERNAL_ERROR, "worker pool unavailable", e)));
    }
  }

  private void answerRemaining() {
    var remaining = new ArrayList<Inbound>();
    queueLock.lock();
    try {
      acceptingCommands = false;
      remaining.addAll(commandQueue);
      commandQueue.clear();
      outOfBandQueue.forEach(request -> remaining.add(new Inbound(request.line(), request)));
      outOfBandQueue.clear();
    } finally {
      queueLock.unlock();
    }

    if (!remaining.isEmpty()) {
      logger.warn("Answering {} queued commands with a shutdown error", remaining.size());
    }
    remaining.forEach(this::replyShuttingDown);
  }

  private void replyShuttingDown(Inbound inbound) {
    var id = codec.decode(inbound.line()).id();
    inbound.replyTo().send(codec.encodeError(id, new AutomationException(ErrorCode.INTERNAL_ERROR, "controller is shutting down")));
  }

  private void joinWorkers() {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(WORKER_JOIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("Parallel commands still running after {}s, interrupting them", WORKER_JOIN_TIMEOUT.toSeconds());
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      logger.warn("Interrupted while joining parallel commands");
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static void pause(Duration duration) {
    try {
      TimeUnit.MILLISECONDS.sleep(duration.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private record Inbound(String line, ResponseChannel replyTo) {
  }
}
