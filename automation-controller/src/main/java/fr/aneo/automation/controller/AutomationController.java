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
package fr.aneo.automation.controller;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import fr.aneo.automation.controller.command.CommandCodec;
import fr.aneo.automation.controller.command.CommandScheduler;
import fr.aneo.automation.controller.command.SharedOutputChannel;
import fr.aneo.automation.controller.pool.IdleSessionReaper;
import fr.aneo.automation.controller.pool.SessionPool;
import fr.aneo.automation.controller.transport.IpcServer;
import fr.aneo.automation.controller.transport.StdinCommandListener;
import fr.aneo.automation.domain.engine.Engine;
import fr.aneo.automation.domain.seed.SeedRegistry;
import fr.aneo.automation.domain.seed.SessionSeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * Registry of the controller's long-lived components.
 * <p>
 * One instance is built at startup and owns the seed registry, the session pool, the command
 * scheduler, the housekeeping executor running the idle session reaper, and the transports.
 * Components reach each other through this object's wiring rather than through global
 * accessors.
 * </p>
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>{@link #start()}: starts the reaper and the transports, then announces readiness on the
 *       output stream ({@code MULTI_IPC_READY <socket>} when IPC is enabled, then {@code READY}).</li>
 *   <li>{@link #runScheduler()}: runs the command loop on the calling thread, which becomes the
 *       engine-affine thread, until a {@code shutdown} command, the end of input or
 *       {@link #close()}.</li>
 *   <li>{@link #close()}: stops everything in reverse order and destroys remaining sessions.
 *       Safe to call more than once.</li>
 * </ol>
 */
public final class AutomationController implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(AutomationController.class);

  private final ControllerConfig config;
  private final SeedRegistry seedRegistry;
  private final SessionPool sessionPool;
  private final SharedOutputChannel output;
  private final CommandScheduler scheduler;
  private final ScheduledExecutorService housekeeping;
  private final IdleSessionReaper reaper;
  private final StdinCommandListener stdinListener;
  private final IpcServer ipcServer;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private AutomationController(ControllerConfig config, Engine engine, SessionSeed sessionSeed, InputStream input, PrintStream out) {
    this.config = requireNonNull(config, "config must not be null");
    requireNonNull(engine, "engine must not be null");
    requireNonNull(sessionSeed, "sessionSeed must not be null");

    var codec = new CommandCodec();
    this.seedRegistry = new SeedRegistry(sessionSeed);
    this.sessionPool = new SessionPool(engine, seedRegistry, config.poolConfig());
    this.output = new SharedOutputChannel(requireNonNull(out, "out must not be null"));
    this.scheduler = new CommandScheduler(sessionPool, engine, codec, output);
    this.housekeeping = Executors.newSingleThreadScheduledExecutor(
      new ThreadFactoryBuilder().setNameFormat("automation-housekeeping-%d").setDaemon(true).build());
    this.reaper = new IdleSessionReaper(sessionPool, housekeeping, config.poolConfig().cleanupInterval());
    this.stdinListener = new StdinCommandListener(requireNonNull(input, "input must not be null"), scheduler);
    this.ipcServer = config.ipcEnabled()
      ? new IpcServer(IpcServer.socketPathFor(config.instanceId()), scheduler, codec)
      : null;
  }

  /**
   * Builds the controller and its components without starting anything.
   *
   * @param config      process configuration
   * @param engine      the engine implementation
   * @param sessionSeed the launch-wide fingerprint seed
   * @param input       the command input stream, usually standard input
   * @param out         the response stream, usually standard output
   * @return the controller
   */
  public static AutomationController create(ControllerConfig config, Engine engine, SessionSeed sessionSeed, InputStream input, PrintStream out) {
    return new AutomationController(config, engine, sessionSeed, input, out);
  }

  /**
   * Starts the background components and transports and announces readiness.
   *
   * @throws IOException if the IPC socket cannot be bound
   */
  public void start() throws IOException {
    logger.info("Starting controller {} (max sessions {}, max memory {} MB, seed {})",
      config.instanceId(), config.poolConfig().maxSessions(), config.poolConfig().maxMemoryMb(), seedRegistry.sessionSeed().asUnsignedString());

    reaper.start();
    if (ipcServer != null) {
      ipcServer.start();
      output.send("MULTI_IPC_READY " + ipcServer.socketPath());
    }
    stdinListener.start();
    output.send("READY");
  }

  /**
   * Runs the command loop on the calling thread until it is stopped.
   */
  public void runScheduler() {
    scheduler.run();
  }

  public SessionPool sessionPool() {
    return sessionPool;
  }

  public CommandScheduler scheduler() {
    return scheduler;
  }

  public SeedRegistry seedRegistry() {
    return seedRegistry;
  }

  public IpcServer ipcServer() {
    return ipcServer;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    logger.info("Shutting down controller {}", config.instanceId());

    if (ipcServer != null) {
      ipcServer.close();
    }
    stdinListener.close();
    scheduler.close();
    reaper.close();
    stopHousekeeping();
    sessionPool.close();
    logger.info("Controller {} stopped", config.instanceId());
  }

  private void stopHousekeeping() {
    housekeeping.shutdown();
    try {
      if (!housekeeping.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.warn("Housekeeping tasks still running after 5s, interrupting them");
        housekeeping.shutdownNow();
      }
    } catch (InterruptedException e) {
      housekeeping.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
