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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import fr.aneo.automation.controller.command.CommandCodec;
import fr.aneo.automation.controller.command.CommandScheduler;
import fr.aneo.automation.domain.AutomationException;
import fr.aneo.automation.domain.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.AsynchronousCloseException;
import java.nio.channels.Channels;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Multi-client command server on a Unix domain socket.
 * <p>
 * One acceptor thread accepts connections; each connection gets its own handler thread that
 * reads newline-delimited commands. Every command is submitted as an out-of-band request: the
 * handler blocks on the request's future and writes the single reply line back on the same
 * connection, so concurrent clients never see each other's replies.
 * </p>
 *
 * <h2>Socket location</h2>
 * <p>
 * The socket lives at {@code <java.io.tmpdir>/automation_<instanceId>.sock}. A stale file at
 * that path is removed on start, and the file is deleted on close.
 * </p>
 */
public final class IpcServer implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(IpcServer.class);

  private final Path socketPath;
  private final CommandScheduler scheduler;
  private final CommandCodec codec;
  private final ExecutorService connectionHandlers;
  private final Set<SocketChannel> clients = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private ServerSocketChannel server;
  private Thread acceptor;

  public IpcServer(Path socketPath, CommandScheduler scheduler, CommandCodec codec) {
    this.socketPath = requireNonNull(socketPath, "socketPath must not be null");
    this.scheduler = requireNonNull(scheduler, "scheduler must not be null");
    this.codec = requireNonNull(codec, "codec must not be null");
    this.connectionHandlers = Executors.newCachedThreadPool(
      new ThreadFactoryBuilder().setNameFormat("automation-ipc-%d").setDaemon(true).build());
  }

  /**
   * Returns the socket path used for the given controller instance.
   *
   * @param instanceId the instance identifier
   * @return the socket path under the temporary directory
   */
  public static Path socketPathFor(String instanceId) {
    return Path.of(System.getProperty("java.io.tmpdir"), "automation_" + instanceId + ".sock");
  }

  public Path socketPath() {
    return socketPath;
  }

  /**
   * Binds the socket and starts accepting connections.
   *
   * @throws IOException if the socket cannot be bound
   */
  public synchronized void start() throws IOException {
    if (server != null) {
      throw new IllegalStateException("IPC server already started");
    }
    Files.deleteIfExists(socketPath);

    server = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
    server.bind(UnixDomainSocketAddress.of(socketPath));

    acceptor = new Thread(this::acceptLoop, "automation-ipc-acceptor");
    acceptor.setDaemon(true);
    acceptor.start();
    logger.info("IPC server listening on {}", socketPath);
  }

  public int connectedClients() {
    return clients.size();
  }

  private void acceptLoop() {
    while (!closed.get()) {
      try {
        var client = server.accept();
        clients.add(client);
        connectionHandlers.execute(() -> handle(client));
      } catch (AsynchronousCloseException e) {
        logger.debug("IPC acceptor stopped");
        return;
      } catch (IOException e) {
        if (closed.get()) {
          return;
        }
        logger.error("Failed to accept IPC connection", e);
      }
    }
  }

  private void handle(SocketChannel client) {
    logger.debug("IPC client connected");
    try (client;
         var reader = new BufferedReader(Channels.newReader(client, UTF_8));
         var writer = Channels.newWriter(client, UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isBlank()) {
          continue;
        }
        reply(writer, line.strip());
      }
    } catch (IOException e) {
      if (!closed.get()) {
        logger.warn("IPC connection failed: {}", e.getMessage());
      }
    } catch (InterruptedException e) {
      logger.debug("IPC handler interrupted");
      Thread.currentThread().interrupt();
    } finally {
      clients.remove(client);
      logger.debug("IPC client disconnected");
    }
  }

  private void reply(Writer writer, String line) throws IOException, InterruptedException {
    String response;
    try {
      response = scheduler.submitForResponse(line).get();
    } catch (ExecutionException e) {
      var cause = e.getCause() != null ? e.getCause() : e;
      response = codec.encodeError(codec.decode(line).id(), new AutomationException(ErrorCode.INTERNAL_ERROR, "controller is shutting down", cause));
    }
    writer.write(response);
    writer.write('\n');
    writer.flush();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    logger.info("Closing IPC server on {}", socketPath);

    try {
      if (server != null) {
        server.close();
      }
    } catch (IOException e) {
      logger.warn("Failed to close IPC server socket", e);
    }
    for (var client : clients) {
      try {
        client.close();
      } catch (IOException e) {
        logger.debug("Failed to close IPC client connection", e);
      }
    }

    connectionHandlers.shutdown();
    try {
      if (!connectionHandlers.awaitTermination(5, TimeUnit.SECONDS)) {
        connectionHandlers.shutdownNow();
      }
    } catch (InterruptedException e) {
      connectionHandlers.shutdownNow();
      Thread.currentThread().interrupt();
    }

    try {
      Files.deleteIfExists(socketPath);
    } catch (IOException e) {
      logger.warn("Failed to delete socket file {}", socketPath, e);
    }
  }
}
