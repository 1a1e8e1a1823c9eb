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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import fr.aneo.automation.controller.pool.OperationScope;
import fr.aneo.automation.controller.pool.SessionPool;
import fr.aneo.automation.domain.AutomationException;
import fr.aneo.automation.domain.CommandTimeoutException;
import fr.aneo.automation.domain.ErrorCode;
import fr.aneo.automation.domain.InvalidCommandException;
import fr.aneo.automation.domain.SessionNotFoundException;
import fr.aneo.automation.domain.engine.Engine;
import fr.aneo.automation.domain.engine.InputEvent;
import fr.aneo.automation.domain.engine.SessionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Executes decoded commands against the session pool and the engine.
 * <p>
 * The executor is stateless apart from its collaborators and is called from both the
 * engine-affine thread and worker threads; choosing the thread is the
 * {@link CommandScheduler}'s job.
 * </p>
 *
 * <h2>Responses</h2>
 * <p>
 * Every call produces exactly one response on the given {@link ResponseChannel}. Failures of the
 * error taxonomy become error responses with their own code; any other exception becomes an
 * {@code InternalError} response and is logged with its stack trace. No exception escapes.
 * </p>
 *
 * <h2>Session operations</h2>
 * <p>
 * Commands targeting a session run inside an {@link OperationScope}, which keeps the session's
 * active operation count raised until the command has finished.
 * </p>
 */
public class CommandExecutor {
  private static final Logger logger = LoggerFactory.getLogger(CommandExecutor.class);

  static final long DEFAULT_NAVIGATION_TIMEOUT_MS = 30_000;
  static final Duration NAVIGATION_POLL_INTERVAL = Duration.ofMillis(50);

  private final SessionPool pool;
  private final Engine engine;
  private final CommandCodec codec;
  private final Runnable shutdownRequest;

  /**
   * @param pool            the session pool
   * @param engine          the engine collaborator
   * @param codec           the response encoder
   * @param shutdownRequest invoked after the reply to a {@code shutdown} command has been sent
   */
  public CommandExecutor(SessionPool pool, Engine engine, CommandCodec codec, Runnable shutdownRequest) {
    this.pool = requireNonNull(pool, "pool must not be null");
    this.engine = requireNonNull(engine, "engine must not be null");
    this.codec = requireNonNull(codec, "codec must not be null");
    this.shutdownRequest = requireNonNull(shutdownRequest, "shutdownRequest must not be null");
  }

  /**
   * Runs a command and sends its response.
   *
   * @param command the command
   * @param replyTo where the response goes
   */
  public void execute(Command command, ResponseChannel replyTo) {
    MDC.put("commandId", Long.toString(command.id()));
    MDC.put("method", command.kind().wireName());
    if (command.params().has(Command.CONTEXT_ID)) {
      putSessionId(command);
    }

    long startTime = System.nanoTime();
    try {
      var result = dispatch(command);
      replyTo.send(codec.encodeResult(command.id(), result));
      logger.debug("Command completed in {}ms", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime));

      if (command.kind() == CommandKind.SHUTDOWN) {
        logger.info("Shutdown requested by command {}", command.id());
        shutdownRequest.run();
      }
    } catch (AutomationException e) {
      logger.debug("Command failed after {}ms: {}", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime), e.toWireMessage());
      replyTo.send(codec.encodeError(command.id(), e));
    } catch (Exception e) {
      var message = e.getMessage() != null ? e.getMessage() : e.toString();
      logger.error("Command failed after {}ms with unexpected exception: {}", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime), message, e);
      replyTo.send(codec.encodeError(command.id(), new AutomationException(ErrorCode.INTERNAL_ERROR, message, e)));
    } finally {
      MDC.clear();
    }
  }

  /**
   * Sends the error response of a line that could not be decoded.
   *
   * @param rejected the rejection
   * @param replyTo  where the response goes
   */
  public void reject(DecodedLine.Rejected rejected, ResponseChannel replyTo) {
    logger.debug("Rejecting command {}: {}", rejected.id(), rejected.error().toWireMessage());
    replyTo.send(codec.encodeError(rejected.id(), rejected.error()));
  }

  private JsonElement dispatch(Command command) {
    return switch (command.kind()) {
      case CREATE_CONTEXT -> createContext(command);
      case RELEASE_CONTEXT -> releaseContext(command);
      case CLOSE_CONTEXT -> closeContext(command);
      case PREWARM_CONTEXTS -> prewarmContexts(command);
      case LIST_CONTEXTS -> listContexts();
      case SHUTDOWN -> new JsonPrimitive(true);
      case NAVIGATE -> withSession(command, scope -> engine.navigate(scope.handle(), command.requireString("url")));
      case CLICK -> withSession(command, scope -> engine.sendInputEvent(scope.handle(), InputEvent.mouseClick(command.requireInt("x"), command.requireInt("y"))));
      case HOVER -> withSession(command, scope -> engine.sendInputEvent(scope.handle(), InputEvent.mouseMove(command.requireInt("x"), command.requireInt("y"))));
      case TYPE -> withSession(command, scope -> engine.sendInputEvent(scope.handle(), InputEvent.textInput(command.requireString("text"))));
      case PRESS_KEY -> withSession(command, scope -> engine.sendInputEvent(scope.handle(), InputEvent.keyPress(command.requireString("key"))));
      case POST_MESSAGE -> withSession(command, scope -> engine.sendSidechannelMessage(scope.handle(), payloadOf(command)));
      case WAIT_FOR_NAVIGATION -> waitForNavigation(command);
      case WAIT_FOR_TIMEOUT -> waitForTimeout(command);
      case GET_CONTEXT_INFO -> contextInfo(command);
      case GET_RESOURCE_STATS -> resourceStats();
    };
  }

  private JsonElement createContext(Command command) {
    var sessionId = pool.create(sessionOptionsOf(command));
    MDC.put("sessionId", sessionId.asString());
    return new JsonPrimitive(sessionId.asString());
  }

  private JsonElement prewarmContexts(Command command) {
    int count = (int) nonNegative(command, "count", command.requireInt("count"));
    return new JsonPrimitive(pool.prewarm(count, sessionOptionsOf(command)));
  }

  private JsonElement releaseContext(Command command) {
    pool.release(command.sessionId());
    return new JsonPrimitive(true);
  }

  private JsonElement closeContext(Command command) {
    pool.close(command.sessionId());
    return new JsonPrimitive(true);
  }

  private JsonElement listContexts() {
    var ids = new JsonArray();
    pool.listSessions().forEach(info -> ids.add(info.sessionId().asString()));
    return ids;
  }

  private JsonElement withSession(Command command, SessionAction action) {
    try (var scope = pool.beginOperation(command.sessionId())) {
      action.run(scope);
    }
    return new JsonPrimitive(true);
  }

  private JsonElement waitForNavigation(Command command) {
    long timeoutMillis = nonNegative(command, "timeout", command.optionalLong("timeout", DEFAULT_NAVIGATION_TIMEOUT_MS));
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);

    try (var scope = pool.beginOperation(command.sessionId())) {
      while (!engine.isNavigationComplete(scope.handle())) {
        if (System.nanoTime() - deadline >= 0) {
          throw new CommandTimeoutException("navigation of " + scope.sessionId().asString() + " did not complete within " + timeoutMillis + " ms");
        }
        sleep(NAVIGATION_POLL_INTERVAL.toMillis());
      }
    }
    return new JsonPrimitive(true);
  }

  private JsonElement waitForTimeout(Command command) {
    long timeoutMillis = nonNegative(command, "timeout", command.requireInt("timeout"));
    var sessionId = command.optionalSessionId();
    if (sessionId.isPresent()) {
      try (var ignored = pool.beginOperation(sessionId.get())) {
        sleep(timeoutMillis);
      }
    } else {
      sleep(timeoutMillis);
    }
    return new JsonPrimitive(true);
  }

  private JsonElement contextInfo(Command command) {
    var sessionId = command.sessionId();
    var info = pool.describe(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));

    var json = new JsonObject();
    json.addProperty("context_id", info.sessionId().asString());
    json.addProperty("identity", info.actualIdentity());
    json.addProperty("predicted_identity", info.predictedIdentity());
    json.addProperty("identity_key", info.identityKey());
    json.addProperty("in_use", info.inUse());
    json.addProperty("active_operations", info.activeOperations());
    json.addProperty("age_ms", info.age().toMillis());
    json.addProperty("idle_ms", info.idleFor().toMillis());
    try (var scope = pool.beginOperation(sessionId)) {
      json.addProperty("engine_identity", engine.getIdentifier(scope.handle()));
    }
    return json;
  }

  private JsonElement resourceStats() {
    var stats = pool.stats();

    var json = new JsonObject();
    json.addProperty("contexts", stats.liveSessions());
    json.addProperty("idle_contexts", stats.idleSessions());
    json.addProperty("in_use_contexts", stats.inUseSessions());
    json.addProperty("pending_creations", stats.pendingCreations());
    json.addProperty("estimated_memory_mb", stats.estimatedMemoryMb());
    json.addProperty("pressure_ratio", stats.pressureRatio());
    json.addProperty("pressure_level", stats.pressureLevel().name().toLowerCase());
    json.addProperty("max_contexts", stats.maxSessions());
    json.addProperty("max_memory_mb", stats.maxMemoryMb());
    return json;
  }

  private static SessionOptions sessionOptionsOf(Command command) {
    return new SessionOptions(
      command.optionalBoolean("resource_blocking", SessionOptions.DEFAULT.resourceBlocking()),
      command.optionalString("os").orElse(null),
      command.optionalString("gpu").orElse(null));
  }

  private static String payloadOf(Command command) {
    var payload = command.params().get("payload");
    if (payload == null || payload.isJsonNull()) {
      throw new InvalidCommandException("postMessage requires field 'payload'");
    }
    return payload.isJsonPrimitive() && payload.getAsJsonPrimitive().isString()
      ? payload.getAsString()
      : payload.toString();
  }

  private static long nonNegative(Command command, String field, long value) {
    if (value < 0) {
      throw new InvalidCommandException(command.kind().wireName() + " field '" + field + "' must not be negative, got: " + value);
    }
    return value;
  }

  private static void sleep(long millis) {
    try {
      TimeUnit.MILLISECONDS.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AutomationException(ErrorCode.INTERNAL_ERROR, "interrupted while waiting", e);
    }
  }

  private static void putSessionId(Command command) {
    var element = command.params().get(Command.CONTEXT_ID);
    if (element.isJsonPrimitive()) {
      MDC.put("sessionId", element.getAsString());
    }
  }

  @FunctionalInterface
  private interface SessionAction {
    void run(OperationScope scope);
  }
}
