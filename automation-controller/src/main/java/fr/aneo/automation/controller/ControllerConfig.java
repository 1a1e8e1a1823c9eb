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

import fr.aneo.automation.controller.pool.SessionPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Process-level configuration of the controller, read from environment variables.
 * <p>
 * Every variable is optional. A missing variable keeps the default; an unparsable or
 * non-positive value is reported with a warning and also keeps the default, so a bad setting
 * never prevents startup.
 * </p>
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code AUTOMATION_MAX_SESSIONS}: session limit (default 1000)</li>
 *   <li>{@code AUTOMATION_MAX_MEMORY_MB}: memory budget in MB (default 32000)</li>
 *   <li>{@code AUTOMATION_IDLE_TIMEOUT_SECONDS}: idle eviction timeout (default 120)</li>
 *   <li>{@code AUTOMATION_SESSION_MEMORY_MB}: estimated cost of one session (default 150)</li>
 *   <li>{@code AUTOMATION_CLEANUP_INTERVAL_SECONDS}: period of the background cleanup (default 30)</li>
 *   <li>{@code AUTOMATION_INSTANCE_ID}: names the IPC socket (default: the process id)</li>
 *   <li>{@code AUTOMATION_IPC_ENABLED}: {@code true} or {@code false} (default true)</li>
 * </ul>
 *
 * @param poolConfig the session pool limits
 * @param instanceId the controller instance identifier
 * @param ipcEnabled whether the Unix socket server is started
 */
public record ControllerConfig(SessionPoolConfig poolConfig, String instanceId, boolean ipcEnabled) {
  private static final Logger logger = LoggerFactory.getLogger(ControllerConfig.class);

  static final String ENV_MAX_SESSIONS = "AUTOMATION_MAX_SESSIONS";
  static final String ENV_MAX_MEMORY_MB = "AUTOMATION_MAX_MEMORY_MB";
  static final String ENV_IDLE_TIMEOUT_SECONDS = "AUTOMATION_IDLE_TIMEOUT_SECONDS";
  static final String ENV_SESSION_MEMORY_MB = "AUTOMATION_SESSION_MEMORY_MB";
  static final String ENV_CLEANUP_INTERVAL_SECONDS = "AUTOMATION_CLEANUP_INTERVAL_SECONDS";
  static final String ENV_INSTANCE_ID = "AUTOMATION_INSTANCE_ID";
  static final String ENV_IPC_ENABLED = "AUTOMATION_IPC_ENABLED";

  public ControllerConfig {
    requireNonNull(poolConfig, "poolConfig must not be null");
    requireNonNull(instanceId, "instanceId must not be null");
    if (instanceId.isBlank()) throw new IllegalArgumentException("instanceId must not be blank");
  }

  /**
   * Reads the configuration from the process environment.
   *
   * @return the configuration
   */
  public static ControllerConfig fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Reads the configuration from the given variables.
   *
   * @param environment the variables to read
   * @return the configuration
   */
  public static ControllerConfig fromEnvironment(Map<String, String> environment) {
    var defaults = SessionPoolConfig.DEFAULT;

    var poolConfig = new SessionPoolConfig(
      (int) positive(environment, ENV_MAX_SESSIONS, defaults.maxSessions(), Integer.MAX_VALUE),
      positive(environment, ENV_MAX_MEMORY_MB, defaults.maxMemoryMb(), Long.MAX_VALUE),
      Duration.ofSeconds(positive(environment, ENV_IDLE_TIMEOUT_SECONDS, defaults.idleTimeout().toSeconds(), Long.MAX_VALUE)),
      positive(environment, ENV_SESSION_MEMORY_MB, defaults.estimatedSessionMemoryMb(), Long.MAX_VALUE),
      Duration.ofSeconds(positive(environment, ENV_CLEANUP_INTERVAL_SECONDS, defaults.cleanupInterval().toSeconds(), Long.MAX_VALUE)),
      defaults.closeDrainRetries(),
      defaults.closeDrainInterval());

    var instanceId = environment.get(ENV_INSTANCE_ID);
    if (instanceId == null || instanceId.isBlank()) {
      instanceId = Long.toString(ProcessHandle.current().pid());
      logger.debug("{} is not set, using the process id {}", ENV_INSTANCE_ID, instanceId);
    }

    return new ControllerConfig(poolConfig, instanceId.trim(), flag(environment, ENV_IPC_ENABLED, true));
  }

  private static long positive(Map<String, String> environment, String name, long defaultValue, long maxValue) {
    var value = environment.get(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      long parsed = Long.parseLong(value.trim());
      if (parsed <= 0 || parsed > maxValue) {
        logger.warn("Invalid value in {}: {} (must be positive). Using default: {}", name, value, defaultValue);
        return defaultValue;
      }
      return parsed;
    } catch (NumberFormatException e) {
      logger.warn("Invalid number format for {}: {}. Using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }

  private static boolean flag(Map<String, String> environment, String name, boolean defaultValue) {
    var value = environment.get(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    var normalized = value.trim().toLowerCase();
    if (normalized.equals("true") || normalized.equals("1")) return true;
    if (normalized.equals("false") || normalized.equals("0")) return false;

    logger.warn("Invalid boolean in {}: {}. Using default: {}", name, value, defaultValue);
    return defaultValue;
  }
}
