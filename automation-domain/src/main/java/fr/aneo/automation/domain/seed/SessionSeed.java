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
package fr.aneo.automation.domain.seed;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Launch-wide seed shared by the controller and the engine processes.
 * <p>
 * The seed is read once at startup, from the {@code --session-seed=<n>} launch argument or,
 * failing that, from the {@code AUTOMATION_SESSION_SEED} environment variable. The value is an
 * unsigned 64-bit decimal number.
 * </p>
 * <p>
 * A missing or unparsable seed never prevents startup: the seed falls back to {@code 0}, which
 * keeps fingerprints consistent inside one launch but repeats them across restarts.
 * </p>
 *
 * @param value the seed, interpreted as unsigned
 */
public record SessionSeed(long value) {
  private static final Logger logger = LoggerFactory.getLogger(SessionSeed.class);

  public static final SessionSeed ZERO = new SessionSeed(0L);

  static final String ARGUMENT_PREFIX = "--session-seed=";
  static final String ENV_SESSION_SEED = "AUTOMATION_SESSION_SEED";

  /**
   * Resolves the seed from launch arguments, then environment.
   *
   * @param args        the process arguments
   * @param environment the process environment
   * @return the resolved seed, or {@link #ZERO} when none is usable
   */
  public static SessionSeed resolve(String[] args, Map<String, String> environment) {
    for (var arg : args) {
      if (arg.startsWith(ARGUMENT_PREFIX)) {
        return parse(arg.substring(ARGUMENT_PREFIX.length()), "launch argument");
      }
    }

    var fromEnvironment = environment.get(ENV_SESSION_SEED);
    if (fromEnvironment != null && !fromEnvironment.isBlank()) {
      return parse(fromEnvironment, ENV_SESSION_SEED);
    }

    logger.warn("No session seed provided (argument {} or variable {}). Falling back to 0: fingerprints will repeat across restarts",
      ARGUMENT_PREFIX, ENV_SESSION_SEED);
    return ZERO;
  }

  /**
   * Returns the seed as an unsigned decimal string, the form passed to the engine.
   *
   * @return the unsigned decimal representation
   */
  public String asUnsignedString() {
    return Long.toUnsignedString(value);
  }

  private static SessionSeed parse(String raw, String source) {
    try {
      return new SessionSeed(Long.parseUnsignedLong(raw.trim()));
    } catch (NumberFormatException e) {
      logger.warn("Invalid session seed '{}' from {}. Falling back to 0", raw, source);
      return ZERO;
    }
  }
}
