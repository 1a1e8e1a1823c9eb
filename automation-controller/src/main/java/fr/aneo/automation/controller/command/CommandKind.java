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

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static fr.aneo.automation.controller.command.Affinity.ENGINE_AFFINE;
import static fr.aneo.automation.controller.command.Affinity.PARALLEL;
import static java.util.stream.Collectors.toUnmodifiableMap;

/**
 * Closed set of commands understood by the controller.
 * <p>
 * The wire method name is resolved once, when a line is decoded. Session lifecycle, navigation,
 * input events and side-channel messages need the engine thread; read-only queries and waits
 * run in parallel.
 * </p>
 */
public enum CommandKind {
  CREATE_CONTEXT("createContext", ENGINE_AFFINE),
  RELEASE_CONTEXT("releaseContext", ENGINE_AFFINE),
  CLOSE_CONTEXT("closeContext", ENGINE_AFFINE),
  PREWARM_CONTEXTS("prewarmContexts", ENGINE_AFFINE),
  LIST_CONTEXTS("listContexts", ENGINE_AFFINE),
  SHUTDOWN("shutdown", ENGINE_AFFINE),
  NAVIGATE("navigate", ENGINE_AFFINE),
  CLICK("click", ENGINE_AFFINE),
  HOVER("hover", ENGINE_AFFINE),
  TYPE("type", ENGINE_AFFINE),
  PRESS_KEY("pressKey", ENGINE_AFFINE),
  POST_MESSAGE("postMessage", ENGINE_AFFINE),
  WAIT_FOR_NAVIGATION("waitForNavigation", PARALLEL),
  WAIT_FOR_TIMEOUT("waitForTimeout", PARALLEL),
  GET_CONTEXT_INFO("getContextInfo", PARALLEL),
  GET_RESOURCE_STATS("getResourceStats", PARALLEL);

  private static final Map<String, CommandKind> BY_WIRE_NAME =
    Arrays.stream(values()).collect(toUnmodifiableMap(CommandKind::wireName, Function.identity()));

  private final String wireName;
  private final Affinity affinity;

  CommandKind(String wireName, Affinity affinity) {
    this.wireName = wireName;
    this.affinity = affinity;
  }

  public String wireName() {
    return wireName;
  }

  public Affinity affinity() {
    return affinity;
  }

  public boolean isEngineAffine() {
    return affinity == ENGINE_AFFINE;
  }

  /**
   * Resolves a wire method name. Matching is case-sensitive.
   *
   * @param wireName the {@code method} field of a command
   * @return the kind, or empty for an unknown method
   */
  public static Optional<CommandKind> fromWireName(String wireName) {
    return Optional.ofNullable(wireName).map(BY_WIRE_NAME::get);
  }
}
