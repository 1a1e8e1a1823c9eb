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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import fr.aneo.automation.domain.InvalidCommandException;
import fr.aneo.automation.domain.SessionId;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A decoded inbound command.
 * <p>
 * Method-specific fields stay in {@code params}, the original JSON object; the typed accessors
 * below raise {@link InvalidCommandException} when a required field is missing or has the
 * wrong type.
 * </p>
 *
 * @param id     the client correlation id, echoed in the response
 * @param kind   the resolved method
 * @param params the full command object
 */
public record Command(long id, CommandKind kind, JsonObject params) {

  public static final String CONTEXT_ID = "context_id";

  public Command {
    requireNonNull(kind, "kind must not be null");
    requireNonNull(params, "params must not be null");
  }

  public SessionId sessionId() {
    return SessionId.from(requireString(CONTEXT_ID));
  }

  public Optional<SessionId> optionalSessionId() {
    return optionalString(CONTEXT_ID).map(SessionId::from);
  }

  public String requireString(String name) {
    return optionalString(name)
      .orElseThrow(() -> new InvalidCommandException(kind.wireName() + " requires string field '" + name + "'"));
  }

  public Optional<String> optionalString(String name) {
    var element = params.get(name);
    if (element == null || element.isJsonNull()) {
      return Optional.empty();
    }
    if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
      throw new InvalidCommandException("field '" + name + "' must be a string, got: " + element);
    }
    return Optional.of(element.getAsString());
  }

  public int requireInt(String name) {
    var element = params.get(name);
    if (element == null || element.isJsonNull()) {
      throw new InvalidCommandException(kind.wireName() + " requires integer field '" + name + "'");
    }
    return asInt(name, element);
  }

  public long optionalLong(String name, long defaultValue) {
    var element = params.get(name);
    if (element == null || element.isJsonNull()) {
      return defaultValue;
    }
    if (!isNumber(element)) {
      throw new InvalidCommandException("field '" + name + "' must be a number, got: " + element);
    }
    return element.getAsLong();
  }

  public boolean optionalBoolean(String name, boolean defaultValue) {
    var element = params.get(name);
    if (element == null || element.isJsonNull()) {
      return defaultValue;
    }
    if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
      throw new InvalidCommandException("field '" + name + "' must be a boolean, got: " + element);
    }
    return element.getAsBoolean();
  }

  private static int asInt(String name, JsonElement element) {
    if (!isNumber(element)) {
      throw new InvalidCommandException("field '" + name + "' must be a number, got: " + element);
    }
    return element.getAsInt();
  }

  private static boolean isNumber(JsonElement element) {
    return element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber();
  }
}
