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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import fr.aneo.automation.domain.AutomationException;
import fr.aneo.automation.domain.InvalidCommandException;
import fr.aneo.automation.domain.SessionId;
import fr.aneo.automation.domain.UnknownMethodException;

import java.lang.reflect.Type;

import static java.util.Objects.requireNonNull;

/**
 * Gson based codec of the line protocol.
 * <p>
 * Requests are single-line JSON objects:
 * </p>
 * <pre>{@code
 * {"id": 7, "method": "navigate", "context_id": "ctx_000001", "url": "https://example.org"}
 * }</pre>
 * <p>
 * Responses are single-line JSON objects carrying either a result or an error string:
 * </p>
 * <pre>{@code
 * {"id":7,"result":true}
 * {"id":8,"error":"SessionNotFound: no session with id ctx_000042"}
 * }</pre>
 *
 * <h2>Decoding rules</h2>
 * <ul>
 *   <li>a line that is not a JSON object is rejected with {@code InvalidCommand} and id 0;</li>
 *   <li>a missing or non-numeric {@code id} is rejected with {@code InvalidCommand};</li>
 *   <li>a missing {@code method} is rejected with {@code InvalidCommand}, an unknown one with
 *       {@code UnknownMethod}, both under the command's id.</li>
 * </ul>
 *
 * <p>This class is thread-safe.</p>
 */
public final class CommandCodec {

  static final String ID = "id";
  static final String METHOD = "method";
  static final String RESULT = "result";
  static final String ERROR = "error";

  private final Gson gson;

  public CommandCodec() {
    this.gson = new GsonBuilder()
      .registerTypeAdapter(SessionId.class, new SessionIdSerializer())
      .disableHtmlEscaping()
      .serializeNulls()
      .create();
  }

  /**
   * Decodes one inbound line. Never throws for malformed input.
   *
   * @param line the raw line, without its terminator
   * @return the decoded command or the rejection to reply with
   */
  public DecodedLine decode(String line) {
    requireNonNull(line, "line must not be null");

    JsonObject root;
    try {
      var element = JsonParser.parseString(line);
      if (!element.isJsonObject()) {
        return new DecodedLine.Rejected(0, new InvalidCommandException("command must be a JSON object"));
      }
      root = element.getAsJsonObject();
    } catch (JsonParseException e) {
      return new DecodedLine.Rejected(0, new InvalidCommandException("malformed JSON: " + e.getMessage(), e));
    }

    var idElement = root.get(ID);
    if (idElement == null || !idElement.isJsonPrimitive() || !idElement.getAsJsonPrimitive().isNumber()) {
      return new DecodedLine.Rejected(0, new InvalidCommandException("command requires a numeric 'id'"));
    }
    long id = idElement.getAsLong();

    var methodElement = root.get(METHOD);
    if (methodElement == null || !methodElement.isJsonPrimitive() || !methodElement.getAsJsonPrimitive().isString()) {
      return new DecodedLine.Rejected(id, new InvalidCommandException("command requires a string 'method'"));
    }
    var method = methodElement.getAsString();

    return CommandKind.fromWireName(method)
                      .<DecodedLine>map(kind -> new DecodedLine.Valid(new Command(id, kind, root)))
                      .orElseGet(() -> new DecodedLine.Rejected(id, new UnknownMethodException(method)));
  }

  /**
   * Encodes a successful response.
   *
   * @param id     the command id
   * @param result the result; {@code null} is encoded as JSON {@code null}
   * @return the single-line response
   */
  public String encodeResult(long id, JsonElement result) {
    var response = new JsonObject();
    response.addProperty(ID, id);
    response.add(RESULT, result == null ? JsonNull.INSTANCE : result);
    return gson.toJson(response);
  }

  /**
   * Encodes an error response, using the exception's wire message.
   *
   * @param id    the command id
   * @param error the failure
   * @return the single-line response
   */
  public String encodeError(long id, AutomationException error) {
    var response = new JsonObject();
    response.addProperty(ID, id);
    response.addProperty(ERROR, error.toWireMessage());
    return gson.toJson(response);
  }

  /**
   * Converts a value to its JSON tree, with session identifiers written as plain strings.
   *
   * @param value the value to convert
   * @return its JSON representation
   */
  public JsonElement toJsonTree(Object value) {
    return gson.toJsonTree(value);
  }

  private static final class SessionIdSerializer implements JsonSerializer<SessionId> {
    @Override
    public JsonElement serialize(SessionId sessionId, Type typeOfSrc, JsonSerializationContext context) {
      return new JsonPrimitive(sessionId.asString());
    }
  }
}
