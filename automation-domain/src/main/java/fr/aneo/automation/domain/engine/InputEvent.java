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
package fr.aneo.automation.domain.engine;

import static java.util.Objects.requireNonNull;

/**
 * A synthetic input event delivered to an engine instance.
 *
 * @param type the kind of event
 * @param x    horizontal viewport coordinate for pointer events, 0 otherwise
 * @param y    vertical viewport coordinate for pointer events, 0 otherwise
 * @param text the typed text or key name for keyboard events, {@code null} otherwise
 */
public record InputEvent(Type type, int x, int y, String text) {

  public enum Type {
    MOUSE_MOVE,
    MOUSE_CLICK,
    KEY_PRESS,
    TEXT_INPUT
  }

  public InputEvent {
    requireNonNull(type, "type must not be null");
  }

  public static InputEvent mouseMove(int x, int y) {
    return new InputEvent(Type.MOUSE_MOVE, x, y, null);
  }

  public static InputEvent mouseClick(int x, int y) {
    return new InputEvent(Type.MOUSE_CLICK, x, y, null);
  }

  public static InputEvent keyPress(String key) {
    return new InputEvent(Type.KEY_PRESS, 0, 0, requireNonNull(key, "key must not be null"));
  }

  public static InputEvent textInput(String text) {
    return new InputEvent(Type.TEXT_INPUT, 0, 0, requireNonNull(text, "text must not be null"));
  }
}
