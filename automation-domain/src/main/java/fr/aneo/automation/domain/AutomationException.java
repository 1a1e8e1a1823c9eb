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
package fr.aneo.automation.domain;

import static java.util.Objects.requireNonNull;

/**
 * Base exception for all automation control plane operations.
 * <p>
 * This unchecked exception carries an {@link ErrorCode} so that the command layer can turn
 * any failure into a per-command error response without inspecting the concrete type.
 * Subclasses exist for each member of the error taxonomy; code that needs to react to a
 * specific failure should catch the subclass, code that only reports errors should catch this
 * type and use {@link #errorCode()}.
 * </p>
 *
 * @see ErrorCode
 */
public class AutomationException extends RuntimeException {

  private final ErrorCode errorCode;

  /**
   * Creates a new exception with the specified code and message.
   *
   * @param errorCode the error category; must not be {@code null}
   * @param message   the detail message explaining the error
   */
  public AutomationException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = requireNonNull(errorCode, "errorCode must not be null");
  }

  /**
   * Creates a new exception with the specified code, message and cause.
   *
   * @param errorCode the error category; must not be {@code null}
   * @param message   the detail message explaining the error
   * @param cause     the underlying cause of this exception; may be {@code null}
   */
  public AutomationException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = requireNonNull(errorCode, "errorCode must not be null");
  }

  /**
   * Returns the error category of this exception.
   *
   * @return the error code, never {@code null}
   */
  public ErrorCode errorCode() {
    return errorCode;
  }

  /**
   * Returns the error string sent to clients: the code's wire name followed by the message.
   *
   * @return the wire representation of this error
   */
  public String toWireMessage() {
    return errorCode.wireName() + ": " + getMessage();
  }
}
