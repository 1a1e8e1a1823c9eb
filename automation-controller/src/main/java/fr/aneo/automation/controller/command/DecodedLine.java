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

import fr.aneo.automation.domain.AutomationException;

import static java.util.Objects.requireNonNull;

/**
 * Result of decoding one inbound line: either a command to run or an error to reply with.
 * A rejected line still carries the id to reply to, {@code 0} when it could not be read.
 */
public sealed interface DecodedLine {

  long id();

  record Valid(Command command) implements DecodedLine {
    public Valid {
      requireNonNull(command, "command must not be null");
    }

    @Override
    public long id() {
      return command.id();
    }
  }

  record Rejected(long id, AutomationException error) implements DecodedLine {
    public Rejected {
      requireNonNull(error, "error must not be null");
    }
  }
}
