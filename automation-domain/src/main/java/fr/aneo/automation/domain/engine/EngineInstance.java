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
 * Result of a successful {@link Engine#createInstance(InstanceConfig)} call.
 *
 * @param handle         the handle owning the new instance
 * @param actualIdentity the identifier the engine assigned to the instance, which may differ
 *                       from the predicted identity passed in the {@link InstanceConfig}
 */
public record EngineInstance(EngineHandle handle, int actualIdentity) {

  public EngineInstance {
    requireNonNull(handle, "handle must not be null");
  }
}
