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

/**
 * Opaque reference to one engine instance.
 * <p>
 * Handles are produced by {@link Engine#createInstance(InstanceConfig)} and are only meaningful
 * to the engine that produced them. The controller never inspects a handle; it only passes it
 * back to the engine and guarantees that {@link Engine#destroyInstance(EngineHandle)} is called
 * at most once per handle.
 */
public interface EngineHandle {
}
