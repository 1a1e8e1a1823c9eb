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
 * Client-supplied options for a new session.
 * <p>
 * The options are passed through to the engine untouched; the pool itself does not interpret
 * them.
 *
 * @param resourceBlocking whether the engine should block ads and trackers
 * @param osFilter         optional operating system the spoofed profile must match, or {@code null}
 * @param gpuFilter        optional GPU vendor the spoofed profile must match, or {@code null}
 */
public record SessionOptions(boolean resourceBlocking, String osFilter, String gpuFilter) {

  public static final SessionOptions DEFAULT = new SessionOptions(true, null, null);
}
