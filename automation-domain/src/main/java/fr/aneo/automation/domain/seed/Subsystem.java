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

/**
 * Spoofed subsystems that receive their own pseudorandom seed.
 * <p>
 * The {@linkplain #label() label} takes part in the hash input, so renaming a label changes
 * every derived seed for that subsystem. Labels must stay identical in every process that
 * derives seeds.
 */
public enum Subsystem {
  CANVAS("canvas"),
  WEBGL("webgl"),
  AUDIO("audio"),
  FONTS("fonts"),
  CLIENT_RECTS("client_rects"),
  NAVIGATOR("navigator"),
  SCREEN("screen");

  private final String label;

  Subsystem(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
