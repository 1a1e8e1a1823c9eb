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

import static java.util.Objects.requireNonNull;

/**
 * Per-session pseudorandom fingerprint material.
 * <p>
 * A bundle is a pure function of its identity key (see {@link SeedProtocol#deriveSeeds(String)}),
 * so two processes holding the same key hold bit-identical bundles. Bundles are immutable.
 *
 * @param identityKey      the key the bundle was derived from
 * @param canvasSeed       noise seed for 2D canvas readback
 * @param webglSeed        noise seed for WebGL readback and parameters
 * @param audioSeed        noise seed for audio context output
 * @param fontsSeed        seed for font enumeration variation
 * @param clientRectsSeed  seed for element geometry noise
 * @param navigatorSeed    seed for navigator property variation
 * @param screenSeed       seed for screen property variation
 * @param audioFingerprint the spoofed audio fingerprint value
 */
public record SeedBundle(
  String identityKey,
  long canvasSeed,
  long webglSeed,
  long audioSeed,
  long fontsSeed,
  long clientRectsSeed,
  long navigatorSeed,
  long screenSeed,
  double audioFingerprint
) {

  public SeedBundle {
    requireNonNull(identityKey, "identityKey must not be null");
  }

  /**
   * Returns the seed of the given subsystem.
   *
   * @param subsystem the spoofed subsystem
   * @return its 64-bit seed
   */
  public long seed(Subsystem subsystem) {
    return switch (subsystem) {
      case CANVAS -> canvasSeed;
      case WEBGL -> webglSeed;
      case AUDIO -> audioSeed;
      case FONTS -> fontsSeed;
      case CLIENT_RECTS -> clientRectsSeed;
      case NAVIGATOR -> navigatorSeed;
      case SCREEN -> screenSeed;
    };
  }

  /**
   * Returns the seed of the given subsystem as an unsigned hexadecimal string, the form the
   * in-page agent consumes.
   *
   * @param subsystem the spoofed subsystem
   * @return e.g. {@code "9f3c01aa42d0be17"}
   */
  public String hexSeed(Subsystem subsystem) {
    return Long.toHexString(seed(subsystem));
  }
}
