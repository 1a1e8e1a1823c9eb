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

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Deterministic derivation of per-session fingerprint seeds.
 * <p>
 * The controller and the engine's in-page agent live in different processes and never talk to
 * each other synchronously, yet both must spoof the same identity values for a given session.
 * They achieve this by deriving everything from two inputs they both know:
 * </p>
 * <ul>
 *   <li>the <strong>session seed</strong>, fixed once per launch and handed to the engine as a
 *       startup parameter;</li>
 *   <li>the <strong>instance identity</strong>, a counter both sides increment once per instance
 *       creation, in the same order.</li>
 * </ul>
 *
 * <h2>Derivation</h2>
 * <pre>
 * identityKey = "ctx_" + unsigned(sessionSeed) + "_" + identity
 * seed(s)     = first 8 bytes (little-endian) of SHA-256(identityKey + ":" + s.label)
 * </pre>
 * <p>
 * Both functions are pure. Any change to the key format, the labels or the hash breaks agreement
 * with engines built against the previous derivation.
 * </p>
 *
 * <p>This class is stateless and thread-safe.</p>
 *
 * @see SeedRegistry
 */
public final class SeedProtocol {

  static final String IDENTITY_KEY_PREFIX = "ctx_";
  static final double AUDIO_FINGERPRINT_BASE = 124.04344968475198;
  static final double AUDIO_FINGERPRINT_SPREAD = 1e-6;

  private static final HashFunction HASH = Hashing.sha256();
  private static final String AUDIO_FINGERPRINT_LABEL = "audio_fingerprint";

  private SeedProtocol() {
  }

  /**
   * Combines the session seed and an instance identity into the canonical identity key.
   *
   * @param sessionSeed the launch-wide seed, interpreted as an unsigned 64-bit value
   * @param identity    the predicted or actual instance identity
   * @return the identity key, e.g. {@code ctx_18446744073709551615_3}
   */
  public static String deriveIdentityKey(long sessionSeed, int identity) {
    return IDENTITY_KEY_PREFIX + Long.toUnsignedString(sessionSeed) + "_" + identity;
  }

  /**
   * Expands an identity key into the full seed bundle.
   *
   * @param identityKey the key produced by {@link #deriveIdentityKey(long, int)}
   * @return the bundle; equal keys always give equal bundles
   * @throws NullPointerException if {@code identityKey} is {@code null}
   */
  public static SeedBundle deriveSeeds(String identityKey) {
    requireNonNull(identityKey, "identityKey must not be null");

    return new SeedBundle(
      identityKey,
      seedFor(identityKey, Subsystem.CANVAS.label()),
      seedFor(identityKey, Subsystem.WEBGL.label()),
      seedFor(identityKey, Subsystem.AUDIO.label()),
      seedFor(identityKey, Subsystem.FONTS.label()),
      seedFor(identityKey, Subsystem.CLIENT_RECTS.label()),
      seedFor(identityKey, Subsystem.NAVIGATOR.label()),
      seedFor(identityKey, Subsystem.SCREEN.label()),
      audioFingerprint(identityKey));
  }

  private static long seedFor(String identityKey, String label) {
    return HASH.hashString(identityKey + ":" + label, UTF_8).asLong();
  }

  // 53 high bits mapped to [0, 1), then scaled into a tiny offset above the base value
  private static double audioFingerprint(String identityKey) {
    long bits = seedFor(identityKey, AUDIO_FINGERPRINT_LABEL);
    double unit = (bits >>> 11) * 0x1.0p-53;
    return AUDIO_FINGERPRINT_BASE + unit * AUDIO_FINGERPRINT_SPREAD;
  }
}
