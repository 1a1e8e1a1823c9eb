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

import fr.aneo.automation.domain.SessionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * Registry of the seed bundles bound to live sessions, indexed by instance identity.
 * <p>
 * A session's bundle is first registered under its <em>predicted</em> identity, before the
 * engine instance exists. Once the engine reports the identity it actually assigned, the
 * session is {@linkplain #reconcile(SessionId, int) reconciled}: if the identities differ, the
 * bundle is re-derived under the actual identity, registered there, and the predicted
 * registration is retired. Every lookup after reconciliation resolves the actual identity.
 * </p>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>An identity is claimed by at most one session at a time.</li>
 *   <li>A session is reconciled at most once. Repeating the reconciliation with the same
 *       actual identity returns the same bundle; a different actual identity is rejected.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * This class is thread-safe. Claims go through {@link ConcurrentHashMap#putIfAbsent}; the
 * reconciliation of one session is serialized on that session's binding.
 * </p>
 *
 * @see SeedProtocol
 */
public final class SeedRegistry {
  private static final Logger logger = LoggerFactory.getLogger(SeedRegistry.class);

  private final SessionSeed sessionSeed;
  private final Map<Integer, Binding> byIdentity = new ConcurrentHashMap<>();
  private final Map<SessionId, Binding> bySession = new ConcurrentHashMap<>();

  public SeedRegistry(SessionSeed sessionSeed) {
    this.sessionSeed = requireNonNull(sessionSeed, "sessionSeed must not be null");
  }

  public SessionSeed sessionSeed() {
    return sessionSeed;
  }

  /**
   * Derives and registers the bundle of a session under its predicted identity.
   *
   * @param sessionId         the session being created
   * @param predictedIdentity the identity the engine is expected to assign
   * @return the bundle derived for the predicted identity
   * @throws IllegalStateException if the session is already registered, or the identity is
   *                               claimed by another session
   */
  public SeedBundle registerPredicted(SessionId sessionId, int predictedIdentity) {
    requireNonNull(sessionId, "sessionId must not be null");

    var bundle = SeedProtocol.deriveSeeds(SeedProtocol.deriveIdentityKey(sessionSeed.value(), predictedIdentity));
    var binding = new Binding(sessionId, predictedIdentity, bundle);

    if (bySession.putIfAbsent(sessionId, binding) != null) {
      throw new IllegalStateException("Session " + sessionId.asString() + " already has a seed registration");
    }
    var previous = byIdentity.putIfAbsent(predictedIdentity, binding);
    if (previous != null) {
      bySession.remove(sessionId, binding);
      throw new IllegalStateException("Identity " + predictedIdentity + " is already claimed by session " + previous.sessionId.asString());
    }

    logger.debug("Registered seeds for session {} under predicted identity {} (key {})", sessionId.asString(), predictedIdentity, bundle.identityKey());
    return bundle;
  }

  /**
   * Binds a session to the identity the engine actually assigned.
   * <p>
   * When the actual identity equals the predicted one, the predicted registration simply
   * becomes final. Otherwise the bundle is re-derived under the actual identity, which must not
   * be claimed by another session, and the predicted identity is released.
   * </p>
   *
   * @param sessionId      a session previously passed to {@link #registerPredicted(SessionId, int)}
   * @param actualIdentity the identity reported by the engine
   * @return the final bundle of the session
   * @throws IllegalStateException if the session is unknown, was already reconciled to a
   *                               different identity, or the actual identity is claimed by
   *                               another session
   */
  public SeedBundle reconcile(SessionId sessionId, int actualIdentity) {
    requireNonNull(sessionId, "sessionId must not be null");
    var binding = bySession.get(sessionId);
    if (binding == null) {
      throw new IllegalStateException("Session " + sessionId.asString() + " has no seed registration to reconcile");
    }

    synchronized (binding) {
      if (binding.reconciled) {
        if (binding.identity != actualIdentity) {
          throw new IllegalStateException("Session " + sessionId.asString() + " was already reconciled to identity "
            + binding.identity + ", refusing identity " + actualIdentity);
        }
        return binding.bundle;
      }

      if (binding.identity != actualIdentity) {
        var owner = byIdentity.get(actualIdentity);
        if (owner != null && owner != binding) {
          throw new IllegalStateException("Identity " + actualIdentity + " is already claimed by session " + owner.sessionId.asString());
        }
        var predictedIdentity = binding.identity;
        var bundle = SeedProtocol.deriveSeeds(SeedProtocol.deriveIdentityKey(sessionSeed.value(), actualIdentity));
        if (byIdentity.putIfAbsent(actualIdentity, binding) != null) {
          throw new IllegalStateException("Identity " + actualIdentity + " was claimed concurrently by another session");
        }
        byIdentity.remove(predictedIdentity, binding);
        binding.identity = actualIdentity;
        binding.bundle = bundle;

        logger.warn("Session {} predicted identity {} but engine assigned {}. Seeds re-derived under key {}",
          sessionId.asString(), predictedIdentity, actualIdentity, bundle.identityKey());
      }

      binding.reconciled = true;
      return binding.bundle;
    }
  }

  /**
   * Looks up the bundle registered under an identity, as the engine side does.
   *
   * @param identity a predicted or reconciled identity
   * @return the bundle, or empty if no live session claims the identity
   */
  public Optional<SeedBundle> lookup(int identity) {
    var binding = byIdentity.get(identity);
    if (binding == null) {
      return Optional.empty();
    }
    synchronized (binding) {
      return binding.identity == identity ? Optional.of(binding.bundle) : Optional.empty();
    }
  }

  /**
   * Returns the current bundle of a session.
   *
   * @param sessionId the session
   * @return its bundle, or empty if the session is not registered
   */
  public Optional<SeedBundle> bundleOf(SessionId sessionId) {
    var binding = bySession.get(sessionId);
    if (binding == null) {
      return Optional.empty();
    }
    synchronized (binding) {
      return Optional.of(binding.bundle);
    }
  }

  /**
   * Reports whether the given session has been reconciled.
   *
   * @param sessionId the session
   * @return {@code true} once {@link #reconcile(SessionId, int)} succeeded for it
   */
  public boolean isReconciled(SessionId sessionId) {
    var binding = bySession.get(sessionId);
    if (binding == null) {
      return false;
    }
    synchronized (binding) {
      return binding.reconciled;
    }
  }

  /**
   * Releases the identity claim of a session. No-op for unknown sessions.
   *
   * @param sessionId the session being torn down
   */
  public void unregister(SessionId sessionId) {
    var binding = bySession.remove(sessionId);
    if (binding == null) {
      return;
    }
    synchronized (binding) {
      byIdentity.remove(binding.identity, binding);
    }
    logger.debug("Released seed registration of session {}", sessionId.asString());
  }

  /**
   * Returns the number of registered sessions.
   *
   * @return the registration count
   */
  public int size() {
    return bySession.size();
  }

  private static final class Binding {
    private final SessionId sessionId;
    private int identity;
    private SeedBundle bundle;
    private boolean reconciled;

    private Binding(SessionId sessionId, int identity, SeedBundle bundle) {
      this.sessionId = sessionId;
      this.identity = identity;
      this.bundle = bundle;
    }
  }
}
