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

import fr.aneo.automation.domain.SessionId;
import fr.aneo.automation.domain.seed.SeedBundle;

import static java.util.Objects.requireNonNull;

/**
 * Everything the engine needs to create one instance.
 * <p>
 * The seed bundle is derived from the <em>predicted</em> identity before the instance exists, so
 * that the engine can hand consistent fingerprint material to its in-page agent from the very
 * first native call. Should the engine assign a different identity, the pool re-derives the
 * bundle under the actual identity after creation.
 *
 * @param sessionId         the id the session will be registered under
 * @param predictedIdentity the identity the engine is expected to assign
 * @param seeds             the fingerprint seeds derived for the predicted identity
 * @param options           the client-supplied creation options
 */
public record InstanceConfig(SessionId sessionId, int predictedIdentity, SeedBundle seeds, SessionOptions options) {

  public InstanceConfig {
    requireNonNull(sessionId, "sessionId must not be null");
    requireNonNull(seeds, "seeds must not be null");
    requireNonNull(options, "options must not be null");
  }
}
