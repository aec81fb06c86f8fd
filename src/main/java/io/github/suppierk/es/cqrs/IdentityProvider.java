/*
 * Copyright 2024 Roman Khlebnov
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

package io.github.suppierk.es.cqrs;

import java.util.UUID;

/**
 * Source of new unique identifiers for streams.
 *
 * <p>Together with {@link java.time.Clock} allows handlers to stay deterministic under test.
 */
@FunctionalInterface
public interface IdentityProvider {
  /**
   * Similar to {@link java.time.Clock#systemUTC()}.
   *
   * @return an instance of {@link IdentityProvider} backed by {@link UUID#randomUUID()}
   */
  static IdentityProvider random() {
    return UUID::randomUUID;
  }

  /**
   * @return a new unique identifier
   */
  UUID newId();
}
