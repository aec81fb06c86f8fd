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
 * Operational command to regenerate projected documents from their event history.
 *
 * @param sessionId of the acting session
 * @param projectionName to rebuild, {@code null} or blank to rebuild every known projection
 */
public record RebuildProjections(UUID sessionId, String projectionName)
    implements DomainCommand.InSession {

  /**
   * @param sessionId of the acting session
   * @return a command to rebuild every known projection
   */
  public static RebuildProjections all(final UUID sessionId) {
    return new RebuildProjections(sessionId, null);
  }
}
