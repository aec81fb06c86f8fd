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

package io.github.suppierk.es.session;

import io.github.suppierk.es.cqrs.DomainEvent;
import java.time.Instant;
import java.util.UUID;

/**
 * Appended by the command pipeline for every command executed on behalf of an open session.
 *
 * @param sessionId of the acting session
 * @param accessedAt when the command was executed
 */
public record SessionActivityRecorded(UUID sessionId, Instant accessedAt) implements DomainEvent {
  @Override
  public Instant occurredAt() {
    return accessedAt;
  }
}
