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

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * Represents an immutable fact appended to exactly one stream.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s: events are never
 * mutated or deleted once appended, and the order of appends within a stream is the order in which
 * projections fold them.
 *
 * <p>Events are persisted as JSON, which is why every component of an event must be serializable
 * by Jackson. The simple class name of the event is used as its stored type name.
 */
public interface DomainEvent extends Serializable {
  /**
   * Defined as {@code sessionId()} rather than {@code getSessionId()} to stay friendly towards Java
   * {@link Record}s.
   *
   * @return the identifier of the session which caused this event, kept for audit
   */
  UUID sessionId();

  /**
   * @return the time when this event happened
   */
  Instant occurredAt();
}
