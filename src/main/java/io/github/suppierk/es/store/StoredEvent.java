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

package io.github.suppierk.es.store;

import io.github.suppierk.es.cqrs.DomainEvent;
import java.util.UUID;

/**
 * An event as it was appended to its stream.
 *
 * @param streamId identifier of the stream
 * @param version position of the event within the stream, starting from {@code 1}
 * @param eventType stored type name of the event
 * @param event deserialized event
 */
public record StoredEvent(UUID streamId, long version, String eventType, DomainEvent event) {}
