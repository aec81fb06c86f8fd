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

package io.github.suppierk.es.projection;

import io.github.suppierk.es.cqrs.DomainEvent;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Explicit, read-only table of every {@link SingleStreamProjection} known to the system.
 *
 * <p>The registry is built once at startup and never changes afterwards, which makes it safe to
 * share between concurrently executing commands.
 */
public final class ProjectionRegistry {
  private final Map<String, SingleStreamProjection<?>> projectionsByName;
  private final Map<Class<?>, SingleStreamProjection<?>> projectionsByDocumentType;
  private final Map<String, Class<? extends DomainEvent>> eventTypesByName;

  private ProjectionRegistry(final List<SingleStreamProjection<?>> projections) {
    final Map<String, SingleStreamProjection<?>> byName = new LinkedHashMap<>();
    final Map<Class<?>, SingleStreamProjection<?>> byDocumentType = new HashMap<>();
    final Map<String, Class<? extends DomainEvent>> eventTypes = new HashMap<>();

    for (SingleStreamProjection<?> projection : projections) {
      if (projection == null) {
        throw new IllegalArgumentException("Projection cannot be null");
      }

      if (projection.creatingEventType() == null) {
        throw new IllegalStateException(
            "Projection '%s' does not declare a creating event".formatted(projection.name()));
      }

      if (byName.putIfAbsent(projection.name(), projection) != null) {
        throw new IllegalStateException(
            "Projection '%s' is already registered".formatted(projection.name()));
      }

      if (byDocumentType.putIfAbsent(projection.documentType(), projection) != null) {
        throw new IllegalStateException(
            "Document type '%s' is already projected"
                .formatted(projection.documentType().getSimpleName()));
      }

      for (Class<? extends DomainEvent> eventType : projection.eventTypes()) {
        final var existing = eventTypes.putIfAbsent(eventType.getSimpleName(), eventType);
        if (existing != null && !existing.equals(eventType)) {
          throw new IllegalStateException(
              "Event type name '%s' is ambiguous".formatted(eventType.getSimpleName()));
        }
      }
    }

    this.projectionsByName = Collections.unmodifiableMap(byName);
    this.projectionsByDocumentType = Collections.unmodifiableMap(byDocumentType);
    this.eventTypesByName = Collections.unmodifiableMap(eventTypes);
  }

  /**
   * @param projections to register
   * @return a new registry
   * @throws IllegalStateException if names, document types or event type names collide
   */
  public static ProjectionRegistry of(final SingleStreamProjection<?>... projections) {
    if (projections == null) {
      throw new IllegalArgumentException("Projections cannot be null");
    }

    return new ProjectionRegistry(Arrays.asList(projections));
  }

  /**
   * @return every registered projection in registration order
   */
  public List<SingleStreamProjection<?>> all() {
    return List.copyOf(projectionsByName.values());
  }

  /**
   * @param name of the projection
   * @return the projection, if registered
   */
  public Optional<SingleStreamProjection<?>> findByName(final String name) {
    return Optional.ofNullable(name).map(projectionsByName::get);
  }

  /**
   * @param documentType projected document class
   * @param <DOC> is the type of the projected document
   * @return the projection producing documents of the given type
   * @throws UnsupportedOperationException if no projection produces the given type
   */
  @SuppressWarnings("unchecked")
  public <DOC> SingleStreamProjection<DOC> forDocumentType(final Class<DOC> documentType) {
    final var projection =
        documentType == null ? null : projectionsByDocumentType.get(documentType);

    if (projection == null) {
      throw new UnsupportedOperationException(
          "No projection registered for document type '%s'"
              .formatted(documentType == null ? "null" : documentType.getSimpleName()));
    }

    return (SingleStreamProjection<DOC>) projection;
  }

  /**
   * @param eventTypeName stored type name of an event
   * @return class of the event
   * @throws IllegalStateException if no registered projection understands the event
   */
  public Class<? extends DomainEvent> eventType(final String eventTypeName) {
    final var eventType = eventTypeName == null ? null : eventTypesByName.get(eventTypeName);

    if (eventType == null) {
      throw new IllegalStateException("Unknown event type '%s'".formatted(eventTypeName));
    }

    return eventType;
  }

  /**
   * @param event to name
   * @return stored type name of the event
   * @throws IllegalStateException if no registered projection understands the event
   */
  public String eventTypeName(final DomainEvent event) {
    final String name = event.getClass().getSimpleName();

    if (!event.getClass().equals(eventTypesByName.get(name))) {
      throw new IllegalStateException("Unknown event type '%s'".formatted(name));
    }

    return name;
  }
}
