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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Describes how the events of one stream type are folded into a current-state document.
 *
 * <p>Implementations declare everything in their constructor:
 *
 * <ul>
 *   <li>Exactly one creating event via {@link #createdBy(Class, Function)}.
 *   <li>Every event which can legally follow the creation via {@link #applying(Class,
 *       BiFunction)}.
 *   <li><b>Optional</b>: document properties which must be unique across all documents of this
 *       projection via {@link #uniqueKey(String, Function)}.
 * </ul>
 *
 * <p>Both creation and application must be pure functions of their inputs: rebuilding a document
 * from scratch must reproduce exactly the document maintained incrementally.
 *
 * @param <DOC> the type of the projected document
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public abstract class SingleStreamProjection<DOC> {
  private final String name;
  private final Class<DOC> documentType;
  private final Map<Class<? extends DomainEvent>, BiFunction<DOC, DomainEvent, DOC>> appliers;
  private final Map<String, Function<DOC, String>> uniqueKeys;

  private Class<? extends DomainEvent> creatingEventType;
  private Function<DomainEvent, DOC> creator;

  /**
   * Default constructor.
   *
   * @param name of this projection, also used as the type of the streams it folds
   * @param documentType class of the projected document
   */
  protected SingleStreamProjection(final String name, final Class<DOC> documentType) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Projection name cannot be blank");
    }

    if (documentType == null) {
      throw new IllegalArgumentException("Document type cannot be null");
    }

    this.name = name;
    this.documentType = documentType;
    this.appliers = new LinkedHashMap<>();
    this.uniqueKeys = new LinkedHashMap<>();
  }

  /**
   * @param document to extract the identifier from
   * @return identifier of the document, equal to the identifier of its stream
   */
  public abstract UUID documentId(final DOC document);

  /**
   * Declares the event which starts every stream of this projection.
   *
   * @param eventType class of the creating event
   * @param creation producing the initial document
   * @param <E> is the type of the creating event
   */
  protected final <E extends DomainEvent> void createdBy(
      final Class<E> eventType, final Function<E, DOC> creation) {
    if (eventType == null || creation == null) {
      throw new IllegalArgumentException("Creating event type and function cannot be null");
    }

    if (creatingEventType != null) {
      throw new IllegalStateException(
          "Projection '%s' is already created by '%s'"
              .formatted(name, creatingEventType.getSimpleName()));
    }

    this.creatingEventType = eventType;
    this.creator = event -> creation.apply(eventType.cast(event));
  }

  /**
   * Declares an event which can follow the creation.
   *
   * @param eventType class of the event
   * @param application producing the next document out of the current one and the event
   * @param <E> is the type of the event
   */
  protected final <E extends DomainEvent> void applying(
      final Class<E> eventType, final BiFunction<DOC, E, DOC> application) {
    if (eventType == null || application == null) {
      throw new IllegalArgumentException("Event type and function cannot be null");
    }

    if (appliers.containsKey(eventType)) {
      throw new IllegalStateException(
          "Projection '%s' already applies '%s'".formatted(name, eventType.getSimpleName()));
    }

    appliers.put(
        eventType, (document, event) -> application.apply(document, eventType.cast(event)));
  }

  /**
   * Declares a document property which storage must keep unique across all documents of this
   * projection. {@code null} values are not indexed.
   *
   * @param keyName unique within this projection
   * @param extractor of the property value
   */
  protected final void uniqueKey(final String keyName, final Function<DOC, String> extractor) {
    if (keyName == null || keyName.isBlank() || extractor == null) {
      throw new IllegalArgumentException("Unique key name and extractor cannot be null");
    }

    if (uniqueKeys.putIfAbsent(keyName, extractor) != null) {
      throw new IllegalStateException(
          "Projection '%s' already has unique key '%s'".formatted(name, keyName));
    }
  }

  /**
   * @return name of this projection
   */
  public final String name() {
    return name;
  }

  /**
   * @return class of the projected document
   */
  public final Class<DOC> documentType() {
    return documentType;
  }

  /**
   * @return class of the event starting the streams of this projection, {@code null} if the
   *     projection is incomplete
   */
  public final Class<? extends DomainEvent> creatingEventType() {
    return creatingEventType;
  }

  /**
   * @return every event class this projection understands, creating event first
   */
  public final Set<Class<? extends DomainEvent>> eventTypes() {
    final Set<Class<? extends DomainEvent>> eventTypes = new LinkedHashSet<>();
    if (creatingEventType != null) {
      eventTypes.add(creatingEventType);
    }
    eventTypes.addAll(appliers.keySet());
    return Collections.unmodifiableSet(eventTypes);
  }

  /**
   * @param event first event of the stream
   * @return initial document
   * @throws IllegalStateException if the event is not the creating event of this projection
   */
  public final DOC create(final DomainEvent event) {
    if (event == null || creatingEventType == null || !creatingEventType.equals(event.getClass())) {
      throw new IllegalStateException(
          "Projection '%s' cannot be created by '%s'".formatted(name, describe(event)));
    }

    return creator.apply(event);
  }

  /**
   * @param document current document
   * @param event next event of the stream
   * @return next document
   * @throws IllegalStateException if the event is not known to this projection - this is a
   *     programming error rather than a data error
   */
  public final DOC apply(final DOC document, final DomainEvent event) {
    final var applier = event == null ? null : appliers.get(event.getClass());

    if (applier == null) {
      throw new IllegalStateException(
          "Projection '%s' cannot apply '%s'".formatted(name, describe(event)));
    }

    return applier.apply(document, event);
  }

  /**
   * @return names of the declared unique keys
   */
  public final Set<String> uniqueKeyNames() {
    return Collections.unmodifiableSet(uniqueKeys.keySet());
  }

  /**
   * @param document to extract unique keys from
   * @return key name to key value, without {@code null} values
   */
  public final Map<String, String> uniqueKeysOf(final DOC document) {
    final Map<String, String> keys = new LinkedHashMap<>();
    uniqueKeys.forEach(
        (keyName, extractor) -> {
          final String value = extractor.apply(document);
          if (value != null) {
            keys.put(keyName, value);
          }
        });
    return Collections.unmodifiableMap(keys);
  }

  private static String describe(final DomainEvent event) {
    return event == null ? "null" : event.getClass().getSimpleName();
  }
}
