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

package io.github.suppierk.es.jooq;

import static io.github.suppierk.es.jooq.EventStoreSchema.CREATED_AT;
import static io.github.suppierk.es.jooq.EventStoreSchema.DOCUMENT_ID;
import static io.github.suppierk.es.jooq.EventStoreSchema.ES_DOCUMENTS;
import static io.github.suppierk.es.jooq.EventStoreSchema.ES_EVENTS;
import static io.github.suppierk.es.jooq.EventStoreSchema.ES_STREAMS;
import static io.github.suppierk.es.jooq.EventStoreSchema.ES_UNIQUE_KEYS;
import static io.github.suppierk.es.jooq.EventStoreSchema.EVENT_TYPE;
import static io.github.suppierk.es.jooq.EventStoreSchema.KEY_NAME;
import static io.github.suppierk.es.jooq.EventStoreSchema.KEY_VALUE;
import static io.github.suppierk.es.jooq.EventStoreSchema.PAYLOAD;
import static io.github.suppierk.es.jooq.EventStoreSchema.PROJECTION;
import static io.github.suppierk.es.jooq.EventStoreSchema.STREAM_ID;
import static io.github.suppierk.es.jooq.EventStoreSchema.STREAM_TYPE;
import static io.github.suppierk.es.jooq.EventStoreSchema.VERSION;

import io.github.suppierk.es.cqrs.DomainEvent;
import io.github.suppierk.es.projection.JsonCodec;
import io.github.suppierk.es.projection.ProjectionEngine;
import io.github.suppierk.es.projection.ProjectionRegistry;
import io.github.suppierk.es.projection.SingleStreamProjection;
import io.github.suppierk.es.store.EventStore;
import io.github.suppierk.es.store.StoredEvent;
import io.github.suppierk.es.store.WriteContext;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.exception.DataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventStore} on top of a relational database accessed via jOOQ.
 *
 * <p>See {@link EventStoreSchema} for the tables it expects. Documents are kept as JSON produced by
 * {@link JsonCodec} and are updated inline, within the same transaction which appends the events.
 */
public final class JooqEventStore implements EventStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(JooqEventStore.class);

  /** SQL standard state for {@code unique_violation}, shared by PostgreSQL and H2. */
  static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

  private final DslContextProvider dslContextProvider;
  private final ProjectionRegistry projections;
  private final JsonCodec jsonCodec;

  /**
   * Default constructor.
   *
   * @param dslContextProvider to select {@link DSLContext}s with
   * @param projections to maintain
   * @param jsonCodec to store events and documents with
   */
  public JooqEventStore(
      final DslContextProvider dslContextProvider,
      final ProjectionRegistry projections,
      final JsonCodec jsonCodec) {
    if (dslContextProvider == null) {
      throw new IllegalArgumentException("DSLContext provider cannot be null");
    }

    if (projections == null) {
      throw new IllegalArgumentException("Projection registry cannot be null");
    }

    if (jsonCodec == null) {
      throw new IllegalArgumentException("JSON codec cannot be null");
    }

    this.dslContextProvider = dslContextProvider;
    this.projections = projections;
    this.jsonCodec = jsonCodec;
  }

  /**
   * @param dslContextProvider to select {@link DSLContext}s with
   * @param projections to maintain
   */
  public JooqEventStore(
      final DslContextProvider dslContextProvider, final ProjectionRegistry projections) {
    this(dslContextProvider, projections, new JsonCodec());
  }

  /** {@inheritDoc} */
  @Override
  public WriteContext openUnitOfWork() {
    return new JooqWriteContext(this);
  }

  /** {@inheritDoc} */
  @Override
  public ProjectionRegistry projections() {
    return projections;
  }

  /** {@inheritDoc} */
  @Override
  public <DOC> Optional<DOC> load(final Class<DOC> documentType, final UUID documentId) {
    if (documentId == null) {
      return Optional.empty();
    }

    return readDocument(
        dsl(DslContextProvider.Access.READ_ONLY),
        projections.forDocumentType(documentType),
        documentId);
  }

  /** {@inheritDoc} */
  @Override
  public <DOC> List<DOC> query(final Class<DOC> documentType, final Predicate<DOC> predicate) {
    if (predicate == null) {
      throw new IllegalArgumentException("Predicate cannot be null");
    }

    final SingleStreamProjection<DOC> projection = projections.forDocumentType(documentType);

    return dsl(DslContextProvider.Access.READ_ONLY)
        .select(PAYLOAD)
        .from(ES_DOCUMENTS)
        .where(PROJECTION.eq(projection.name()))
        .orderBy(DOCUMENT_ID)
        .fetch(PAYLOAD)
        .stream()
        .map(payload -> jsonCodec.read(payload, documentType))
        .filter(predicate)
        .toList();
  }

  /** {@inheritDoc} */
  @Override
  public <DOC> Optional<DOC> findByUniqueKey(
      final Class<DOC> documentType, final String keyName, final String keyValue) {
    final SingleStreamProjection<DOC> projection = projections.forDocumentType(documentType);

    if (!projection.uniqueKeyNames().contains(keyName)) {
      throw new IllegalArgumentException(
          "Projection '%s' has no unique key '%s'".formatted(projection.name(), keyName));
    }

    if (keyValue == null) {
      return Optional.empty();
    }

    final DSLContext dsl = dsl(DslContextProvider.Access.READ_ONLY);

    return dsl.select(DOCUMENT_ID)
        .from(ES_UNIQUE_KEYS)
        .where(PROJECTION.eq(projection.name()))
        .and(KEY_NAME.eq(keyName))
        .and(KEY_VALUE.eq(keyValue))
        .fetchOptional(DOCUMENT_ID)
        .flatMap(documentId -> readDocument(dsl, projection, documentId));
  }

  /** {@inheritDoc} */
  @Override
  public List<StoredEvent> readStream(final UUID streamId) {
    if (streamId == null) {
      return List.of();
    }

    return readEvents(dsl(DslContextProvider.Access.READ_ONLY), streamId);
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, Long> rebuild(final List<SingleStreamProjection<?>> projectionsToRebuild) {
    if (projectionsToRebuild == null) {
      throw new IllegalArgumentException("Projections cannot be null");
    }

    return dsl(DslContextProvider.Access.READ_WRITE)
        .transactionResult((Configuration trx) -> rebuildWithin(trx.dsl(), projectionsToRebuild));
  }

  /** {@inheritDoc} */
  @Override
  public boolean isUniqueConstraintViolation(final Throwable error) {
    Throwable current = error;

    while (current != null) {
      if (current instanceof DataAccessException dataAccessException
          && UNIQUE_VIOLATION_SQL_STATE.equals(dataAccessException.sqlState())) {
        return true;
      }

      if (current instanceof SQLException sqlException
          && UNIQUE_VIOLATION_SQL_STATE.equals(sqlException.getSQLState())) {
        return true;
      }

      if (current.getCause() == current) {
        break;
      }

      current = current.getCause();
    }

    return false;
  }

  /**
   * @param access kind of access
   * @return non-null context for the given access
   */
  DSLContext dsl(final DslContextProvider.Access access) {
    final DSLContext dsl = dslContextProvider.apply(access);

    if (dsl == null) {
      throw new IllegalStateException("%s DSLContext cannot be null".formatted(access));
    }

    return dsl;
  }

  /**
   * @param dsl within a transaction
   * @param projectionsToRebuild in the order to rebuild them
   * @return projection name to the number of rematerialized documents
   */
  Map<String, Long> rebuildWithin(
      final DSLContext dsl, final List<SingleStreamProjection<?>> projectionsToRebuild) {
    final Map<String, Long> rebuilt = new LinkedHashMap<>();

    for (SingleStreamProjection<?> projection : projectionsToRebuild) {
      final long documents = rebuildProjection(dsl, projection);
      LOGGER.info("Rebuilt projection '{}' with {} documents", projection.name(), documents);
      rebuilt.put(projection.name(), documents);
    }

    return rebuilt;
  }

  JsonCodec jsonCodec() {
    return jsonCodec;
  }

  /**
   * Folds events on top of the stored document and stores the result, replacing unique keys.
   *
   * @param dsl within a transaction
   * @param projection of the stream
   * @param streamId stream and document identifier
   * @param events to fold
   * @param version of the stream after the events
   * @param <DOC> is the type of the projected document
   */
  <DOC> void foldIntoDocument(
      final DSLContext dsl,
      final SingleStreamProjection<DOC> projection,
      final UUID streamId,
      final List<? extends DomainEvent> events,
      final long version) {
    final DOC current = readDocument(dsl, projection, streamId).orElse(null);
    final DOC next = ProjectionEngine.fold(projection, current, events);

    if (next == null) {
      return;
    }

    if (!streamId.equals(projection.documentId(next))) {
      throw new IllegalStateException(
          "Projection '%s' produced document '%s' for stream '%s'"
              .formatted(projection.name(), projection.documentId(next), streamId));
    }

    dsl.deleteFrom(ES_DOCUMENTS)
        .where(PROJECTION.eq(projection.name()))
        .and(DOCUMENT_ID.eq(streamId))
        .execute();

    dsl.insertInto(ES_DOCUMENTS)
        .columns(PROJECTION, DOCUMENT_ID, PAYLOAD, VERSION)
        .values(projection.name(), streamId, jsonCodec.write(next), version)
        .execute();

    dsl.deleteFrom(ES_UNIQUE_KEYS)
        .where(PROJECTION.eq(projection.name()))
        .and(DOCUMENT_ID.eq(streamId))
        .execute();

    for (Map.Entry<String, String> key : projection.uniqueKeysOf(next).entrySet()) {
      dsl.insertInto(ES_UNIQUE_KEYS)
          .columns(PROJECTION, KEY_NAME, KEY_VALUE, DOCUMENT_ID)
          .values(projection.name(), key.getKey(), key.getValue(), streamId)
          .execute();
    }
  }

  /**
   * @param dsl to read with
   * @param streamId identifier of the stream
   * @return events of the stream in append order
   */
  List<StoredEvent> readEvents(final DSLContext dsl, final UUID streamId) {
    return dsl.select(VERSION, EVENT_TYPE, PAYLOAD)
        .from(ES_EVENTS)
        .where(STREAM_ID.eq(streamId))
        .orderBy(VERSION)
        .fetch(
            row -> {
              final String eventType = row.get(EVENT_TYPE);
              return new StoredEvent(
                  streamId,
                  row.get(VERSION),
                  eventType,
                  jsonCodec.read(row.get(PAYLOAD), projections.eventType(eventType)));
            });
  }

  private <DOC> Optional<DOC> readDocument(
      final DSLContext dsl, final SingleStreamProjection<DOC> projection, final UUID documentId) {
    return dsl.select(PAYLOAD)
        .from(ES_DOCUMENTS)
        .where(PROJECTION.eq(projection.name()))
        .and(DOCUMENT_ID.eq(documentId))
        .fetchOptional(PAYLOAD)
        .map(payload -> jsonCodec.read(payload, projection.documentType()));
  }

  private long rebuildProjection(
      final DSLContext dsl, final SingleStreamProjection<?> projection) {
    dsl.deleteFrom(ES_UNIQUE_KEYS).where(PROJECTION.eq(projection.name())).execute();
    dsl.deleteFrom(ES_DOCUMENTS).where(PROJECTION.eq(projection.name())).execute();

    final List<UUID> streamIds =
        dsl.select(STREAM_ID)
            .from(ES_STREAMS)
            .where(STREAM_TYPE.eq(projection.name()))
            .orderBy(CREATED_AT, STREAM_ID)
            .fetch(STREAM_ID);

    long documents = 0;
    for (UUID streamId : streamIds) {
      final List<StoredEvent> storedEvents = readEvents(dsl, streamId);

      if (storedEvents.isEmpty()) {
        continue;
      }

      final long version = storedEvents.get(storedEvents.size() - 1).version();
      final List<DomainEvent> events = storedEvents.stream().map(StoredEvent::event).toList();
      foldIntoDocument(dsl, projection, streamId, events, version);
      documents++;
    }

    return documents;
  }
}
