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
import static io.github.suppierk.es.jooq.EventStoreSchema.ES_EVENTS;
import static io.github.suppierk.es.jooq.EventStoreSchema.ES_STREAMS;
import static io.github.suppierk.es.jooq.EventStoreSchema.EVENT_TYPE;
import static io.github.suppierk.es.jooq.EventStoreSchema.OCCURRED_AT;
import static io.github.suppierk.es.jooq.EventStoreSchema.PAYLOAD;
import static io.github.suppierk.es.jooq.EventStoreSchema.SESSION_ID;
import static io.github.suppierk.es.jooq.EventStoreSchema.STREAM_ID;
import static io.github.suppierk.es.jooq.EventStoreSchema.STREAM_TYPE;
import static io.github.suppierk.es.jooq.EventStoreSchema.VERSION;

import io.github.suppierk.es.cqrs.DomainEvent;
import io.github.suppierk.es.projection.SingleStreamProjection;
import io.github.suppierk.es.store.EventStoreException;
import io.github.suppierk.es.store.WriteContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link WriteContext} of {@link JooqEventStore}.
 *
 * <p>Staged work is kept in memory until {@link #commit()}, which then locks the rows of every
 * existing stream being appended to, so that concurrent units of work appending to the same stream
 * are serialized by the database rather than failing on the version key.
 */
final class JooqWriteContext implements WriteContext {
  private static final Logger LOGGER = LoggerFactory.getLogger(JooqWriteContext.class);

  private final JooqEventStore eventStore;
  private final Map<UUID, PendingStream> pendingStreams;
  private final List<DomainEvent> pendingEvents;
  private final List<SingleStreamProjection<?>> pendingRebuild;

  private boolean completed;

  JooqWriteContext(final JooqEventStore eventStore) {
    this.eventStore = eventStore;
    this.pendingStreams = new LinkedHashMap<>();
    this.pendingEvents = new ArrayList<>();
    this.pendingRebuild = new ArrayList<>();
    this.completed = false;
  }

  /** {@inheritDoc} */
  @Override
  public <DOC> Optional<DOC> load(final Class<DOC> documentType, final UUID documentId) {
    ensureNotCompleted();
    return eventStore.load(documentType, documentId);
  }

  /** {@inheritDoc} */
  @Override
  public <DOC> Optional<DOC> queryCurrent(
      final Class<DOC> documentType, final Predicate<DOC> predicate) {
    ensureNotCompleted();
    return eventStore.query(documentType, predicate).stream().findFirst();
  }

  /** {@inheritDoc} */
  @Override
  public <DOC> Optional<DOC> findByUniqueKey(
      final Class<DOC> documentType, final String keyName, final String keyValue) {
    ensureNotCompleted();
    return eventStore.findByUniqueKey(documentType, keyName, keyValue);
  }

  /** {@inheritDoc} */
  @Override
  public void startStream(
      final Class<?> documentType, final UUID streamId, final DomainEvent firstEvent) {
    ensureNotCompleted();

    if (streamId == null || firstEvent == null) {
      throw new IllegalArgumentException("Stream identifier and first event cannot be null");
    }

    final SingleStreamProjection<?> projection =
        eventStore.projections().forDocumentType(documentType);

    if (pendingStreams.containsKey(streamId)) {
      throw new IllegalStateException(
          "Stream '%s' is already staged in this unit of work".formatted(streamId));
    }

    final PendingStream pendingStream = new PendingStream(streamId, projection);
    pendingStream.events.add(firstEvent);
    pendingStreams.put(streamId, pendingStream);
    pendingEvents.add(firstEvent);
  }

  /** {@inheritDoc} */
  @Override
  public void appendEvents(final UUID streamId, final List<? extends DomainEvent> events) {
    ensureNotCompleted();

    if (streamId == null || events == null || events.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("Stream identifier and events cannot be null");
    }

    if (events.isEmpty()) {
      return;
    }

    pendingStreams
        .computeIfAbsent(streamId, id -> new PendingStream(id, null))
        .events
        .addAll(events);
    pendingEvents.addAll(events);
  }

  /** {@inheritDoc} */
  @Override
  public void rebuildOnCommit(final List<SingleStreamProjection<?>> projections) {
    ensureNotCompleted();

    if (projections == null || projections.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("Projections cannot be null");
    }

    for (SingleStreamProjection<?> projection : projections) {
      if (!pendingRebuild.contains(projection)) {
        pendingRebuild.add(projection);
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public List<DomainEvent> pendingEvents() {
    return List.copyOf(pendingEvents);
  }

  /** {@inheritDoc} */
  @Override
  public void discardPending() {
    pendingStreams.clear();
    pendingEvents.clear();
    pendingRebuild.clear();
  }

  /** {@inheritDoc} */
  @Override
  public void commit() {
    ensureNotCompleted();
    completed = true;

    if (pendingStreams.isEmpty() && pendingRebuild.isEmpty()) {
      return;
    }

    final List<PendingStream> streams = List.copyOf(pendingStreams.values());
    final List<SingleStreamProjection<?>> rebuild = List.copyOf(pendingRebuild);
    discardPending();

    eventStore
        .dsl(DslContextProvider.Access.READ_WRITE)
        .transaction(
            (Configuration trx) -> {
              write(trx.dsl(), streams);

              if (!rebuild.isEmpty()) {
                eventStore.rebuildWithin(trx.dsl(), rebuild);
              }
            });

    LOGGER.debug(
        "Committed events to {} streams, rebuilt {} projections", streams.size(), rebuild.size());
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    completed = true;
    discardPending();
  }

  private void ensureNotCompleted() {
    if (completed) {
      throw new IllegalStateException("Unit of work is already committed or closed");
    }
  }

  private void write(final DSLContext dsl, final List<PendingStream> streams) {
    final Map<UUID, Record> existingStreams = lockExistingStreams(dsl, streams);

    for (PendingStream stream : streams) {
      final SingleStreamProjection<?> projection;
      final long currentVersion;

      if (stream.projection != null) {
        projection = stream.projection;
        currentVersion = 0L;

        dsl.insertInto(ES_STREAMS)
            .columns(STREAM_ID, STREAM_TYPE, VERSION, CREATED_AT)
            .values(
                stream.streamId,
                projection.name(),
                (long) stream.events.size(),
                stream.events.get(0).occurredAt())
            .execute();
      } else {
        final Record existing = existingStreams.get(stream.streamId);
        final String streamType = existing.get(STREAM_TYPE);

        projection =
            eventStore
                .projections()
                .findByName(streamType)
                .orElseThrow(
                    () ->
                        new EventStoreException(
                            "Stream '%s' has unknown type '%s'"
                                .formatted(stream.streamId, streamType)));
        currentVersion = existing.get(VERSION);

        dsl.update(ES_STREAMS)
            .set(VERSION, currentVersion + stream.events.size())
            .where(STREAM_ID.eq(stream.streamId))
            .execute();
      }

      long version = currentVersion;
      for (DomainEvent event : stream.events) {
        version++;

        dsl.insertInto(ES_EVENTS)
            .columns(STREAM_ID, VERSION, EVENT_TYPE, PAYLOAD, SESSION_ID, OCCURRED_AT)
            .values(
                stream.streamId,
                version,
                eventStore.projections().eventTypeName(event),
                eventStore.jsonCodec().write(event),
                event.sessionId(),
                event.occurredAt())
            .execute();
      }

      eventStore.foldIntoDocument(dsl, projection, stream.streamId, stream.events, version);
    }
  }

  private Map<UUID, Record> lockExistingStreams(
      final DSLContext dsl, final List<PendingStream> streams) {
    final List<UUID> existingStreamIds =
        streams.stream()
            .filter(stream -> stream.projection == null)
            .map(stream -> stream.streamId)
            .sorted()
            .toList();

    final Map<UUID, Record> lockedStreams = new LinkedHashMap<>();

    if (existingStreamIds.isEmpty()) {
      return lockedStreams;
    }

    dsl.select(STREAM_ID, STREAM_TYPE, VERSION)
        .from(ES_STREAMS)
        .where(STREAM_ID.in(existingStreamIds))
        .orderBy(STREAM_ID)
        .forUpdate()
        .fetch()
        .forEach(row -> lockedStreams.put(row.get(STREAM_ID), row));

    for (UUID streamId : existingStreamIds) {
      if (!lockedStreams.containsKey(streamId)) {
        throw new EventStoreException("Stream '%s' does not exist".formatted(streamId));
      }
    }

    return lockedStreams;
  }

  private static final class PendingStream {
    private final UUID streamId;

    /** Known only for streams started within this unit of work. */
    private final SingleStreamProjection<?> projection;

    private final List<DomainEvent> events;

    private PendingStream(final UUID streamId, final SingleStreamProjection<?> projection) {
      this.streamId = streamId;
      this.projection = projection;
      this.events = new ArrayList<>();
    }
  }
}
