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
import io.github.suppierk.es.projection.SingleStreamProjection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * A unit of work against the {@link EventStore}, scoped to exactly one command execution.
 *
 * <p>Reads observe committed state of the store. Writes are staged in memory and reach the store
 * only on {@link #commit()}, which appends the staged events and folds them into their projections
 * atomically.
 *
 * <p>Instances are not thread-safe and must not outlive the command they were opened for.
 */
public interface WriteContext extends AutoCloseable {
  /**
   * @param documentType projected document class
   * @param documentId identifier of the stream the document was projected from
   * @param <DOC> is the type of the projected document
   * @return current document, if the stream exists
   */
  <DOC> Optional<DOC> load(final Class<DOC> documentType, final UUID documentId);

  /**
   * @param documentType projected document class
   * @param predicate to match documents with
   * @param <DOC> is the type of the projected document
   * @return first current document matching the predicate
   */
  <DOC> Optional<DOC> queryCurrent(final Class<DOC> documentType, final Predicate<DOC> predicate);

  /**
   * Looks a document up through a unique key its projection declares, without scanning the other
   * documents.
   *
   * @param documentType projected document class
   * @param keyName unique key declared by the projection
   * @param keyValue to look for
   * @param <DOC> is the type of the projected document
   * @return current document holding the value, if any
   */
  <DOC> Optional<DOC> findByUniqueKey(
      final Class<DOC> documentType, final String keyName, final String keyValue);

  /**
   * Stages the creation of a new stream.
   *
   * @param documentType projected document class, which defines the type of the stream
   * @param streamId identifier of the new stream
   * @param firstEvent creating event of the stream
   */
  void startStream(final Class<?> documentType, final UUID streamId, final DomainEvent firstEvent);

  /**
   * Stages events to be appended to an existing stream, or to a stream started within this unit of
   * work.
   *
   * @param streamId identifier of the stream
   * @param events to append, in order
   */
  void appendEvents(final UUID streamId, final List<? extends DomainEvent> events);

  /**
   * @param streamId identifier of the stream
   * @param events to append, in order
   */
  default void appendEvents(final UUID streamId, final DomainEvent... events) {
    appendEvents(streamId, List.of(events));
  }

  /**
   * Stages a rebuild of the given projections. {@link #commit()} performs it after writing the
   * staged events, within the same transaction, so the rebuild also sees those events.
   *
   * @param projections to rebuild
   */
  void rebuildOnCommit(final List<SingleStreamProjection<?>> projections);

  /**
   * @return events staged so far, in the order they were staged
   */
  List<DomainEvent> pendingEvents();

  /** Drops everything staged so far, including a staged rebuild. */
  void discardPending();

  /**
   * Appends staged events and updates projections in a single transaction.
   *
   * @throws IllegalStateException if this unit of work was already committed or closed
   */
  void commit();

  /** Discards anything not committed, never throws. */
  @Override
  void close();
}
