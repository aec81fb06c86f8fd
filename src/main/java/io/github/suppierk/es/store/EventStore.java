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

import io.github.suppierk.es.projection.ProjectionRegistry;
import io.github.suppierk.es.projection.SingleStreamProjection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Narrow storage capability the command pipeline is built on: an append-only log of per-stream
 * events, projected documents derived from it, and units of work to change both atomically.
 */
public interface EventStore {
  /**
   * @return a new unit of work, which must be closed by the caller
   */
  WriteContext openUnitOfWork();

  /**
   * @return projections this store maintains
   */
  ProjectionRegistry projections();

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
   * @return all current documents matching the predicate
   */
  <DOC> List<DOC> query(final Class<DOC> documentType, final Predicate<DOC> predicate);

  /**
   * @param documentType projected document class
   * @param keyName unique key declared by the projection
   * @param keyValue to look for
   * @param <DOC> is the type of the projected document
   * @return current document holding the value, if any
   * @throws IllegalArgumentException if the projection does not declare the key
   */
  <DOC> Optional<DOC> findByUniqueKey(
      final Class<DOC> documentType, final String keyName, final String keyValue);

  /**
   * @param streamId identifier of the stream
   * @return all events of the stream in append order, empty if the stream does not exist
   */
  List<StoredEvent> readStream(final UUID streamId);

  /**
   * Drops the given projections and replays their entire event history, all within one
   * transaction: either every projection is rebuilt, or none is.
   *
   * @param projections to rebuild
   * @return projection name to the number of rematerialized documents
   */
  Map<String, Long> rebuild(final List<SingleStreamProjection<?>> projections);

  /**
   * The only place where storage-specific error knowledge is exposed to the command pipeline.
   *
   * @param error thrown while working with this store
   * @return {@code true} if the error means that a unique constraint was violated
   */
  boolean isUniqueConstraintViolation(final Throwable error);
}
