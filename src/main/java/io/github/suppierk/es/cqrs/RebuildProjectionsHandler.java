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

import io.github.suppierk.es.projection.SingleStreamProjection;
import io.github.suppierk.es.session.Session;
import io.github.suppierk.es.store.EventStore;
import io.github.suppierk.es.store.WriteContext;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Replays the whole event history of the requested projections.
 *
 * <p>The rebuild is staged on the {@link WriteContext} of the command and performed by its commit,
 * in the same transaction as the session activity: either every projection is rebuilt and the
 * activity recorded, or nothing is. The result data is a map of projection name to the number of
 * projection types processed for it, always {@code 1}.
 */
public final class RebuildProjectionsHandler
    extends DomainCommandHandler.InSession<RebuildProjections> {
  private final EventStore eventStore;

  /**
   * @param eventStore whose projections can be rebuilt
   */
  public RebuildProjectionsHandler(final EventStore eventStore) {
    super(RebuildProjections.class);
    this.eventStore = requireArgument(eventStore, "Event store");
  }

  /** {@inheritDoc} */
  @Override
  protected CommandResult handle(
      final RebuildProjections command, final WriteContext context, final Session session) {
    final List<SingleStreamProjection<?>> projections;

    if (command.projectionName() == null || command.projectionName().isBlank()) {
      projections = eventStore.projections().all();
    } else {
      final Optional<SingleStreamProjection<?>> projection =
          eventStore.projections().findByName(command.projectionName());

      if (projection.isEmpty()) {
        return CommandResult.invalid("Unknown projection: " + command.projectionName());
      }

      projections = List.of(projection.get());
    }

    context.rebuildOnCommit(projections);

    final Map<String, Long> processed = new LinkedHashMap<>();
    projections.forEach(projection -> processed.put(projection.name(), 1L));
    return CommandResult.ok(Collections.unmodifiableMap(processed));
  }
}
