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
import java.util.List;

/**
 * Folds events into documents.
 *
 * <p>This is the only folding routine in the codebase: inline folding at commit time and replay
 * during a rebuild both go through it.
 */
public final class ProjectionEngine {
  private ProjectionEngine() {
    // No instance
  }

  /**
   * @param projection describing how to fold
   * @param current document, {@code null} if the stream is new
   * @param events to fold in append order
   * @param <DOC> is the type of the projected document
   * @return the next document, or {@code current} if there were no events
   * @throws IllegalStateException if the projection does not understand one of the events or
   *     produced {@code null}
   */
  public static <DOC> DOC fold(
      final SingleStreamProjection<DOC> projection,
      final DOC current,
      final List<? extends DomainEvent> events) {
    if (projection == null || events == null) {
      throw new IllegalArgumentException("Projection and events cannot be null");
    }

    DOC document = current;
    for (DomainEvent event : events) {
      document = document == null ? projection.create(event) : projection.apply(document, event);

      if (document == null) {
        throw new IllegalStateException(
            "Projection '%s' produced null document".formatted(projection.name()));
      }
    }

    return document;
  }
}
