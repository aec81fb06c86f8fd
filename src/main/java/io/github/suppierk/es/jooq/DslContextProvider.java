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

import java.util.function.Function;
import org.jooq.DSLContext;

/**
 * Allows for flexibility to define {@link DSLContext}s to be used.
 *
 * <p>Extends {@link Function} to give the ability to decide which {@link DSLContext} to use based
 * on the kind of access the event store needs, where the typical usage is to send projection reads
 * to a replica while appends and commits go to the primary database.
 */
@FunctionalInterface
public interface DslContextProvider extends Function<DslContextProvider.Access, DSLContext> {
  /** Kind of access the caller is about to perform. */
  enum Access {
    /** Appends, commits and rebuilds. */
    READ_WRITE,

    /** Projection and stream reads outside a transaction. */
    READ_ONLY
  }

  /**
   * Similar to {@link Function#identity()}.
   *
   * @param dslContext to create {@link DslContextProvider} with
   * @return a new instance of {@link DslContextProvider} which simply returns provided {@link
   *     DSLContext} for any kind of access
   */
  static DslContextProvider dslContextIdentity(DSLContext dslContext) {
    if (dslContext == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    return access -> dslContext;
  }

  /**
   * @param readWriteDslContext to use for {@link Access#READ_WRITE}
   * @param readOnlyDslContext to use for {@link Access#READ_ONLY}
   * @return a new instance of {@link DslContextProvider} routing by the kind of access
   */
  static DslContextProvider readWriteSplit(
      DSLContext readWriteDslContext, DSLContext readOnlyDslContext) {
    if (readWriteDslContext == null || readOnlyDslContext == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    return access -> access == Access.READ_ONLY ? readOnlyDslContext : readWriteDslContext;
  }
}
