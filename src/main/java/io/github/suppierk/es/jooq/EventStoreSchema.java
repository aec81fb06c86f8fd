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

import java.time.Instant;
import java.util.UUID;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/**
 * Tables backing {@link JooqEventStore}.
 *
 * <ul>
 *   <li>{@code es_streams} - one row per stream with its type and current version.
 *   <li>{@code es_events} - the append-only log, keyed by stream and version.
 *   <li>{@code es_documents} - current projected documents, keyed by projection and stream.
 *   <li>{@code es_unique_keys} - unique projected values, the final arbiter of uniqueness races.
 * </ul>
 */
public final class EventStoreSchema {
  static final Table<Record> ES_STREAMS = DSL.table(DSL.name("es_streams"));
  static final Table<Record> ES_EVENTS = DSL.table(DSL.name("es_events"));
  static final Table<Record> ES_DOCUMENTS = DSL.table(DSL.name("es_documents"));
  static final Table<Record> ES_UNIQUE_KEYS = DSL.table(DSL.name("es_unique_keys"));

  static final Field<UUID> STREAM_ID =
      DSL.field(DSL.name("stream_id"), SQLDataType.UUID.nullable(false));
  static final Field<String> STREAM_TYPE =
      DSL.field(DSL.name("stream_type"), SQLDataType.VARCHAR(100).nullable(false));
  static final Field<Long> VERSION =
      DSL.field(DSL.name("version"), SQLDataType.BIGINT.nullable(false));
  static final Field<Instant> CREATED_AT =
      DSL.field(DSL.name("created_at"), SQLDataType.INSTANT.nullable(false));

  static final Field<String> EVENT_TYPE =
      DSL.field(DSL.name("event_type"), SQLDataType.VARCHAR(200).nullable(false));
  static final Field<String> PAYLOAD =
      DSL.field(DSL.name("payload"), SQLDataType.CLOB.nullable(false));
  static final Field<UUID> SESSION_ID =
      DSL.field(DSL.name("session_id"), SQLDataType.UUID.nullable(true));
  static final Field<Instant> OCCURRED_AT =
      DSL.field(DSL.name("occurred_at"), SQLDataType.INSTANT.nullable(false));

  static final Field<String> PROJECTION =
      DSL.field(DSL.name("projection"), SQLDataType.VARCHAR(100).nullable(false));
  static final Field<UUID> DOCUMENT_ID =
      DSL.field(DSL.name("document_id"), SQLDataType.UUID.nullable(false));

  static final Field<String> KEY_NAME =
      DSL.field(DSL.name("key_name"), SQLDataType.VARCHAR(100).nullable(false));
  static final Field<String> KEY_VALUE =
      DSL.field(DSL.name("key_value"), SQLDataType.VARCHAR(500).nullable(false));

  private EventStoreSchema() {
    // No instance
  }

  /**
   * Creates missing tables, existing tables are left untouched.
   *
   * @param dsl to execute DDL with
   */
  public static void create(final DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    dsl.createTableIfNotExists(ES_STREAMS)
        .column(STREAM_ID)
        .column(STREAM_TYPE)
        .column(VERSION)
        .column(CREATED_AT)
        .constraints(DSL.constraint("pk_es_streams").primaryKey(STREAM_ID))
        .execute();

    dsl.createTableIfNotExists(ES_EVENTS)
        .column(STREAM_ID)
        .column(VERSION)
        .column(EVENT_TYPE)
        .column(PAYLOAD)
        .column(SESSION_ID)
        .column(OCCURRED_AT)
        .constraints(DSL.constraint("pk_es_events").primaryKey(STREAM_ID, VERSION))
        .execute();

    dsl.createTableIfNotExists(ES_DOCUMENTS)
        .column(PROJECTION)
        .column(DOCUMENT_ID)
        .column(PAYLOAD)
        .column(VERSION)
        .constraints(DSL.constraint("pk_es_documents").primaryKey(PROJECTION, DOCUMENT_ID))
        .execute();

    dsl.createTableIfNotExists(ES_UNIQUE_KEYS)
        .column(PROJECTION)
        .column(KEY_NAME)
        .column(KEY_VALUE)
        .column(DOCUMENT_ID)
        .constraints(
            DSL.constraint("pk_es_unique_keys").primaryKey(PROJECTION, KEY_NAME, KEY_VALUE))
        .execute();
  }

  /**
   * Removes every stream, event and document while keeping the tables.
   *
   * @param dsl to execute statements with
   */
  public static void truncate(final DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    dsl.deleteFrom(ES_UNIQUE_KEYS).execute();
    dsl.deleteFrom(ES_DOCUMENTS).execute();
    dsl.deleteFrom(ES_EVENTS).execute();
    dsl.deleteFrom(ES_STREAMS).execute();
  }
}
