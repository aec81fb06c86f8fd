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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.suppierk.es.store.EventStoreException;

/** Converts events and projected documents to and from their stored JSON form. */
public final class JsonCodec {
  private final ObjectMapper objectMapper;

  /** Creates a codec with the default {@link ObjectMapper}. */
  public JsonCodec() {
    this(createDefaultObjectMapper());
  }

  /**
   * @param objectMapper to use, must support {@link java.time} types
   */
  public JsonCodec(final ObjectMapper objectMapper) {
    if (objectMapper == null) {
      throw new IllegalArgumentException("Object mapper cannot be null");
    }

    this.objectMapper = objectMapper;
  }

  /**
   * @param value to serialize
   * @return JSON representation of the value
   * @throws EventStoreException if the value cannot be serialized
   */
  public String write(final Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new EventStoreException(
          "Cannot serialize '%s'".formatted(value.getClass().getSimpleName()), e);
    }
  }

  /**
   * @param json to deserialize
   * @param type expected type
   * @param <T> is the expected type
   * @return deserialized value
   * @throws EventStoreException if the JSON does not represent the expected type
   */
  public <T> T read(final String json, final Class<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new EventStoreException("Cannot deserialize '%s'".formatted(type.getSimpleName()), e);
    }
  }

  /** Creates a default ObjectMapper with JSR310 support and ISO-8601 timestamps. */
  private static ObjectMapper createDefaultObjectMapper() {
    final ObjectMapper mapper = new ObjectMapper();
    mapper.registerModule(new JavaTimeModule());
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    return mapper;
  }
}
