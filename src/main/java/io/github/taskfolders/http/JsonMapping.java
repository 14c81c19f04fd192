/*
 * Copyright 2026 The Task Folders Authors
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

package io.github.taskfolders.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.taskfolders.ddd.error.ValidationException;

/** JSON settings shared by the HTTP layer and its tests. */
public final class JsonMapping {
  private JsonMapping() {
    // Cannot be instantiated
  }

  /**
   * @return mapper writing dates as ISO strings and ignoring unknown request properties
   */
  public static ObjectMapper objectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /**
   * @param mapper to read with
   * @param body raw request body
   * @param type to read
   * @param <T> of the request
   * @return parsed request
   * @throws ValidationException if the body is empty or not valid JSON for {@code type}
   */
  static <T> T read(final ObjectMapper mapper, final String body, final Class<T> type) {
    if (body == null || body.isBlank()) {
      throw new ValidationException("Request body is required.");
    }

    try {
      return mapper.readValue(body, type);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Malformed JSON body.", e);
    }
  }
}
