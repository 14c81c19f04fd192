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

package io.github.taskfolders.validation;

import io.github.taskfolders.ddd.error.ValidationException;
import io.github.taskfolders.model.TaskStatus;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.UUID;

/**
 * Shared checks for raw caller input.
 *
 * <p>Every method either returns the parsed value or throws {@link ValidationException}, so the
 * first malformed value stops the operation before any storage access.
 */
public final class Inputs {
  private Inputs() {
    // Cannot be instantiated
  }

  /**
   * @param raw identifier, surrounding whitespace is ignored
   * @param what is being identified, used in the error message, e.g. {@code folder}
   * @return parsed identifier
   * @throws ValidationException if the value is missing or not a UUID
   */
  public static UUID parseId(final String raw, final String what) {
    final String trimmed = trimToNull(raw);
    if (trimmed == null) {
      throw new ValidationException("Missing %s id.".formatted(what));
    }

    return tryParseId(trimmed)
        .orElseThrow(() -> new ValidationException("Invalid %s id format.".formatted(what)));
  }

  /**
   * @param raw possible identifier
   * @return {@code true} if the value parses as an identifier
   */
  public static boolean isId(final String raw) {
    return raw != null && tryParseId(raw.strip()).isPresent();
  }

  /**
   * @param raw text which must be present
   * @param message of the error thrown otherwise
   * @return the text without surrounding whitespace
   * @throws ValidationException if the value is {@code null} or blank
   */
  public static String requireText(final String raw, final String message) {
    final String trimmed = trimToNull(raw);
    if (trimmed == null) {
      throw new ValidationException(message);
    }

    return trimmed;
  }

  /**
   * @param raw status label, can be {@code null}
   * @return parsed status, or {@code null} if absent
   * @throws ValidationException if the label is not a known status
   */
  public static TaskStatus parseStatus(final String raw) {
    return raw == null ? null : TaskStatus.fromLabel(raw.strip());
  }

  /**
   * Accepts a plain {@code yyyy-MM-dd} date or an ISO-8601 date-time with an offset, in which case
   * the date part is used.
   *
   * @param raw date, can be {@code null} or blank
   * @return parsed date, or {@code null} if absent
   * @throws ValidationException if the value is not a valid calendar date
   */
  public static LocalDate parseDueDate(final String raw) {
    final String trimmed = trimToNull(raw);
    if (trimmed == null) {
      return null;
    }

    try {
      return LocalDate.parse(trimmed);
    } catch (DateTimeParseException e) {
      try {
        return OffsetDateTime.parse(trimmed).toLocalDate();
      } catch (DateTimeParseException dateTimeFailure) {
        e.addSuppressed(dateTimeFailure);
        throw new ValidationException("Invalid date format.", e);
      }
    }
  }

  private static Optional<UUID> tryParseId(final String raw) {
    try {
      // UUID.fromString accepts shortened groups, so the canonical form is compared as well
      final UUID id = UUID.fromString(raw);
      return id.toString().equalsIgnoreCase(raw) ? Optional.of(id) : Optional.empty();
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  private static String trimToNull(final String raw) {
    if (raw == null) {
      return null;
    }

    final String trimmed = raw.strip();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
