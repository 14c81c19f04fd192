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

package io.github.taskfolders.model;

import com.fasterxml.jackson.annotation.JsonValue;
import io.github.taskfolders.ddd.error.ValidationException;
import java.util.Arrays;

/** Progress of a task. Any value may be set directly, there is no transition check. */
public enum TaskStatus {
  PENDING("Pending"),
  WORKING("Working"),
  COMPLETED("Completed");

  private final String label;

  TaskStatus(final String label) {
    this.label = label;
  }

  /**
   * @return the label used in storage and payloads
   */
  @JsonValue
  public String label() {
    return label;
  }

  /**
   * @param label to resolve, case-sensitive
   * @return matching status
   * @throws ValidationException if the label is not one of the known ones
   */
  public static TaskStatus fromLabel(final String label) {
    return Arrays.stream(values())
        .filter(status -> status.label.equals(label))
        .findFirst()
        .orElseThrow(() -> new ValidationException("Invalid status value."));
  }
}
