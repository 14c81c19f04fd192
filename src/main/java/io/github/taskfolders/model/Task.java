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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A unit of work owned by a single user.
 *
 * @param id generated at creation
 * @param title never blank
 * @param dueDate optional deadline
 * @param status current progress
 * @param folder containing folder, {@code null} when unfiled
 * @param owner immutable after creation
 * @param createdAt used to sort listings, newest first
 */
public record Task(
    UUID id,
    String title,
    LocalDate dueDate,
    TaskStatus status,
    UUID folder,
    UUID owner,
    LocalDateTime createdAt)
    implements Entity {

  @Override
  public EntityKind kind() {
    return EntityKind.TASK;
  }
}
