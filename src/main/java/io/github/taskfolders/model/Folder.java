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

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * A named group of tasks.
 *
 * <p>{@code taskRefs} mirrors the tasks pointing at this folder in the order they were added. The
 * {@link Task#folder()} field of each task stays authoritative.
 */
public record Folder(
    UUID id,
    String name,
    UUID owner,
    @JsonProperty("tasks") List<UUID> taskRefs,
    LocalDateTime createdAt)
    implements Entity {

  public Folder {
    taskRefs = taskRefs == null ? List.of() : List.copyOf(taskRefs);
  }

  @Override
  public EntityKind kind() {
    return EntityKind.FOLDER;
  }
}
