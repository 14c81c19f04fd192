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

package io.github.taskfolders.ddd.cqrs;

import org.jooq.Condition;

/**
 * Represents an immutable command which must update the underlying model as per CQRS paradigm.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 *
 * <p>Commands must be task-oriented, not data-centric - e.g. 'Reset Folder Progress' instead of
 * 'Set status of tasks with folder X to Pending'.
 *
 * <p>To bridge the gap in understanding between CRUD and CQRS, the interface is {@code sealed},
 * forcing users to pick one of the specific CRUD-related commands rather than defining a command
 * completely on their own.
 */
public sealed interface DomainCommand extends DomainMessage
    permits DomainCommand.Create,
        DomainCommand.Update,
        DomainCommand.Delete,
        DomainCommand.BatchUpdate,
        DomainCommand.BatchDelete {

  /** Intent to create a new model in the system. */
  non-sealed interface Create extends DomainCommand {}

  /** Intent to update an existing model in the system. */
  non-sealed interface Update extends DomainCommand {
    /**
     * @return a {@link Condition} selecting the single record to work with
     */
    Condition condition();
  }

  /** Intent to delete an existing model from the system. */
  non-sealed interface Delete extends DomainCommand {
    /**
     * @return a {@link Condition} selecting the single record to work with
     */
    Condition condition();
  }

  /** Intent to update every model matching a condition. */
  non-sealed interface BatchUpdate extends DomainCommand {
    /**
     * @return a {@link Condition} selecting the records to work with
     */
    Condition condition();
  }

  /** Intent to delete every model matching a condition. */
  non-sealed interface BatchDelete extends DomainCommand {
    /**
     * @return a {@link Condition} selecting the records to work with
     */
    Condition condition();
  }
}
