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

/**
 * Represents a query which must retrieve the underlying model as per CQRS paradigm.
 *
 * <p>Queries answer a specific question - e.g. 'Which of my tasks are not filed anywhere' instead
 * of 'Fetch tasks where folder is null'.
 */
public sealed interface DomainQuery extends DomainMessage
    permits DomainQuery.One, DomainQuery.Many {

  /** Intent to read a single model. */
  non-sealed interface One extends DomainQuery {}

  /** Intent to read multiple models. */
  non-sealed interface Many extends DomainQuery {}
}
