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

/**
 * Command Query Responsibility Segregation (CQRS) building blocks used by the task and folder
 * contexts.
 *
 * <p>Every table of the system is served by a {@link io.github.taskfolders.ddd.cqrs.BoundedContext}
 * which dispatches:
 *
 * <ul>
 *   <li>{@link io.github.taskfolders.ddd.cqrs.DomainCommand}s, changing the state of the table
 *       within a single transaction each.
 *   <li>{@link io.github.taskfolders.ddd.cqrs.DomainQuery}s, reading records of the table.
 *   <li>{@link io.github.taskfolders.ddd.cqrs.DomainView}s, reading several tables into a
 *       user-defined object.
 * </ul>
 *
 * <p>Each message carries the {@link io.github.taskfolders.ddd.authorization.DomainClient} on whose
 * behalf it runs, and handlers refuse clients they are not meant for.
 *
 * @see <a href="https://martinfowler.com/bliki/CQRS.html">Martin Fowler about CQRS</a>
 */
package io.github.taskfolders.ddd.cqrs;
