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

package io.github.taskfolders.ddd.jooq;

import io.github.taskfolders.ddd.cqrs.DomainMessage;
import java.util.function.Function;
import org.jooq.DSLContext;

/**
 * Picks the {@link DSLContext} a message runs against.
 *
 * <p>Every bounded context takes one provider for writes and one for reads, so reads can be sent
 * elsewhere without touching any handler. The application itself runs on a single H2 database and
 * uses {@link #dslContextIdentity(DSLContext)} for both.
 */
@FunctionalInterface
public interface DslContextProvider extends Function<DomainMessage, DSLContext> {

  /**
   * @param dslContext returned for every message
   * @return provider ignoring the message
   * @throws IllegalArgumentException if {@code dslContext} is {@code null}
   */
  static DslContextProvider dslContextIdentity(final DSLContext dslContext) {
    if (dslContext == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    return message -> dslContext;
  }
}
