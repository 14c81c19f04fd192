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

import java.util.List;
import java.util.Optional;
import org.jooq.DSLContext;
import org.jooq.UpdatableRecord;

/**
 * Reads records of a single table for one {@link DomainQuery} type.
 *
 * <p>The handler gets a read-only {@link DSLContext} and must not write. An empty result is an
 * empty {@link Optional} or {@link List}, never {@code null}.
 *
 * @param <QUERY> handled query
 * @param <OUTPUT> {@link Optional} or {@link List} of records
 */
@SuppressWarnings("squid:S119")
public abstract sealed class DomainQueryHandler<QUERY extends DomainQuery, OUTPUT>
    extends DomainHandler<QUERY> permits DomainQueryHandler.One, DomainQueryHandler.Many {
  private static final String KIND = "query";

  protected DomainQueryHandler(final Class<QUERY> queryClass) {
    super(queryClass, KIND);
  }

  public final Class<QUERY> getQueryClass() {
    return getOperationClass();
  }

  /**
   * @param query to answer, already authorized
   * @param dsl read-only context
   * @return matching records
   * @throws Exception wrapped into an internal error by the caller
   */
  @SuppressWarnings("squid:S112")
  protected abstract OUTPUT run(final QUERY query, final DSLContext dsl) throws Exception;

  final OUTPUT runInContext(final QUERY query, final DSLContext readOnlyDsl) {
    final QUERY checked = authorize(query, KIND);
    final DSLContext dsl = throwIllegalStateIfNull(readOnlyDsl, "Read-only DSL");

    return throwIllegalStateIfNull(invoke(() -> run(checked, dsl)), "Query handler result");
  }

  /** Answers with at most one record. */
  public abstract static non-sealed class One<
          ONE extends DomainQuery.One, RECORD extends UpdatableRecord<RECORD>>
      extends DomainQueryHandler<ONE, Optional<RECORD>> {
    protected One(final Class<ONE> queryClass) {
      super(queryClass);
    }
  }

  /** Answers with a possibly empty list of records. */
  public abstract static non-sealed class Many<
          MANY extends DomainQuery.Many, RECORD extends UpdatableRecord<RECORD>>
      extends DomainQueryHandler<MANY, List<RECORD>> {
    protected Many(final Class<MANY> queryClass) {
      super(queryClass);
    }
  }
}
