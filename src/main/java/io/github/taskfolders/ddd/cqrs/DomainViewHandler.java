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

import java.util.Optional;
import org.jooq.DSLContext;

/**
 * Builds a read model for one {@link DomainView} type, typically by joining several tables.
 *
 * <p>The output class is declared up front so that {@link BoundedContext} can reject callers
 * expecting a different type before anything is read.
 *
 * @param <VIEW> handled view
 * @param <POJO> read model type, usually a record rather than a jOOQ table record
 * @param <OUTPUT> container of the read model
 */
@SuppressWarnings("squid:S119")
public abstract sealed class DomainViewHandler<VIEW extends DomainView, POJO, OUTPUT>
    extends DomainHandler<VIEW> permits DomainViewHandler.One {
  private static final String KIND = "view";

  private final Class<POJO> viewOutputClass;

  protected DomainViewHandler(final Class<VIEW> viewClass, final Class<POJO> viewOutputClass) {
    super(viewClass, KIND);
    this.viewOutputClass = throwIllegalArgumentIfNull(viewOutputClass, "View output class");
  }

  public final Class<VIEW> getViewClass() {
    return getOperationClass();
  }

  public final Class<POJO> getViewOutputClass() {
    return viewOutputClass;
  }

  /**
   * @param view to build, already authorized
   * @param dsl read-only context
   * @return read model
   * @throws Exception wrapped into an internal error by the caller
   */
  @SuppressWarnings("squid:S112")
  protected abstract OUTPUT run(final VIEW view, final DSLContext dsl) throws Exception;

  final OUTPUT runInContext(final VIEW view, final DSLContext readOnlyDsl) {
    final VIEW checked = authorize(view, KIND);
    final DSLContext dsl = throwIllegalStateIfNull(readOnlyDsl, "Read-only DSL");

    return throwIllegalStateIfNull(invoke(() -> run(checked, dsl)), "View handler result");
  }

  /** Builds at most one read model. */
  public abstract static non-sealed class One<ONE extends DomainView.One, POJO>
      extends DomainViewHandler<ONE, POJO, Optional<POJO>> {
    protected One(final Class<ONE> viewClass, final Class<POJO> viewOutputClass) {
      super(viewClass, viewOutputClass);
    }
  }
}
