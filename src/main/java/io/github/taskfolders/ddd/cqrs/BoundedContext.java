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

import io.github.taskfolders.ddd.error.InternalException;
import io.github.taskfolders.ddd.jooq.DslContextProvider;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.jooq.DSLContext;
import org.jooq.Table;
import org.jooq.UpdatableRecord;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logical boundary of a single table within the system.
 *
 * <p>Consumers register handlers for their {@link DomainCommand}s, {@link DomainQuery}s and {@link
 * DomainView}s and then dispatch messages through the context. The context resolves the {@link
 * DSLContext} to use, finds the handler registered for the exact message class and translates
 * storage failures into {@link InternalException}.
 *
 * <p>Handler registration is guarded by a {@link ReentrantReadWriteLock}, so handlers can be added
 * while the context is already serving requests.
 *
 * @param <RECORD> the database record type generated by jOOQ
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public abstract non-sealed class BoundedContext<RECORD extends UpdatableRecord<RECORD>>
    extends Suspicious {
  private static final Logger LOGGER = LoggerFactory.getLogger(BoundedContext.class);

  private final Table<RECORD> table;
  private final DslContextProvider writeDslContextProvider;
  private final DslContextProvider readDslContextProvider;

  private final ReentrantReadWriteLock lock;
  private final Map<Class<?>, DomainCommandHandler<?, RECORD, ?>> commandHandlers;
  private final Map<Class<?>, DomainQueryHandler<?, ?>> queryHandlers;
  private final Map<Class<?>, DomainViewHandler<?, ?, ?>> viewHandlers;

  /**
   * @param table this context owns
   * @param writeDslContextProvider to resolve {@link DSLContext} for commands
   * @param readDslContextProvider to resolve {@link DSLContext} for queries and views
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  protected BoundedContext(
      final Table<RECORD> table,
      final DslContextProvider writeDslContextProvider,
      final DslContextProvider readDslContextProvider) {
    this.table = throwIllegalArgumentIfNull(table, "Table");
    this.writeDslContextProvider =
        throwIllegalArgumentIfNull(writeDslContextProvider, "Write DSL context provider");
    this.readDslContextProvider =
        throwIllegalArgumentIfNull(readDslContextProvider, "Read DSL context provider");

    this.lock = new ReentrantReadWriteLock();
    this.commandHandlers = new HashMap<>();
    this.queryHandlers = new HashMap<>();
    this.viewHandlers = new HashMap<>();
  }

  /**
   * @param handler to register
   * @throws IllegalArgumentException if handler is {@code null}
   * @throws IllegalStateException if a handler for the same command class already exists
   */
  public final void addDomainCommandHandler(final DomainCommandHandler<?, RECORD, ?> handler) {
    final DomainCommandHandler<?, RECORD, ?> nonNullHandler =
        throwIllegalArgumentIfNull(handler, "Command handler");
    register(commandHandlers, nonNullHandler.getCommandClass(), nonNullHandler, "Command");
  }

  /**
   * @param handler to register
   * @throws IllegalArgumentException if handler is {@code null}
   * @throws IllegalStateException if a handler for the same query class already exists
   */
  public final void addDomainQueryHandler(final DomainQueryHandler<?, ?> handler) {
    final DomainQueryHandler<?, ?> nonNullHandler =
        throwIllegalArgumentIfNull(handler, "Query handler");
    register(queryHandlers, nonNullHandler.getQueryClass(), nonNullHandler, "Query");
  }

  /**
   * @param handler to register
   * @throws IllegalArgumentException if handler is {@code null}
   * @throws IllegalStateException if a handler for the same view class already exists
   */
  public final void addDomainViewHandler(final DomainViewHandler<?, ?, ?> handler) {
    final DomainViewHandler<?, ?, ?> nonNullHandler =
        throwIllegalArgumentIfNull(handler, "View handler");
    register(viewHandlers, nonNullHandler.getViewClass(), nonNullHandler, "View");
  }

  public final Set<Class<?>> getSupportedDomainCommandClasses() {
    return keys(commandHandlers);
  }

  public final Set<Class<?>> getSupportedDomainQueryClasses() {
    return keys(queryHandlers);
  }

  public final Set<Class<?>> getSupportedDomainViewClasses() {
    return keys(viewHandlers);
  }

  /**
   * @param command to run
   * @param <CREATE> the type of the command
   * @return created record, detached
   */
  public final <CREATE extends DomainCommand.Create> RECORD createModel(final CREATE command) {
    final CREATE nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final DomainCommandHandler.Create<CREATE, RECORD> handler =
        commandHandler(nonNullCommand.getClass());
    return translate(
        nonNullCommand,
        () ->
            handler.runInContext(
                nonNullCommand, writeDsl(nonNullCommand), table, DSL.noCondition()));
  }

  /**
   * @param command to run
   * @param <UPDATE> the type of the command
   * @return updated record, if the condition matched any
   */
  public final <UPDATE extends DomainCommand.Update> Optional<RECORD> updateModel(
      final UPDATE command) {
    final UPDATE nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final DomainCommandHandler.Update<UPDATE, RECORD> handler =
        commandHandler(nonNullCommand.getClass());
    return translate(
        nonNullCommand,
        () ->
            handler.runInContext(
                nonNullCommand, writeDsl(nonNullCommand), table, nonNullCommand.condition()));
  }

  /**
   * @param command to run
   * @param <DELETE> the type of the command
   * @return deleted record, if the condition matched any
   */
  public final <DELETE extends DomainCommand.Delete> Optional<RECORD> deleteModel(
      final DELETE command) {
    final DELETE nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final DomainCommandHandler.Delete<DELETE, RECORD> handler =
        commandHandler(nonNullCommand.getClass());
    return translate(
        nonNullCommand,
        () ->
            handler.runInContext(
                nonNullCommand, writeDsl(nonNullCommand), table, nonNullCommand.condition()));
  }

  /**
   * @param command to run
   * @param <BATCH_UPDATE> the type of the command
   * @return updated records
   */
  public final <BATCH_UPDATE extends DomainCommand.BatchUpdate> List<RECORD> batchUpdateModels(
      final BATCH_UPDATE command) {
    final BATCH_UPDATE nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final DomainCommandHandler.BatchUpdate<BATCH_UPDATE, RECORD> handler =
        commandHandler(nonNullCommand.getClass());
    return translate(
        nonNullCommand,
        () ->
            handler.runInContext(
                nonNullCommand, writeDsl(nonNullCommand), table, nonNullCommand.condition()));
  }

  /**
   * @param command to run
   * @param <BATCH_DELETE> the type of the command
   * @return deleted records
   */
  public final <BATCH_DELETE extends DomainCommand.BatchDelete> List<RECORD> batchDeleteModels(
      final BATCH_DELETE command) {
    final BATCH_DELETE nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final DomainCommandHandler.BatchDelete<BATCH_DELETE, RECORD> handler =
        commandHandler(nonNullCommand.getClass());
    return translate(
        nonNullCommand,
        () ->
            handler.runInContext(
                nonNullCommand, writeDsl(nonNullCommand), table, nonNullCommand.condition()));
  }

  /**
   * @param query to run
   * @param <ONE> the type of the query
   * @return found record, if any
   */
  public final <ONE extends DomainQuery.One> Optional<RECORD> queryOneModel(final ONE query) {
    final ONE nonNullQuery = throwIllegalArgumentIfNull(query, "Query");
    final DomainQueryHandler.One<ONE, RECORD> handler = queryHandler(nonNullQuery.getClass());
    return translate(
        nonNullQuery, () -> handler.runInContext(nonNullQuery, readDsl(nonNullQuery)));
  }

  /**
   * @param query to run
   * @param <MANY> the type of the query
   * @return found records, possibly empty
   */
  public final <MANY extends DomainQuery.Many> List<RECORD> queryManyModels(final MANY query) {
    final MANY nonNullQuery = throwIllegalArgumentIfNull(query, "Query");
    final DomainQueryHandler.Many<MANY, RECORD> handler = queryHandler(nonNullQuery.getClass());
    return translate(
        nonNullQuery, () -> handler.runInContext(nonNullQuery, readDsl(nonNullQuery)));
  }

  /**
   * @param view to run
   * @param viewOutputClass expected by the caller
   * @param <ONE> the type of the view
   * @param <POJO> the type of the view output
   * @return view output, if any
   * @throws IllegalStateException if the registered handler produces another output class
   */
  public final <ONE extends DomainView.One, POJO> Optional<POJO> viewOneModel(
      final ONE view, final Class<POJO> viewOutputClass) {
    final ONE nonNullView = throwIllegalArgumentIfNull(view, "View");
    final Class<POJO> nonNullOutputClass =
        throwIllegalArgumentIfNull(viewOutputClass, "View output class");
    final DomainViewHandler.One<ONE, POJO> handler = viewHandler(nonNullView.getClass());

    if (!nonNullOutputClass.equals(handler.getViewOutputClass())) {
      throw new IllegalStateException(
          "View '%s' produces '%s', not '%s'"
              .formatted(
                  nonNullView.getClass().getSimpleName(),
                  handler.getViewOutputClass().getSimpleName(),
                  nonNullOutputClass.getSimpleName()));
    }

    return translate(nonNullView, () -> handler.runInContext(nonNullView, readDsl(nonNullView)));
  }

  /**
   * @return {@code true} if any thread holds the read lock, used by tests to assert the lock is
   *     always released
   */
  final boolean isAnyReadLockHeld() {
    return lock.getReadLockCount() > 0;
  }

  /**
   * @return {@code true} if any thread holds the write lock
   */
  final boolean isAnyWriteLockHeld() {
    return lock.isWriteLocked();
  }

  private DSLContext writeDsl(final DomainMessage message) {
    return throwIllegalStateIfNull(writeDslContextProvider.apply(message), "Write DSL context");
  }

  private DSLContext readDsl(final DomainMessage message) {
    return throwIllegalStateIfNull(readDslContextProvider.apply(message), "Read DSL context");
  }

  private <T> T translate(final DomainMessage message, final Supplier<T> dispatch) {
    LOGGER.debug(
        "Dispatching '{}' ({}) on '{}'",
        message.getClass().getSimpleName(),
        message.messageId(),
        table.getName());

    try {
      return dispatch.get();
    } catch (DataAccessException e) {
      LOGGER.warn(
          "Storage failure while running '{}' on '{}'",
          message.getClass().getSimpleName(),
          table.getName(),
          e);
      throw new InternalException(
          "Storage failure while running '%s'".formatted(message.getClass().getSimpleName()), e);
    }
  }

  private <H> void register(
      final Map<Class<?>, H> handlers,
      final Class<?> messageClass,
      final H handler,
      final String kind) {
    lock.writeLock().lock();
    try {
      if (handlers.containsKey(messageClass)) {
        throw new IllegalStateException(
            "%s handler for '%s' already exists".formatted(kind, messageClass.getSimpleName()));
      }

      handlers.put(messageClass, handler);
    } finally {
      lock.writeLock().unlock();
    }
  }

  private <H> Set<Class<?>> keys(final Map<Class<?>, H> handlers) {
    lock.readLock().lock();
    try {
      return Set.copyOf(handlers.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  private <H> H lookup(final Map<Class<?>, ?> handlers, final Class<?> messageClass, String kind) {
    lock.readLock().lock();
    try {
      @SuppressWarnings("unchecked")
      final H handler = (H) handlers.get(messageClass);
      return throwUnsupportedOperationIfNull(
          handler, "%s handler for '%s'".formatted(kind, messageClass.getSimpleName()));
    } finally {
      lock.readLock().unlock();
    }
  }

  private <H> H commandHandler(final Class<?> messageClass) {
    return lookup(commandHandlers, messageClass, "Command");
  }

  private <H> H queryHandler(final Class<?> messageClass) {
    return lookup(queryHandlers, messageClass, "Query");
  }

  private <H> H viewHandler(final Class<?> messageClass) {
    return lookup(viewHandlers, messageClass, "View");
  }
}
