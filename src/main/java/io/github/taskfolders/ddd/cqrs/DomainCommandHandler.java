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
import java.util.stream.Stream;
import org.jooq.Condition;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Table;
import org.jooq.UpdatableRecord;
import org.jooq.impl.DSL;

/**
 * Writes to a single table for one {@link DomainCommand} type, each call in its own transaction.
 *
 * <p>Subclasses only see detached records: they change values and hand the records back, and this
 * class performs the insert, update or delete. Every kind except {@link Create} works on the rows
 * selected by the command condition, which must actually restrict the table.
 *
 * @param <COMMAND> handled command
 * @param <RECORD> jOOQ record of the table
 * @param <OUTPUT> written record or records
 */
@SuppressWarnings("squid:S119")
public abstract sealed class DomainCommandHandler<
        COMMAND extends DomainCommand, RECORD extends UpdatableRecord<RECORD>, OUTPUT>
    extends DomainHandler<COMMAND>
    permits DomainCommandHandler.Create,
        DomainCommandHandler.Update,
        DomainCommandHandler.Delete,
        DomainCommandHandler.BatchUpdate,
        DomainCommandHandler.BatchDelete {
  private static final String KIND = "command";

  // Conditions which would select the whole table or nothing at all
  private static final List<Condition> UNSCOPED =
      List.of(DSL.noCondition(), DSL.nullCondition(), DSL.trueCondition(), DSL.falseCondition());

  private final boolean scoped;

  private DomainCommandHandler(final Class<COMMAND> commandClass, final boolean scoped) {
    super(commandClass, KIND);
    this.scoped = scoped;
  }

  public final Class<COMMAND> getCommandClass() {
    return getOperationClass();
  }

  /**
   * Runs inside the transaction opened by {@link #runInContext}.
   *
   * @param command already authorized
   * @param trxDsl bound to the transaction
   * @param table to write to
   * @param condition selecting the rows, already checked when the kind needs one
   * @return what was written
   */
  abstract OUTPUT execute(
      final COMMAND command,
      final DSLContext trxDsl,
      final Table<RECORD> table,
      final Condition condition);

  final OUTPUT runInContext(
      final COMMAND command,
      final DSLContext readWriteDsl,
      final Table<RECORD> table,
      final Condition condition) {
    final COMMAND checked = authorize(command, KIND);
    final Table<RECORD> target = throwIllegalArgumentIfNull(table, "Table");
    final Condition where = throwIllegalArgumentIfNull(condition, "Command DSL condition");
    if (scoped && UNSCOPED.contains(where)) {
      throw new IllegalArgumentException(
          "'%s' needs a condition restricting the table, got '%s'"
              .formatted(getCommandClass().getSimpleName(), where));
    }
    final DSLContext dsl = throwIllegalStateIfNull(readWriteDsl, "Read-write DSL");

    return dsl.transactionResult(
        (final Configuration trx) -> execute(checked, trx.dsl(), target, where));
  }

  /** Inserts one record filled in by the subclass. */
  public abstract static non-sealed class Create<
          CREATE extends DomainCommand.Create, RECORD extends UpdatableRecord<RECORD>>
      extends DomainCommandHandler<CREATE, RECORD, RECORD> {
    protected Create(final Class<CREATE> commandClass) {
      super(commandClass, false);
    }

    /**
     * @param command carrying the new values
     * @param blankRecord detached record of the table
     * @return record to insert
     * @throws Exception wrapped into an internal error, nothing is inserted
     */
    @SuppressWarnings("squid:S112")
    protected abstract RECORD fillBlankRecord(final CREATE command, final RECORD blankRecord)
        throws Exception;

    @Override
    final RECORD execute(
        final CREATE command,
        final DSLContext trxDsl,
        final Table<RECORD> table,
        final Condition condition) {
      final RECORD blank = trxDsl.newRecord(table);
      blank.detach();

      final RECORD filled =
          throwIllegalStateIfNull(
              invoke(() -> fillBlankRecord(command, blank)), "New database record");
      trxDsl.batchInsert(filled).execute();
      filled.detach();
      return filled;
    }
  }

  /** Updates the single record matching the condition, if there is one. */
  public abstract static non-sealed class Update<
          UPDATE extends DomainCommand.Update, RECORD extends UpdatableRecord<RECORD>>
      extends DomainCommandHandler<UPDATE, RECORD, Optional<RECORD>> {
    protected Update(final Class<UPDATE> commandClass) {
      super(commandClass, true);
    }

    /**
     * @param command carrying the new values
     * @param oldRecord detached copy of the stored row
     * @return record to write back
     * @throws Exception wrapped into an internal error, the transaction is rolled back
     */
    @SuppressWarnings("squid:S112")
    protected abstract RECORD updateRecordValues(final UPDATE command, final RECORD oldRecord)
        throws Exception;

    @Override
    final Optional<RECORD> execute(
        final UPDATE command,
        final DSLContext trxDsl,
        final Table<RECORD> table,
        final Condition condition) {
      return trxDsl
          .fetchOptional(table, condition)
          .map(
              stored -> {
                stored.detach();
                final RECORD changed =
                    throwIllegalStateIfNull(
                        invoke(() -> updateRecordValues(command, stored)),
                        "Updated database record");
                trxDsl.batchUpdate(changed).execute();
                changed.detach();
                return changed;
              });
    }
  }

  /** Deletes the single record matching the condition, if there is one. */
  public abstract static non-sealed class Delete<
          DELETE extends DomainCommand.Delete, RECORD extends UpdatableRecord<RECORD>>
      extends DomainCommandHandler<DELETE, RECORD, Optional<RECORD>> {
    protected Delete(final Class<DELETE> commandClass) {
      super(commandClass, true);
    }

    @Override
    final Optional<RECORD> execute(
        final DELETE command,
        final DSLContext trxDsl,
        final Table<RECORD> table,
        final Condition condition) {
      return trxDsl
          .fetchOptional(table, condition)
          .map(
              stored -> {
                trxDsl.batchDelete(stored).execute();
                stored.detach();
                return stored;
              });
    }
  }

  /** Updates every record matching the condition. */
  public abstract static non-sealed class BatchUpdate<
          BATCH_UPDATE extends DomainCommand.BatchUpdate, RECORD extends UpdatableRecord<RECORD>>
      extends DomainCommandHandler<BATCH_UPDATE, RECORD, List<RECORD>> {
    protected BatchUpdate(final Class<BATCH_UPDATE> commandClass) {
      super(commandClass, true);
    }

    /**
     * @param command carrying the new values
     * @param oldRecords detached copies of the matching rows
     * @return records to write back, possibly fewer than given
     * @throws Exception wrapped into an internal error, the transaction is rolled back
     */
    @SuppressWarnings("squid:S112")
    protected abstract Stream<RECORD> updateRecordValues(
        final BATCH_UPDATE command, final Stream<RECORD> oldRecords) throws Exception;

    @Override
    final List<RECORD> execute(
        final BATCH_UPDATE command,
        final DSLContext trxDsl,
        final Table<RECORD> table,
        final Condition condition) {
      final List<RECORD> stored = trxDsl.fetch(table, condition);
      stored.forEach(UpdatableRecord::detach);

      final List<RECORD> changed =
          invoke(
              () ->
                  throwIllegalStateIfNull(
                          updateRecordValues(command, stored.stream()),
                          "Updated database records stream")
                      .toList());

      if (!changed.isEmpty()) {
        trxDsl.batchUpdate(changed).execute();
      }
      changed.forEach(UpdatableRecord::detach);
      return changed;
    }
  }

  /** Deletes every record matching the condition. */
  public abstract static non-sealed class BatchDelete<
          BATCH_DELETE extends DomainCommand.BatchDelete, RECORD extends UpdatableRecord<RECORD>>
      extends DomainCommandHandler<BATCH_DELETE, RECORD, List<RECORD>> {
    protected BatchDelete(final Class<BATCH_DELETE> commandClass) {
      super(commandClass, true);
    }

    @Override
    final List<RECORD> execute(
        final BATCH_DELETE command,
        final DSLContext trxDsl,
        final Table<RECORD> table,
        final Condition condition) {
      final List<RECORD> stored = trxDsl.fetch(table, condition);

      if (!stored.isEmpty()) {
        trxDsl.batchDelete(stored).execute();
      }
      stored.forEach(UpdatableRecord::detach);
      return stored;
    }
  }
}
