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

package io.github.taskfolders.task;

import static io.github.taskfolders.storage.Tables.TASKS;

import io.github.taskfolders.ddd.authorization.TaskOwner;
import io.github.taskfolders.ddd.cqrs.BoundedContext;
import io.github.taskfolders.ddd.cqrs.DomainCommand;
import io.github.taskfolders.ddd.cqrs.DomainCommandHandler;
import io.github.taskfolders.ddd.cqrs.DomainQuery;
import io.github.taskfolders.ddd.cqrs.DomainQueryHandler;
import io.github.taskfolders.ddd.jooq.DslContextProvider;
import io.github.taskfolders.model.Task;
import io.github.taskfolders.model.TaskStatus;
import io.github.taskfolders.storage.tables.records.TasksRecord;
import io.github.taskfolders.validation.Inputs;
import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Task entity logic over the {@code tasks} table.
 *
 * <p>Every command and query is scoped by its owner: a task of another user is reported exactly
 * like an absent one.
 */
public final class TaskContext extends BoundedContext<TasksRecord> {
  private static final Logger LOGGER = LoggerFactory.getLogger(TaskContext.class);

  public TaskContext(
      final DslContextProvider writeDslContextProvider,
      final DslContextProvider readDslContextProvider) {
    super(TASKS, writeDslContextProvider, readDslContextProvider);

    addDomainCommandHandler(new CreateTaskHandler());
    addDomainCommandHandler(new UpdateTaskHandler());
    addDomainCommandHandler(new DeleteTaskHandler());
    addDomainCommandHandler(new ResetTasksInFolderHandler());
    addDomainCommandHandler(new DeleteTasksInFolderHandler());
    addDomainQueryHandler(new FindTaskHandler());
    addDomainQueryHandler(new ListTasksHandler<>(ListOwnerTasks.class));
    addDomainQueryHandler(new ListTasksHandler<>(ListFolderTasks.class));
    addDomainQueryHandler(new ListTasksHandler<>(ListUnfiledTasks.class));
  }

  /**
   * Validates raw task input.
   *
   * @param title required
   * @param status optional label, defaults to {@link TaskStatus#PENDING}
   * @param dueDate optional date
   * @return validated values
   */
  public static Draft validate(final String title, final String status, final String dueDate) {
    final String validTitle = Inputs.requireText(title, "Title is required.");
    final TaskStatus validStatus = Inputs.parseStatus(status);
    final LocalDate validDueDate = Inputs.parseDueDate(dueDate);
    return new Draft(
        validTitle, validDueDate, validStatus == null ? TaskStatus.PENDING : validStatus);
  }

  /**
   * Persists a new task. The caller must have verified that {@code folder}, when present, belongs
   * to the same owner.
   *
   * @param owner of the new task
   * @param draft validated by {@link #validate(String, String, String)}
   * @param folder containing folder or {@code null}
   * @return created task
   */
  public Task create(final TaskOwner owner, final Draft draft, final UUID folder) {
    final Task task = toTask(createModel(new CreateTask(owner, draft, folder)));
    LOGGER.debug("Task '{}' created for '{}'", task.id(), owner.userId());
    return task;
  }

  /**
   * Applies present values only.
   *
   * @param owner of the task
   * @param id of the task
   * @param folder required containing folder, or {@code null} for any
   * @param title new title or {@code null}
   * @param status new status or {@code null}
   * @param dueDate new due date or {@code null}
   * @return updated task, empty if no such task is owned by {@code owner}
   */
  public Optional<Task> updateFields(
      final TaskOwner owner,
      final UUID id,
      final UUID folder,
      final String title,
      final TaskStatus status,
      final LocalDate dueDate) {
    return updateModel(new UpdateTask(owner, id, folder, title, status, dueDate))
        .map(TaskContext::toTask);
  }

  /**
   * @param owner of the task
   * @param id of the task
   * @param folder required containing folder, or {@code null} for any
   * @return deleted task, empty if no such task is owned by {@code owner}
   */
  public Optional<Task> deleteById(final TaskOwner owner, final UUID id, final UUID folder) {
    return deleteModel(new DeleteTask(owner, id, folder)).map(TaskContext::toTask);
  }

  /**
   * @param owner of the tasks
   * @param folder containing the tasks
   * @return deleted tasks
   */
  public List<Task> deleteByFolder(final TaskOwner owner, final UUID folder) {
    return batchDeleteModels(new DeleteTasksInFolder(owner, folder)).stream()
        .map(TaskContext::toTask)
        .toList();
  }

  /**
   * Sets every task of the folder back to {@link TaskStatus#PENDING}.
   *
   * @param owner of the tasks
   * @param folder containing the tasks
   * @return reset tasks
   */
  public List<Task> resetByFolder(final TaskOwner owner, final UUID folder) {
    return batchUpdateModels(new ResetTasksInFolder(owner, folder)).stream()
        .map(TaskContext::toTask)
        .toList();
  }

  public Optional<Task> findById(final TaskOwner owner, final UUID id) {
    return queryOneModel(new FindTask(owner, id)).map(TaskContext::toTask);
  }

  public List<Task> listForOwner(final TaskOwner owner) {
    return toTasks(queryManyModels(new ListOwnerTasks(owner)));
  }

  public List<Task> listInFolder(final TaskOwner owner, final UUID folder) {
    return toTasks(queryManyModels(new ListFolderTasks(owner, folder)));
  }

  public List<Task> listUnfiled(final TaskOwner owner) {
    return toTasks(queryManyModels(new ListUnfiledTasks(owner)));
  }

  /**
   * @param dbRecord read from {@code tasks}
   * @return the task it holds
   */
  public static Task toTask(final TasksRecord dbRecord) {
    return new Task(
        dbRecord.getId(),
        dbRecord.getTitle(),
        dbRecord.getDueDate(),
        TaskStatus.fromLabel(dbRecord.getStatus()),
        dbRecord.getFolderId(),
        dbRecord.getOwnerId(),
        dbRecord.getCreatedAt());
  }

  private static List<Task> toTasks(final List<TasksRecord> dbRecords) {
    return dbRecords.stream().map(TaskContext::toTask).toList();
  }

  private static Condition ownedBy(final TaskOwner owner) {
    return TASKS.OWNER_ID.eq(owner.userId());
  }

  private static Condition ownedTask(final TaskOwner owner, final UUID id, final UUID folder) {
    final Condition condition = TASKS.ID.eq(id).and(ownedBy(owner));
    return folder == null ? condition : condition.and(TASKS.FOLDER_ID.eq(folder));
  }

  /**
   * Validated task values.
   *
   * @param title never blank
   * @param dueDate optional
   * @param status never {@code null}
   */
  public record Draft(String title, LocalDate dueDate, TaskStatus status) implements Serializable {}

  /** Common filter of the task listings. */
  interface TaskFilter {
    Condition filter();
  }

  // Commands

  record CreateTask(
      UUID messageId, Instant createdAt, TaskOwner domainClient, Draft draft, UUID folder)
      implements DomainCommand.Create {
    CreateTask(final TaskOwner owner, final Draft draft, final UUID folder) {
      this(UUID.randomUUID(), Instant.now(), owner, draft, folder);
    }
  }

  record UpdateTask(
      UUID messageId,
      Instant createdAt,
      TaskOwner domainClient,
      UUID id,
      UUID folder,
      String title,
      TaskStatus status,
      LocalDate dueDate)
      implements DomainCommand.Update {
    UpdateTask(
        final TaskOwner owner,
        final UUID id,
        final UUID folder,
        final String title,
        final TaskStatus status,
        final LocalDate dueDate) {
      this(UUID.randomUUID(), Instant.now(), owner, id, folder, title, status, dueDate);
    }

    @Override
    public Condition condition() {
      return ownedTask(domainClient, id, folder);
    }
  }

  record DeleteTask(
      UUID messageId, Instant createdAt, TaskOwner domainClient, UUID id, UUID folder)
      implements DomainCommand.Delete {
    DeleteTask(final TaskOwner owner, final UUID id, final UUID folder) {
      this(UUID.randomUUID(), Instant.now(), owner, id, folder);
    }

    @Override
    public Condition condition() {
      return ownedTask(domainClient, id, folder);
    }
  }

  record ResetTasksInFolder(
      UUID messageId, Instant createdAt, TaskOwner domainClient, UUID folder)
      implements DomainCommand.BatchUpdate {
    ResetTasksInFolder(final TaskOwner owner, final UUID folder) {
      this(UUID.randomUUID(), Instant.now(), owner, folder);
    }

    @Override
    public Condition condition() {
      return TASKS.FOLDER_ID.eq(folder).and(ownedBy(domainClient));
    }
  }

  record DeleteTasksInFolder(
      UUID messageId, Instant createdAt, TaskOwner domainClient, UUID folder)
      implements DomainCommand.BatchDelete {
    DeleteTasksInFolder(final TaskOwner owner, final UUID folder) {
      this(UUID.randomUUID(), Instant.now(), owner, folder);
    }

    @Override
    public Condition condition() {
      return TASKS.FOLDER_ID.eq(folder).and(ownedBy(domainClient));
    }
  }

  // Queries

  record FindTask(UUID messageId, Instant createdAt, TaskOwner domainClient, UUID id)
      implements DomainQuery.One {
    FindTask(final TaskOwner owner, final UUID id) {
      this(UUID.randomUUID(), Instant.now(), owner, id);
    }
  }

  record ListOwnerTasks(UUID messageId, Instant createdAt, TaskOwner domainClient)
      implements DomainQuery.Many, TaskFilter {
    ListOwnerTasks(final TaskOwner owner) {
      this(UUID.randomUUID(), Instant.now(), owner);
    }

    @Override
    public Condition filter() {
      return ownedBy(domainClient);
    }
  }

  record ListFolderTasks(UUID messageId, Instant createdAt, TaskOwner domainClient, UUID folder)
      implements DomainQuery.Many, TaskFilter {
    ListFolderTasks(final TaskOwner owner, final UUID folder) {
      this(UUID.randomUUID(), Instant.now(), owner, folder);
    }

    @Override
    public Condition filter() {
      return ownedBy(domainClient).and(TASKS.FOLDER_ID.eq(folder));
    }
  }

  record ListUnfiledTasks(UUID messageId, Instant createdAt, TaskOwner domainClient)
      implements DomainQuery.Many, TaskFilter {
    ListUnfiledTasks(final TaskOwner owner) {
      this(UUID.randomUUID(), Instant.now(), owner);
    }

    @Override
    public Condition filter() {
      return ownedBy(domainClient).and(TASKS.FOLDER_ID.isNull());
    }
  }

  // Handlers

  static final class CreateTaskHandler
      extends DomainCommandHandler.Create<CreateTask, TasksRecord> {
    CreateTaskHandler() {
      super(CreateTask.class);
    }

    @Override
    protected TasksRecord fillBlankRecord(final CreateTask command, final TasksRecord blankRecord) {
      final Draft draft = command.draft();
      blankRecord.setId(UUID.randomUUID());
      blankRecord.setTitle(draft.title());
      blankRecord.setDueDate(draft.dueDate());
      blankRecord.setStatus(draft.status().label());
      blankRecord.setFolderId(command.folder());
      blankRecord.setOwnerId(command.domainClient().userId());
      blankRecord.setCreatedAt(LocalDateTime.now().truncatedTo(ChronoUnit.MICROS));
      return blankRecord;
    }
  }

  static final class UpdateTaskHandler
      extends DomainCommandHandler.Update<UpdateTask, TasksRecord> {
    UpdateTaskHandler() {
      super(UpdateTask.class);
    }

    @Override
    protected TasksRecord updateRecordValues(
        final UpdateTask command, final TasksRecord oldRecord) {
      if (command.title() != null) {
        oldRecord.setTitle(command.title());
      }

      if (command.status() != null) {
        oldRecord.setStatus(command.status().label());
      }

      if (command.dueDate() != null) {
        oldRecord.setDueDate(command.dueDate());
      }

      return oldRecord;
    }
  }

  static final class DeleteTaskHandler
      extends DomainCommandHandler.Delete<DeleteTask, TasksRecord> {
    DeleteTaskHandler() {
      super(DeleteTask.class);
    }
  }

  static final class ResetTasksInFolderHandler
      extends DomainCommandHandler.BatchUpdate<ResetTasksInFolder, TasksRecord> {
    ResetTasksInFolderHandler() {
      super(ResetTasksInFolder.class);
    }

    @Override
    protected Stream<TasksRecord> updateRecordValues(
        final ResetTasksInFolder command, final Stream<TasksRecord> oldRecords) {
      return oldRecords.map(
          dbRecord -> {
            dbRecord.setStatus(TaskStatus.PENDING.label());
            return dbRecord;
          });
    }
  }

  static final class DeleteTasksInFolderHandler
      extends DomainCommandHandler.BatchDelete<DeleteTasksInFolder, TasksRecord> {
    DeleteTasksInFolderHandler() {
      super(DeleteTasksInFolder.class);
    }
  }

  static final class FindTaskHandler extends DomainQueryHandler.One<FindTask, TasksRecord> {
    FindTaskHandler() {
      super(FindTask.class);
    }

    @Override
    protected Optional<TasksRecord> run(final FindTask query, final DSLContext dsl) {
      return dsl.selectFrom(TASKS)
          .where(ownedTask(query.domainClient(), query.id(), null))
          .fetchOptional();
    }
  }

  static final class ListTasksHandler<Q extends DomainQuery.Many & TaskFilter>
      extends DomainQueryHandler.Many<Q, TasksRecord> {
    ListTasksHandler(final Class<Q> queryClass) {
      super(queryClass);
    }

    @Override
    protected List<TasksRecord> run(final Q query, final DSLContext dsl) {
      return dsl.selectFrom(TASKS)
          .where(query.filter())
          .orderBy(TASKS.CREATED_AT.desc(), TASKS.ID)
          .fetch();
    }
  }
}
