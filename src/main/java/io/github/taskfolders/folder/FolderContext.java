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

package io.github.taskfolders.folder;

import static io.github.taskfolders.storage.Tables.FOLDERS;
import static io.github.taskfolders.storage.Tables.FOLDER_TASK_REFS;
import static io.github.taskfolders.storage.Tables.TASKS;

import io.github.taskfolders.ddd.authorization.TaskOwner;
import io.github.taskfolders.ddd.cqrs.BoundedContext;
import io.github.taskfolders.ddd.cqrs.DomainCommand;
import io.github.taskfolders.ddd.cqrs.DomainCommandHandler;
import io.github.taskfolders.ddd.cqrs.DomainQuery;
import io.github.taskfolders.ddd.cqrs.DomainQueryHandler;
import io.github.taskfolders.ddd.cqrs.DomainView;
import io.github.taskfolders.ddd.cqrs.DomainViewHandler;
import io.github.taskfolders.ddd.jooq.DslContextProvider;
import io.github.taskfolders.model.Folder;
import io.github.taskfolders.model.FolderDetails;
import io.github.taskfolders.model.Task;
import io.github.taskfolders.storage.tables.records.FoldersRecord;
import io.github.taskfolders.task.TaskContext;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.Result;

/**
 * Folder records of the {@code folders} table, plus the {@link FolderDetails} view joining them
 * with their tasks.
 */
public final class FolderContext extends BoundedContext<FoldersRecord> {
  public FolderContext(
      final DslContextProvider writeDslContextProvider,
      final DslContextProvider readDslContextProvider) {
    super(FOLDERS, writeDslContextProvider, readDslContextProvider);

    addDomainCommandHandler(new CreateFolderHandler());
    addDomainCommandHandler(new RenameFolderHandler());
    addDomainCommandHandler(new DeleteFolderHandler());
    addDomainQueryHandler(new FindFolderHandler());
    addDomainQueryHandler(new ListFoldersHandler());
    addDomainViewHandler(new FolderWithTasksHandler());
  }

  public FoldersRecord create(final TaskOwner owner, final String name) {
    return createModel(new CreateFolder(owner, name));
  }

  public Optional<FoldersRecord> rename(final TaskOwner owner, final UUID id, final String name) {
    return updateModel(new RenameFolder(owner, id, name));
  }

  public Optional<FoldersRecord> delete(final TaskOwner owner, final UUID id) {
    return deleteModel(new DeleteFolder(owner, id));
  }

  public Optional<FoldersRecord> find(final TaskOwner owner, final UUID id) {
    return queryOneModel(new FindFolder(owner, id));
  }

  /**
   * @param owner of the folders
   * @return owned folders sorted by name
   */
  public List<FoldersRecord> listForOwner(final TaskOwner owner) {
    return queryManyModels(new ListFolders(owner));
  }

  /**
   * @param owner of the folder
   * @param id of the folder
   * @return the folder with its tasks, empty if no such folder is owned by {@code owner}
   */
  public Optional<FolderDetails> withTasks(final TaskOwner owner, final UUID id) {
    return viewOneModel(new FolderWithTasks(owner, id), FolderDetails.class);
  }

  /**
   * @param dbRecord read from {@code folders}
   * @param taskRefs of the folder, in insertion order
   * @return the folder it holds
   */
  static Folder toFolder(final FoldersRecord dbRecord, final List<UUID> taskRefs) {
    return new Folder(
        dbRecord.getId(),
        dbRecord.getName(),
        dbRecord.getOwnerId(),
        taskRefs,
        dbRecord.getCreatedAt());
  }

  private static Condition ownedFolder(final TaskOwner owner, final UUID id) {
    return FOLDERS.ID.eq(id).and(FOLDERS.OWNER_ID.eq(owner.userId()));
  }

  // Commands

  record CreateFolder(UUID messageId, Instant createdAt, TaskOwner domainClient, String name)
      implements DomainCommand.Create {
    CreateFolder(final TaskOwner owner, final String name) {
      this(UUID.randomUUID(), Instant.now(), owner, name);
    }
  }

  record RenameFolder(
      UUID messageId, Instant createdAt, TaskOwner domainClient, UUID id, String name)
      implements DomainCommand.Update {
    RenameFolder(final TaskOwner owner, final UUID id, final String name) {
      this(UUID.randomUUID(), Instant.now(), owner, id, name);
    }

    @Override
    public Condition condition() {
      return ownedFolder(domainClient, id);
    }
  }

  record DeleteFolder(UUID messageId, Instant createdAt, TaskOwner domainClient, UUID id)
      implements DomainCommand.Delete {
    DeleteFolder(final TaskOwner owner, final UUID id) {
      this(UUID.randomUUID(), Instant.now(), owner, id);
    }

    @Override
    public Condition condition() {
      return ownedFolder(domainClient, id);
    }
  }

  // Queries and views

  record FindFolder(UUID messageId, Instant createdAt, TaskOwner domainClient, UUID id)
      implements DomainQuery.One {
    FindFolder(final TaskOwner owner, final UUID id) {
      this(UUID.randomUUID(), Instant.now(), owner, id);
    }
  }

  record ListFolders(UUID messageId, Instant createdAt, TaskOwner domainClient)
      implements DomainQuery.Many {
    ListFolders(final TaskOwner owner) {
      this(UUID.randomUUID(), Instant.now(), owner);
    }
  }

  record FolderWithTasks(UUID messageId, Instant createdAt, TaskOwner domainClient, UUID id)
      implements DomainView.One {
    FolderWithTasks(final TaskOwner owner, final UUID id) {
      this(UUID.randomUUID(), Instant.now(), owner, id);
    }
  }

  // Handlers

  static final class CreateFolderHandler
      extends DomainCommandHandler.Create<CreateFolder, FoldersRecord> {
    CreateFolderHandler() {
      super(CreateFolder.class);
    }

    @Override
    protected FoldersRecord fillBlankRecord(
        final CreateFolder command, final FoldersRecord blankRecord) {
      blankRecord.setId(UUID.randomUUID());
      blankRecord.setName(command.name());
      blankRecord.setOwnerId(command.domainClient().userId());
      blankRecord.setCreatedAt(LocalDateTime.now().truncatedTo(ChronoUnit.MICROS));
      return blankRecord;
    }
  }

  static final class RenameFolderHandler
      extends DomainCommandHandler.Update<RenameFolder, FoldersRecord> {
    RenameFolderHandler() {
      super(RenameFolder.class);
    }

    @Override
    protected FoldersRecord updateRecordValues(
        final RenameFolder command, final FoldersRecord oldRecord) {
      oldRecord.setName(command.name());
      return oldRecord;
    }
  }

  static final class DeleteFolderHandler
      extends DomainCommandHandler.Delete<DeleteFolder, FoldersRecord> {
    DeleteFolderHandler() {
      super(DeleteFolder.class);
    }
  }

  static final class FindFolderHandler extends DomainQueryHandler.One<FindFolder, FoldersRecord> {
    FindFolderHandler() {
      super(FindFolder.class);
    }

    @Override
    protected Optional<FoldersRecord> run(final FindFolder query, final DSLContext dsl) {
      return dsl.selectFrom(FOLDERS)
          .where(ownedFolder(query.domainClient(), query.id()))
          .fetchOptional();
    }
  }

  static final class ListFoldersHandler
      extends DomainQueryHandler.Many<ListFolders, FoldersRecord> {
    ListFoldersHandler() {
      super(ListFolders.class);
    }

    @Override
    protected List<FoldersRecord> run(final ListFolders query, final DSLContext dsl) {
      return dsl.selectFrom(FOLDERS)
          .where(FOLDERS.OWNER_ID.eq(query.domainClient().userId()))
          .orderBy(FOLDERS.NAME.asc(), FOLDERS.ID)
          .fetch();
    }
  }

  static final class FolderWithTasksHandler
      extends DomainViewHandler.One<FolderWithTasks, FolderDetails> {
    FolderWithTasksHandler() {
      super(FolderWithTasks.class, FolderDetails.class);
    }

    @Override
    protected Optional<FolderDetails> run(final FolderWithTasks view, final DSLContext dsl) {
      final Result<Record> rows =
          dsl.select()
              .from(FOLDERS)
              .leftJoin(TASKS)
              .on(TASKS.FOLDER_ID.eq(FOLDERS.ID).and(TASKS.OWNER_ID.eq(FOLDERS.OWNER_ID)))
              .where(ownedFolder(view.domainClient(), view.id()))
              .orderBy(TASKS.CREATED_AT.asc(), TASKS.ID)
              .fetch();

      if (rows.isEmpty()) {
        return Optional.empty();
      }

      final List<UUID> taskRefs =
          dsl.select(FOLDER_TASK_REFS.TASK_ID)
              .from(FOLDER_TASK_REFS)
              .where(FOLDER_TASK_REFS.FOLDER_ID.eq(view.id()))
              .orderBy(FOLDER_TASK_REFS.SEQ.asc())
              .fetch(FOLDER_TASK_REFS.TASK_ID);

      final List<Task> tasks =
          rows.stream()
              .filter(row -> row.get(TASKS.ID) != null)
              .map(row -> TaskContext.toTask(row.into(TASKS)))
              .toList();

      final Folder folder = toFolder(rows.get(0).into(FOLDERS), taskRefs);
      return Optional.of(new FolderDetails(folder, tasks, FolderDetails.Progress.of(tasks)));
    }
  }
}
