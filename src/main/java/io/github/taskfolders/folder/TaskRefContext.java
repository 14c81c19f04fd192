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

import static io.github.taskfolders.storage.Tables.FOLDER_TASK_REFS;

import io.github.taskfolders.ddd.authorization.TaskOwner;
import io.github.taskfolders.ddd.cqrs.BoundedContext;
import io.github.taskfolders.ddd.cqrs.DomainCommand;
import io.github.taskfolders.ddd.cqrs.DomainCommandHandler;
import io.github.taskfolders.ddd.cqrs.DomainQuery;
import io.github.taskfolders.ddd.cqrs.DomainQueryHandler;
import io.github.taskfolders.ddd.jooq.DslContextProvider;
import io.github.taskfolders.storage.tables.records.FolderTaskRefsRecord;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.jooq.Condition;
import org.jooq.DSLContext;

/**
 * Membership cache of the folders: one {@code folder_task_refs} row per task a folder references,
 * ordered by the time it was added.
 *
 * <p>The table carries no owner, callers verify folder ownership before touching it.
 */
public final class TaskRefContext extends BoundedContext<FolderTaskRefsRecord> {
  public TaskRefContext(
      final DslContextProvider writeDslContextProvider,
      final DslContextProvider readDslContextProvider) {
    super(FOLDER_TASK_REFS, writeDslContextProvider, readDslContextProvider);

    addDomainCommandHandler(new AppendRefHandler());
    addDomainCommandHandler(new RemoveRefHandler());
    addDomainCommandHandler(new ClearRefsHandler());
    addDomainQueryHandler(new ListRefsHandler());
  }

  public void append(final TaskOwner owner, final UUID folder, final UUID task) {
    createModel(new AppendRef(owner, folder, task));
  }

  /**
   * @return {@code true} if the reference existed
   */
  public boolean remove(final TaskOwner owner, final UUID folder, final UUID task) {
    return deleteModel(new RemoveRef(owner, folder, task)).isPresent();
  }

  /**
   * @return number of removed references
   */
  public int clear(final TaskOwner owner, final UUID folder) {
    return batchDeleteModels(new ClearRefs(owner, folder)).size();
  }

  public List<UUID> list(final TaskOwner owner, final UUID folder) {
    return list(owner, Set.of(folder)).getOrDefault(folder, List.of());
  }

  /**
   * @param owner on whose behalf the references are read
   * @param folders to read references of
   * @return task references per folder in insertion order, folders without references are absent
   */
  public Map<UUID, List<UUID>> list(final TaskOwner owner, final Set<UUID> folders) {
    if (folders.isEmpty()) {
      return Map.of();
    }

    return queryManyModels(new ListRefs(owner, folders)).stream()
        .collect(
            Collectors.groupingBy(
                FolderTaskRefsRecord::getFolderId,
                LinkedHashMap::new,
                Collectors.mapping(FolderTaskRefsRecord::getTaskId, Collectors.toList())));
  }

  private static Condition ref(final UUID folder, final UUID task) {
    return FOLDER_TASK_REFS.FOLDER_ID.eq(folder).and(FOLDER_TASK_REFS.TASK_ID.eq(task));
  }

  record AppendRef(
      UUID messageId, Instant createdAt, TaskOwner domainClient, UUID folder, UUID task)
      implements DomainCommand.Create {
    AppendRef(final TaskOwner owner, final UUID folder, final UUID task) {
      this(UUID.randomUUID(), Instant.now(), owner, folder, task);
    }
  }

  record RemoveRef(
      UUID messageId, Instant createdAt, TaskOwner domainClient, UUID folder, UUID task)
      implements DomainCommand.Delete {
    RemoveRef(final TaskOwner owner, final UUID folder, final UUID task) {
      this(UUID.randomUUID(), Instant.now(), owner, folder, task);
    }

    @Override
    public Condition condition() {
      return ref(folder, task);
    }
  }

  record ClearRefs(UUID messageId, Instant createdAt, TaskOwner domainClient, UUID folder)
      implements DomainCommand.BatchDelete {
    ClearRefs(final TaskOwner owner, final UUID folder) {
      this(UUID.randomUUID(), Instant.now(), owner, folder);
    }

    @Override
    public Condition condition() {
      return FOLDER_TASK_REFS.FOLDER_ID.eq(folder);
    }
  }

  record ListRefs(UUID messageId, Instant createdAt, TaskOwner domainClient, Set<UUID> folders)
      implements DomainQuery.Many {
    ListRefs(final TaskOwner owner, final Set<UUID> folders) {
      this(UUID.randomUUID(), Instant.now(), owner, Set.copyOf(folders));
    }
  }

  static final class AppendRefHandler
      extends DomainCommandHandler.Create<AppendRef, FolderTaskRefsRecord> {
    AppendRefHandler() {
      super(AppendRef.class);
    }

    @Override
    protected FolderTaskRefsRecord fillBlankRecord(
        final AppendRef command, final FolderTaskRefsRecord blankRecord) {
      blankRecord.setFolderId(command.folder());
      blankRecord.setTaskId(command.task());
      blankRecord.setAddedAt(LocalDateTime.now().truncatedTo(ChronoUnit.MICROS));
      return blankRecord;
    }
  }

  static final class RemoveRefHandler
      extends DomainCommandHandler.Delete<RemoveRef, FolderTaskRefsRecord> {
    RemoveRefHandler() {
      super(RemoveRef.class);
    }
  }

  static final class ClearRefsHandler
      extends DomainCommandHandler.BatchDelete<ClearRefs, FolderTaskRefsRecord> {
    ClearRefsHandler() {
      super(ClearRefs.class);
    }
  }

  static final class ListRefsHandler
      extends DomainQueryHandler.Many<ListRefs, FolderTaskRefsRecord> {
    ListRefsHandler() {
      super(ListRefs.class);
    }

    @Override
    protected List<FolderTaskRefsRecord> run(final ListRefs query, final DSLContext dsl) {
      return dsl.selectFrom(FOLDER_TASK_REFS)
          .where(FOLDER_TASK_REFS.FOLDER_ID.in(query.folders()))
          .orderBy(FOLDER_TASK_REFS.SEQ.asc())
          .fetch();
    }
  }
}
