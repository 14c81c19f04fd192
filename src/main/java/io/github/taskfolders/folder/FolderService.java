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

import io.github.taskfolders.ddd.authorization.TaskOwner;
import io.github.taskfolders.ddd.error.NotFoundException;
import io.github.taskfolders.ddd.error.ValidationException;
import io.github.taskfolders.model.Folder;
import io.github.taskfolders.model.FolderDetails;
import io.github.taskfolders.model.Task;
import io.github.taskfolders.model.TaskPatch;
import io.github.taskfolders.model.TaskStatus;
import io.github.taskfolders.storage.tables.records.FoldersRecord;
import io.github.taskfolders.task.TaskContext;
import io.github.taskfolders.validation.Inputs;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folder entity logic: folders, their membership cache and the tasks filed in them.
 *
 * <p>Operations touching several tables run one transaction per table in a fixed order. They are
 * not atomic as a whole: the task {@code folder} field always stays authoritative and the
 * membership cache may lag behind it.
 */
public final class FolderService {
  private static final Logger LOGGER = LoggerFactory.getLogger(FolderService.class);

  static final String FOLDER_NOT_FOUND = "Folder not found.";
  static final String TASK_NOT_FOUND = "Task not found.";

  private final TaskContext tasks;
  private final FolderContext folders;
  private final TaskRefContext taskRefs;

  public FolderService(
      final TaskContext tasks, final FolderContext folders, final TaskRefContext taskRefs) {
    if (tasks == null || folders == null || taskRefs == null) {
      throw new IllegalArgumentException("Folder service collaborators cannot be null");
    }

    this.tasks = tasks;
    this.folders = folders;
    this.taskRefs = taskRefs;
  }

  /**
   * @param owner of the new folder
   * @param name of the new folder
   * @return created folder with no tasks
   * @throws ValidationException if the name is blank
   */
  public Folder create(final TaskOwner owner, final String name) {
    final String validName = Inputs.requireText(name, "Folder name is required.");
    final FoldersRecord dbRecord = folders.create(owner, validName);
    LOGGER.info("Folder '{}' created for '{}'", dbRecord.getId(), owner.userId());
    return FolderContext.toFolder(dbRecord, List.of());
  }

  public Optional<Folder> find(final TaskOwner owner, final UUID id) {
    return folders.find(owner, id).map(dbRecord -> withRefs(owner, dbRecord));
  }

  /**
   * @return the folder
   * @throws NotFoundException if no such folder is owned by {@code owner}
   */
  public Folder requireOwned(final TaskOwner owner, final UUID id) {
    return find(owner, id).orElseThrow(() -> new NotFoundException(FOLDER_NOT_FOUND));
  }

  /**
   * @return owned folders sorted by name
   */
  public List<Folder> listForOwner(final TaskOwner owner) {
    final List<FoldersRecord> dbRecords = folders.listForOwner(owner);
    final Map<UUID, List<UUID>> refs =
        taskRefs.list(
            owner, dbRecords.stream().map(FoldersRecord::getId).collect(Collectors.toSet()));

    return dbRecords.stream()
        .map(
            dbRecord ->
                FolderContext.toFolder(
                    dbRecord, refs.getOrDefault(dbRecord.getId(), List.of())))
        .toList();
  }

  /**
   * @param name already validated
   * @return renamed folder, empty if no such folder is owned by {@code owner}
   */
  public Optional<Folder> rename(final TaskOwner owner, final UUID id, final String name) {
    return folders.rename(owner, id, name).map(dbRecord -> withRefs(owner, dbRecord));
  }

  /**
   * @return the folder with its tasks and completion summary
   * @throws NotFoundException if no such folder is owned by {@code owner}
   */
  public FolderDetails getWithTasks(final TaskOwner owner, final UUID id) {
    return folders.withTasks(owner, id).orElseThrow(() -> new NotFoundException(FOLDER_NOT_FOUND));
  }

  /**
   * @return owned tasks filed in the folder, newest first
   */
  public List<Task> listTasks(final TaskOwner owner, final UUID folderId) {
    return tasks.listInFolder(owner, folderId);
  }

  /**
   * Creates a task filed in the folder and references it from the folder.
   *
   * @param title of the new task
   * @param dueDate of the new task, optional
   * @return created task
   * @throws NotFoundException if no such folder is owned by {@code owner}
   * @throws ValidationException if the task input is invalid
   */
  public Task addTask(
      final TaskOwner owner, final UUID folderId, final String title, final String dueDate) {
    final TaskContext.Draft draft = TaskContext.validate(title, null, dueDate);
    requireOwned(owner, folderId);

    final Task task = tasks.create(owner, draft, folderId);
    appendTaskRef(owner, folderId, task.id());
    return task;
  }

  /** Caller must have verified that the folder is owned by {@code owner}. */
  public void appendTaskRef(final TaskOwner owner, final UUID folderId, final UUID taskId) {
    taskRefs.append(owner, folderId, taskId);
    LOGGER.debug("Task '{}' referenced by folder '{}'", taskId, folderId);
  }

  /**
   * Applies present values of the patch to a task filed in the folder.
   *
   * @return updated task
   * @throws ValidationException if the patch is empty or invalid
   * @throws NotFoundException if no such task is filed in the folder
   */
  public Task updateTask(
      final TaskOwner owner, final UUID folderId, final UUID taskId, final TaskPatch patch) {
    if (patch == null || patch.isEmpty()) {
      throw new ValidationException("Provide at least title, status or dueDate to update.");
    }

    final String title =
        patch.title() == null ? null : Inputs.requireText(patch.title(), "Title cannot be empty.");
    final TaskStatus status = Inputs.parseStatus(patch.status());
    final LocalDate dueDate = Inputs.parseDueDate(patch.dueDate());

    return tasks
        .updateFields(owner, taskId, folderId, title, status, dueDate)
        .orElseThrow(() -> new NotFoundException(TASK_NOT_FOUND));
  }

  /**
   * @return updated task
   * @throws ValidationException if the status is missing or unknown
   * @throws NotFoundException if no such task is filed in the folder
   */
  public Task updateTaskStatus(
      final TaskOwner owner, final UUID folderId, final UUID taskId, final String status) {
    final TaskStatus validStatus =
        Inputs.parseStatus(Inputs.requireText(status, "Status is required."));

    return tasks
        .updateFields(owner, taskId, folderId, null, validStatus, null)
        .orElseThrow(() -> new NotFoundException(TASK_NOT_FOUND));
  }

  /**
   * Deletes a task filed in the folder and drops its reference.
   *
   * @return deleted task
   * @throws NotFoundException if no such task is filed in the folder
   */
  public Task deleteTask(final TaskOwner owner, final UUID folderId, final UUID taskId) {
    final Task task =
        tasks
            .deleteById(owner, taskId, folderId)
            .orElseThrow(() -> new NotFoundException(TASK_NOT_FOUND));
    removeTaskRef(owner, folderId, taskId);
    return task;
  }

  /** Idempotent, removing an absent reference is a no-op. */
  public void removeTaskRef(final TaskOwner owner, final UUID folderId, final UUID taskId) {
    if (!taskRefs.remove(owner, folderId, taskId)) {
      LOGGER.debug("Folder '{}' did not reference task '{}'", folderId, taskId);
    }
  }

  /**
   * Sets every task of the folder back to {@link TaskStatus#PENDING}, references are untouched.
   *
   * @return reset tasks
   * @throws NotFoundException if no such folder is owned by {@code owner}
   */
  public List<Task> resetProgress(final TaskOwner owner, final UUID id) {
    requireOwned(owner, id);
    final List<Task> reset = tasks.resetByFolder(owner, id);
    LOGGER.info("Progress of folder '{}' reset over {} tasks", id, reset.size());
    return reset;
  }

  /**
   * Deletes every task of the folder and empties its references, the folder itself stays.
   *
   * @return deleted tasks
   * @throws NotFoundException if no such folder is owned by {@code owner}
   */
  public List<Task> clearProgress(final TaskOwner owner, final UUID id) {
    requireOwned(owner, id);
    final List<Task> deleted = tasks.deleteByFolder(owner, id);
    taskRefs.clear(owner, id);
    LOGGER.info("Progress of folder '{}' cleared, {} tasks deleted", id, deleted.size());
    return deleted;
  }

  /**
   * Deletes the tasks of the folder first, then the folder with its references. Owned tasks are
   * removed even when the folder itself turns out to be absent.
   *
   * @return deleted folder
   * @throws NotFoundException if no such folder is owned by {@code owner}
   */
  public Folder deleteCascade(final TaskOwner owner, final UUID id) {
    final List<Task> deletedTasks = tasks.deleteByFolder(owner, id);
    final FoldersRecord deleted =
        folders.delete(owner, id).orElseThrow(() -> new NotFoundException(FOLDER_NOT_FOUND));
    taskRefs.clear(owner, id);

    LOGGER.info("Folder '{}' deleted with {} tasks", id, deletedTasks.size());
    return FolderContext.toFolder(deleted, List.of());
  }

  private Folder withRefs(final TaskOwner owner, final FoldersRecord dbRecord) {
    return FolderContext.toFolder(dbRecord, taskRefs.list(owner, dbRecord.getId()));
  }
}
