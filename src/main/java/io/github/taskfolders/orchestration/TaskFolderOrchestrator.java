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

package io.github.taskfolders.orchestration;

import io.github.taskfolders.ddd.authorization.TaskOwner;
import io.github.taskfolders.ddd.error.NotFoundException;
import io.github.taskfolders.ddd.error.ValidationException;
import io.github.taskfolders.folder.FolderService;
import io.github.taskfolders.model.Entity;
import io.github.taskfolders.model.EntityKind;
import io.github.taskfolders.model.EntityRequest;
import io.github.taskfolders.model.Folder;
import io.github.taskfolders.model.Listing;
import io.github.taskfolders.model.Task;
import io.github.taskfolders.model.TaskPatch;
import io.github.taskfolders.model.TaskStatus;
import io.github.taskfolders.task.TaskContext;
import io.github.taskfolders.validation.Inputs;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operations whose target can be either a task or a folder.
 *
 * <p>There is no index from identifier to kind: lookups probe tasks first and folders second, and
 * return the first match as an {@link Entity}.
 */
public final class TaskFolderOrchestrator {
  private static final Logger LOGGER = LoggerFactory.getLogger(TaskFolderOrchestrator.class);

  public static final String TASK_DELETED = "Task deleted successfully.";
  public static final String FOLDER_DELETED = "Folder and its tasks deleted successfully.";

  private static final String NOT_FOUND = "Task or folder not found.";

  private final TaskContext tasks;
  private final FolderService folders;

  public TaskFolderOrchestrator(final TaskContext tasks, final FolderService folders) {
    if (tasks == null || folders == null) {
      throw new IllegalArgumentException("Orchestrator collaborators cannot be null");
    }

    this.tasks = tasks;
    this.folders = folders;
  }

  /**
   * Creates a folder or a task depending on {@link EntityRequest#type()}.
   *
   * <p>Folder requests use the title as the folder name and ignore task fields. A folder reference
   * of a task request is format-checked before it is looked up, and the lookup happens before any
   * write.
   *
   * @return created task or folder
   * @throws ValidationException if the title or type is missing, the type is unknown or the task
   *     input is invalid
   * @throws NotFoundException if the referenced folder is not owned by {@code owner}
   */
  public Entity createEntity(final TaskOwner owner, final EntityRequest request) {
    if (request == null || isBlank(request.title()) || isBlank(request.type())) {
      throw new ValidationException("Title and type are required.");
    }

    final EntityKind kind =
        EntityKind.fromHint(request.type().strip())
            .orElseThrow(() -> new ValidationException("Invalid type value."));

    if (kind == EntityKind.FOLDER) {
      return folders.create(owner, request.title());
    }

    final TaskContext.Draft draft =
        TaskContext.validate(request.title(), request.status(), request.dueDate());

    UUID folderId = null;
    if (!isBlank(request.folder())) {
      folderId = Inputs.parseId(request.folder(), "folder");
      if (folders.find(owner, folderId).isEmpty()) {
        throw new NotFoundException("Folder does not exist or does not belong to the user.");
      }
    }

    final Task task = tasks.create(owner, draft, folderId);
    if (folderId != null) {
      folders.appendTaskRef(owner, folderId, task.id());
    }

    return task;
  }

  /**
   * @return tasks newest first and folders by name
   */
  public Listing listAll(final TaskOwner owner) {
    return new Listing(tasks.listForOwner(owner), folders.listForOwner(owner));
  }

  public List<Task> listByFolder(final TaskOwner owner, final String folderId) {
    return tasks.listInFolder(owner, Inputs.parseId(folderId, "folder"));
  }

  public List<Task> listUnfiled(final TaskOwner owner) {
    return tasks.listUnfiled(owner);
  }

  /**
   * @return owned task or, failing that, owned folder
   * @throws NotFoundException if neither matched
   */
  public Entity getById(final TaskOwner owner, final String id) {
    final UUID validId = Inputs.parseId(id, "task or folder");

    return tasks
        .findById(owner, validId)
        .<Entity>map(task -> task)
        .or(() -> folders.find(owner, validId))
        .orElseThrow(() -> new NotFoundException(NOT_FOUND));
  }

  /**
   * Updates title and status of an owned task or, failing that, renames an owned folder with the
   * title alone.
   *
   * @return updated task or folder
   * @throws ValidationException if both title and status are absent, or either is invalid
   * @throws NotFoundException if neither matched
   */
  public Entity updateById(final TaskOwner owner, final String id, final TaskPatch patch) {
    if (patch == null || (patch.title() == null && patch.status() == null)) {
      throw new ValidationException("Provide at least title or status to update.");
    }

    final UUID validId = Inputs.parseId(id, "task or folder");
    final String title =
        patch.title() == null ? null : Inputs.requireText(patch.title(), "Title cannot be empty.");
    final TaskStatus status = Inputs.parseStatus(patch.status());

    final Optional<Task> updatedTask =
        tasks.updateFields(owner, validId, null, title, status, null);
    if (updatedTask.isPresent()) {
      return updatedTask.get();
    }

    final Optional<Folder> folder =
        title == null ? folders.find(owner, validId) : folders.rename(owner, validId, title);
    return folder.orElseThrow(() -> new NotFoundException(NOT_FOUND));
  }

  /**
   * Deletes a task or a folder with its tasks.
   *
   * <p>Supported shapes are {@code (type, id)}, {@code (id, null)} where the single segment is an
   * identifier, and {@code (null, id)}. An explicit {@code task} or {@code folder} hint dispatches
   * directly. Without a recognized hint the task is tried first and the folder second.
   *
   * @param typeHint {@code task}, {@code folder}, an identifier or {@code null}
   * @param id of the target, can be {@code null} when {@code typeHint} carries it
   * @return confirmation message
   * @throws ValidationException if no identifier was supplied or it is malformed
   * @throws NotFoundException if nothing matched
   */
  public String deleteById(final TaskOwner owner, final String typeHint, final String id) {
    String type = typeHint;
    String rawId = id;
    if (isBlank(rawId) && Inputs.isId(type)) {
      rawId = type;
      type = null;
    }

    if (isBlank(rawId)) {
      throw new ValidationException("Missing id parameter.");
    }

    final UUID validId = Inputs.parseId(rawId, "task or folder");
    final Optional<EntityKind> kind = EntityKind.fromHint(type == null ? null : type.strip());

    if (kind.isPresent() && kind.get() == EntityKind.TASK) {
      deleteTask(owner, validId).orElseThrow(() -> new NotFoundException("Task not found."));
      return TASK_DELETED;
    }

    if (kind.isPresent() && kind.get() == EntityKind.FOLDER) {
      folders.deleteCascade(owner, validId);
      return FOLDER_DELETED;
    }

    if (deleteTask(owner, validId).isPresent()) {
      return TASK_DELETED;
    }

    if (folders.find(owner, validId).isPresent()) {
      folders.deleteCascade(owner, validId);
      return FOLDER_DELETED;
    }

    throw new NotFoundException(NOT_FOUND);
  }

  private Optional<Task> deleteTask(final TaskOwner owner, final UUID id) {
    final Optional<Task> deleted = tasks.deleteById(owner, id, null);
    deleted.ifPresent(
        task -> {
          if (task.folder() != null) {
            folders.removeTaskRef(owner, task.folder(), task.id());
          }
          LOGGER.info("Task '{}' deleted for '{}'", task.id(), owner.userId());
        });
    return deleted;
  }

  private static boolean isBlank(final String value) {
    return value == null || value.isBlank();
  }
}
