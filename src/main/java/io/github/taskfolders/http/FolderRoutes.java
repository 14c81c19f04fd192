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

package io.github.taskfolders.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.taskfolders.folder.FolderService;
import io.github.taskfolders.model.TaskPatch;
import io.github.taskfolders.validation.Inputs;
import io.javalin.Javalin;
import io.javalin.http.Context;
import java.util.Map;
import java.util.UUID;

/** Routes of {@link FolderService} under {@value #BASE}. */
final class FolderRoutes implements Controller {
  static final String BASE = "/api/v1/folders";

  private final FolderService folders;
  private final ObjectMapper objectMapper;

  FolderRoutes(final FolderService folders, final ObjectMapper objectMapper) {
    this.folders = folders;
    this.objectMapper = objectMapper;
  }

  @Override
  public void registerRoutes(final Javalin app) {
    app.post(BASE, this::create);
    app.get(BASE + "/{id}", this::getWithTasks);
    app.get(BASE + "/{folderId}/tasks", this::listTasks);
    app.post(BASE + "/{folderId}/tasks", this::addTask);
    app.patch(BASE + "/{folderId}/tasks/{taskId}", this::updateTask);
    app.patch(BASE + "/{folderId}/tasks/{taskId}/status", this::updateTaskStatus);
    app.delete(BASE + "/{folderId}/tasks/{taskId}", this::deleteTask);
    app.patch(BASE + "/{id}/progress/reset", this::resetProgress);
    app.delete(BASE + "/{id}/progress", this::clearProgress);
  }

  private void create(final Context ctx) {
    final NewFolder request = JsonMapping.read(objectMapper, ctx.body(), NewFolder.class);
    ctx.status(201).json(folders.create(owner(ctx), request.name()));
  }

  private void getWithTasks(final Context ctx) {
    ctx.json(folders.getWithTasks(owner(ctx), folderId(ctx, "id")));
  }

  private void listTasks(final Context ctx) {
    ctx.json(folders.listTasks(owner(ctx), folderId(ctx, "folderId")));
  }

  private void addTask(final Context ctx) {
    final NewTask request = JsonMapping.read(objectMapper, ctx.body(), NewTask.class);
    ctx.status(201)
        .json(
            folders.addTask(
                owner(ctx), folderId(ctx, "folderId"), request.title(), request.dueDate()));
  }

  private void updateTask(final Context ctx) {
    final TaskPatch patch = JsonMapping.read(objectMapper, ctx.body(), TaskPatch.class);
    ctx.json(folders.updateTask(owner(ctx), folderId(ctx, "folderId"), taskId(ctx), patch));
  }

  private void updateTaskStatus(final Context ctx) {
    final StatusChange request = JsonMapping.read(objectMapper, ctx.body(), StatusChange.class);
    ctx.json(
        folders.updateTaskStatus(
            owner(ctx), folderId(ctx, "folderId"), taskId(ctx), request.status()));
  }

  private void deleteTask(final Context ctx) {
    folders.deleteTask(owner(ctx), folderId(ctx, "folderId"), taskId(ctx));
    ctx.json(Map.of("message", "Task deleted"));
  }

  private void resetProgress(final Context ctx) {
    folders.resetProgress(owner(ctx), folderId(ctx, "id"));
    ctx.json(Map.of("message", "Folder progress reset"));
  }

  private void clearProgress(final Context ctx) {
    folders.clearProgress(owner(ctx), folderId(ctx, "id"));
    ctx.json(Map.of("message", "Folder progress cleared"));
  }

  private static UUID folderId(final Context ctx, final String pathParam) {
    return Inputs.parseId(ctx.pathParam(pathParam), "folder");
  }

  private static UUID taskId(final Context ctx) {
    return Inputs.parseId(ctx.pathParam("taskId"), "task");
  }

  record NewFolder(String name) {}

  record NewTask(String title, String dueDate) {}

  record StatusChange(String status) {}
}
