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
import io.github.taskfolders.model.Entity;
import io.github.taskfolders.model.EntityKind;
import io.github.taskfolders.model.EntityRequest;
import io.github.taskfolders.model.TaskPatch;
import io.github.taskfolders.orchestration.TaskFolderOrchestrator;
import io.javalin.Javalin;
import io.javalin.http.Context;
import java.util.Map;

/** Routes of {@link TaskFolderOrchestrator} under {@value #BASE}. */
final class TaskRoutes implements Controller {
  static final String BASE = "/api/v1/task";

  private final TaskFolderOrchestrator orchestrator;
  private final ObjectMapper objectMapper;

  TaskRoutes(final TaskFolderOrchestrator orchestrator, final ObjectMapper objectMapper) {
    this.orchestrator = orchestrator;
    this.objectMapper = objectMapper;
  }

  @Override
  public void registerRoutes(final Javalin app) {
    // Fixed paths go first, they would match the {id} routes as well
    app.get(BASE + "/nofolder", this::listUnfiled);
    app.get(BASE + "/folder/{folderId}", this::listByFolder);
    app.post(BASE, this::create);
    app.get(BASE, this::listAll);
    app.get(BASE + "/{id}", this::getById);
    app.patch(BASE + "/{id}", this::updateById);
    app.delete(BASE + "/{type}/{id}", this::deleteTyped);
    app.delete(BASE + "/{id}", this::deleteSingleSegment);
  }

  private void create(final Context ctx) {
    final EntityRequest request = JsonMapping.read(objectMapper, ctx.body(), EntityRequest.class);
    final Entity created = orchestrator.createEntity(owner(ctx), request);
    final String message =
        created.kind() == EntityKind.FOLDER
            ? "Folder created successfully"
            : "Task created successfully";
    ctx.status(201).json(Map.of("message", message, "data", created));
  }

  private void listAll(final Context ctx) {
    ctx.json(orchestrator.listAll(owner(ctx)));
  }

  private void listByFolder(final Context ctx) {
    ctx.json(orchestrator.listByFolder(owner(ctx), ctx.pathParam("folderId")));
  }

  private void listUnfiled(final Context ctx) {
    ctx.json(orchestrator.listUnfiled(owner(ctx)));
  }

  private void getById(final Context ctx) {
    ctx.json(orchestrator.getById(owner(ctx), ctx.pathParam("id")));
  }

  private void updateById(final Context ctx) {
    final TaskPatch patch = JsonMapping.read(objectMapper, ctx.body(), TaskPatch.class);
    final Entity updated = orchestrator.updateById(owner(ctx), ctx.pathParam("id"), patch);
    ctx.json(Map.of("message", "Task or folder updated.", "data", updated));
  }

  private void deleteTyped(final Context ctx) {
    final String message =
        orchestrator.deleteById(owner(ctx), ctx.pathParam("type"), ctx.pathParam("id"));
    ctx.json(Map.of("message", message));
  }

  private void deleteSingleSegment(final Context ctx) {
    final String message = orchestrator.deleteById(owner(ctx), ctx.pathParam("id"), null);
    ctx.json(Map.of("message", message));
  }
}
