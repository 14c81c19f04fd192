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
import io.github.taskfolders.config.TaskFoldersConfig;
import io.github.taskfolders.ddd.error.DomainException;
import io.github.taskfolders.ddd.error.InternalException;
import io.github.taskfolders.ddd.jooq.DslContextProvider;
import io.github.taskfolders.ddd.jooq.StorageBindings;
import io.github.taskfolders.folder.FolderContext;
import io.github.taskfolders.folder.FolderService;
import io.github.taskfolders.folder.TaskRefContext;
import io.github.taskfolders.orchestration.TaskFolderOrchestrator;
import io.github.taskfolders.task.TaskContext;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.json.JavalinJackson;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires storage, domain services and HTTP routes together.
 *
 * <p>Every {@code /api} request resolves its owner through {@link HeaderIdentityContext} before
 * any route runs. {@link DomainException}s are rendered as {@code {"error": message}} with their
 * own status code, anything else as an opaque 500.
 */
public final class TaskFoldersApp implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(TaskFoldersApp.class);

  private static final String INTERNAL_ERROR = "Internal server error.";

  private final TaskFoldersConfig config;
  private final StorageBindings storage;
  private final Javalin app;

  private TaskFoldersApp(
      final TaskFoldersConfig config, final StorageBindings storage, final Javalin app) {
    this.config = config;
    this.storage = storage;
    this.app = app;
  }

  /**
   * Binds storage and registers routes, without starting the server.
   *
   * @param config to create the application with
   * @return created application
   */
  public static TaskFoldersApp create(final TaskFoldersConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("Configuration cannot be null");
    }

    final StorageBindings storage =
        StorageBindings.open(
            config.databaseUrl(), config.databaseUser(), config.databasePassword());
    final DslContextProvider dsl = storage.dslContextProvider();

    final TaskContext tasks = new TaskContext(dsl, dsl);
    final FolderService folders =
        new FolderService(tasks, new FolderContext(dsl, dsl), new TaskRefContext(dsl, dsl));
    final TaskFolderOrchestrator orchestrator = new TaskFolderOrchestrator(tasks, folders);

    final ObjectMapper objectMapper = JsonMapping.objectMapper();
    final Javalin app =
        Javalin.create(
            javalinConfig -> {
              javalinConfig.showJavalinBanner = false;
              javalinConfig.jsonMapper(new JavalinJackson(objectMapper));
            });

    app.before(
        "/api/*",
        ctx ->
            ctx.attribute(
                Controller.OWNER_ATTRIBUTE,
                new HeaderIdentityContext(config.identityHeader(), ctx::header).currentUser()));

    app.exception(DomainException.class, TaskFoldersApp::renderDomainException);
    app.exception(
        Exception.class,
        (e, ctx) -> {
          LOGGER.error("Unexpected failure on {} {}", ctx.method(), ctx.path(), e);
          ctx.status(500).json(Map.of("error", INTERNAL_ERROR));
        });

    List.of(new TaskRoutes(orchestrator, objectMapper), new FolderRoutes(folders, objectMapper))
        .forEach(controller -> controller.registerRoutes(app));

    return new TaskFoldersApp(config, storage, app);
  }

  /**
   * @return this application listening on the configured port
   */
  public TaskFoldersApp start() {
    return start(config.port());
  }

  /**
   * @param port to listen on, {@code 0} picks a free one
   * @return this application
   */
  public TaskFoldersApp start(final int port) {
    app.start(port);
    LOGGER.info("Task folders API listening on port {}", app.port());
    return this;
  }

  /**
   * @return the port the server listens on
   */
  public int port() {
    return app.port();
  }

  @Override
  public void close() {
    app.stop();
    storage.close();
  }

  public static void main(final String[] args) {
    final TaskFoldersApp application = create(TaskFoldersConfig.fromEnvironment()).start();
    Runtime.getRuntime().addShutdownHook(new Thread(application::close, "task-folders-shutdown"));
  }

  private static void renderDomainException(final DomainException e, final Context ctx) {
    if (e instanceof InternalException) {
      LOGGER.error("Internal failure on {} {}", ctx.method(), ctx.path(), e);
      ctx.status(e.getStatusCode()).json(Map.of("error", INTERNAL_ERROR));
      return;
    }

    LOGGER.debug("{} {} rejected: {}", ctx.method(), ctx.path(), e.getMessage());
    ctx.status(e.getStatusCode()).json(Map.of("error", e.getMessage()));
  }
}
