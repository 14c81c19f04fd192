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

import io.github.taskfolders.ddd.authorization.TaskOwner;
import io.javalin.Javalin;
import io.javalin.http.Context;

/** A group of HTTP routes. */
interface Controller {
  /** Request attribute holding the {@link TaskOwner} resolved before any route runs. */
  String OWNER_ATTRIBUTE = "taskfolders.owner";

  void registerRoutes(Javalin app);

  default TaskOwner owner(final Context ctx) {
    final TaskOwner owner = ctx.attribute(OWNER_ATTRIBUTE);
    if (owner == null) {
      throw new IllegalStateException("Request owner was not resolved");
    }

    return owner;
  }
}
