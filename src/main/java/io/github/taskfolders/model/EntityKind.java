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

package io.github.taskfolders.model;

import java.util.Arrays;
import java.util.Optional;

/** Discriminator used by requests which can target either a task or a folder. */
public enum EntityKind {
  TASK("task"),
  FOLDER("folder");

  private final String hint;

  EntityKind(final String hint) {
    this.hint = hint;
  }

  /**
   * @param hint as supplied by the caller, can be {@code null}
   * @return matching kind, or empty if the hint is absent or unknown
   */
  public static Optional<EntityKind> fromHint(final String hint) {
    return Arrays.stream(values()).filter(kind -> kind.hint.equals(hint)).findFirst();
  }
}
