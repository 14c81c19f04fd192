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

/**
 * Raw partial update of a task; {@code null} components are left untouched.
 *
 * @param title new title
 * @param status new status label
 * @param dueDate new due date, only honoured by folder-scoped updates
 */
public record TaskPatch(String title, String status, String dueDate) {
  public TaskPatch(final String title, final String status) {
    this(title, status, null);
  }

  public boolean isEmpty() {
    return title == null && status == null && dueDate == null;
  }
}
