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

import java.util.List;

/**
 * A folder together with its resolved tasks and the completion summary over them.
 *
 * @param folder itself
 * @param tasks pointing at the folder, oldest first
 * @param progress over {@code tasks}
 */
public record FolderDetails(Folder folder, List<Task> tasks, Progress progress) {
  public FolderDetails {
    tasks = List.copyOf(tasks);
  }

  /**
   * @param total number of tasks
   * @param completed number of tasks with {@link TaskStatus#COMPLETED}
   * @param percent of completed tasks rounded down, {@code 0} for an empty folder
   */
  public record Progress(int total, int completed, int percent) {
    public static Progress of(final List<Task> tasks) {
      final int total = tasks.size();
      final int completed =
          (int) tasks.stream().filter(task -> task.status() == TaskStatus.COMPLETED).count();
      return new Progress(total, completed, total == 0 ? 0 : completed * 100 / total);
    }
  }
}
