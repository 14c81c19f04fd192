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
 * Raw input of a create request which can produce either a task or a folder. Values are kept as
 * supplied and validated by the receiving operation.
 *
 * @param type {@code task} or {@code folder}
 * @param title task title or folder name
 * @param status optional status label, tasks only
 * @param dueDate optional date, tasks only
 * @param folder optional folder identifier, tasks only
 */
public record EntityRequest(
    String type, String title, String status, String dueDate, String folder) {}
