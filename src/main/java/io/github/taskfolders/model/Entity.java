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

import java.util.UUID;

/**
 * Anything addressable by its identifier alone: lookups which do not know the target kind return
 * one of the permitted variants.
 */
public sealed interface Entity permits Task, Folder {
  UUID id();

  UUID owner();

  EntityKind kind();
}
