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

package io.github.taskfolders.ddd.authorization;

/**
 * Source of the verified user identity for the request being served.
 *
 * <p>Implementations are created per request and consulted once, before any domain logic runs.
 * The domain never verifies identity itself.
 */
@FunctionalInterface
public interface IdentityContext {
  /**
   * @return the owner the current request acts on behalf of
   * @throws UnauthorizedException if the request carries no usable identity
   */
  TaskOwner currentUser();
}
