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

import java.io.Serializable;

/**
 * Whoever a message is sent on behalf of.
 *
 * <p>Handlers only decide whether a kind of client may use them at all. Which tasks and folders the
 * client may see is decided by the owner conditions of each message.
 */
public interface DomainClient extends Serializable {
  /**
   * @return role name, used in error messages
   */
  String domainRole();
}
