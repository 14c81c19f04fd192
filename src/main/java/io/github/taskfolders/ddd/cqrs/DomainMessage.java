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

package io.github.taskfolders.ddd.cqrs;

import io.github.taskfolders.ddd.authorization.AnonymousDomainClient;
import io.github.taskfolders.ddd.authorization.DomainClient;
import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/** Metadata every command, query and view carries, used for logging and authorization. */
public interface DomainMessage extends Serializable {
  /**
   * Not named {@code id()}: most messages use that component for the task or folder they target.
   *
   * @return unique id of this message
   */
  UUID messageId();

  /**
   * @return when the message was built
   */
  Instant createdAt();

  /**
   * @return on whose behalf the message is sent, anonymous unless overridden
   */
  default DomainClient domainClient() {
    return AnonymousDomainClient.getInstance();
  }
}
