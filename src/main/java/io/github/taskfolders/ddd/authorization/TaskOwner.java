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

import java.io.Serial;
import java.util.UUID;

/**
 * The authenticated user every task and folder is scoped to.
 *
 * @param userId opaque identifier handed over by the upstream authentication step
 */
public record TaskOwner(UUID userId) implements DomainClient {
  @Serial private static final long serialVersionUID = 6170259345001849872L;

  private static final String ROLE = "OWNER";

  public TaskOwner {
    if (userId == null) {
      throw new IllegalArgumentException("User ID cannot be null");
    }
  }

  /** {@inheritDoc} */
  @Override
  public String domainRole() {
    return ROLE;
  }
}
