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

/**
 * Client of messages created without an authenticated user.
 *
 * <p>No task or folder handler accepts it: any message carrying it fails with {@link
 * UnauthorizedException}.
 */
public final class AnonymousDomainClient implements DomainClient {
  @Serial private static final long serialVersionUID = -2611523096852178379L;

  private static final String ROLE = "ANONYMOUS";
  private static final AnonymousDomainClient INSTANCE = new AnonymousDomainClient();

  private AnonymousDomainClient() {
    // Singleton
  }

  public static AnonymousDomainClient getInstance() {
    return INSTANCE;
  }

  @Override
  public String domainRole() {
    return ROLE;
  }

  @Serial
  private Object readResolve() {
    return INSTANCE;
  }
}
