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

package io.github.taskfolders.http;

import io.github.taskfolders.ddd.authorization.IdentityContext;
import io.github.taskfolders.ddd.authorization.TaskOwner;
import io.github.taskfolders.ddd.authorization.UnauthorizedException;
import io.github.taskfolders.validation.Inputs;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Reads the authenticated user from a request header set by the upstream authenticator.
 *
 * <p>The header value is trusted as is, it only has to be a well-formed user identifier.
 */
public final class HeaderIdentityContext implements IdentityContext {
  private final String headerName;
  private final UnaryOperator<String> headers;

  /**
   * @param headerName carrying the user identifier
   * @param headers lookup of a header value by name, returning {@code null} if absent
   */
  public HeaderIdentityContext(final String headerName, final UnaryOperator<String> headers) {
    if (headerName == null || headers == null) {
      throw new IllegalArgumentException("Header name and lookup cannot be null");
    }

    this.headerName = headerName;
    this.headers = headers;
  }

  /**
   * @throws UnauthorizedException if the header is missing or malformed
   */
  @Override
  public TaskOwner currentUser() {
    final String raw = headers.apply(headerName);
    if (raw == null || raw.isBlank()) {
      throw new UnauthorizedException("Not authorized, no identity supplied.");
    }

    if (!Inputs.isId(raw)) {
      throw new UnauthorizedException("Not authorized, identity is malformed.");
    }

    return new TaskOwner(UUID.fromString(raw.strip()));
  }
}
