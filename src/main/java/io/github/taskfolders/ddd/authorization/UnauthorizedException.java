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

import io.github.taskfolders.ddd.error.DomainException;
import java.io.Serial;

/**
 * Thrown when a request carries no usable identity, or when a message client is not allowed to
 * invoke a handler at all. Ownership of individual records is never reported this way, see {@link
 * io.github.taskfolders.ddd.error.NotFoundException}.
 */
public class UnauthorizedException extends DomainException {
  @Serial private static final long serialVersionUID = 7996325054039085081L;

  /**
   * @param message explaining what was missing
   */
  public UnauthorizedException(String message) {
    super(message);
  }

  /**
   * @return {@code 401}
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/401">401
   *     Unauthorized</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 401;
  }
}
