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

package io.github.taskfolders.ddd.error;

import java.io.Serial;

/**
 * Thrown when the requested record does not exist <b>or</b> belongs to somebody else.
 *
 * <p>The two cases are deliberately indistinguishable: callers must never learn that a record they
 * do not own exists.
 */
public class NotFoundException extends DomainException {
  @Serial private static final long serialVersionUID = -7135926066713418062L;

  /**
   * @param message naming what could not be found
   */
  public NotFoundException(String message) {
    super(message);
  }

  /**
   * @return the most appropriate HTTP status code for this exception
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/404">404 Not Found</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 404;
  }
}
