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

/** Thrown when caller input is malformed or a required value is missing. */
public class ValidationException extends DomainException {
  @Serial private static final long serialVersionUID = 2148833105618960331L;

  /**
   * @param message describing which input was rejected
   */
  public ValidationException(String message) {
    super(message);
  }

  /**
   * @param message describing which input was rejected
   * @param cause parsing failure behind the rejection
   */
  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * @return the most appropriate HTTP status code for this exception
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/400">400 Bad
   *     Request</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 400;
  }
}
