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
 * Base of every failure the domain reports back to its caller.
 *
 * <p>Each subclass is an expected outcome of an operation rather than a programming error, which
 * is why it carries the most appropriate HTTP status code for consumer convenience. Programming
 * errors keep using {@link IllegalArgumentException} and {@link IllegalStateException}.
 */
public abstract class DomainException extends RuntimeException {
  @Serial private static final long serialVersionUID = -4302816254427530151L;

  protected DomainException(String message) {
    super(message);
  }

  protected DomainException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * @return the most appropriate HTTP status code for this exception
   */
  public abstract int getStatusCode();
}
