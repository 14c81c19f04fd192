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

/**
 * Null checks shared by bounded contexts and handlers.
 *
 * <p>The exception type tells who is at fault: the caller ({@link IllegalArgumentException}), a
 * collaborator or handler implementation ({@link IllegalStateException}) or the registration of
 * the bounded context ({@link UnsupportedOperationException}).
 */
abstract sealed class Suspicious permits BoundedContext, DomainHandler {
  /**
   * @param value produced by a collaborator
   * @param whatMustNotBeNull used in the message
   * @param <T> of the value
   * @return non-null value
   * @throws IllegalStateException if the value is {@code null}
   */
  protected final <T> T throwIllegalStateIfNull(final T value, final String whatMustNotBeNull) {
    if (value == null) {
      throw new IllegalStateException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * @param value passed in by the caller
   * @param whatMustNotBeNull used in the message
   * @param <T> of the value
   * @return non-null value
   * @throws IllegalArgumentException if the value is {@code null}
   */
  protected final <T> T throwIllegalArgumentIfNull(final T value, final String whatMustNotBeNull) {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * @param value looked up in a handler registry
   * @param whatMustNotBeNull used in the message
   * @param <T> of the value
   * @return non-null value
   * @throws UnsupportedOperationException if nothing was registered
   */
  protected final <T> T throwUnsupportedOperationIfNull(
      final T value, final String whatMustNotBeNull) {
    if (value == null) {
      throw new UnsupportedOperationException("%s is not registered".formatted(whatMustNotBeNull));
    }

    return value;
  }
}
