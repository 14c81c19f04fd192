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

import io.github.taskfolders.ddd.authorization.DomainClient;
import io.github.taskfolders.ddd.authorization.TaskOwner;
import io.github.taskfolders.ddd.authorization.UnauthorizedException;
import io.github.taskfolders.ddd.error.InternalException;
import java.util.concurrent.Callable;

/**
 * Defines some of the common functionalities defined for handlers.
 *
 * @param <OPERATION> supported by the current handler
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
abstract sealed class DomainHandler<OPERATION extends DomainMessage> extends Suspicious
    permits DomainCommandHandler, DomainQueryHandler, DomainViewHandler {
  private final Class<OPERATION> operationClass;

  protected DomainHandler(final Class<OPERATION> operationClass, final String operationKind) {
    this.operationClass = throwIllegalArgumentIfNull(operationClass, operationKind + " class");
  }

  /**
   * @return the specific message class this handler accepts
   */
  public final Class<OPERATION> getOperationClass() {
    return operationClass;
  }

  /**
   * Every task and folder operation acts on behalf of an authenticated owner, so only {@link
   * TaskOwner}s are accepted by default.
   *
   * @param domainClient invoking the operation
   * @return {@code true} if the client can invoke current handler, {@code false} otherwise
   */
  protected boolean canBeUsedBy(final DomainClient domainClient) {
    return domainClient instanceof TaskOwner;
  }

  /**
   * Rejects the operation unless its client passes {@link #canBeUsedBy(DomainClient)}.
   *
   * @param operation being invoked
   * @param operationKind used in the error message, e.g. {@code command}
   * @return the same operation, verified to be non-null
   */
  final OPERATION authorize(final OPERATION operation, final String operationKind) {
    final OPERATION nonNullOperation =
        throwIllegalArgumentIfNull(operation, capitalize(operationKind));
    final DomainClient nonNullDomainClient =
        throwIllegalStateIfNull(
            nonNullOperation.domainClient(), "%s's client".formatted(capitalize(operationKind)));

    if (!canBeUsedBy(nonNullDomainClient)) {
      throw new UnauthorizedException(
          "Client '%s' is not allowed to use '%s' %s"
              .formatted(
                  nonNullDomainClient.domainRole(),
                  getOperationClass().getSimpleName(),
                  operationKind));
    }

    return nonNullOperation;
  }

  /**
   * Invokes handler business logic, letting unchecked exceptions through untouched and wrapping
   * checked ones, which handlers are allowed to throw, into {@link InternalException}.
   *
   * @param logic to invoke
   * @param <T> of the result
   * @return logic result
   */
  final <T> T invoke(final Callable<T> logic) {
    try {
      return logic.call();
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new InternalException(
          "'%s' handler failed".formatted(getOperationClass().getSimpleName()), e);
    }
  }

  private static String capitalize(final String input) {
    return Character.toUpperCase(input.charAt(0)) + input.substring(1);
  }
}
