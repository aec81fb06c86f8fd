/*
 * Copyright 2024 Roman Khlebnov
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

package io.github.suppierk.es.cqrs;

/**
 * Sealed base of everything that takes part in running a {@link DomainCommand}.
 *
 * <p>Handlers are written by users of the pipeline, so neither their collaborators nor their
 * outputs are trusted. A missing value is reported in the terms of command execution, naming the
 * component that ran into it, instead of surfacing as an anonymous {@link NullPointerException}.
 */
abstract sealed class Suspicious permits CommandPipeline, DomainCommandHandler, SessionGuard {
  /**
   * For constructor and method arguments.
   *
   * @param value which must not be {@code null}
   * @param argumentName to report
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalArgumentException when the value is {@code null}
   */
  protected final <T> T requireArgument(final T value, final String argumentName) {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(argumentName));
    }

    return value;
  }

  /**
   * For settings which must have been supplied before the component is assembled.
   *
   * @param value which must not be {@code null}
   * @param settingName to report
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalStateException when the value is {@code null}
   */
  protected final <T> T requireConfigured(final T value, final String settingName) {
    if (value == null) {
      throw new IllegalStateException(
          "%s must be configured for '%s'".formatted(settingName, componentName()));
    }

    return value;
  }

  /**
   * For values produced while a command runs: handler results, new identifiers, password hashes.
   * The pipeline turns the resulting exception into {@link CommandFailure#INTERNAL_ERROR}.
   *
   * @param value which must not be {@code null}
   * @param whatWasExpected to report
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalStateException when the value is {@code null}
   */
  protected final <T> T requireProduced(final T value, final String whatWasExpected) {
    if (value == null) {
      throw new IllegalStateException(
          "'%s' cannot continue without %s".formatted(componentName(), whatWasExpected));
    }

    return value;
  }

  /**
   * @param handler registered for the command, can be {@code null}
   * @param commandClass being dispatched
   * @param <H> is the type of the handler
   * @return handler if it was registered
   * @throws UnsupportedOperationException when no handler is registered for the command
   */
  protected final <H> H requireHandler(
      final H handler, final Class<? extends DomainCommand> commandClass) {
    if (handler == null) {
      throw new UnsupportedOperationException(
          "No handler is registered for command '%s'".formatted(commandClass.getSimpleName()));
    }

    return handler;
  }

  private String componentName() {
    return getClass().getSimpleName();
  }
}
