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
 * Uniform outcome of every command execution.
 *
 * <p>Expected business-rule violations are returned as values of this type and never thrown.
 *
 * @param success whether the command produced its effects
 * @param resultData opaque payload for the caller, e.g. an identifier of a new stream, can be
 *     {@code null}
 * @param errorMessage human-readable reason of the failure, {@code null} on success
 * @param failure kind of the failure, {@code null} on success
 */
public record CommandResult(
    boolean success, Object resultData, String errorMessage, CommandFailure failure) {

  public CommandResult {
    if (success && failure != null) {
      throw new IllegalArgumentException("Successful result cannot have a failure kind");
    }

    if (!success && failure == null) {
      throw new IllegalArgumentException("Failed result must have a failure kind");
    }
  }

  /**
   * @return a successful result without any data
   */
  public static CommandResult ok() {
    return new CommandResult(true, null, null, null);
  }

  /**
   * @param resultData to hand back to the caller
   * @return a successful result with the given data
   */
  public static CommandResult ok(Object resultData) {
    return new CommandResult(true, resultData, null, null);
  }

  /**
   * @param failure kind of the failure
   * @return a failed result with the default message of the failure kind
   */
  public static CommandResult failed(CommandFailure failure) {
    if (failure == null) {
      throw new IllegalArgumentException("Failure cannot be null");
    }

    return new CommandResult(false, null, failure.defaultMessage(), failure);
  }

  /**
   * @param failure kind of the failure
   * @param errorMessage to show to the caller
   * @return a failed result
   */
  public static CommandResult failed(CommandFailure failure, String errorMessage) {
    return new CommandResult(false, null, errorMessage, failure);
  }

  /**
   * Shortcut for the most common failure reported by handlers.
   *
   * @param errorMessage to show to the caller
   * @return a failed result of {@link CommandFailure#VALIDATION_FAILED} kind
   */
  public static CommandResult invalid(String errorMessage) {
    return failed(CommandFailure.VALIDATION_FAILED, errorMessage);
  }

  /**
   * @param type expected type of the result data
   * @param <T> is the expected type of the result data
   * @return result data cast to the given type
   * @throws IllegalStateException if there is no result data or it has a different type
   */
  public <T> T resultDataAs(Class<T> type) {
    if (!type.isInstance(resultData)) {
      throw new IllegalStateException(
          "Result data is not of type %s: %s".formatted(type.getSimpleName(), resultData));
    }

    return type.cast(resultData);
  }
}
