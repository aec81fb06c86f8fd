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

/** Kinds of failures a {@link CommandResult} can report. */
public enum CommandFailure {
  /** Command required a session and none was supplied. */
  MISSING_SESSION_ID("SessionId is missing"),

  /** Supplied session identifier does not resolve to any session. */
  INVALID_SESSION_ID("Invalid SessionId"),

  /** Session was resolved, but it is closed. */
  SESSION_CLOSED("Session is closed"),

  /** Business precondition or input validation failed. */
  VALIDATION_FAILED("Validation failed"),

  /**
   * Storage rejected the commit due to a concurrent duplicate - the caller can resubmit with fresh
   * input.
   */
  RACE_CONDITION("Race condition: Unique constraint violated"),

  /** Anything unexpected, details are only available in the server logs. */
  INTERNAL_ERROR("An error occurred processing your request");

  private final String defaultMessage;

  CommandFailure(String defaultMessage) {
    this.defaultMessage = defaultMessage;
  }

  /**
   * @return a message safe to show to the caller when there is nothing more specific to say
   */
  public String defaultMessage() {
    return defaultMessage;
  }
}
