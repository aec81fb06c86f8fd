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

package io.github.suppierk.es.user;

import java.time.Instant;
import java.util.UUID;

/**
 * Projected state of an account.
 *
 * @param userId identifier of the user and of its stream
 * @param userName unique across all users
 * @param email unique across all users
 * @param passwordHash one-way hash of the password, {@code null} until password authentication is
 *     added
 * @param deactivated whether the account was deactivated
 * @param createdAt when the user was created
 * @param lastUpdatedAt when the user was changed last
 */
public record User(
    UUID userId,
    String userName,
    String email,
    String passwordHash,
    boolean deactivated,
    Instant createdAt,
    Instant lastUpdatedAt) {

  User withPasswordHash(final String newPasswordHash, final Instant updatedAt) {
    return new User(userId, userName, email, newPasswordHash, deactivated, createdAt, updatedAt);
  }

  User deactivatedAt(final Instant updatedAt) {
    return new User(userId, userName, email, passwordHash, true, createdAt, updatedAt);
  }

  User withEmail(final String newEmail, final Instant updatedAt) {
    return new User(userId, userName, newEmail, passwordHash, deactivated, createdAt, updatedAt);
  }

  @Override
  public String toString() {
    return ("User[userId=%s, userName=%s, email=%s, passwordHash=%s, deactivated=%s, "
            + "createdAt=%s, lastUpdatedAt=%s]")
        .formatted(
            userId,
            userName,
            email,
            passwordHash == null ? null : "***",
            deactivated,
            createdAt,
            lastUpdatedAt);
  }
}
