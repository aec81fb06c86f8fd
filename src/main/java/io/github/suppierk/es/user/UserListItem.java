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

import java.util.UUID;

/**
 * Compact view of a {@link User} without its password hash.
 *
 * @param userId of the user
 * @param userName of the user
 * @param email of the user
 * @param deactivated whether the user is deactivated
 * @param hasPassword whether password authentication was added
 */
public record UserListItem(
    UUID userId, String userName, String email, boolean deactivated, boolean hasPassword) {

  static UserListItem of(final User user) {
    return new UserListItem(
        user.userId(),
        user.userName(),
        user.email(),
        user.deactivated(),
        user.passwordHash() != null && !user.passwordHash().isEmpty());
  }
}
