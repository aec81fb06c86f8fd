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

import io.github.suppierk.es.projection.SingleStreamProjection;
import java.util.UUID;

/**
 * Folds user streams into {@link User} documents.
 *
 * <p>User names and emails are declared as unique keys, which makes the storage reject a commit
 * introducing a duplicate even when two commands pass their pre-checks concurrently.
 */
public final class UserProjection extends SingleStreamProjection<User> {
  public static final String NAME = "User";
  public static final String USER_NAME_KEY = "user_name";
  public static final String EMAIL_KEY = "email";

  public UserProjection() {
    super(NAME, User.class);

    createdBy(
        UserCreated.class,
        event ->
            new User(
                event.userId(),
                event.userName(),
                event.email(),
                null,
                false,
                event.createdAt(),
                event.createdAt()));
    applying(
        PasswordAuthenticationAdded.class,
        (user, event) -> user.withPasswordHash(event.passwordHash(), event.addedAt()));
    applying(UserDeactivated.class, (user, event) -> user.deactivatedAt(event.deactivatedAt()));
    applying(
        UserEmailChanged.class,
        (user, event) -> user.withEmail(event.newEmail(), event.timestamp()));

    uniqueKey(USER_NAME_KEY, User::userName);
    uniqueKey(EMAIL_KEY, User::email);
  }

  @Override
  public UUID documentId(final User user) {
    return user.userId();
  }
}
