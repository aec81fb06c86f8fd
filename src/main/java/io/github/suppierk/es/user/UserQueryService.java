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

import io.github.suppierk.es.store.EventStore;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Read side of users. */
public final class UserQueryService {
  private final EventStore eventStore;

  public UserQueryService(final EventStore eventStore) {
    if (eventStore == null) {
      throw new IllegalArgumentException("Event store cannot be null");
    }

    this.eventStore = eventStore;
  }

  /**
   * @return every user sorted by user name
   */
  public List<UserListItem> getAllUsers() {
    return eventStore.query(User.class, user -> true).stream()
        .map(UserListItem::of)
        .sorted(Comparator.comparing(UserListItem::userName))
        .toList();
  }

  /**
   * @param userId to look up
   * @return current state of the user, if it exists
   */
  public Optional<User> findUser(final UUID userId) {
    return eventStore.load(User.class, userId);
  }
}
