package io.github.suppierk.es.user;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.test.TestSystem;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UserQueryServiceTest {
  TestSystem system;
  UUID sessionId;

  @BeforeEach
  void setUp() {
    system = TestSystem.fresh();
    sessionId = system.openSession();
  }

  UUID createUser(String userName) {
    return system
        .userCommands
        .createUser(new CreateUser(sessionId, userName, userName + "@x.com"))
        .resultDataAs(UUID.class);
  }

  @Test
  void when_event_store_is_null_illegal_argument_exception_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> new UserQueryService(null));
  }

  @Test
  void no_users_at_start() {
    assertTrue(system.userQueries.getAllUsers().isEmpty());
  }

  @Test
  void users_are_listed_by_name() {
    createUser("carol");
    final UUID ann = createUser("ann");
    createUser("bob");
    system.userCommands.deactivateUser(new DeactivateUser(sessionId, ann));

    final List<UserListItem> users = system.userQueries.getAllUsers();

    assertEquals(
        List.of("ann", "bob", "carol"), users.stream().map(UserListItem::userName).toList());
    assertEquals(new UserListItem(ann, "ann", "ann@x.com", true, false), users.get(0));
  }

  @Test
  void unknown_user_is_not_found() {
    assertFalse(system.userQueries.findUser(UUID.randomUUID()).isPresent());
  }

  @Test
  void password_hash_is_masked_in_text_form() {
    final UUID ann = createUser("ann");
    system.userCommands.addPasswordAuthentication(
        new AddPasswordAuthentication(sessionId, ann, "secret"));

    final User user = system.userQueries.findUser(ann).orElseThrow();

    assertFalse(user.toString().contains("hashed:secret"));
  }
}
