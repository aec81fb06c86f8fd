package io.github.suppierk.es.cqrs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.session.Session;
import io.github.suppierk.es.session.SessionProjection;
import io.github.suppierk.es.test.TestEventStore;
import io.github.suppierk.es.test.TestSystem;
import io.github.suppierk.es.user.AddPasswordAuthentication;
import io.github.suppierk.es.user.ChangeUserEmail;
import io.github.suppierk.es.user.CreateUser;
import io.github.suppierk.es.user.DeactivateUser;
import io.github.suppierk.es.user.User;
import io.github.suppierk.es.user.UserProjection;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RebuildProjectionsTest {
  TestSystem system;
  UUID sessionId;

  @BeforeEach
  void setUp() {
    system = TestSystem.fresh();
    sessionId = system.openSession();

    final UUID ann = createUser("ann", "ann@x.com");
    final UUID bob = createUser("bob", "bob@x.com");
    createUser("eve", "eve@x.com");

    system.clock.advance(Duration.ofMinutes(1));
    system.userCommands.addPasswordAuthentication(
        new AddPasswordAuthentication(sessionId, ann, "secret"));
    system.clock.advance(Duration.ofMinutes(1));
    system.userCommands.changeUserEmail(new ChangeUserEmail(sessionId, ann, "ann@y.com"));
    system.clock.advance(Duration.ofMinutes(1));
    system.userCommands.deactivateUser(new DeactivateUser(sessionId, bob));
  }

  UUID createUser(String userName, String email) {
    return system
        .userCommands
        .createUser(new CreateUser(sessionId, userName, email))
        .resultDataAs(UUID.class);
  }

  List<User> users() {
    return system.eventStore.query(User.class, user -> true).stream()
        .sorted(Comparator.comparing(User::userName))
        .toList();
  }

  List<Session> sessions() {
    return system.eventStore.query(Session.class, session -> true).stream()
        .sorted(Comparator.comparing(Session::createdAt).thenComparing(Session::sessionId))
        .toList();
  }

  @Test
  void rebuilding_everything_reproduces_incremental_documents() {
    final List<User> usersBefore = users();
    final List<Session> sessionsBefore = sessions();

    final var result = system.pipeline.execute(RebuildProjections.all(sessionId));

    assertTrue(result.success(), result::errorMessage);
    assertEquals(
        Map.of(SessionProjection.NAME, 1L, UserProjection.NAME, 1L),
        result.resultDataAs(Map.class));
    assertEquals(usersBefore, users());
    assertEquals(sessionsBefore, sessions());
  }

  @Test
  void lost_documents_are_rematerialized() {
    final List<User> usersBefore = users();
    TestEventStore.DSL_CONTEXT.deleteFrom(DSL.table(DSL.name("es_documents"))).execute();

    final var rebuilt = system.eventStore.rebuild(system.eventStore.projections().all());

    assertEquals(Map.of(SessionProjection.NAME, 1L, UserProjection.NAME, 3L), rebuilt);
    assertEquals(usersBefore, users());
  }

  @Test
  void single_projection_can_be_rebuilt() {
    final List<User> usersBefore = users();

    final var result =
        system.pipeline.execute(new RebuildProjections(sessionId, UserProjection.NAME));

    assertTrue(result.success());
    assertEquals(Map.of(UserProjection.NAME, 1L), result.resultDataAs(Map.class));
    assertEquals(usersBefore, users());
  }

  @Test
  void unique_keys_are_rebuilt() {
    system.pipeline.execute(new RebuildProjections(sessionId, UserProjection.NAME));

    final var result =
        system.userCommands.createUser(new CreateUser(sessionId, "ann", "other@x.com"));
    assertEquals("Username already exists", result.errorMessage());

    final var freed =
        system.userCommands.createUser(new CreateUser(sessionId, "ann2", "ann@x.com"));
    assertTrue(freed.success(), freed::errorMessage);
  }

  @Test
  void rebuild_commits_together_with_session_activity() {
    final var now = system.clock.advance(Duration.ofMinutes(5));

    assertTrue(system.pipeline.execute(RebuildProjections.all(sessionId)).success());

    final Session session = system.sessionQueries.findSession(sessionId).orElseThrow();
    assertEquals(now, session.lastAccessedAt());
    assertEquals(3, users().size());
  }

  @Test
  void unknown_projection_is_rejected() {
    final var result = system.pipeline.execute(new RebuildProjections(sessionId, "Order"));

    assertEquals(CommandFailure.VALIDATION_FAILED, result.failure());
    assertEquals("Unknown projection: Order", result.errorMessage());
  }

  @Test
  void rebuild_requires_open_session() {
    system.sessionCommands.endSession(sessionId, "UserRequest");

    final var result = system.pipeline.execute(RebuildProjections.all(sessionId));

    assertEquals(CommandFailure.SESSION_CLOSED, result.failure());
  }

  @Test
  void when_event_store_is_null_illegal_argument_exception_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> new RebuildProjectionsHandler(null));
  }
}
