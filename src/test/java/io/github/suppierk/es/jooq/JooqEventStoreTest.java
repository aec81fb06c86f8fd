package io.github.suppierk.es.jooq;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.session.Session;
import io.github.suppierk.es.session.SessionActivityRecorded;
import io.github.suppierk.es.session.SessionCreated;
import io.github.suppierk.es.store.EventStoreException;
import io.github.suppierk.es.store.StoredEvent;
import io.github.suppierk.es.test.TestEventStore;
import io.github.suppierk.es.user.User;
import io.github.suppierk.es.user.UserCreated;
import io.github.suppierk.es.user.UserEmailChanged;
import io.github.suppierk.es.user.UserProjection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.jooq.exception.DataAccessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JooqEventStoreTest {
  static final UUID SESSION_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");
  static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000002");
  static final UUID OTHER_USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000003");
  static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");
  static final Instant T1 = T0.plusSeconds(60);

  JooqEventStore eventStore;

  @BeforeEach
  void setUp() {
    TestEventStore.truncate();
    eventStore = TestEventStore.create();
  }

  void createSession() {
    try (var context = eventStore.openUnitOfWork()) {
      context.startStream(Session.class, SESSION_ID, new SessionCreated(SESSION_ID, T0));
      context.commit();
    }
  }

  @Test
  void when_constructor_arguments_are_null_illegal_argument_exception_is_thrown() {
    final var provider = DslContextProvider.dslContextIdentity(TestEventStore.DSL_CONTEXT);

    assertThrows(
        IllegalArgumentException.class,
        () -> new JooqEventStore(null, TestEventStore.PROJECTIONS));
    assertThrows(IllegalArgumentException.class, () -> new JooqEventStore(provider, null));
    assertThrows(
        IllegalArgumentException.class,
        () -> new JooqEventStore(provider, TestEventStore.PROJECTIONS, null));
  }

  @Test
  void when_schema_is_created_twice_nothing_happens() {
    assertDoesNotThrow(() -> EventStoreSchema.create(TestEventStore.DSL_CONTEXT));
  }

  @Nested
  class Commit {
    @Test
    void committed_events_are_appended_and_projected() {
      try (var context = eventStore.openUnitOfWork()) {
        context.startStream(Session.class, SESSION_ID, new SessionCreated(SESSION_ID, T0));
        context.appendEvents(SESSION_ID, new SessionActivityRecorded(SESSION_ID, T1));

        assertEquals(2, context.pendingEvents().size());
        assertTrue(context.load(Session.class, SESSION_ID).isEmpty());

        context.commit();
      }

      assertEquals(
          new Session(SESSION_ID, T0, T1, false),
          eventStore.load(Session.class, SESSION_ID).orElseThrow());

      final List<StoredEvent> stream = eventStore.readStream(SESSION_ID);
      assertEquals(2, stream.size());
      assertEquals(1L, stream.get(0).version());
      assertEquals("SessionCreated", stream.get(0).eventType());
      assertEquals(new SessionCreated(SESSION_ID, T0), stream.get(0).event());
      assertEquals(2L, stream.get(1).version());
      assertEquals(new SessionActivityRecorded(SESSION_ID, T1), stream.get(1).event());
    }

    @Test
    void appends_to_existing_stream_continue_its_versions() {
      createSession();

      try (var context = eventStore.openUnitOfWork()) {
        context.appendEvents(SESSION_ID, List.of(new SessionActivityRecorded(SESSION_ID, T1)));
        context.commit();
      }

      assertEquals(
          List.of(1L, 2L),
          eventStore.readStream(SESSION_ID).stream().map(StoredEvent::version).toList());
      assertEquals(T1, eventStore.load(Session.class, SESSION_ID).orElseThrow().lastAccessedAt());
    }

    @Test
    void queries_see_only_committed_documents_matching_predicate() {
      try (var context = eventStore.openUnitOfWork()) {
        context.startStream(
            User.class, USER_ID, new UserCreated(SESSION_ID, USER_ID, "ann", "ann@x.com", T0));
        context.startStream(
            User.class,
            OTHER_USER_ID,
            new UserCreated(SESSION_ID, OTHER_USER_ID, "bob", "bob@x.com", T0));
        context.commit();
      }

      assertEquals(2, eventStore.query(User.class, user -> true).size());
      assertEquals(
          List.of("bob"),
          eventStore.query(User.class, user -> user.email().startsWith("bob")).stream()
              .map(User::userName)
              .toList());

      try (var context = eventStore.openUnitOfWork()) {
        assertTrue(
            context.queryCurrent(User.class, user -> user.userName().equals("ann")).isPresent());
        assertTrue(
            context.queryCurrent(User.class, user -> user.userName().equals("eve")).isEmpty());
      }
    }

    @Test
    void appended_events_are_accepted_as_immutable_list() {
      createSession();

      try (var context = eventStore.openUnitOfWork()) {
        context.appendEvents(SESSION_ID, List.of(new SessionActivityRecorded(SESSION_ID, T1)));
        context.appendEvents(SESSION_ID, new SessionActivityRecorded(SESSION_ID, T1));

        assertEquals(2, context.pendingEvents().size());
      }
    }

    @Test
    void when_appended_events_contain_null_illegal_argument_exception_is_thrown() {
      try (var context = eventStore.openUnitOfWork()) {
        final var events = Arrays.asList(new SessionActivityRecorded(SESSION_ID, T1), null);

        assertThrows(
            IllegalArgumentException.class, () -> context.appendEvents(SESSION_ID, events));
        assertTrue(context.pendingEvents().isEmpty());
      }
    }

    @Test
    void committing_nothing_succeeds() {
      try (var context = eventStore.openUnitOfWork()) {
        assertDoesNotThrow(context::commit);
      }
    }

    @Test
    void when_unit_of_work_is_committed_twice_illegal_state_exception_is_thrown() {
      try (var context = eventStore.openUnitOfWork()) {
        context.commit();

        assertThrows(IllegalStateException.class, context::commit);
      }
    }

    @Test
    void when_unit_of_work_is_closed_it_cannot_be_used() {
      final var context = eventStore.openUnitOfWork();
      context.close();

      assertThrows(IllegalStateException.class, context::commit);
      assertThrows(
          IllegalStateException.class,
          () -> context.startStream(Session.class, SESSION_ID, new SessionCreated(SESSION_ID, T0)));
      assertThrows(
          IllegalStateException.class, () -> context.load(Session.class, SESSION_ID));
    }
  }

  @Nested
  class Discard {
    @Test
    void discarded_events_are_never_committed() {
      try (var context = eventStore.openUnitOfWork()) {
        context.startStream(Session.class, SESSION_ID, new SessionCreated(SESSION_ID, T0));
        context.discardPending();

        assertTrue(context.pendingEvents().isEmpty());
        context.commit();
      }

      assertTrue(eventStore.load(Session.class, SESSION_ID).isEmpty());
      assertTrue(eventStore.readStream(SESSION_ID).isEmpty());
    }

    @Test
    void closing_without_commit_discards_everything() {
      try (var context = eventStore.openUnitOfWork()) {
        context.startStream(Session.class, SESSION_ID, new SessionCreated(SESSION_ID, T0));
      }

      assertTrue(eventStore.load(Session.class, SESSION_ID).isEmpty());
    }
  }

  @Nested
  class UniqueKeys {
    @BeforeEach
    void setUp() {
      try (var context = eventStore.openUnitOfWork()) {
        context.startStream(
            User.class, USER_ID, new UserCreated(SESSION_ID, USER_ID, "ann", "ann@x.com", T0));
        context.commit();
      }
    }

    @Test
    void document_is_found_by_its_unique_key() {
      final var user =
          eventStore.findByUniqueKey(User.class, UserProjection.USER_NAME_KEY, "ann").orElseThrow();

      assertEquals(USER_ID, user.userId());
      assertTrue(eventStore.findByUniqueKey(User.class, UserProjection.EMAIL_KEY, "ann").isEmpty());
      assertTrue(eventStore.findByUniqueKey(User.class, UserProjection.EMAIL_KEY, null).isEmpty());
    }

    @Test
    void replaced_value_is_released() {
      try (var context = eventStore.openUnitOfWork()) {
        context.appendEvents(
            USER_ID, new UserEmailChanged(SESSION_ID, USER_ID, "ann@y.com", T1));
        context.commit();
      }

      try (var context = eventStore.openUnitOfWork()) {
        assertTrue(
            context.findByUniqueKey(User.class, UserProjection.EMAIL_KEY, "ann@x.com").isEmpty());
        assertEquals(
            "ann@y.com",
            context
                .findByUniqueKey(User.class, UserProjection.EMAIL_KEY, "ann@y.com")
                .orElseThrow()
                .email());
      }
    }

    @Test
    void when_key_is_not_declared_illegal_argument_exception_is_thrown() {
      assertThrows(
          IllegalArgumentException.class,
          () -> eventStore.findByUniqueKey(User.class, "phone", "123"));
    }
  }

  @Nested
  class Failures {
    @Test
    void when_stream_does_not_exist_event_store_exception_is_thrown_at_commit() {
      try (var context = eventStore.openUnitOfWork()) {
        context.appendEvents(SESSION_ID, new SessionActivityRecorded(SESSION_ID, T1));

        assertThrows(EventStoreException.class, context::commit);
      }
    }

    @Test
    void when_document_type_has_no_projection_unsupported_operation_exception_is_thrown() {
      try (var context = eventStore.openUnitOfWork()) {
        assertThrows(
            UnsupportedOperationException.class,
            () ->
                context.startStream(String.class, SESSION_ID, new SessionCreated(SESSION_ID, T0)));
      }
    }

    @Test
    void when_stream_is_started_twice_unique_constraint_is_violated() {
      createSession();

      try (var context = eventStore.openUnitOfWork()) {
        context.startStream(Session.class, SESSION_ID, new SessionCreated(SESSION_ID, T1));

        final var exception = assertThrows(DataAccessException.class, context::commit);
        assertTrue(eventStore.isUniqueConstraintViolation(exception));
      }

      assertEquals(T0, eventStore.load(Session.class, SESSION_ID).orElseThrow().createdAt());
    }

    @Test
    void when_unique_key_is_taken_whole_commit_is_rolled_back() {
      try (var context = eventStore.openUnitOfWork()) {
        context.startStream(
            User.class, USER_ID, new UserCreated(SESSION_ID, USER_ID, "ann", "ann@x.com", T0));
        context.commit();
      }

      try (var context = eventStore.openUnitOfWork()) {
        context.startStream(Session.class, SESSION_ID, new SessionCreated(SESSION_ID, T0));
        context.startStream(
            User.class,
            OTHER_USER_ID,
            new UserCreated(SESSION_ID, OTHER_USER_ID, "ann", "other@x.com", T0));

        final var exception = assertThrows(DataAccessException.class, context::commit);
        assertTrue(eventStore.isUniqueConstraintViolation(exception));
      }

      assertTrue(eventStore.load(Session.class, SESSION_ID).isEmpty());
      assertTrue(eventStore.load(User.class, OTHER_USER_ID).isEmpty());
      assertTrue(eventStore.readStream(OTHER_USER_ID).isEmpty());
    }

    @Test
    void unique_violation_is_recognized_anywhere_in_cause_chain() {
      final var sqlException = new SQLException("duplicate", "23505");

      assertTrue(eventStore.isUniqueConstraintViolation(sqlException));
      assertTrue(
          eventStore.isUniqueConstraintViolation(
              new IllegalStateException(new RuntimeException(sqlException))));
      assertFalse(eventStore.isUniqueConstraintViolation(new SQLException("other", "23503")));
      assertFalse(eventStore.isUniqueConstraintViolation(new IllegalStateException("boom")));
      assertFalse(eventStore.isUniqueConstraintViolation(null));
    }
  }

  @Nested
  class Rebuild {
    @Test
    void rebuild_rematerializes_deleted_documents() {
      createSession();

      try (var context = eventStore.openUnitOfWork()) {
        context.appendEvents(SESSION_ID, new SessionActivityRecorded(SESSION_ID, T1));
        context.startStream(
            User.class, USER_ID, new UserCreated(SESSION_ID, USER_ID, "ann", "ann@x.com", T0));
        context.commit();
      }

      final var session = eventStore.load(Session.class, SESSION_ID).orElseThrow();
      final var user = eventStore.load(User.class, USER_ID).orElseThrow();

      TestEventStore.DSL_CONTEXT.deleteFrom(EventStoreSchema.ES_DOCUMENTS).execute();
      assertTrue(eventStore.load(Session.class, SESSION_ID).isEmpty());

      final Map<String, Long> rebuilt = eventStore.rebuild(TestEventStore.PROJECTIONS.all());

      assertEquals(Map.of("Session", 1L, "User", 1L), rebuilt);
      assertEquals(session, eventStore.load(Session.class, SESSION_ID).orElseThrow());
      assertEquals(user, eventStore.load(User.class, USER_ID).orElseThrow());
    }

    @Test
    void staged_rebuild_is_performed_by_commit() {
      createSession();
      try (var context = eventStore.openUnitOfWork()) {
        context.startStream(
            User.class, USER_ID, new UserCreated(SESSION_ID, USER_ID, "ann", "ann@x.com", T0));
        context.commit();
      }

      final var user = eventStore.load(User.class, USER_ID).orElseThrow();
      TestEventStore.DSL_CONTEXT
          .deleteFrom(EventStoreSchema.ES_DOCUMENTS)
          .where(EventStoreSchema.PROJECTION.eq(UserProjection.NAME))
          .execute();

      try (var context = eventStore.openUnitOfWork()) {
        context.appendEvents(SESSION_ID, new SessionActivityRecorded(SESSION_ID, T1));
        context.rebuildOnCommit(
            List.of(TestEventStore.PROJECTIONS.findByName(UserProjection.NAME).orElseThrow()));

        assertTrue(eventStore.load(User.class, USER_ID).isEmpty());

        context.commit();
      }

      assertEquals(user, eventStore.load(User.class, USER_ID).orElseThrow());
      assertEquals(T1, eventStore.load(Session.class, SESSION_ID).orElseThrow().lastAccessedAt());
    }

    @Test
    void staged_rebuild_is_rolled_back_with_failed_commit() {
      createSession();
      TestEventStore.DSL_CONTEXT.deleteFrom(EventStoreSchema.ES_DOCUMENTS).execute();

      try (var context = eventStore.openUnitOfWork()) {
        context.rebuildOnCommit(TestEventStore.PROJECTIONS.all());
        context.appendEvents(USER_ID, new UserEmailChanged(SESSION_ID, USER_ID, "ann@y.com", T1));

        assertThrows(EventStoreException.class, context::commit);
      }

      assertTrue(eventStore.load(Session.class, SESSION_ID).isEmpty());
    }

    @Test
    void discarded_rebuild_is_never_performed() {
      createSession();
      TestEventStore.DSL_CONTEXT.deleteFrom(EventStoreSchema.ES_DOCUMENTS).execute();

      try (var context = eventStore.openUnitOfWork()) {
        context.rebuildOnCommit(TestEventStore.PROJECTIONS.all());
        context.discardPending();
        context.commit();
      }

      assertTrue(eventStore.load(Session.class, SESSION_ID).isEmpty());
    }

    @Test
    void rebuild_keeps_unique_keys_in_place() {
      try (var context = eventStore.openUnitOfWork()) {
        context.startStream(
            User.class, USER_ID, new UserCreated(SESSION_ID, USER_ID, "ann", "ann@x.com", T0));
        context.commit();
      }

      eventStore.rebuild(TestEventStore.PROJECTIONS.all());

      try (var context = eventStore.openUnitOfWork()) {
        context.startStream(
            User.class,
            OTHER_USER_ID,
            new UserCreated(SESSION_ID, OTHER_USER_ID, "bob", "ann@x.com", T0));

        final var exception = assertThrows(DataAccessException.class, context::commit);
        assertTrue(eventStore.isUniqueConstraintViolation(exception));
      }
    }
  }
}
