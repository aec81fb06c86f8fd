package io.github.suppierk.es.cqrs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.es.jooq.JooqEventStore;
import io.github.suppierk.es.session.Session;
import io.github.suppierk.es.session.SessionCreated;
import io.github.suppierk.es.session.SessionEnded;
import io.github.suppierk.es.test.TestEventStore;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionGuardTest {
  static final UUID OPEN_SESSION_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");
  static final UUID CLOSED_SESSION_ID = UUID.fromString("00000000-0000-0000-0000-000000000002");
  static final UUID UNKNOWN_SESSION_ID = UUID.fromString("00000000-0000-0000-0000-000000000009");
  static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");

  final SessionGuard sessionGuard = new SessionGuard();

  JooqEventStore eventStore;

  @BeforeEach
  void setUp() {
    TestEventStore.truncate();
    eventStore = TestEventStore.create();

    try (var context = eventStore.openUnitOfWork()) {
      context.startStream(Session.class, OPEN_SESSION_ID, new SessionCreated(OPEN_SESSION_ID, T0));
      context.startStream(
          Session.class, CLOSED_SESSION_ID, new SessionCreated(CLOSED_SESSION_ID, T0));
      context.appendEvents(
          CLOSED_SESSION_ID, new SessionEnded(CLOSED_SESSION_ID, "UserRequest", T0));
      context.commit();
    }
  }

  @Test
  void when_context_is_null_illegal_argument_exception_is_thrown() {
    assertThrows(
        IllegalArgumentException.class,
        () -> sessionGuard.loadActive(null, OPEN_SESSION_ID, null));
  }

  @Test
  void missing_session_id_is_rejected() {
    try (var context = eventStore.openUnitOfWork()) {
      final var check = sessionGuard.loadActive(context, null, null);

      assertFalse(check.active());
      assertEquals(CommandFailure.MISSING_SESSION_ID, check.failure());
      assertFalse(sessionGuard.validate(context, null));
    }
  }

  @Test
  void unknown_session_id_is_rejected() {
    try (var context = eventStore.openUnitOfWork()) {
      assertEquals(
          CommandFailure.INVALID_SESSION_ID,
          sessionGuard.loadActive(context, UNKNOWN_SESSION_ID, null).failure());
      assertFalse(sessionGuard.validate(context, UNKNOWN_SESSION_ID));
    }
  }

  @Test
  void closed_session_is_rejected() {
    try (var context = eventStore.openUnitOfWork()) {
      assertEquals(
          CommandFailure.SESSION_CLOSED,
          sessionGuard.loadActive(context, CLOSED_SESSION_ID, null).failure());
      assertFalse(sessionGuard.validate(context, CLOSED_SESSION_ID));
    }
  }

  @Test
  void open_session_is_returned() {
    try (var context = eventStore.openUnitOfWork()) {
      final var check = sessionGuard.loadActive(context, OPEN_SESSION_ID, null);

      assertTrue(check.active());
      assertNull(check.failure());
      assertEquals(new Session(OPEN_SESSION_ID, T0, T0, false), check.session());
      assertTrue(sessionGuard.validate(context, OPEN_SESSION_ID));
    }
  }

  @Test
  void matching_pre_resolved_session_is_used_without_query() {
    final var preResolved = new Session(UNKNOWN_SESSION_ID, T0, T0, false);

    try (var context = eventStore.openUnitOfWork()) {
      assertSame(
          preResolved, sessionGuard.loadActive(context, UNKNOWN_SESSION_ID, preResolved).session());
    }
  }

  @Test
  void mismatching_or_closed_pre_resolved_session_falls_back_to_query() {
    final var otherSession = new Session(UNKNOWN_SESSION_ID, T0, T0, false);
    final var closedSession = new Session(UNKNOWN_SESSION_ID, T0, T0, true);

    try (var context = eventStore.openUnitOfWork()) {
      assertEquals(
          OPEN_SESSION_ID,
          sessionGuard.loadActive(context, OPEN_SESSION_ID, otherSession).session().sessionId());
      assertEquals(
          CommandFailure.INVALID_SESSION_ID,
          sessionGuard.loadActive(context, UNKNOWN_SESSION_ID, closedSession).failure());
    }
  }

  @Test
  void pre_resolved_session_claiming_to_be_open_is_trusted() {
    final var staleSession = new Session(CLOSED_SESSION_ID, T0, T0, false);

    try (var context = eventStore.openUnitOfWork()) {
      assertTrue(sessionGuard.loadActive(context, CLOSED_SESSION_ID, staleSession).active());
    }
  }

  @Test
  void session_check_must_have_exactly_one_outcome() {
    final var session = new Session(OPEN_SESSION_ID, T0, T0, false);

    assertThrows(IllegalArgumentException.class, () -> new SessionGuard.SessionCheck(null, null));
    assertThrows(
        IllegalArgumentException.class,
        () -> new SessionGuard.SessionCheck(session, CommandFailure.SESSION_CLOSED));
  }
}
