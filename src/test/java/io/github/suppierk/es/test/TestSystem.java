package io.github.suppierk.es.test;

import io.github.suppierk.es.cqrs.CommandPipeline;
import io.github.suppierk.es.cqrs.RebuildProjectionsHandler;
import io.github.suppierk.es.jooq.JooqEventStore;
import io.github.suppierk.es.session.CreateSessionHandler;
import io.github.suppierk.es.session.EndSessionHandler;
import io.github.suppierk.es.session.SessionCommandService;
import io.github.suppierk.es.session.SessionQueryService;
import io.github.suppierk.es.user.AddPasswordAuthenticationHandler;
import io.github.suppierk.es.user.ChangeUserEmailHandler;
import io.github.suppierk.es.user.CreateUserHandler;
import io.github.suppierk.es.user.DeactivateUserHandler;
import io.github.suppierk.es.user.UserCommandService;
import io.github.suppierk.es.user.UserQueryService;
import java.util.UUID;

/** Everything wired together the way an application would, against {@link TestEventStore}. */
public final class TestSystem {
  public final MutableClock clock;
  public final SequentialIdentityProvider identityProvider;
  public final JooqEventStore eventStore;
  public final CommandPipeline pipeline;
  public final SessionCommandService sessionCommands;
  public final SessionQueryService sessionQueries;
  public final UserCommandService userCommands;
  public final UserQueryService userQueries;

  private TestSystem(boolean sessionActivityTracking) {
    this.clock = new MutableClock();
    this.identityProvider = new SequentialIdentityProvider();
    this.eventStore = TestEventStore.create();
    this.pipeline =
        CommandPipeline.builder()
            .eventStore(eventStore)
            .clock(clock)
            .sessionActivityTracking(sessionActivityTracking)
            .addCommandHandler(new CreateSessionHandler(clock, identityProvider))
            .addCommandHandler(new EndSessionHandler(clock))
            .addCommandHandler(new CreateUserHandler(clock, identityProvider))
            .addCommandHandler(
                new AddPasswordAuthenticationHandler(clock, new FakePasswordHasher()))
            .addCommandHandler(new DeactivateUserHandler(clock))
            .addCommandHandler(new ChangeUserEmailHandler(clock))
            .addCommandHandler(new RebuildProjectionsHandler(eventStore))
            .build();
    this.sessionCommands = new SessionCommandService(pipeline);
    this.sessionQueries = new SessionQueryService(eventStore);
    this.userCommands = new UserCommandService(pipeline);
    this.userQueries = new UserQueryService(eventStore);
  }

  /** Truncates the shared database and wires a fresh system with activity tracking on. */
  public static TestSystem fresh() {
    return fresh(true);
  }

  public static TestSystem fresh(boolean sessionActivityTracking) {
    TestEventStore.truncate();
    return new TestSystem(sessionActivityTracking);
  }

  public UUID openSession() {
    return sessionCommands.createSession().resultDataAs(UUID.class);
  }
}
