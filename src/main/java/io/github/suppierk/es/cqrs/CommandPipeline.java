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

import io.github.suppierk.es.session.Session;
import io.github.suppierk.es.session.SessionActivityRecorded;
import io.github.suppierk.es.store.EventStore;
import io.github.suppierk.es.store.WriteContext;
import java.time.Clock;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The orchestrator of command execution.
 *
 * <p>Every call of {@link #execute(DomainCommand)} owns exactly one {@link WriteContext}: it is
 * opened on entry and closed on every exit path. The handler table is built once by {@link
 * Builder} and never changes afterwards, so one instance can serve any number of concurrent
 * callers.
 *
 * <p>Two execution modes exist, selected by the kind of the command:
 *
 * <ul>
 *   <li>{@link DomainCommand.Anonymous} commands run the handler and commit only if it succeeded.
 *   <li>{@link DomainCommand.InSession} commands first resolve the acting session via {@link
 *       SessionGuard}. If the handler fails, every staged event is discarded and only the session
 *       activity is committed.
 * </ul>
 *
 * <p>No exception escapes {@link #execute(DomainCommand)} once a handler is found: unique
 * constraint violations become {@link CommandFailure#RACE_CONDITION}, everything else becomes
 * {@link CommandFailure#INTERNAL_ERROR}.
 */
public final class CommandPipeline extends Suspicious {
  private static final Logger LOGGER = LoggerFactory.getLogger(CommandPipeline.class);

  // @formatter:off
  private final Map<
    Class<? extends DomainCommand>,
    DomainCommandHandler<? extends DomainCommand>
  > commandHandlers;
  // @formatter:on

  private final EventStore eventStore;
  private final Clock clock;
  private final boolean sessionActivityTracking;
  private final SessionGuard sessionGuard;

  private CommandPipeline(final Builder builder) {
    this.eventStore = requireConfigured(builder.eventStore, "Event store");
    this.clock = requireConfigured(builder.clock, "Clock");
    this.sessionActivityTracking = builder.sessionActivityTracking;
    this.commandHandlers = Collections.unmodifiableMap(new HashMap<>(builder.commandHandlers));
    this.sessionGuard = new SessionGuard();
  }

  /**
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return command classes this pipeline can execute
   */
  public Set<Class<? extends DomainCommand>> getSupportedDomainCommandClasses() {
    return commandHandlers.keySet();
  }

  /**
   * @param command to execute
   * @return the result of the execution
   * @throws IllegalArgumentException if the command is {@code null}
   * @throws UnsupportedOperationException if no handler is registered for the command
   */
  public CommandResult execute(final DomainCommand command) {
    return execute(command, null);
  }

  /**
   * @param command to execute
   * @param preResolvedSession the acting session if the caller already loaded it, can be {@code
   *     null}; ignored for {@link DomainCommand.Anonymous} commands
   * @return the result of the execution
   * @throws IllegalArgumentException if the command is {@code null}
   * @throws UnsupportedOperationException if no handler is registered for the command
   */
  public CommandResult execute(final DomainCommand command, final Session preResolvedSession) {
    final DomainCommand nonNullCommand = requireArgument(command, "Command");
    final DomainCommandHandler<? extends DomainCommand> handler =
        requireHandler(commandHandlers.get(nonNullCommand.getClass()), nonNullCommand.getClass());

    return validateAndDispatch(handler, nonNullCommand, preResolvedSession);
  }

  private <C extends DomainCommand> CommandResult validateAndDispatch(
      final DomainCommandHandler<C> handler,
      final DomainCommand command,
      final Session preResolvedSession) {
    final C typedCommand = handler.getCommandClass().cast(command);
    final String commandName = handler.getCommandClass().getSimpleName();

    LOGGER.info("Executing command '{}'", commandName);
    LOGGER.debug("Command payload: {}", typedCommand);

    final List<String> problems;
    try {
      problems = handler.validateCommand(typedCommand);
    } catch (RuntimeException e) {
      LOGGER.error("Command '{}' could not be validated", commandName, e);
      return CommandResult.failed(CommandFailure.INTERNAL_ERROR);
    }

    if (!problems.isEmpty()) {
      final CommandResult rejected = CommandResult.invalid(String.join(", ", problems));
      LOGGER.warn("Command '{}' is invalid: {}", commandName, rejected.errorMessage());
      return rejected;
    }

    return handler.dispatch(this, typedCommand, preResolvedSession);
  }

  /**
   * Runs a command which needs no session: the handler's events are committed only on success.
   *
   * @param handler of the command
   * @param command being executed
   * @param <C> is the type of the command
   * @return the result of the execution
   */
  <C extends DomainCommand.Anonymous> CommandResult executeUnvalidated(
      final DomainCommandHandler.Anonymous<C> handler, final C command) {
    final String commandName = handler.getCommandClass().getSimpleName();

    try (WriteContext context = eventStore.openUnitOfWork()) {
      final CommandResult result = handler.runInContext(command, context);

      if (result.success()) {
        context.commit();
        LOGGER.info("Command '{}' succeeded", commandName);
      } else {
        LOGGER.warn("Command '{}' failed: {}", commandName, result.errorMessage());
      }

      return result;
    } catch (Exception e) {
      return translate(commandName, e);
    }
  }

  /**
   * Runs a command on behalf of an open session: the handler's events are committed only on
   * success, while session activity is committed either way.
   *
   * @param handler of the command
   * @param command being executed
   * @param preResolvedSession the acting session if the caller already loaded it, can be {@code
   *     null}
   * @param <C> is the type of the command
   * @return the result of the execution
   */
  <C extends DomainCommand.InSession> CommandResult executeInSession(
      final DomainCommandHandler.InSession<C> handler,
      final C command,
      final Session preResolvedSession) {
    final String commandName = handler.getCommandClass().getSimpleName();
    final UUID sessionId = command.sessionId();

    if (sessionId == null) {
      LOGGER.warn("Command '{}' was rejected: no session supplied", commandName);
      return CommandResult.failed(CommandFailure.MISSING_SESSION_ID);
    }

    try (WriteContext context = eventStore.openUnitOfWork()) {
      final SessionGuard.SessionCheck check =
          sessionGuard.loadActive(context, sessionId, preResolvedSession);

      if (!check.active()) {
        LOGGER.warn(
            "Command '{}' was rejected for session {}: {}",
            commandName,
            sessionId,
            check.failure().defaultMessage());
        return CommandResult.failed(check.failure());
      }

      final Session session = check.session();
      final SessionActivityRecorded activity = recordActivity(context, session);
      final CommandResult result = handler.runInContext(command, context, session);

      if (result.success()) {
        context.commit();
        LOGGER.info("Command '{}' succeeded in session {}", commandName, sessionId);
        return result;
      }

      context.discardPending();
      if (activity != null) {
        context.appendEvents(session.sessionId(), activity);
      }
      context.commit();

      LOGGER.warn("Command '{}' failed: {}", commandName, result.errorMessage());
      return result;
    } catch (Exception e) {
      return translate(commandName, e);
    }
  }

  private SessionActivityRecorded recordActivity(
      final WriteContext context, final Session session) {
    if (!sessionActivityTracking) {
      return null;
    }

    final SessionActivityRecorded activity =
        new SessionActivityRecorded(session.sessionId(), clock.instant());
    context.appendEvents(session.sessionId(), activity);
    return activity;
  }

  private CommandResult translate(final String commandName, final Exception e) {
    if (eventStore.isUniqueConstraintViolation(e)) {
      LOGGER.warn("Command '{}' lost a race on a unique constraint", commandName, e);
      return CommandResult.failed(CommandFailure.RACE_CONDITION);
    }

    LOGGER.error("Command '{}' failed unexpectedly", commandName, e);
    return CommandResult.failed(CommandFailure.INTERNAL_ERROR);
  }

  /** Collects everything the {@link CommandPipeline} needs, the only way to create one. */
  public static final class Builder {
    // @formatter:off
    private final Map<
      Class<? extends DomainCommand>,
      DomainCommandHandler<? extends DomainCommand>
    > commandHandlers;
    // @formatter:on

    private EventStore eventStore;
    private Clock clock;
    private boolean sessionActivityTracking;

    private Builder() {
      this.commandHandlers = new HashMap<>();
      this.clock = Clock.systemUTC();
      this.sessionActivityTracking = true;
    }

    /**
     * @param eventStore to open units of work with
     * @return this builder
     */
    public Builder eventStore(final EventStore eventStore) {
      if (eventStore == null) {
        throw new IllegalArgumentException("Event store cannot be null");
      }

      this.eventStore = eventStore;
      return this;
    }

    /**
     * @param clock to timestamp session activity with, {@link Clock#systemUTC()} by default
     * @return this builder
     */
    public Builder clock(final Clock clock) {
      if (clock == null) {
        throw new IllegalArgumentException("Clock cannot be null");
      }

      this.clock = clock;
      return this;
    }

    /**
     * @param enabled whether commands executed in a session record its activity, {@code true} by
     *     default
     * @return this builder
     */
    public Builder sessionActivityTracking(final boolean enabled) {
      this.sessionActivityTracking = enabled;
      return this;
    }

    /**
     * @param handler to register
     * @return this builder
     * @throws IllegalArgumentException if the handler is {@code null}
     * @throws IllegalStateException if a handler for the same command is already registered
     */
    public Builder addCommandHandler(final DomainCommandHandler<? extends DomainCommand> handler) {
      if (handler == null) {
        throw new IllegalArgumentException("Command handler cannot be null");
      }

      final var existing = commandHandlers.putIfAbsent(handler.getCommandClass(), handler);
      if (existing != null) {
        throw new IllegalStateException(
            "Command '%s' is already handled by '%s'"
                .formatted(
                    handler.getCommandClass().getSimpleName(),
                    existing.getClass().getSimpleName()));
      }

      return this;
    }

    /**
     * @return a new pipeline with a read-only copy of the registered handlers
     * @throws IllegalStateException if the event store was not set
     */
    public CommandPipeline build() {
      return new CommandPipeline(this);
    }
  }
}
