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
import io.github.suppierk.es.store.WriteContext;
import io.github.suppierk.java.Try;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Class to accept and process the work associated to a specific {@link DomainCommand}:
 *
 * <ul>
 *   <li><b>Optional</b>: reject malformed input via {@link #validate(DomainCommand)} before any
 *       storage work starts.
 *   <li>Read current projected documents through the {@link WriteContext}.
 *   <li>Decide which {@link DomainEvent}s, if any, to stage.
 *   <li>Report the outcome as a {@link CommandResult}.
 * </ul>
 *
 * <p>Handlers never open, commit or discard units of work: that is the responsibility of the
 * {@link CommandPipeline}. Expected business-rule violations must be returned as failed results
 * rather than thrown.
 *
 * <p>Because {@link DomainCommand} leverages Java {@code sealed} feature, for more type safety this
 * class also makes use of the same feature: the execution mode is defined by picking one of the two
 * variants.
 *
 * @param <COMMAND> the type of the particular {@link DomainCommand}
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class DomainCommandHandler<
  COMMAND extends DomainCommand
>
extends
  Suspicious
permits
  DomainCommandHandler.Anonymous, DomainCommandHandler.InSession
{
// @formatter:on
  private static final Logger LOGGER = LoggerFactory.getLogger(DomainCommandHandler.class);

  private static final String COMMAND_RESULT = "a command result";

  private final Class<COMMAND> commandClass;

  /**
   * Constructs a new {@link DomainCommandHandler} for a specific {@link DomainCommand} class.
   *
   * @param commandClass the class of the {@link DomainCommand} to handle
   * @throws IllegalArgumentException if the command class is null
   */
  protected DomainCommandHandler(final Class<COMMAND> commandClass) {
    this.commandClass = requireArgument(commandClass, "Command class");
  }

  /**
   * Returns the class type of the command being handled by this {@link DomainCommandHandler}.
   *
   * @return the class type of the command
   */
  public final Class<COMMAND> getCommandClass() {
    return commandClass;
  }

  /**
   * Checks the shape of the command before any storage work starts.
   *
   * @param command to validate
   * @return human-readable problems, empty if the command is well-formed
   */
  protected List<String> validate(final COMMAND command) {
    return List.of();
  }

  /**
   * @param command to validate
   * @return problems reported by {@link #validate(DomainCommand)}
   * @throws IllegalStateException if the handler returned {@code null}
   */
  final List<String> validateCommand(final COMMAND command) {
    return requireProduced(validate(command), "a validation result");
  }

  /**
   * Hands the command over to the execution mode of this handler.
   *
   * @param pipeline to execute the command with
   * @param command being executed
   * @param preResolvedSession session loaded by the caller, can be {@code null}
   * @return the result of the command execution
   */
  abstract CommandResult dispatch(
      final CommandPipeline pipeline, final COMMAND command, final Session preResolvedSession);

  final CommandResult logFailure(final Try<CommandResult> output) {
    output.ifFailure(
        reason ->
            LOGGER.debug(
                "Handler of '{}' threw {}",
                commandClass.getSimpleName(),
                reason.getClass().getSimpleName()));

    return output.get();
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.Anonymous}, executed
   * without any session validation.
   *
   * @param <ANONYMOUS> the type of the particular {@link DomainCommand.Anonymous}
   */
  public abstract static non-sealed class Anonymous<ANONYMOUS extends DomainCommand.Anonymous>
      extends DomainCommandHandler<ANONYMOUS> {
    protected Anonymous(final Class<ANONYMOUS> commandClass) {
      super(commandClass);
    }

    /**
     * Business logic of the command.
     *
     * @param command being executed
     * @param context to read current documents from and stage events into
     * @return the result of the command execution
     * @throws Exception if any unexpected error occurs during the execution of the command
     * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
     *     more flexibility</a>
     */
    @SuppressWarnings("squid:S112")
    protected abstract CommandResult handle(final ANONYMOUS command, final WriteContext context)
        throws Exception;

    /** {@inheritDoc} */
    @Override
    final CommandResult dispatch(
        final CommandPipeline pipeline,
        final ANONYMOUS command,
        final Session preResolvedSession) {
      return pipeline.executeUnvalidated(this, command);
    }

    final CommandResult runInContext(final ANONYMOUS command, final WriteContext context) {
      return logFailure(
          Try.of(
              () ->
                  requireProduced(
                      handle(command, context), COMMAND_RESULT)));
    }
  }

  /**
   * A variant of the {@link DomainCommandHandler} for {@link DomainCommand.InSession}, executed
   * only after the acting session was resolved and found open.
   *
   * @param <IN_SESSION> the type of the particular {@link DomainCommand.InSession}
   */
  public abstract static non-sealed class InSession<IN_SESSION extends DomainCommand.InSession>
      extends DomainCommandHandler<IN_SESSION> {
    protected InSession(final Class<IN_SESSION> commandClass) {
      super(commandClass);
    }

    /**
     * Business logic of the command.
     *
     * @param command being executed
     * @param context to read current documents from and stage events into
     * @param session snapshot of the acting session, never closed
     * @return the result of the command execution
     * @throws Exception if any unexpected error occurs during the execution of the command
     * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
     *     more flexibility</a>
     */
    @SuppressWarnings("squid:S112")
    protected abstract CommandResult handle(
        final IN_SESSION command, final WriteContext context, final Session session)
        throws Exception;

    /** {@inheritDoc} */
    @Override
    final CommandResult dispatch(
        final CommandPipeline pipeline,
        final IN_SESSION command,
        final Session preResolvedSession) {
      return pipeline.executeInSession(this, command, preResolvedSession);
    }

    final CommandResult runInContext(
        final IN_SESSION command, final WriteContext context, final Session session) {
      return logFailure(
          Try.of(
              () ->
                  requireProduced(
                      handle(command, context, session), COMMAND_RESULT)));
    }
  }
}
