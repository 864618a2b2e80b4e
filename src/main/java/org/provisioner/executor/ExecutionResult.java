package org.provisioner.executor;

import com.google.common.base.Preconditions;
import org.provisioner.session.Session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The outcome of executing one action, paired with the session to continue with. A result either carries the
 * action's return value or an {@link ActionError}. A result flagged as stopped ends the execution of the plan.
 *
 * The result of an action which executes a block of other actions, such as a conditional, also holds the result of
 * each action run in that block.
 */
public final class ExecutionResult {
    private final Object value;
    private final ActionError error;
    private final boolean stopped;
    private final Session session;
    private final List<ExecutionResult> blockResults;

    private ExecutionResult(
            Object value,
            ActionError error,
            boolean stopped,
            Session session,
            List<ExecutionResult> blockResults) {
        this.value = value;
        this.error = error;
        this.stopped = stopped;
        this.session = Preconditions.checkNotNull(session, "session");
        this.blockResults = blockResults;
    }

    public static ExecutionResult of(Object value, Session session) {
        return new ExecutionResult(value, null, false, session, Collections.emptyList());
    }

    public static ExecutionResult failed(ActionError error, Session session) {
        return new ExecutionResult(
                null, Preconditions.checkNotNull(error, "error"), false, session, Collections.emptyList());
    }

    /**
     * Returns the result of running a block of actions: the value of the last action run, stopped if that action
     * stopped execution. Errors raised in the block are reported through {@link #getErrors()}.
     */
    public static ExecutionResult ofBlock(List<ExecutionResult> results, Session session) {
        List<ExecutionResult> copy = Collections.unmodifiableList(new ArrayList<>(results));
        ExecutionResult last = copy.isEmpty() ? null : copy.get(copy.size() - 1);
        return new ExecutionResult(
                last == null ? null : last.getValue(),
                null,
                last != null && last.isStopped(),
                session,
                copy);
    }

    /**
     * Returns the value produced by the action, null for a failed action.
     */
    public Object getValue() {
        return value;
    }

    public Optional<ActionError> getError() {
        return Optional.ofNullable(error);
    }

    public boolean hasError() {
        return error != null;
    }

    /**
     * Returns this result's own error followed by every error raised in its block, depth first.
     */
    public List<ActionError> getErrors() {
        List<ActionError> errors = new ArrayList<>();
        if (error != null) {
            errors.add(error);
        }
        for (ExecutionResult blockResult : blockResults) {
            errors.addAll(blockResult.getErrors());
        }
        return errors;
    }

    /**
     * Returns the results of the actions run in this action's block, empty for an action without one.
     */
    public List<ExecutionResult> getBlockResults() {
        return blockResults;
    }

    public boolean isStopped() {
        return stopped;
    }

    public Session getSession() {
        return session;
    }

    /**
     * Returns a copy of this result flagged to stop execution.
     */
    public ExecutionResult stop() {
        return stopped ? this : new ExecutionResult(value, error, true, session, blockResults);
    }

    public ExecutionResult withSession(Session newSession) {
        return new ExecutionResult(value, error, stopped, newSession, blockResults);
    }

    @Override
    public String toString() {
        return "ExecutionResult{" +
                "value=" + value +
                ", error=" + error +
                ", stopped=" + stopped +
                (blockResults.isEmpty() ? "" : ", blockResults=" + blockResults) +
                '}';
    }
}
