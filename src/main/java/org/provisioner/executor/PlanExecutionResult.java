package org.provisioner.executor;

import org.provisioner.session.Session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The outcome of executing a sequence of action maps: the result of each action that ran, in order, and the final
 * session. When execution was stopped, the last result is the one which stopped it.
 */
public class PlanExecutionResult {
    private final List<ExecutionResult> results;
    private final Session session;

    public PlanExecutionResult(List<ExecutionResult> results, Session session) {
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
        this.session = session;
    }

    public List<ExecutionResult> getResults() {
        return results;
    }

    public Session getSession() {
        return session;
    }

    public Optional<ExecutionResult> getLastResult() {
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(results.size() - 1));
    }

    public boolean isStopped() {
        return getLastResult().map(ExecutionResult::isStopped).orElse(false);
    }

    /**
     * Returns every error raised during execution, in the order the failing actions ran, including errors raised
     * inside the blocks of conditional actions.
     */
    public List<ActionError> getErrors() {
        return results.stream()
                .flatMap(result -> result.getErrors().stream())
                .collect(Collectors.toList());
    }

    public List<Object> getValues() {
        return results.stream().map(ExecutionResult::getValue).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "PlanExecutionResult{results=" + results + ", session=" + session + '}';
    }
}
