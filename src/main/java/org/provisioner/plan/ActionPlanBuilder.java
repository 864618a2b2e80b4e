package org.provisioner.plan;

import org.provisioner.action.Action;
import org.provisioner.config.ActionPlanConfiguration;
import org.provisioner.nodevalue.NodeValue;
import org.provisioner.nodevalue.NodeValueRegistry;
import org.provisioner.util.Gensym;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Builds an action plan while a phase routine runs. The plan is a stack of open scopes: actions are appended to the
 * innermost scope, and closing a nested scope turns it into a block of the last action in the enclosing scope.
 *
 * Not threadsafe: a builder must only be used on the thread which created it.
 */
public class ActionPlanBuilder implements ActionPlan {
    private static final Logger logger = LoggerFactory.getLogger(ActionPlanBuilder.class);

    // Innermost scope first
    private final Deque<List<ActionMap>> scopes = new ArrayDeque<>();
    private final NodeValueRegistry nodeValueRegistry;
    private final String actionIdPrefix;
    private final Thread startThread;
    private boolean closed = false;

    public ActionPlanBuilder() {
        this(ActionPlanConfiguration.defaults());
    }

    public ActionPlanBuilder(ActionPlanConfiguration configuration) {
        this.nodeValueRegistry = new NodeValueRegistry(configuration.getNodeValuePrefix());
        this.actionIdPrefix = configuration.getActionIdPrefix();
        this.startThread = Thread.currentThread();
        this.scopes.push(new ArrayList<>());
    }

    /**
     * Appends an instance of {@code action} to the innermost open scope.
     *
     * @return a handle to the value the instance will produce when executed
     */
    public NodeValue schedule(Action action, List<?> args, ActionOptions options, PhaseContext phaseContext) {
        ensureMutationSafe();
        ActionMap actionMap = ActionMap.create(action, args, options, phaseContext, () -> Gensym.next(actionIdPrefix));
        String path = nodeValueRegistry.pathFor(this, action);
        scopes.peek().add(actionMap.withNodeValuePath(path));
        logger.debug("Scheduled {} at depth {} with node value {}", action.getName(), scopes.size(), path);
        return new NodeValue(path);
    }

    /**
     * Opens a nested scope. Must be called after scheduling the action which will own the scope as a block.
     */
    public void beginScope() {
        ensureMutationSafe();
        scopes.push(new ArrayList<>());
    }

    /**
     * Closes the innermost scope. A nested scope is added to the blocks of the last action in the enclosing scope;
     * closing the outermost scope closes the plan.
     *
     * @return the actions of the closed scope, in the order they were scheduled
     * @throws IllegalStateException if the enclosing scope contains no action to own the block
     */
    public List<ActionMap> endScope() {
        ensureMutationSafe();
        if (scopes.size() == 1) {
            return close();
        }
        List<ActionMap> block = Collections.unmodifiableList(scopes.pop());
        List<ActionMap> parent = scopes.peek();
        if (parent.isEmpty()) {
            throw new IllegalStateException(
                    "Cannot close a scope: the enclosing scope has no action to attach the block to");
        }
        int last = parent.size() - 1;
        parent.set(last, parent.get(last).withBlockAppended(block));
        return block;
    }

    /**
     * Closes the outermost scope, returning the plan's root sequence. After closing, the builder can no longer be
     * modified.
     *
     * @throws IllegalStateException if nested scopes are still open or the plan is already closed
     */
    public List<ActionMap> close() {
        ensureMutationSafe();
        if (scopes.size() != 1) {
            throw new IllegalStateException(String.format(
                    "Cannot close an action plan with %d unclosed nested scope(s)", scopes.size() - 1));
        }
        closed = true;
        return Collections.unmodifiableList(new ArrayList<>(scopes.peek()));
    }

    /**
     * Finds the node-value path of any instance of {@code action} already scheduled in this plan, in any scope.
     */
    public Optional<String> findNodeValuePath(Action action) {
        for (List<ActionMap> scope : scopes) {
            Optional<String> path = findNodeValuePath(scope, action);
            if (path.isPresent()) {
                return path;
            }
        }
        return Optional.empty();
    }

    private static Optional<String> findNodeValuePath(List<ActionMap> scope, Action action) {
        for (ActionMap actionMap : scope) {
            if (action.equals(actionMap.getAction())) {
                return Optional.of(actionMap.getNodeValuePath());
            }
            for (List<ActionMap> block : actionMap.getBlocks()) {
                Optional<String> path = findNodeValuePath(block, action);
                if (path.isPresent()) {
                    return path;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * @return the number of open scopes, 1 when only the root scope is open
     */
    public int getDepth() {
        return closed ? 0 : scopes.size();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public boolean isTranslated() {
        return false;
    }

    private void ensureMutationSafe() {
        if (closed) {
            throw new IllegalStateException("Action plan has already been closed");
        }
        if (startThread != Thread.currentThread()) {
            throw new IllegalStateException(
                    "Detected use of ActionPlanBuilder on multiple threads. ActionPlanBuilder is not threadsafe.");
        }
    }

    @Override
    public String toString() {
        return "ActionPlanBuilder{scopes=" + scopes + ", closed=" + closed + '}';
    }
}
