package org.provisioner.action;

import org.provisioner.plan.ActionMap;
import org.provisioner.session.Session;

/**
 * One named implementation of an {@link Action}. Which implementation runs is chosen by the executor.
 *
 * An implementation may return a plain value, which leaves the session untouched, or an
 * {@link org.provisioner.executor.ExecutionResult} carrying both the value and the next session.
 */
@FunctionalInterface
public interface ActionImplementation {

    /**
     * @param session the session as it stands before this action
     * @param actionMap the instance being run. Its arguments are already evaluated at execution time, and are the
     *                  stored raw arguments when a deferred action is expanded.
     */
    Object apply(Session session, ActionMap actionMap) throws Exception;
}
