package org.provisioner.executor;

import org.provisioner.plan.ActionMap;
import org.provisioner.session.Session;

/**
 * Runs one action map. The executor chooses which of the action's named implementations to use.
 */
@FunctionalInterface
public interface ActionExecutor {

    /**
     * @param session the session before the action runs
     * @param actionMap the action map with its arguments evaluated and its recorded context
     * @return the value produced and the session to continue with
     */
    ExecutionResult execute(Session session, ActionMap actionMap) throws Exception;
}
