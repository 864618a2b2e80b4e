package org.provisioner.executor;

import org.provisioner.session.Session;

/**
 * An argument computed from the session when the action using it is executed, rather than when it is scheduled.
 */
@FunctionalInterface
public interface DelayedArgument {
    Object evaluate(Session session) throws Exception;
}
