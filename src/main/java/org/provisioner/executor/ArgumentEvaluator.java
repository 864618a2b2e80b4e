package org.provisioner.executor;

import org.provisioner.session.Session;

/**
 * Resolves a raw action argument to the value passed to an implementation.
 */
@FunctionalInterface
public interface ArgumentEvaluator {
    Object evaluate(Object rawArg, Session session) throws Exception;
}
