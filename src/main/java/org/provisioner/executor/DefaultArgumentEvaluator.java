package org.provisioner.executor;

import org.provisioner.nodevalue.NodeValue;
import org.provisioner.session.Session;

/**
 * Resolves {@link NodeValue}s from the session and computes {@link DelayedArgument}s. Any other argument, including
 * null, is passed through as is.
 */
public class DefaultArgumentEvaluator implements ArgumentEvaluator {

    @Override
    public Object evaluate(Object rawArg, Session session) throws Exception {
        if (rawArg instanceof NodeValue) {
            return session.getNodeValue((NodeValue) rawArg);
        }
        if (rawArg instanceof DelayedArgument) {
            return ((DelayedArgument) rawArg).evaluate(session);
        }
        return rawArg;
    }
}
