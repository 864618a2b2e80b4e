package org.provisioner.executor;

/**
 * Kinds of error recorded in an {@link ActionError}.
 */
public enum ErrorType {
    /** an exception was thrown while evaluating arguments for, or executing, an action */
    ACTION_EXECUTION_ERROR
}
