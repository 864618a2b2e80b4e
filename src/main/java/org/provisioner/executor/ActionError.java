package org.provisioner.executor;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Describes an action which failed during execution.
 */
public class ActionError {
    private final ErrorType type;
    private final List<String> context;
    private final String message;
    private final Throwable cause;

    public ActionError(ErrorType type, List<String> context, String message, Throwable cause) {
        this.type = type;
        this.context = ImmutableList.copyOf(context);
        this.message = message;
        this.cause = cause;
    }

    public static ActionError fromException(List<String> context, Exception e) {
        return new ActionError(
                ErrorType.ACTION_EXECUTION_ERROR,
                context,
                String.format("Unexpected exception: %s", e.getMessage()),
                e);
    }

    public ErrorType getType() {
        return type;
    }

    /**
     * Returns the phase context of the failed action.
     */
    public List<String> getContext() {
        return context;
    }

    public String getMessage() {
        return message;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return "ActionError{" +
                "type=" + type +
                ", context=" + context +
                ", message='" + message + '\'' +
                '}';
    }
}
