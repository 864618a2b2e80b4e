package org.provisioner.executor;

/**
 * The executor, status function and argument evaluator of a running plan. Stored in the session while the plan
 * runs, so that conditional actions can execute their blocks the same way.
 */
public class ExecutionSettings {
    private final ActionExecutor executor;
    private final ExecutionStatusFunction statusFunction;
    private final ArgumentEvaluator argumentEvaluator;

    public ExecutionSettings(
            ActionExecutor executor,
            ExecutionStatusFunction statusFunction,
            ArgumentEvaluator argumentEvaluator) {
        this.executor = executor;
        this.statusFunction = statusFunction;
        this.argumentEvaluator = argumentEvaluator;
    }

    public ActionExecutor getExecutor() {
        return executor;
    }

    public ExecutionStatusFunction getStatusFunction() {
        return statusFunction;
    }

    public ArgumentEvaluator getArgumentEvaluator() {
        return argumentEvaluator;
    }

    @Override
    public String toString() {
        return "ExecutionSettings{" +
                "executor=" + executor +
                ", statusFunction=" + statusFunction +
                ", argumentEvaluator=" + argumentEvaluator +
                '}';
    }
}
