package org.provisioner.executor;

import org.provisioner.config.ActionPlanConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Standard {@link ExecutionStatusFunction}s.
 */
public final class StatusFunctions {
    private static final Logger logger = LoggerFactory.getLogger(StatusFunctions.class);

    private static final ExecutionStatusFunction STOP_ON_ERROR = result -> {
        if (result.isStopped() || !result.hasError()) {
            return result;
        }
        logger.error("Stopping execution: {}", result.getError().get());
        return result.stop();
    };

    private static final ExecutionStatusFunction CONTINUE_ON_ERROR = result -> {
        if (result.hasError() && !result.isStopped()) {
            logger.warn("Continuing execution after error: {}", result.getError().get());
        }
        return result;
    };

    private StatusFunctions() {
    }

    /**
     * Stops execution at the first action which fails.
     */
    public static ExecutionStatusFunction stopOnError() {
        return STOP_ON_ERROR;
    }

    /**
     * Runs every action regardless of failures. Errors are available from
     * {@link PlanExecutionResult#getErrors()}.
     */
    public static ExecutionStatusFunction continueOnError() {
        return CONTINUE_ON_ERROR;
    }

    public static ExecutionStatusFunction fromConfiguration(ActionPlanConfiguration configuration) {
        return configuration.isStopOnError() ? stopOnError() : continueOnError();
    }
}
