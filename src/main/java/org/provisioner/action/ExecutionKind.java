package org.provisioner.action;

/**
 * How instances of an action are scheduled and executed.
 */
public enum ExecutionKind {
    /** executed in the order scheduled, never merged */
    IN_SEQUENCE,
    /** merged per scope and executed before in-sequence actions */
    AGGREGATED,
    /** merged per scope and executed after in-sequence actions */
    COLLECTED,
    /** expanded at translation time into in-sequence actions */
    DEFERRED_IN_SEQUENCE,
    /** expanded at translation time, grouped with aggregated actions */
    DEFERRED_AGGREGATED,
    /** expanded at translation time, grouped with collected actions */
    DEFERRED_COLLECTED;

    /**
     * @return true if instances of this kind are expanded into further actions at translation time.
     */
    public boolean isDeferred() {
        return this == DEFERRED_IN_SEQUENCE || this == DEFERRED_AGGREGATED || this == DEFERRED_COLLECTED;
    }

    /**
     * @return the kind with any deferral removed, which decides how an instance is grouped.
     */
    public ExecutionKind getBaseKind() {
        switch (this) {
            case DEFERRED_IN_SEQUENCE:
                return IN_SEQUENCE;
            case DEFERRED_AGGREGATED:
                return AGGREGATED;
            case DEFERRED_COLLECTED:
                return COLLECTED;
            default:
                return this;
        }
    }

    /**
     * @return true if instances sharing an action and action-id are merged into one instance within a scope.
     */
    public boolean isMerged() {
        ExecutionKind base = getBaseKind();
        return base == AGGREGATED || base == COLLECTED;
    }
}
