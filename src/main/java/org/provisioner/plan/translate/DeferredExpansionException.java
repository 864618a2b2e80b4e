package org.provisioner.plan.translate;

/**
 * Wraps a checked exception thrown by a deferred action while it was being expanded. Unchecked exceptions are
 * propagated unwrapped.
 */
public class DeferredExpansionException extends RuntimeException {

    public DeferredExpansionException(String actionName, Throwable cause) {
        super(String.format("Expansion of deferred action '%s' failed: %s", actionName, cause.getMessage()), cause);
    }
}
