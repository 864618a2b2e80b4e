package org.provisioner.executor;

/**
 * Thrown when asked to execute an action plan which has not been translated. This is a programming error.
 */
public class UntranslatedPlanException extends IllegalStateException {

    public UntranslatedPlanException() {
        super("Attempt to execute an untranslated action plan");
    }
}
