package org.provisioner.action;

import java.util.Map;
import java.util.Optional;

/**
 * A registered unit of infrastructure work, e.g. installing a package or writing a file. Each occurrence of an
 * action in a plan is an {@link org.provisioner.plan.ActionMap}.
 */
public interface Action {
    /** Name of the implementation used when expanding deferred actions, and the usual fallback. */
    String DEFAULT_IMPLEMENTATION = "default";

    /**
     * Returns the name which identifies this action, e.g. {@code package}.
     */
    String getName();

    ExecutionKind getExecutionKind();

    /**
     * Returns the implementations of this action keyed by name, in registration order.
     */
    Map<String, ActionImplementation> getImplementations();

    default Optional<ActionImplementation> getImplementation(String name) {
        return Optional.ofNullable(getImplementations().get(name));
    }

    /**
     * Returns the ordering constraints applied to every instance of this action unless the instance's options
     * declare their own.
     */
    Precedence getPrecedence();
}
