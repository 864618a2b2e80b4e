package org.provisioner.plan.translate;

import java.util.List;

/**
 * Thrown at translation time when precedence declarations within a scope form a cycle and the configuration asks
 * for cycles to be reported rather than tolerated.
 */
public class PrecedenceCycleException extends RuntimeException {
    private final List<String> members;

    public PrecedenceCycleException(List<String> members) {
        super("Cyclic precedence declarations between actions: " + String.join(" -> ", members));
        this.members = members;
    }

    /**
     * Returns a description of each instance in the cycle, in the order the cycle was discovered.
     */
    public List<String> getMembers() {
        return members;
    }
}
