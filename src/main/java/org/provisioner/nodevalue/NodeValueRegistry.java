package org.provisioner.nodevalue;

import org.provisioner.action.Action;
import org.provisioner.action.ExecutionKind;
import org.provisioner.plan.ActionPlanBuilder;
import org.provisioner.util.Gensym;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Assigns node-value paths to action instances as they are scheduled.
 *
 * Every instance of an aggregated or collected action in a plan is merged into one instance at translation time,
 * so all of them share a single path. Every other instance gets a fresh path.
 */
public class NodeValueRegistry {
    private static final Logger logger = LoggerFactory.getLogger(NodeValueRegistry.class);

    private final String prefix;

    public NodeValueRegistry(String prefix) {
        this.prefix = prefix;
    }

    public String pathFor(ActionPlanBuilder plan, Action action) {
        ExecutionKind kind = action.getExecutionKind();
        if (kind == ExecutionKind.AGGREGATED || kind == ExecutionKind.COLLECTED) {
            Optional<String> existing = plan.findNodeValuePath(action);
            if (existing.isPresent()) {
                logger.trace("Reusing node value path {} for {}", existing.get(), action.getName());
                return existing.get();
            }
        }
        return mint();
    }

    public String mint() {
        return Gensym.next(prefix);
    }
}
