package org.provisioner.plan.translate;

import org.provisioner.plan.ActionMap;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Applies a per-scope transform to every scope of an action plan tree. Nested blocks are transformed before the
 * scope containing them, and each scope is transformed independently of the others.
 */
final class PlanWalker {

    private PlanWalker() {
    }

    static List<ActionMap> transformScopes(List<ActionMap> scope, UnaryOperator<List<ActionMap>> scopeTransform) {
        List<ActionMap> walked = new ArrayList<>(scope.size());
        for (ActionMap actionMap : scope) {
            if (actionMap.hasBlocks()) {
                List<List<ActionMap>> blocks = new ArrayList<>(actionMap.getBlocks().size());
                for (List<ActionMap> block : actionMap.getBlocks()) {
                    blocks.add(transformScopes(block, scopeTransform));
                }
                walked.add(actionMap.withBlocks(blocks));
            } else {
                walked.add(actionMap);
            }
        }
        return scopeTransform.apply(walked);
    }
}
