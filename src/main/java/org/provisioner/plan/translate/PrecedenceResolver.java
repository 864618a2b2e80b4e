package org.provisioner.plan.translate;

import org.provisioner.action.PrecedenceTarget;
import org.provisioner.config.ActionPlanConfiguration;
import org.provisioner.plan.ActionMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Reorders each scope of an action plan so that always-before and always-after declarations hold between the
 * instances of that scope.
 *
 * Instances are emitted in their original order, except that an instance is preceded by every not yet emitted
 * instance which must come before it. Declarations naming an action or action-id absent from the scope have no
 * effect. Cyclic declarations still terminate with every instance emitted once; the cycle is either logged or, if
 * configured, reported with a {@link PrecedenceCycleException}.
 */
public class PrecedenceResolver {
    private static final Logger logger = LoggerFactory.getLogger(PrecedenceResolver.class);

    private final boolean failOnCycle;

    public PrecedenceResolver(ActionPlanConfiguration configuration) {
        this.failOnCycle = configuration.isFailOnPrecedenceCycle();
    }

    public List<ActionMap> resolve(List<ActionMap> plan) {
        return PlanWalker.transformScopes(plan, this::resolveScope);
    }

    List<ActionMap> resolveScope(List<ActionMap> scope) {
        ScopeDependencies dependencies = ScopeDependencies.of(scope);
        if (dependencies.isEmpty()) {
            return scope;
        }

        List<ActionMap> emitted = new ArrayList<>(scope.size());
        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < scope.size(); i++) {
            emit(i, scope, dependencies, seen, new LinkedHashSet<>(), emitted);
        }
        return emitted;
    }

    private void emit(
            int index,
            List<ActionMap> scope,
            ScopeDependencies dependencies,
            Set<Integer> seen,
            LinkedHashSet<Integer> visiting,
            List<ActionMap> emitted) {
        if (seen.contains(index)) {
            return;
        }
        visiting.add(index);
        for (int prerequisite : dependencies.getPrerequisites(index)) {
            if (seen.contains(prerequisite)) {
                continue;
            }
            if (visiting.contains(prerequisite)) {
                onCycle(scope, visiting, prerequisite);
                continue;
            }
            emit(prerequisite, scope, dependencies, seen, visiting, emitted);
        }
        visiting.remove(index);
        seen.add(index);
        emitted.add(scope.get(index));
    }

    private void onCycle(List<ActionMap> scope, LinkedHashSet<Integer> visiting, int reentered) {
        List<String> members = new ArrayList<>();
        boolean inCycle = false;
        for (int index : visiting) {
            inCycle |= index == reentered;
            if (inCycle) {
                members.add(describe(scope.get(index)));
            }
        }
        members.add(describe(scope.get(reentered)));
        if (failOnCycle) {
            throw new PrecedenceCycleException(members);
        }
        logger.warn("Ignoring cyclic precedence declarations, using first discovered order: {}", members);
    }

    private static String describe(ActionMap actionMap) {
        return actionMap.getActionId()
                .map(id -> actionMap.getAction().getName() + "[" + id + "]")
                .orElse(actionMap.getAction().getName());
    }

    /**
     * For each instance of a scope, identified by position, the instances which must precede it.
     */
    private static final class ScopeDependencies {
        private final Map<Integer, SortedSet<Integer>> prerequisites = new HashMap<>();

        static ScopeDependencies of(List<ActionMap> scope) {
            ScopeDependencies dependencies = new ScopeDependencies();
            for (int source = 0; source < scope.size(); source++) {
                ActionMap actionMap = scope.get(source);
                for (PrecedenceTarget target : actionMap.getPrecedence().getAlwaysBefore()) {
                    for (int match : matching(scope, target, source)) {
                        dependencies.addDependency(match, source);
                    }
                }
                for (PrecedenceTarget target : actionMap.getPrecedence().getAlwaysAfter()) {
                    for (int match : matching(scope, target, source)) {
                        dependencies.addDependency(source, match);
                    }
                }
            }
            return dependencies;
        }

        private static List<Integer> matching(List<ActionMap> scope, PrecedenceTarget target, int source) {
            List<Integer> matches = new ArrayList<>();
            for (int i = 0; i < scope.size(); i++) {
                if (i != source && target.matches(scope.get(i))) {
                    matches.add(i);
                }
            }
            return matches;
        }

        void addDependency(int child, int parent) {
            prerequisites.computeIfAbsent(child, k -> new TreeSet<>()).add(parent);
        }

        Set<Integer> getPrerequisites(int index) {
            return prerequisites.getOrDefault(index, Collections.emptySortedSet());
        }

        boolean isEmpty() {
            return prerequisites.isEmpty();
        }
    }
}
