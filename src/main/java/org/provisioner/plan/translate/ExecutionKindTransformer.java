package org.provisioner.plan.translate;

import org.provisioner.action.ExecutionKind;
import org.provisioner.plan.ActionMap;
import org.provisioner.plan.PhaseContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sorts each scope of an action plan by execution kind, in the order aggregated, in-sequence, collected. Deferred
 * kinds are sorted with their base kind.
 *
 * Aggregated and collected instances of the same action with the same action-id are merged into a single instance
 * whose arguments are the list of each instance's argument list, and whose context holds each instance's rendered
 * context label. The merged instance keeps the node-value path of the first instance. In-sequence instances keep
 * their relative order and are never merged.
 */
public class ExecutionKindTransformer {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionKindTransformer.class);
    private static final List<ExecutionKind> EXECUTION_ORDER = Collections.unmodifiableList(Arrays.asList(
            ExecutionKind.AGGREGATED, ExecutionKind.IN_SEQUENCE, ExecutionKind.COLLECTED));

    public List<ActionMap> transform(List<ActionMap> plan) {
        return PlanWalker.transformScopes(plan, this::transformScope);
    }

    List<ActionMap> transformScope(List<ActionMap> scope) {
        Map<ExecutionKind, List<ActionMap>> byKind = new EnumMap<>(ExecutionKind.class);
        for (ActionMap actionMap : scope) {
            byKind.computeIfAbsent(actionMap.getExecutionKind().getBaseKind(), k -> new ArrayList<>()).add(actionMap);
        }

        List<ActionMap> result = new ArrayList<>(scope.size());
        for (ExecutionKind kind : EXECUTION_ORDER) {
            List<ActionMap> group = byKind.getOrDefault(kind, Collections.emptyList());
            if (kind.isMerged()) {
                result.addAll(merge(group));
            } else {
                result.addAll(group);
            }
        }
        return result;
    }

    private static List<ActionMap> merge(List<ActionMap> group) {
        Map<List<Object>, List<ActionMap>> byInstance = new LinkedHashMap<>();
        for (ActionMap actionMap : group) {
            List<Object> key = Arrays.asList(actionMap.getAction(), actionMap.getActionId().orElse(null));
            byInstance.computeIfAbsent(key, k -> new ArrayList<>()).add(actionMap);
        }

        List<ActionMap> merged = new ArrayList<>(byInstance.size());
        for (List<ActionMap> instances : byInstance.values()) {
            merged.add(combine(instances));
        }
        return merged;
    }

    private static ActionMap combine(List<ActionMap> instances) {
        List<Object> args = new ArrayList<>(instances.size());
        Set<String> labels = new LinkedHashSet<>();
        for (ActionMap instance : instances) {
            args.add(instance.getArgs());
            if (instance.isCompositeContext()) {
                labels.addAll(instance.getContext());
            } else {
                PhaseContext.multiLabel(instance.getContext()).ifPresent(labels::add);
            }
        }
        ActionMap first = instances.get(0);
        logger.trace("Merged {} instance(s) of {}", instances.size(), first.getAction().getName());
        return first.withArgs(args).withCompositeContext(new ArrayList<>(labels));
    }
}
