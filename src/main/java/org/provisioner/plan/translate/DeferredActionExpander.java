package org.provisioner.plan.translate;

import org.provisioner.action.Action;
import org.provisioner.action.ActionImplementation;
import org.provisioner.config.ActionPlanConfiguration;
import org.provisioner.plan.ActionMap;
import org.provisioner.plan.ActionPlanBuilder;
import org.provisioner.plan.PhaseContext;
import org.provisioner.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces each deferred action in a plan with the actions its {@code default} implementation schedules.
 *
 * The implementation is invoked with a session holding a fresh action plan and the phase context recorded for the
 * deferred instance. The actions it schedules are sorted by execution kind, expanded in turn (a generated action may
 * itself be deferred), and spliced into the scope in place of the deferred instance.
 *
 * Exceptions thrown by an implementation abort the expansion.
 */
public class DeferredActionExpander {
    private static final Logger logger = LoggerFactory.getLogger(DeferredActionExpander.class);

    private final ActionPlanConfiguration configuration;
    private final ExecutionKindTransformer executionKindTransformer;

    public DeferredActionExpander(
            ActionPlanConfiguration configuration,
            ExecutionKindTransformer executionKindTransformer) {
        this.configuration = configuration;
        this.executionKindTransformer = executionKindTransformer;
    }

    /**
     * @throws DeferredExpansionException if an implementation throws a checked exception. Unchecked exceptions are
     *                                    rethrown as they are.
     */
    public List<ActionMap> expand(List<ActionMap> plan, Session session) {
        return PlanWalker.transformScopes(plan, scope -> expandScope(scope, session));
    }

    private List<ActionMap> expandScope(List<ActionMap> scope, Session session) {
        List<ActionMap> result = new ArrayList<>(scope.size());
        for (ActionMap actionMap : scope) {
            if (actionMap.getExecutionKind().isDeferred()) {
                result.addAll(expandAction(actionMap, session));
            } else {
                result.add(actionMap);
            }
        }
        return result;
    }

    private List<ActionMap> expandAction(ActionMap actionMap, Session session) {
        Action action = actionMap.getAction();
        ActionImplementation implementation = action.getImplementation(Action.DEFAULT_IMPLEMENTATION)
                .orElseThrow(() -> new IllegalStateException(String.format(
                        "Deferred action '%s' has no '%s' implementation",
                        action.getName(), Action.DEFAULT_IMPLEMENTATION)));

        ActionPlanBuilder subPlan = new ActionPlanBuilder(configuration);
        Session expansionSession = session
                .withActionPlan(subPlan)
                .withPhaseContext(PhaseContext.of(actionMap.getContext()));
        logger.debug("Expanding deferred action {} in context {}", action.getName(), actionMap.getContext());
        try {
            implementation.apply(expansionSession, actionMap);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new DeferredExpansionException(action.getName(), e);
        }

        List<ActionMap> generated = subPlan.close();
        logger.debug("Deferred action {} generated {} action(s)", action.getName(), generated.size());
        return expand(executionKindTransformer.transform(generated), session);
    }
}
