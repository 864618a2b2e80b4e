package org.provisioner.plan.translate;

import org.provisioner.config.ActionPlanConfiguration;
import org.provisioner.plan.ActionMap;
import org.provisioner.plan.ActionPlan;
import org.provisioner.plan.ActionPlanBuilder;
import org.provisioner.plan.TranslatedActionPlan;
import org.provisioner.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns a built action plan into an executable one: closes the root scope, sorts and merges each scope by execution
 * kind, expands deferred actions against the session, then enforces declared precedence.
 *
 * Translating an already translated plan returns it unchanged.
 */
public class PlanTranslator {
    private static final Logger logger = LoggerFactory.getLogger(PlanTranslator.class);

    private final ExecutionKindTransformer executionKindTransformer;
    private final DeferredActionExpander deferredActionExpander;
    private final PrecedenceResolver precedenceResolver;

    public PlanTranslator() {
        this(ActionPlanConfiguration.defaults());
    }

    public PlanTranslator(ActionPlanConfiguration configuration) {
        this.executionKindTransformer = new ExecutionKindTransformer();
        this.deferredActionExpander = new DeferredActionExpander(configuration, executionKindTransformer);
        this.precedenceResolver = new PrecedenceResolver(configuration);
    }

    /**
     * @param plan the plan built while running a phase routine, or an already translated plan
     * @param session the session deferred actions are expanded against
     * @return the translated plan, and {@code session} without its in-progress action plan
     */
    public TranslationResult translate(ActionPlan plan, Session session) {
        if (plan.isTranslated()) {
            logger.debug("Action plan is already translated");
            return new TranslationResult(asTranslated(plan), session.withoutActionPlan());
        }
        if (!(plan instanceof ActionPlanBuilder)) {
            throw new IllegalArgumentException("Unsupported action plan type: " + plan.getClass().getName());
        }

        List<ActionMap> actions = ((ActionPlanBuilder) plan).close();
        logger.debug("Translating action plan with {} top-level action(s)", actions.size());
        actions = executionKindTransformer.transform(actions);
        actions = deferredActionExpander.expand(actions, session);
        actions = precedenceResolver.resolve(actions);
        logger.info("Translated action plan into {} top-level action(s)", actions.size());

        return new TranslationResult(new TranslatedActionPlan(actions), session.withoutActionPlan());
    }

    private static TranslatedActionPlan asTranslated(ActionPlan plan) {
        if (!(plan instanceof TranslatedActionPlan)) {
            throw new IllegalArgumentException("Unsupported action plan type: " + plan.getClass().getName());
        }
        return (TranslatedActionPlan) plan;
    }
}
