package org.provisioner.plan;

/**
 * An action plan is either still being built by executing a phase routine ({@link ActionPlanBuilder}), or has been
 * translated into an ordered, executable tree of action maps ({@link TranslatedActionPlan}).
 */
public interface ActionPlan {

    /**
     * @return true once the plan is no longer in builder shape and may be executed.
     */
    boolean isTranslated();
}
