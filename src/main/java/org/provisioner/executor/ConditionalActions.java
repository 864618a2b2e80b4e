package org.provisioner.executor;

import org.provisioner.action.Action;
import org.provisioner.action.DefaultAction;
import org.provisioner.action.ExecutionKind;
import org.provisioner.nodevalue.NodeValue;
import org.provisioner.plan.ActionPlanBuilder;
import org.provisioner.session.Session;
import org.provisioner.session.SessionActions;

import java.util.function.Consumer;

/**
 * The built-in conditional action. Its single argument is the condition, which may be a {@link NodeValue} or a
 * {@link DelayedArgument} so that it is only known at execution time. Its blocks are the actions scheduled by the
 * then and else routines.
 */
public final class ConditionalActions {

    public static final Action IF = DefaultAction.newBuilder("if", ExecutionKind.IN_SEQUENCE)
            .defaultImplementation((session, actionMap) ->
                    ActionPlanExecutor.executeIf(session, actionMap, actionMap.getArgs().get(0)))
            .build();

    private ConditionalActions() {
    }

    public static NodeValue scheduleIf(Session session, Object condition, Consumer<Session> thenRoutine) {
        return scheduleIf(session, condition, thenRoutine, null);
    }

    /**
     * Schedules a conditional action. Each routine schedules its actions into a nested scope of the session's action
     * plan, which becomes a block of the conditional action.
     *
     * @param elseRoutine may be null, in which case nothing runs when the condition is false
     */
    public static NodeValue scheduleIf(
            Session session,
            Object condition,
            Consumer<Session> thenRoutine,
            Consumer<Session> elseRoutine) {
        ActionPlanBuilder plan = SessionActions.actionPlan(session);
        NodeValue nodeValue = SessionActions.schedule(session, IF, condition);
        plan.beginScope();
        thenRoutine.accept(session);
        plan.endScope();
        if (elseRoutine != null) {
            plan.beginScope();
            elseRoutine.accept(session);
            plan.endScope();
        }
        return nodeValue;
    }
}
