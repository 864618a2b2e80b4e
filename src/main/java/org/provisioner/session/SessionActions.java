package org.provisioner.session;

import com.google.common.base.Preconditions;
import org.provisioner.action.Action;
import org.provisioner.nodevalue.NodeValue;
import org.provisioner.plan.ActionOptions;
import org.provisioner.plan.ActionPlanBuilder;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Entry points used by phase routines to schedule actions into the session's in-progress action plan, in the
 * session's current phase context.
 */
public final class SessionActions {

    private SessionActions() {
    }

    public static NodeValue schedule(Session session, Action action, Object... args) {
        return schedule(session, action, ActionOptions.none(), args);
    }

    /**
     * @param args the arguments of the action. A null array, which is what a lone {@code null} argument binds to,
     *             schedules the action with a single null argument.
     * @throws NullPointerException if {@code options} is null
     */
    public static NodeValue schedule(Session session, Action action, ActionOptions options, Object... args) {
        Preconditions.checkNotNull(options,
                "options must not be null, use ActionOptions.none() or cast a null argument to Object");
        List<Object> argList = args == null ? Collections.singletonList(null) : Arrays.asList(args);
        return actionPlan(session).schedule(action, argList, options, session.getPhaseContext());
    }

    /**
     * @throws IllegalStateException if no action plan is being built in {@code session}
     */
    public static ActionPlanBuilder actionPlan(Session session) {
        return session.getActionPlan().orElseThrow(() -> new IllegalStateException(
                "No action plan is being built in this session. Actions can only be scheduled from a phase routine."));
    }
}
