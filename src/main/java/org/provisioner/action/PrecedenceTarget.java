package org.provisioner.action;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.provisioner.plan.ActionMap;

/**
 * The far end of an always-before or always-after declaration: either every instance of an {@link Action}, or the
 * instance labelled with a given action-id.
 */
public final class PrecedenceTarget {
    private final Action action;
    private final String actionId;

    private PrecedenceTarget(Action action, String actionId) {
        this.action = action;
        this.actionId = actionId;
    }

    public static PrecedenceTarget action(Action action) {
        return new PrecedenceTarget(Preconditions.checkNotNull(action, "action"), null);
    }

    public static PrecedenceTarget id(String actionId) {
        return new PrecedenceTarget(null, Preconditions.checkNotNull(actionId, "actionId"));
    }

    public boolean isActionId() {
        return actionId != null;
    }

    public boolean matches(ActionMap actionMap) {
        if (isActionId()) {
            return actionMap.getActionId().map(actionId::equals).orElse(false);
        }
        return action.equals(actionMap.getAction());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PrecedenceTarget that = (PrecedenceTarget) o;
        return new EqualsBuilder()
                .append(action, that.action)
                .append(actionId, that.actionId)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37).append(action).append(actionId).toHashCode();
    }

    @Override
    public String toString() {
        return isActionId() ? "id:" + actionId : "action:" + action.getName();
    }
}
