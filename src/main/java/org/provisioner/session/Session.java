package org.provisioner.session;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.provisioner.executor.ExecutionSettings;
import org.provisioner.nodevalue.NodeValue;
import org.provisioner.nodevalue.NodeValueException;
import org.provisioner.plan.ActionPlanBuilder;
import org.provisioner.plan.PhaseContext;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The state threaded through building, translating and executing an action plan. Sessions are values: every
 * {@code with...} method returns a new session and leaves the receiver unchanged.
 *
 * A session holds the in-progress action plan (while a phase routine runs), the current phase context, the values
 * produced by executed actions keyed by node-value path, the execution settings of a running plan, and arbitrary
 * attributes owned by callers.
 */
public final class Session {
    private static final Session EMPTY = new Session(
            null, PhaseContext.root(), Collections.emptyMap(), null, Collections.emptyMap());

    private final ActionPlanBuilder actionPlan;
    private final PhaseContext phaseContext;
    private final Map<String, Object> nodeValues;
    private final ExecutionSettings executionSettings;
    private final Map<String, Object> attributes;

    private Session(
            ActionPlanBuilder actionPlan,
            PhaseContext phaseContext,
            Map<String, Object> nodeValues,
            ExecutionSettings executionSettings,
            Map<String, Object> attributes) {
        this.actionPlan = actionPlan;
        this.phaseContext = phaseContext;
        this.nodeValues = nodeValues;
        this.executionSettings = executionSettings;
        this.attributes = attributes;
    }

    public static Session empty() {
        return EMPTY;
    }

    public Optional<ActionPlanBuilder> getActionPlan() {
        return Optional.ofNullable(actionPlan);
    }

    public Session withActionPlan(ActionPlanBuilder plan) {
        return new Session(Preconditions.checkNotNull(plan, "plan"), phaseContext, nodeValues, executionSettings,
                attributes);
    }

    public Session withoutActionPlan() {
        return actionPlan == null ? this : new Session(null, phaseContext, nodeValues, executionSettings, attributes);
    }

    public PhaseContext getPhaseContext() {
        return phaseContext;
    }

    public Session withPhaseContext(PhaseContext context) {
        return new Session(actionPlan, Preconditions.checkNotNull(context, "context"), nodeValues, executionSettings,
                attributes);
    }

    /**
     * Returns a session whose phase context has {@code label} as its innermost label.
     */
    public Session inPhaseContext(String label) {
        return withPhaseContext(phaseContext.enter(label));
    }

    public boolean hasNodeValue(NodeValue nodeValue) {
        return nodeValues.containsKey(nodeValue.getPath());
    }

    /**
     * @throws NodeValueException if the action producing {@code nodeValue} has not been executed
     */
    public Object getNodeValue(NodeValue nodeValue) {
        if (!hasNodeValue(nodeValue)) {
            throw new NodeValueException(String.format(
                    "Node value '%s' has not been set. The action producing it has not run yet.",
                    nodeValue.getPath()));
        }
        return nodeValues.get(nodeValue.getPath());
    }

    public Map<String, Object> getNodeValues() {
        return nodeValues;
    }

    public Session withNodeValue(String path, Object value) {
        Map<String, Object> values = new HashMap<>(nodeValues);
        values.put(path, value);
        return new Session(actionPlan, phaseContext, Collections.unmodifiableMap(values), executionSettings,
                attributes);
    }

    public Optional<ExecutionSettings> getExecutionSettings() {
        return Optional.ofNullable(executionSettings);
    }

    /**
     * @param settings the settings of the running plan, or null to clear them
     */
    public Session withExecutionSettings(ExecutionSettings settings) {
        return new Session(actionPlan, phaseContext, nodeValues, settings, attributes);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Session with(String key, Object value) {
        Map<String, Object> newAttributes = new HashMap<>(attributes);
        newAttributes.put(key, value);
        return new Session(actionPlan, phaseContext, nodeValues, executionSettings,
                Collections.unmodifiableMap(newAttributes));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Session that = (Session) o;
        return new EqualsBuilder()
                .append(actionPlan, that.actionPlan)
                .append(phaseContext, that.phaseContext)
                .append(nodeValues, that.nodeValues)
                .append(executionSettings, that.executionSettings)
                .append(attributes, that.attributes)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(phaseContext)
                .append(nodeValues)
                .append(attributes)
                .toHashCode();
    }

    @Override
    public String toString() {
        return "Session{" +
                "actionPlan=" + (actionPlan != null) +
                ", phaseContext=" + phaseContext +
                ", nodeValues=" + nodeValues +
                ", executionSettings=" + executionSettings +
                ", attributes=" + attributes +
                '}';
    }
}
