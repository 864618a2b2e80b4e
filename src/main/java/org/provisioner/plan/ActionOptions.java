package org.provisioner.plan;

import com.google.common.collect.ImmutableSet;
import org.provisioner.action.PrecedenceTarget;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-instance options supplied when scheduling an action: an optional action-id naming the instance, optional
 * always-before/always-after constraints which replace the action's own, and free-form named options such as a
 * sudo user, which are copied onto the {@link ActionMap}.
 */
public final class ActionOptions {
    private static final ActionOptions NONE = newBuilder().build();

    private final String actionId;
    private final Set<PrecedenceTarget> alwaysBefore;
    private final Set<PrecedenceTarget> alwaysAfter;
    private final Map<String, Object> options;

    private ActionOptions(
            String actionId,
            Set<PrecedenceTarget> alwaysBefore,
            Set<PrecedenceTarget> alwaysAfter,
            Map<String, Object> options) {
        this.actionId = actionId;
        this.alwaysBefore = alwaysBefore;
        this.alwaysAfter = alwaysAfter;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public static ActionOptions none() {
        return NONE;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public Optional<String> getActionId() {
        return Optional.ofNullable(actionId);
    }

    public Optional<Set<PrecedenceTarget>> getAlwaysBefore() {
        return Optional.ofNullable(alwaysBefore);
    }

    public Optional<Set<PrecedenceTarget>> getAlwaysAfter() {
        return Optional.ofNullable(alwaysAfter);
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    /**
     * @return true if either precedence field is set, in which case the instance is always given an action-id.
     */
    public boolean hasPrecedence() {
        return alwaysBefore != null || alwaysAfter != null;
    }

    @Override
    public String toString() {
        return "ActionOptions{" +
                "actionId='" + actionId + '\'' +
                ", alwaysBefore=" + alwaysBefore +
                ", alwaysAfter=" + alwaysAfter +
                ", options=" + options +
                '}';
    }

    /**
     * Builder for {@link ActionOptions}.
     */
    public static class Builder {
        private String actionId;
        private Set<PrecedenceTarget> alwaysBefore;
        private Set<PrecedenceTarget> alwaysAfter;
        private final Map<String, Object> options = new LinkedHashMap<>();

        public Builder actionId(String actionId) {
            this.actionId = actionId;
            return this;
        }

        public Builder alwaysBefore(PrecedenceTarget... targets) {
            this.alwaysBefore = union(alwaysBefore, targets);
            return this;
        }

        public Builder alwaysAfter(PrecedenceTarget... targets) {
            this.alwaysAfter = union(alwaysAfter, targets);
            return this;
        }

        public Builder option(String name, Object value) {
            options.put(name, value);
            return this;
        }

        public ActionOptions build() {
            return new ActionOptions(actionId, alwaysBefore, alwaysAfter, options);
        }

        private static Set<PrecedenceTarget> union(Set<PrecedenceTarget> existing, PrecedenceTarget[] targets) {
            ImmutableSet.Builder<PrecedenceTarget> builder = ImmutableSet.builder();
            if (existing != null) {
                builder.addAll(existing);
            }
            return builder.addAll(Arrays.asList(targets)).build();
        }
    }
}
