package org.provisioner.action;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * This class is a default implementation of the {@link Action} interface. Two actions are the same action when they
 * share a name and an execution kind.
 */
public class DefaultAction implements Action {
    private final String name;
    private final ExecutionKind executionKind;
    private final Map<String, ActionImplementation> implementations;
    private final Precedence precedence;

    private DefaultAction(
            String name,
            ExecutionKind executionKind,
            Map<String, ActionImplementation> implementations,
            Precedence precedence) {
        this.name = name;
        this.executionKind = executionKind;
        this.implementations = Collections.unmodifiableMap(new LinkedHashMap<>(implementations));
        this.precedence = precedence;
    }

    public static Builder newBuilder(String name, ExecutionKind executionKind) {
        return new Builder(name, executionKind);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ExecutionKind getExecutionKind() {
        return executionKind;
    }

    @Override
    public Map<String, ActionImplementation> getImplementations() {
        return implementations;
    }

    @Override
    public Precedence getPrecedence() {
        return precedence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        DefaultAction that = (DefaultAction) o;
        return new EqualsBuilder()
                .append(name, that.name)
                .append(executionKind, that.executionKind)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37).append(name).append(executionKind).toHashCode();
    }

    @Override
    public String toString() {
        return "DefaultAction{" +
                "name='" + name + '\'' +
                ", executionKind=" + executionKind +
                ", implementations=" + implementations.keySet() +
                '}';
    }

    /**
     * Builder for {@link DefaultAction}s.
     */
    public static class Builder {
        private final String name;
        private final ExecutionKind executionKind;
        private final Map<String, ActionImplementation> implementations = new LinkedHashMap<>();
        private Precedence precedence = Precedence.none();

        private Builder(String name, ExecutionKind executionKind) {
            Preconditions.checkArgument(StringUtils.isNotBlank(name), "Action name must not be blank");
            this.name = name;
            this.executionKind = Preconditions.checkNotNull(executionKind, "executionKind");
        }

        public Builder implementation(String implementationName, ActionImplementation implementation) {
            implementations.put(implementationName, Preconditions.checkNotNull(implementation, "implementation"));
            return this;
        }

        public Builder defaultImplementation(ActionImplementation implementation) {
            return implementation(DEFAULT_IMPLEMENTATION, implementation);
        }

        public Builder precedence(Precedence precedence) {
            this.precedence = Preconditions.checkNotNull(precedence, "precedence");
            return this;
        }

        public DefaultAction build() {
            if (executionKind.isDeferred() && !implementations.containsKey(DEFAULT_IMPLEMENTATION)) {
                throw new IllegalStateException(String.format(
                        "Deferred action '%s' must have a '%s' implementation", name, DEFAULT_IMPLEMENTATION));
            }
            return new DefaultAction(name, executionKind, implementations, precedence);
        }
    }
}
