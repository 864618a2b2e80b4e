package org.provisioner.action;

import com.google.common.collect.ImmutableSet;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

import java.util.Arrays;
import java.util.Set;

/**
 * Ordering constraints declared for an action or an action instance. Constraints only apply between instances in
 * the same scope.
 */
public final class Precedence {
    private static final Precedence NONE = new Precedence(ImmutableSet.of(), ImmutableSet.of());

    private final ImmutableSet<PrecedenceTarget> alwaysBefore;
    private final ImmutableSet<PrecedenceTarget> alwaysAfter;

    private Precedence(Set<PrecedenceTarget> alwaysBefore, Set<PrecedenceTarget> alwaysAfter) {
        this.alwaysBefore = ImmutableSet.copyOf(alwaysBefore);
        this.alwaysAfter = ImmutableSet.copyOf(alwaysAfter);
    }

    public static Precedence none() {
        return NONE;
    }

    public static Precedence of(Set<PrecedenceTarget> alwaysBefore, Set<PrecedenceTarget> alwaysAfter) {
        return new Precedence(alwaysBefore, alwaysAfter);
    }

    public Precedence alwaysBefore(PrecedenceTarget... targets) {
        return new Precedence(
                ImmutableSet.<PrecedenceTarget>builder().addAll(alwaysBefore).addAll(Arrays.asList(targets)).build(),
                alwaysAfter);
    }

    public Precedence alwaysAfter(PrecedenceTarget... targets) {
        return new Precedence(
                alwaysBefore,
                ImmutableSet.<PrecedenceTarget>builder().addAll(alwaysAfter).addAll(Arrays.asList(targets)).build());
    }

    /**
     * Targets which must appear later in the scope than the declaring instance.
     */
    public Set<PrecedenceTarget> getAlwaysBefore() {
        return alwaysBefore;
    }

    /**
     * Targets which must appear earlier in the scope than the declaring instance.
     */
    public Set<PrecedenceTarget> getAlwaysAfter() {
        return alwaysAfter;
    }

    public boolean isEmpty() {
        return alwaysBefore.isEmpty() && alwaysAfter.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Precedence that = (Precedence) o;
        return new EqualsBuilder()
                .append(alwaysBefore, that.alwaysBefore)
                .append(alwaysAfter, that.alwaysAfter)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37).append(alwaysBefore).append(alwaysAfter).toHashCode();
    }

    @Override
    public String toString() {
        return "Precedence{alwaysBefore=" + alwaysBefore + ", alwaysAfter=" + alwaysAfter + '}';
    }
}
