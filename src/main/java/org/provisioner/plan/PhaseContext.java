package org.provisioner.plan;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Optional;

/**
 * The nested labels of the phase-definition calls which are active when an action is scheduled, outermost first,
 * e.g. {@code [configure, install-java]}. Used for diagnostics only.
 */
public final class PhaseContext {
    private static final PhaseContext ROOT = new PhaseContext(ImmutableList.of());
    private static final String SEPARATOR = ": ";

    private final ImmutableList<String> labels;

    private PhaseContext(List<String> labels) {
        this.labels = ImmutableList.copyOf(labels);
    }

    public static PhaseContext root() {
        return ROOT;
    }

    public static PhaseContext of(List<String> labels) {
        return labels.isEmpty() ? ROOT : new PhaseContext(labels);
    }

    public PhaseContext enter(String label) {
        Preconditions.checkArgument(StringUtils.isNotBlank(label), "Phase context label must not be blank");
        return new PhaseContext(ImmutableList.<String>builder().addAll(labels).add(label).build());
    }

    /**
     * Returns the enclosing context, without the innermost label.
     */
    public PhaseContext dropLast() {
        return labels.isEmpty() ? this : of(labels.subList(0, labels.size() - 1));
    }

    public List<String> getLabels() {
        return labels;
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    /**
     * Label used for in-sequence actions, e.g. {@code configure: install-java}.
     */
    public static Optional<String> label(List<String> labels) {
        return labels.isEmpty() ? Optional.empty() : Optional.of(String.join(SEPARATOR, labels));
    }

    /**
     * Label used for aggregated and collected actions, e.g. {@code [configure: install-java]}.
     */
    public static Optional<String> multiLabel(List<String> labels) {
        return label(labels).map(s -> "[" + s + "]");
    }

    /**
     * Prefix for naming generated scripts after the context they were defined in, e.g.
     * {@code configure: install-java: }. Empty for the root context.
     *
     * This is the hook for action implementations which render scripts: calling it on
     * {@code PhaseContext.of(actionMap.getContext())} labels a script with the phase its action was scheduled from.
     */
    public String toContextString() {
        return label(labels).map(s -> s + SEPARATOR).orElse("");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return labels.equals(((PhaseContext) o).labels);
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }

    @Override
    public String toString() {
        return labels.toString();
    }
}
