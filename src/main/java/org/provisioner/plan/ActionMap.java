package org.provisioner.plan;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.apache.commons.collections.CollectionUtils;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.provisioner.action.Action;
import org.provisioner.action.ExecutionKind;
import org.provisioner.action.Precedence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * An instance of an {@link Action} in an action plan: the action, the arguments it will be applied to, and the
 * phase context it was scheduled in. Conditional actions additionally carry nested {@code blocks}, so an action plan
 * is a tree of action maps.
 *
 * Action maps are immutable; the translation pipeline produces modified copies.
 */
public final class ActionMap {
    private final Action action;
    private final List<Object> args;
    private final List<String> context;
    private final boolean compositeContext;
    private final String actionId;
    private final Precedence precedence;
    private final Map<String, Object> options;
    private final String nodeValuePath;
    private final List<List<ActionMap>> blocks;

    private ActionMap(
            Action action,
            List<?> args,
            List<String> context,
            boolean compositeContext,
            String actionId,
            Precedence precedence,
            Map<String, Object> options,
            String nodeValuePath,
            List<List<ActionMap>> blocks) {
        this.action = action;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.context = ImmutableList.copyOf(context);
        this.compositeContext = compositeContext;
        this.actionId = actionId;
        this.precedence = precedence;
        this.options = options;
        this.nodeValuePath = nodeValuePath;
        this.blocks = blocks;
    }

    /**
     * Returns an action map for the given {@code action} and {@code args}.
     *
     * If {@code options} declares either precedence field, an action-id is generated when none is given, so that
     * declaring precedence never changes how the instance groups with other instances of the same action. Declared
     * precedence fields replace the action's own; undeclared ones keep the action's defaults.
     *
     * Deferred actions record the phase context without its innermost label, since the label is supplied again
     * when the action is expanded.
     */
    public static ActionMap create(
            Action action,
            List<?> args,
            ActionOptions options,
            PhaseContext phaseContext,
            Supplier<String> actionIdGenerator) {
        Preconditions.checkNotNull(action, "action");
        Preconditions.checkNotNull(args, "args");
        Preconditions.checkNotNull(options, "options");
        String actionId = options.getActionId().orElse(null);
        if (actionId == null && options.hasPrecedence()) {
            actionId = actionIdGenerator.get();
        }
        Precedence defaults = action.getPrecedence();
        Precedence precedence = Precedence.of(
                options.getAlwaysBefore().orElse(defaults.getAlwaysBefore()),
                options.getAlwaysAfter().orElse(defaults.getAlwaysAfter()));
        PhaseContext recorded = action.getExecutionKind().isDeferred() ? phaseContext.dropLast() : phaseContext;
        return new ActionMap(
                action,
                args,
                recorded.getLabels(),
                false,
                actionId,
                precedence,
                options.getOptions(),
                null,
                Collections.emptyList());
    }

    public Action getAction() {
        return action;
    }

    public ExecutionKind getExecutionKind() {
        return action.getExecutionKind();
    }

    /**
     * For in-sequence actions, the argument list. For merged aggregated and collected actions, a list holding each
     * merged instance's argument list, in the order the instances were scheduled.
     */
    public List<Object> getArgs() {
        return args;
    }

    /**
     * The phase context labels this instance was scheduled in. After aggregation this holds the distinct rendered
     * labels of every merged instance, see {@link #isCompositeContext()}.
     */
    public List<String> getContext() {
        return context;
    }

    public boolean isCompositeContext() {
        return compositeContext;
    }

    public Optional<String> getActionId() {
        return Optional.ofNullable(actionId);
    }

    public Precedence getPrecedence() {
        return precedence;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    public Optional<Object> getOption(String name) {
        return Optional.ofNullable(options.get(name));
    }

    public String getNodeValuePath() {
        return nodeValuePath;
    }

    public List<List<ActionMap>> getBlocks() {
        return blocks;
    }

    public boolean hasBlocks() {
        return CollectionUtils.isNotEmpty(blocks);
    }

    /**
     * Returns a label for this instance built from its context: {@code a: b} for in-sequence actions and
     * {@code [a: b]} for aggregated and collected ones.
     */
    public Optional<String> getContextLabel() {
        if (compositeContext) {
            return context.isEmpty() ? Optional.empty() : Optional.of(String.join(" ", context));
        }
        return getExecutionKind().isMerged() ? PhaseContext.multiLabel(context) : PhaseContext.label(context);
    }

    public ActionMap withArgs(List<?> newArgs) {
        return new ActionMap(action, newArgs, context, compositeContext, actionId, precedence, options,
                nodeValuePath, blocks);
    }

    public ActionMap withCompositeContext(List<String> labels) {
        return new ActionMap(action, args, labels, true, actionId, precedence, options, nodeValuePath, blocks);
    }

    public ActionMap withNodeValuePath(String path) {
        return new ActionMap(action, args, context, compositeContext, actionId, precedence, options, path, blocks);
    }

    public ActionMap withBlocks(List<List<ActionMap>> newBlocks) {
        List<List<ActionMap>> copy = new ArrayList<>(newBlocks.size());
        for (List<ActionMap> block : newBlocks) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(block)));
        }
        return new ActionMap(action, args, context, compositeContext, actionId, precedence, options,
                nodeValuePath, Collections.unmodifiableList(copy));
    }

    /**
     * Returns a copy with {@code block} added after any existing blocks.
     */
    public ActionMap withBlockAppended(List<ActionMap> block) {
        List<List<ActionMap>> newBlocks = new ArrayList<>(blocks);
        newBlocks.add(block);
        return withBlocks(newBlocks);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ActionMap that = (ActionMap) o;
        return new EqualsBuilder()
                .append(action, that.action)
                .append(args, that.args)
                .append(context, that.context)
                .append(compositeContext, that.compositeContext)
                .append(actionId, that.actionId)
                .append(precedence, that.precedence)
                .append(options, that.options)
                .append(nodeValuePath, that.nodeValuePath)
                .append(blocks, that.blocks)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(action)
                .append(actionId)
                .append(nodeValuePath)
                .toHashCode();
    }

    @Override
    public String toString() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("action", action.getName());
        fields.put("args", args);
        fields.put("context", context);
        if (actionId != null) {
            fields.put("actionId", actionId);
        }
        if (!precedence.isEmpty()) {
            fields.put("precedence", precedence);
        }
        fields.put("nodeValuePath", nodeValuePath);
        if (hasBlocks()) {
            fields.put("blocks", blocks);
        }
        return "ActionMap" + fields;
    }
}
