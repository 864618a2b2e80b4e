package org.provisioner.executor;

import com.google.common.collect.ImmutableList;
import org.provisioner.action.Action;
import org.provisioner.action.ActionImplementation;
import org.provisioner.plan.ActionMap;
import org.provisioner.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * An {@link ActionExecutor} which runs the first implementation of each action found in a list of preferred
 * implementation names, falling back to the {@code default} implementation.
 *
 * An implementation returning an {@link ExecutionResult} supplies the next session itself; any other return value
 * leaves the session unchanged.
 */
public class NamedImplementationExecutor implements ActionExecutor {
    private static final Logger logger = LoggerFactory.getLogger(NamedImplementationExecutor.class);

    private final List<String> preferredImplementations;

    public NamedImplementationExecutor(String... preferredImplementations) {
        List<String> names = new ArrayList<>(Arrays.asList(preferredImplementations));
        if (!names.contains(Action.DEFAULT_IMPLEMENTATION)) {
            names.add(Action.DEFAULT_IMPLEMENTATION);
        }
        this.preferredImplementations = ImmutableList.copyOf(names);
    }

    @Override
    public ExecutionResult execute(Session session, ActionMap actionMap) throws Exception {
        Action action = actionMap.getAction();
        for (String name : preferredImplementations) {
            Optional<ActionImplementation> implementation = action.getImplementation(name);
            if (implementation.isPresent()) {
                logger.debug("Executing {} using implementation '{}'", action.getName(), name);
                Object value = implementation.get().apply(session, actionMap);
                if (value instanceof ExecutionResult) {
                    return (ExecutionResult) value;
                }
                return ExecutionResult.of(value, session);
            }
        }
        throw new IllegalStateException(String.format(
                "Action '%s' has none of the implementations %s. Available: %s",
                action.getName(), preferredImplementations, action.getImplementations().keySet()));
    }

    public List<String> getPreferredImplementations() {
        return preferredImplementations;
    }
}
