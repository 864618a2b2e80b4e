package org.provisioner.executor;

import org.apache.commons.collections.CollectionUtils;
import org.provisioner.plan.ActionMap;
import org.provisioner.plan.ActionPlan;
import org.provisioner.plan.TranslatedActionPlan;
import org.provisioner.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Executes a translated action plan, one action map at a time, threading the session from each action to the next.
 *
 * For each action map, the arguments are evaluated against the current session and the executor is called. The
 * value it returns is stored in the session under the action's node-value path, and the result is passed through the
 * status function. An exception thrown for one action becomes an error result paired with the session from before
 * that action. Once the status function flags a result as stopped, no further action runs, in this sequence or in any
 * enclosing one.
 */
public class ActionPlanExecutor {
    private static final Logger logger = LoggerFactory.getLogger(ActionPlanExecutor.class);

    private final ArgumentEvaluator argumentEvaluator;

    public ActionPlanExecutor() {
        this(new DefaultArgumentEvaluator());
    }

    public ActionPlanExecutor(ArgumentEvaluator argumentEvaluator) {
        this.argumentEvaluator = argumentEvaluator;
    }

    /**
     * @throws UntranslatedPlanException if {@code plan} has not been translated. No action is run.
     */
    public PlanExecutionResult execute(
            ActionPlan plan,
            Session session,
            ActionExecutor executor,
            ExecutionStatusFunction statusFunction) {
        if (!plan.isTranslated()) {
            throw new UntranslatedPlanException();
        }
        if (!(plan instanceof TranslatedActionPlan)) {
            throw new IllegalArgumentException("Unsupported action plan type: " + plan.getClass().getName());
        }
        List<ActionMap> actions = ((TranslatedActionPlan) plan).getActions();
        logger.info("Executing action plan with {} top-level action(s)", actions.size());

        ExecutionSettings previous = session.getExecutionSettings().orElse(null);
        ExecutionSettings settings = new ExecutionSettings(executor, statusFunction, argumentEvaluator);
        PlanExecutionResult result = fold(actions, session.withExecutionSettings(settings), settings);

        logger.info("Executed {} action(s), stopped: {}, errors: {}",
                result.getResults().size(), result.isStopped(), result.getErrors().size());
        return new PlanExecutionResult(result.getResults(), result.getSession().withExecutionSettings(previous));
    }

    /**
     * Executes the then block of a conditional action map if {@code value} is true, otherwise its else block when it
     * has one. Uses the execution settings of the running plan.
     *
     * @param value the evaluated condition, a {@link Boolean} or null for false
     * @return a result holding the value of the last action run in the chosen block, or a null value if nothing
     *         ran, along with the result of every action run in the block
     * @throws IllegalStateException if no plan is executing in {@code session}
     * @throws IllegalArgumentException if {@code value} is not a boolean
     */
    public static ExecutionResult executeIf(Session session, ActionMap actionMap, Object value) {
        ExecutionSettings settings = session.getExecutionSettings().orElseThrow(() -> new IllegalStateException(
                "Conditional actions can only be executed as part of an executing action plan"));
        boolean condition = asCondition(value);
        logger.trace("Condition of {} is {}", actionMap.getAction().getName(), condition);

        List<List<ActionMap>> blocks = actionMap.getBlocks();
        List<ActionMap> branch;
        if (condition) {
            branch = CollectionUtils.isEmpty(blocks) ? Collections.emptyList() : blocks.get(0);
        } else if (blocks.size() > 1 && CollectionUtils.isNotEmpty(blocks.get(1))) {
            branch = blocks.get(1);
        } else {
            return ExecutionResult.of(null, session);
        }

        PlanExecutionResult result = fold(branch, session, settings);
        return ExecutionResult.ofBlock(result.getResults(), result.getSession());
    }

    private static boolean asCondition(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new IllegalArgumentException(String.format(
                "Condition must be a boolean, got %s: %s", value.getClass().getName(), value));
    }

    private static PlanExecutionResult fold(List<ActionMap> actions, Session session, ExecutionSettings settings) {
        List<ExecutionResult> results = new ArrayList<>(actions.size());
        Session current = session;
        for (ActionMap actionMap : actions) {
            ExecutionResult result = settings.getStatusFunction()
                    .apply(executeActionMap(settings, current, actionMap));
            results.add(result);
            current = result.getSession();
            if (result.isStopped()) {
                logger.debug("Execution stopped after {}", actionMap.getAction().getName());
                break;
            }
        }
        return new PlanExecutionResult(results, current);
    }

    private static ExecutionResult executeActionMap(
            ExecutionSettings settings,
            Session session,
            ActionMap actionMap) {
        try {
            ActionMap evaluated = evaluateArguments(settings.getArgumentEvaluator(), session, actionMap);
            ExecutionResult result = settings.getExecutor().execute(session, evaluated);
            logger.trace("{} returned {}", actionMap.getAction().getName(), result.getValue());
            return result.withSession(
                    result.getSession().withNodeValue(actionMap.getNodeValuePath(), result.getValue()));
        } catch (Exception e) {
            logger.error(String.format("Exception executing action %s %s",
                    actionMap.getAction().getName(), actionMap.getContextLabel().orElse("")), e);
            return ExecutionResult.failed(ActionError.fromException(actionMap.getContext(), e), session);
        }
    }

    /**
     * Evaluates the arguments of an action map. The arguments of an aggregated or collected action map are a list of
     * argument lists, each of which is evaluated on its own.
     */
    static ActionMap evaluateArguments(
            ArgumentEvaluator evaluator,
            Session session,
            ActionMap actionMap) throws Exception {
        if (!actionMap.getExecutionKind().isMerged()) {
            return actionMap.withArgs(evaluateArgs(evaluator, session, actionMap.getArgs()));
        }
        List<Object> evaluated = new ArrayList<>(actionMap.getArgs().size());
        for (Object args : actionMap.getArgs()) {
            evaluated.add(evaluateArgs(evaluator, session, (List<?>) args));
        }
        return actionMap.withArgs(evaluated);
    }

    private static List<Object> evaluateArgs(ArgumentEvaluator evaluator, Session session, List<?> args)
            throws Exception {
        List<Object> evaluated = new ArrayList<>(args.size());
        for (Object arg : args) {
            evaluated.add(arg == null ? null : evaluator.evaluate(arg, session));
        }
        return evaluated;
    }
}
