package org.provisioner.plan.translate;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.provisioner.TestActions;
import org.provisioner.action.Action;
import org.provisioner.action.ExecutionKind;
import org.provisioner.action.PrecedenceTarget;
import org.provisioner.plan.ActionMap;
import org.provisioner.plan.ActionOptions;
import org.provisioner.plan.ActionPlanBuilder;
import org.provisioner.plan.TranslatedActionPlan;
import org.provisioner.session.Session;
import org.provisioner.session.SessionActions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class PlanTranslatorTest {
    private PlanTranslator translator;
    private ActionPlanBuilder builder;
    private Session session;

    @Before
    public void beforeEach() {
        translator = new PlanTranslator();
        builder = new ActionPlanBuilder();
        session = Session.empty().withActionPlan(builder).inPhaseContext("configure");
    }

    private static List<String> names(List<ActionMap> scope) {
        List<String> names = new ArrayList<>();
        for (ActionMap actionMap : scope) {
            names.add(actionMap.getAction().getName());
        }
        return names;
    }

    @Test
    public void testTranslate() {
        Action update = TestActions.inSequence("update-repos");
        Action java = TestActions.deferred("java", ExecutionKind.DEFERRED_IN_SEQUENCE, (s, am) -> {
            SessionActions.schedule(s, TestActions.aggregated("package"), "openjdk-17");
            SessionActions.schedule(s, TestActions.inSequence("set-java-home"));
            return null;
        });
        SessionActions.schedule(session, TestActions.collected("report"));
        SessionActions.schedule(session, java);
        SessionActions.schedule(session, TestActions.aggregated("package"), "git");
        SessionActions.schedule(session, update,
                ActionOptions.newBuilder().alwaysBefore(PrecedenceTarget.action(java)).build());

        TranslationResult result = translator.translate(builder, session);
        Assert.assertTrue(result.getPlan().isTranslated());
        Assert.assertFalse(result.getSession().getActionPlan().isPresent());
        Assert.assertTrue(builder.isClosed());
        // the deferred action is expanded before precedence is resolved, so it no longer matches
        Assert.assertEquals(Arrays.asList("package", "package", "set-java-home", "update-repos", "report"),
                names(result.getPlan().getActions()));
    }

    @Test
    public void testPrecedenceAppliedAfterSorting() {
        Action update = TestActions.inSequence("update-repos");
        Action packages = TestActions.aggregated("package");
        SessionActions.schedule(session, packages,
                ActionOptions.newBuilder().actionId("packages").alwaysAfter(PrecedenceTarget.action(update)).build(),
                "git");
        SessionActions.schedule(session, update);

        TranslationResult result = translator.translate(builder, session);
        Assert.assertEquals(Arrays.asList("update-repos", "package"), names(result.getPlan().getActions()));
    }

    @Test
    public void testTranslatedPlanIsReturnedUnchanged() {
        SessionActions.schedule(session, TestActions.inSequence("a"));
        TranslationResult first = translator.translate(builder, session);
        TranslationResult second = translator.translate(first.getPlan(), session);
        Assert.assertSame(first.getPlan(), second.getPlan());
        Assert.assertFalse(second.getSession().getActionPlan().isPresent());
        Assert.assertEquals(first.getSession(), second.getSession());
    }

    @Test
    public void testEmptyPlan() {
        TranslatedActionPlan plan = translator.translate(builder, session).getPlan();
        Assert.assertTrue(plan.getActions().isEmpty());
    }

    @Test(expected = IllegalStateException.class)
    public void testUnclosedScope() {
        SessionActions.schedule(session, TestActions.inSequence("owner"));
        builder.beginScope();
        translator.translate(builder, session);
    }
}
