package org.provisioner.session;

import org.junit.Assert;
import org.junit.Test;
import org.provisioner.TestActions;
import org.provisioner.nodevalue.NodeValue;
import org.provisioner.nodevalue.NodeValueException;
import org.provisioner.plan.ActionMap;
import org.provisioner.plan.ActionOptions;
import org.provisioner.plan.ActionPlanBuilder;
import org.provisioner.plan.PhaseContext;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public class SessionTest {

    @Test
    public void testSessionsAreValues() {
        Session empty = Session.empty();
        Session withValue = empty.withNodeValue("nv-1", "x").with("host", "web-1");

        Assert.assertTrue(empty.getNodeValues().isEmpty());
        Assert.assertFalse(empty.get("host").isPresent());
        Assert.assertEquals(Optional.of("web-1"), withValue.get("host"));
        Assert.assertEquals(withValue, Session.empty().with("host", "web-1").withNodeValue("nv-1", "x"));
        Assert.assertNotEquals(empty, withValue);
    }

    @Test
    public void testNodeValues() {
        NodeValue nodeValue = new NodeValue("nv-1");
        Session session = Session.empty().withNodeValue("nv-1", null);
        Assert.assertTrue(session.hasNodeValue(nodeValue));
        Assert.assertNull(session.getNodeValue(nodeValue));
    }

    @Test(expected = NodeValueException.class)
    public void testUnsetNodeValue() {
        Session.empty().getNodeValue(new NodeValue("nv-missing"));
    }

    @Test
    public void testPhaseContext() {
        Session session = Session.empty().inPhaseContext("configure").inPhaseContext("install-java");
        Assert.assertEquals(Arrays.asList("configure", "install-java"), session.getPhaseContext().getLabels());
        Assert.assertTrue(Session.empty().getPhaseContext().isEmpty());
    }

    @Test
    public void testWithoutActionPlan() {
        Session session = Session.empty().withActionPlan(new ActionPlanBuilder());
        Assert.assertTrue(session.getActionPlan().isPresent());
        Assert.assertFalse(session.withoutActionPlan().getActionPlan().isPresent());
        Assert.assertSame(Session.empty(), Session.empty().withoutActionPlan());
    }

    @Test
    public void testScheduleInPhaseContext() {
        ActionPlanBuilder plan = new ActionPlanBuilder();
        Session session = Session.empty().withActionPlan(plan).inPhaseContext("configure");
        NodeValue nodeValue = SessionActions.schedule(session, TestActions.inSequence("file"), "/etc/hosts");
        SessionActions.schedule(session, TestActions.inSequence("exec"),
                ActionOptions.newBuilder().actionId("restart").build(), "service nginx restart");

        List<ActionMap> actions = plan.close();
        Assert.assertEquals(2, actions.size());
        Assert.assertEquals(Arrays.asList("/etc/hosts"), actions.get(0).getArgs());
        Assert.assertEquals(nodeValue.getPath(), actions.get(0).getNodeValuePath());
        Assert.assertEquals(PhaseContext.root().enter("configure").getLabels(), actions.get(0).getContext());
        Assert.assertEquals(Optional.of("restart"), actions.get(1).getActionId());
    }

    @Test(expected = IllegalStateException.class)
    public void testScheduleWithoutActionPlan() {
        SessionActions.schedule(Session.empty(), TestActions.inSequence("file"));
    }

    @Test
    public void testNullOptionsRejected() {
        Session session = Session.empty().withActionPlan(new ActionPlanBuilder());
        try {
            SessionActions.schedule(session, TestActions.inSequence("file"), (ActionOptions) null, "/etc/hosts");
            Assert.fail("Expected a NullPointerException");
        } catch (NullPointerException e) {
            Assert.assertTrue(e.getMessage().contains("ActionOptions.none()"));
        }
    }

    @Test
    public void testNullArgumentScheduled() {
        ActionPlanBuilder plan = new ActionPlanBuilder();
        Session session = Session.empty().withActionPlan(plan);
        SessionActions.schedule(session, TestActions.inSequence("file"), (Object) null);
        SessionActions.schedule(session, TestActions.inSequence("file"), null);

        List<ActionMap> actions = plan.close();
        Assert.assertEquals(Collections.singletonList(null), actions.get(0).getArgs());
        Assert.assertEquals(Collections.singletonList(null), actions.get(1).getArgs());
    }
}
