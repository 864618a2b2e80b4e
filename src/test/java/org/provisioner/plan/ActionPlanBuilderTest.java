package org.provisioner.plan;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.provisioner.TestActions;
import org.provisioner.action.Action;
import org.provisioner.nodevalue.NodeValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

public class ActionPlanBuilderTest {
    private static final PhaseContext CONTEXT = PhaseContext.root().enter("configure");

    private ActionPlanBuilder builder;

    @Before
    public void beforeEach() {
        builder = new ActionPlanBuilder();
    }

    private NodeValue schedule(Action action, Object... args) {
        return builder.schedule(action, Arrays.asList(args), ActionOptions.none(), CONTEXT);
    }

    @Test
    public void testActionsKeepScheduledOrder() {
        schedule(TestActions.inSequence("a"));
        schedule(TestActions.inSequence("b"));
        schedule(TestActions.inSequence("c"));

        List<ActionMap> plan = builder.close();
        Assert.assertEquals(3, plan.size());
        Assert.assertEquals("a", plan.get(0).getAction().getName());
        Assert.assertEquals("b", plan.get(1).getAction().getName());
        Assert.assertEquals("c", plan.get(2).getAction().getName());
        Assert.assertTrue(builder.isClosed());
        Assert.assertEquals(0, builder.getDepth());
    }

    @Test
    public void testNestedScopeBecomesBlockOfLastAction() {
        schedule(TestActions.inSequence("first"));
        schedule(TestActions.inSequence("owner"));
        builder.beginScope();
        Assert.assertEquals(2, builder.getDepth());
        schedule(TestActions.inSequence("then-1"));
        schedule(TestActions.inSequence("then-2"));
        List<ActionMap> block = builder.endScope();
        builder.beginScope();
        schedule(TestActions.inSequence("else-1"));
        builder.endScope();

        Assert.assertEquals(2, block.size());
        List<ActionMap> plan = builder.endScope();
        Assert.assertTrue(builder.isClosed());
        Assert.assertEquals(2, plan.size());
        Assert.assertFalse(plan.get(0).hasBlocks());

        ActionMap owner = plan.get(1);
        Assert.assertEquals(2, owner.getBlocks().size());
        Assert.assertEquals("then-1", owner.getBlocks().get(0).get(0).getAction().getName());
        Assert.assertEquals("then-2", owner.getBlocks().get(0).get(1).getAction().getName());
        Assert.assertEquals("else-1", owner.getBlocks().get(1).get(0).getAction().getName());
    }

    @Test
    public void testEndScopeWithoutOwningAction() {
        builder.beginScope();
        schedule(TestActions.inSequence("orphan"));
        try {
            builder.endScope();
            Assert.fail("Expected an IllegalStateException");
        } catch (IllegalStateException e) {
            Assert.assertTrue(e.getMessage().contains("no action"));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testCloseWithOpenNestedScope() {
        schedule(TestActions.inSequence("owner"));
        builder.beginScope();
        builder.close();
    }

    @Test(expected = IllegalStateException.class)
    public void testScheduleAfterClose() {
        builder.close();
        schedule(TestActions.inSequence("late"));
    }

    @Test(expected = IllegalStateException.class)
    public void testCloseTwice() {
        builder.close();
        builder.close();
    }

    @Test
    public void testEmptyPlan() {
        Assert.assertEquals(Collections.emptyList(), builder.close());
    }

    @Test
    public void testAggregatedInstancesShareNodeValue() {
        Action packages = TestActions.aggregated("package");
        NodeValue first = schedule(packages, "git");
        schedule(TestActions.inSequence("owner"));
        builder.beginScope();
        NodeValue nested = schedule(packages, "curl");
        builder.endScope();
        NodeValue last = schedule(packages, "vim");

        Assert.assertEquals(first, nested);
        Assert.assertEquals(first, last);
    }

    @Test
    public void testInSequenceInstancesNeverShareNodeValue() {
        Action file = TestActions.inSequence("file");
        NodeValue first = schedule(file, "/etc/hosts");
        NodeValue second = schedule(file, "/etc/hosts");
        Assert.assertNotEquals(first, second);

        List<ActionMap> plan = builder.close();
        Assert.assertEquals(first.getPath(), plan.get(0).getNodeValuePath());
        Assert.assertEquals(second.getPath(), plan.get(1).getNodeValuePath());
    }

    @Test
    public void testFindNodeValuePath() {
        Action collected = TestActions.collected("user");
        Assert.assertFalse(builder.findNodeValuePath(collected).isPresent());
        NodeValue value = schedule(collected, "bob");
        Assert.assertEquals(value.getPath(), builder.findNodeValuePath(collected).get());
    }

    @Test
    public void testUseFromAnotherThread() throws InterruptedException {
        AtomicReference<Exception> thrown = new AtomicReference<>();
        Thread thread = new Thread(() -> {
            try {
                schedule(TestActions.inSequence("a"));
            } catch (Exception e) {
                thrown.set(e);
            }
        });
        thread.start();
        thread.join();
        Assert.assertTrue(thrown.get() instanceof IllegalStateException);
    }

    @Test
    public void testIsNotTranslated() {
        Assert.assertFalse(builder.isTranslated());
        Assert.assertTrue(new TranslatedActionPlan(Collections.emptyList()).isTranslated());
    }
}
