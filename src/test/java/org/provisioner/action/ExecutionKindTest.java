package org.provisioner.action;

import org.junit.Assert;
import org.junit.Test;

public class ExecutionKindTest {

    @Test
    public void testBaseKinds() {
        Assert.assertEquals(ExecutionKind.IN_SEQUENCE, ExecutionKind.DEFERRED_IN_SEQUENCE.getBaseKind());
        Assert.assertEquals(ExecutionKind.AGGREGATED, ExecutionKind.DEFERRED_AGGREGATED.getBaseKind());
        Assert.assertEquals(ExecutionKind.COLLECTED, ExecutionKind.DEFERRED_COLLECTED.getBaseKind());
        Assert.assertEquals(ExecutionKind.AGGREGATED, ExecutionKind.AGGREGATED.getBaseKind());
    }

    @Test
    public void testDeferred() {
        Assert.assertTrue(ExecutionKind.DEFERRED_IN_SEQUENCE.isDeferred());
        Assert.assertTrue(ExecutionKind.DEFERRED_COLLECTED.isDeferred());
        Assert.assertFalse(ExecutionKind.IN_SEQUENCE.isDeferred());
        Assert.assertFalse(ExecutionKind.AGGREGATED.isDeferred());
    }

    @Test
    public void testMerged() {
        Assert.assertTrue(ExecutionKind.AGGREGATED.isMerged());
        Assert.assertTrue(ExecutionKind.COLLECTED.isMerged());
        Assert.assertTrue(ExecutionKind.DEFERRED_AGGREGATED.isMerged());
        Assert.assertFalse(ExecutionKind.IN_SEQUENCE.isMerged());
        Assert.assertFalse(ExecutionKind.DEFERRED_IN_SEQUENCE.isMerged());
    }
}
