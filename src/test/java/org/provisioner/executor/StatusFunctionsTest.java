package org.provisioner.executor;

import org.junit.Assert;
import org.junit.Test;
import org.provisioner.config.ActionPlanConfiguration;
import org.provisioner.session.Session;

import java.io.IOException;
import java.util.Collections;

public class StatusFunctionsTest {
    private static final ExecutionResult SUCCESS = ExecutionResult.of("ok", Session.empty());
    private static final ExecutionResult FAILURE = ExecutionResult.failed(
            ActionError.fromException(Collections.singletonList("configure"), new IOException("boom")),
            Session.empty());

    @Test
    public void testStopOnError() {
        Assert.assertSame(SUCCESS, StatusFunctions.stopOnError().apply(SUCCESS));
        ExecutionResult stopped = StatusFunctions.stopOnError().apply(FAILURE);
        Assert.assertTrue(stopped.isStopped());
        Assert.assertEquals("Unexpected exception: boom", stopped.getError().get().getMessage());
        Assert.assertSame(stopped, StatusFunctions.stopOnError().apply(stopped));
    }

    @Test
    public void testContinueOnError() {
        Assert.assertSame(FAILURE, StatusFunctions.continueOnError().apply(FAILURE));
        Assert.assertFalse(StatusFunctions.continueOnError().apply(FAILURE).isStopped());
    }

    @Test
    public void testStoppedResultStaysStopped() {
        Assert.assertTrue(StatusFunctions.continueOnError().apply(SUCCESS.stop()).isStopped());
    }

    @Test
    public void testFromConfiguration() {
        Assert.assertSame(StatusFunctions.stopOnError(),
                StatusFunctions.fromConfiguration(ActionPlanConfiguration.defaults()));
        Assert.assertSame(StatusFunctions.continueOnError(),
                StatusFunctions.fromConfiguration(new ActionPlanConfiguration(null, false, null, null)));
    }
}
