package org.provisioner.executor;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.MockitoAnnotations;
import org.provisioner.nodevalue.NodeValue;
import org.provisioner.nodevalue.NodeValueException;
import org.provisioner.session.Session;

public class DefaultArgumentEvaluatorTest {
    @Mock private DelayedArgument mockDelayedArgument;

    private DefaultArgumentEvaluator evaluator;
    private Session session;

    @Before
    public void beforeEach() {
        MockitoAnnotations.initMocks(this);
        evaluator = new DefaultArgumentEvaluator();
        session = Session.empty().withNodeValue("nv-1", "installed");
    }

    @Test
    public void testNodeValueResolved() throws Exception {
        Assert.assertEquals("installed", evaluator.evaluate(new NodeValue("nv-1"), session));
    }

    @Test(expected = NodeValueException.class)
    public void testUnsetNodeValue() throws Exception {
        evaluator.evaluate(new NodeValue("nv-2"), session);
    }

    @Test
    public void testDelayedArgumentEvaluatedAgainstSession() throws Exception {
        Mockito.when(mockDelayedArgument.evaluate(session)).thenReturn(42);
        Assert.assertEquals(42, evaluator.evaluate(mockDelayedArgument, session));
        Mockito.verify(mockDelayedArgument).evaluate(session);
    }

    @Test
    public void testPlainValuesPassThrough() throws Exception {
        Assert.assertEquals("/etc/hosts", evaluator.evaluate("/etc/hosts", session));
        Assert.assertNull(evaluator.evaluate(null, session));
    }
}
