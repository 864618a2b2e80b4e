package org.provisioner.plan.translate;

import org.provisioner.plan.TranslatedActionPlan;
import org.provisioner.session.Session;

/**
 * A translated plan along with the session it should be executed against.
 */
public class TranslationResult {
    private final TranslatedActionPlan plan;
    private final Session session;

    public TranslationResult(TranslatedActionPlan plan, Session session) {
        this.plan = plan;
        this.session = session;
    }

    public TranslatedActionPlan getPlan() {
        return plan;
    }

    /**
     * Returns the session passed to translation, with its in-progress action plan cleared.
     */
    public Session getSession() {
        return session;
    }

    @Override
    public String toString() {
        return "TranslationResult{plan=" + plan + ", session=" + session + '}';
    }
}
