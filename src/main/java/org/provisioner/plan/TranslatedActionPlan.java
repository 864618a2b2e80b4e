package org.provisioner.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The output of translation: an ordered sequence of action maps, conditional ones carrying their then and else
 * blocks. Read-only.
 */
public class TranslatedActionPlan implements ActionPlan {
    private final List<ActionMap> actions;

    public TranslatedActionPlan(List<ActionMap> actions) {
        this.actions = Collections.unmodifiableList(new ArrayList<>(actions));
    }

    public List<ActionMap> getActions() {
        return actions;
    }

    @Override
    public boolean isTranslated() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return actions.equals(((TranslatedActionPlan) o).actions);
    }

    @Override
    public int hashCode() {
        return actions.hashCode();
    }

    @Override
    public String toString() {
        return "TranslatedActionPlan{actions=" + actions + '}';
    }
}
