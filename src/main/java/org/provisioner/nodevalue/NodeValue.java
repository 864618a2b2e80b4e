package org.provisioner.nodevalue;

import com.google.common.base.Preconditions;

/**
 * A handle to the value an action will return once it has been executed. A node value may be passed as an argument
 * to actions scheduled later; it is resolved against the session when those actions evaluate their arguments.
 */
public final class NodeValue {
    private final String path;

    public NodeValue(String path) {
        this.path = Preconditions.checkNotNull(path, "path");
    }

    /**
     * Returns the key under which the session stores this value.
     */
    public String getPath() {
        return path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return path.equals(((NodeValue) o).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return "NodeValue{" + path + '}';
    }
}
