package org.provisioner.nodevalue;

/**
 * Thrown when a node value is read before the action producing it has run.
 */
public class NodeValueException extends RuntimeException {

    public NodeValueException(String message) {
        super(message);
    }
}
