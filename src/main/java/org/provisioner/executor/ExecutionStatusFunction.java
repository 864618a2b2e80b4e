package org.provisioner.executor;

/**
 * Decides, after each action, whether execution continues. Returning a result flagged with
 * {@link ExecutionResult#stop()} skips every remaining action, including those of enclosing blocks.
 */
@FunctionalInterface
public interface ExecutionStatusFunction {
    ExecutionResult apply(ExecutionResult result);
}
