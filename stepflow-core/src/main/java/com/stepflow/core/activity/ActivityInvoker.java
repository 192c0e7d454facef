package com.stepflow.core.activity;

import com.stepflow.core.model.NodeOutcome;

/**
 * Performs the side-effecting work of one node.
 * Implementations never throw for activity failures; they report them as
 * {@link NodeOutcome} values so the state machine can classify them.
 */
@FunctionalInterface
public interface ActivityInvoker {

    /**
     * Invoke the activity for the request's node.
     *
     * @param request node, accumulated state and identity of the invocation
     * @return the outcome; never null
     */
    NodeOutcome invoke(ActivityRequest request);
}
