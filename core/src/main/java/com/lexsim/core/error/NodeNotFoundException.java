package com.lexsim.core.error;

import lombok.Getter;

/**
 * A mutation referenced a node ID the cluster does not have.
 */
@Getter
public class NodeNotFoundException extends ClusterException {
    private final int nodeId;

    public NodeNotFoundException(int nodeId) {
        super("Node " + nodeId + " not found");
        this.nodeId = nodeId;
    }
}
