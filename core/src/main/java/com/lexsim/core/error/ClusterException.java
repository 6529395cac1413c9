package com.lexsim.core.error;

/**
 * Base class for errors raised by the cluster coordination layer.
 * <p>
 * All errors are caller programming errors surfaced synchronously; none are transient,
 * so nothing in this hierarchy is worth retrying.
 * </p>
 */
public class ClusterException extends RuntimeException {

    public ClusterException(String message) {
        super(message);
    }

    public ClusterException(String message, Throwable cause) {
        super(message, cause);
    }
}
