package com.lexsim.core.error;

/**
 * A call argument is outside its valid domain (e.g., zero nodes).
 */
public class InvalidParameterException extends ClusterException {

    public InvalidParameterException(String message) {
        super(message);
    }
}
