package com.alphabeta.core;

/**
 * Thrown at construction time when a supplied position does not honour the {@link Position}
 * contract well enough to be searched.
 */
public class MissingCapabilityException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public MissingCapabilityException(String message) {
        super(message);
    }
}
