package com.herzen.dropout.scoring;

/** A feature set reached scoring with a missing category or an out-of-range field. */
public class InvalidFeatureStateException extends RuntimeException {
    public InvalidFeatureStateException(String message) {
        super(message);
    }
}
