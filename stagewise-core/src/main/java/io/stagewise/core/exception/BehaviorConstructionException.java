package io.stagewise.core.exception;

import java.io.Serial;

/// Thrown when a behavior builder cannot produce an instance of a type.
public class BehaviorConstructionException extends RuntimeException {

    @Serial private static final long serialVersionUID = -3319070581944226157L;

    public BehaviorConstructionException(String message) {
        super(message);
    }

    public BehaviorConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
