package com.phillippitts.terrarium.exception;

/**
 * Base exception for all terrarium supervisor errors.
 * All domain exceptions extend this class so loop boundaries can handle them uniformly.
 */
public class TerrariumException extends RuntimeException {

    public TerrariumException(String message) {
        super(message);
    }

    public TerrariumException(String message, Throwable cause) {
        super(message, cause);
    }

    public TerrariumException(Throwable cause) {
        super(cause);
    }
}
