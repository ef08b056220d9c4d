package com.phillippitts.terrarium.exception;

/**
 * Thrown when the control collaborator cannot be initialized or started.
 */
public class ControlServiceException extends TerrariumException {

    public ControlServiceException(String message) {
        super(message);
    }

    public ControlServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
