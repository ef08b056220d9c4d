package com.phillippitts.terrarium.exception;

/**
 * Thrown when the watchdog fails to restart a supervised service, either because
 * {@code stop()}/{@code start()} threw or because {@code start()} reported failure.
 */
public class ServiceRestartException extends TerrariumException {

    private final String serviceName;

    public ServiceRestartException(String serviceName, String message) {
        super(message + " (service: " + serviceName + ")");
        this.serviceName = serviceName;
    }

    public ServiceRestartException(String serviceName, String message, Throwable cause) {
        super(message + " (service: " + serviceName + ")", cause);
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
