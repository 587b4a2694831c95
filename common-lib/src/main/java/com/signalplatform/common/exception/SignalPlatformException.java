package com.signalplatform.common.exception;

/**
 * Root of the platform's unchecked exception hierarchy.
 */
public class SignalPlatformException extends RuntimeException {

    public SignalPlatformException(String message) {
        super(message);
    }

    public SignalPlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
