package com.demochat.service.realtime;

/**
 * Completes a registration's response slot when no worker can take the request.
 */
public class RegistrationFailedException extends RuntimeException {

    public RegistrationFailedException(String message) {
        super(message);
    }
}
