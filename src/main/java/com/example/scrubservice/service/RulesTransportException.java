package com.example.scrubservice.service;

/**
 * Thrown when a rules document could not be retrieved.
 */
public class RulesTransportException extends RuntimeException {

    public RulesTransportException(String message) {
        super(message);
    }

    public RulesTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
