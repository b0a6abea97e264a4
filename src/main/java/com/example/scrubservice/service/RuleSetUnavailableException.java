package com.example.scrubservice.service;

/**
 * Thrown when no ruleset is published and none could be loaded.
 */
public class RuleSetUnavailableException extends RuntimeException {

    public RuleSetUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
