package com.example.scrubservice.ruleset;

/**
 * Thrown when a rules document does not have the shape of a provider mapping.
 * Nothing is built from such a document.
 */
public class MalformedRulesDocumentException extends RuntimeException {

    public MalformedRulesDocumentException(String message) {
        super(message);
    }

    public MalformedRulesDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
