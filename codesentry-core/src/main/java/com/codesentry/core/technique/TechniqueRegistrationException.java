package com.codesentry.core.technique;

/**
 * Thrown when a technique cannot be registered.
 *
 * <p>This is the only fatal error class of the engine: it is raised at startup,
 * before any run begins, for structurally malformed registrations (missing id,
 * invalid id, duplicate id, registration into a frozen registry).</p>
 */
public class TechniqueRegistrationException extends RuntimeException {

    /**
     * Creates a new exception.
     *
     * @param message description of the structural fault
     */
    public TechniqueRegistrationException(String message) {
        super(message);
    }
}
