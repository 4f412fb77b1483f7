package com.mythos.core.manager;

/**
 * Thrown for programmer or configuration errors against the objective manager:
 * duplicate ids, unknown objective types, unknown templates, failed construction.
 */
public class ObjectiveManagerException extends RuntimeException {
    public ObjectiveManagerException(String message) {
        super(message);
    }

    public ObjectiveManagerException(String message, Throwable cause) {
        super(message, cause);
    }
}
