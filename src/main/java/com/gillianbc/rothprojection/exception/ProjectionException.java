package com.gillianbc.rothprojection.exception;

/**
 * Base class for failures raised by the projection engine.
 */
public abstract class ProjectionException extends RuntimeException {

    protected ProjectionException(String message) {
        super(message);
    }

    protected ProjectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
