package com.gillianbc.rothprojection.exception;

/**
 * A required reference-table entry (bracket, deduction, state rule, IRMAA bracket, RMD divisor)
 * is missing for the requested year, filing status or age.
 */
public class ConfigurationException extends ProjectionException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
