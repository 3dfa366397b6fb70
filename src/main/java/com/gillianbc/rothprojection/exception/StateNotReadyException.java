package com.gillianbc.rothprojection.exception;

/**
 * A balance or MAGI lookup asked for a year that has not been computed yet,
 * or a ledger write arrived out of year order.
 */
public class StateNotReadyException extends ProjectionException {

    public StateNotReadyException(String message) {
        super(message);
    }
}
