package com.product.resolution.store;

/**
 * A record source or resolution sink failed. Fatal for the run that triggered it.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
