package com.sysmuse.hash;

/**
 * The mapping store failed to initialize, append or query. Fatal to the run.
 */
public class StoreException extends HashRunException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
