package com.sysmuse.hash;

/**
 * Base class for every failure raised by the hashing pipeline.
 */
public class HashRunException extends RuntimeException {

    public HashRunException(String message) {
        super(message);
    }

    public HashRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
