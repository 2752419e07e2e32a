package com.sysmuse.hash;

/**
 * Invalid or incomplete run configuration, e.g. no algorithm selected or a missing directory.
 */
public class ConfigurationException extends HashRunException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
