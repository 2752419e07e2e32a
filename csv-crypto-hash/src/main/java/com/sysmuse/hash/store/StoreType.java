package com.sysmuse.hash.store;

import com.sysmuse.hash.ConfigurationException;

/**
 * Backing mechanism for the mapping store of a run
 */
public enum StoreType {
    /** Sorted in memory, for small runs */
    MEMORY,
    /** Embedded H2 database in a scratch directory */
    H2,
    /** H2 once the inputs exceed the configured size threshold, memory otherwise */
    AUTO;

    public static StoreType fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            return AUTO;
        }
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown store type: " + name + " (expected memory, h2 or auto)", e);
        }
    }
}
