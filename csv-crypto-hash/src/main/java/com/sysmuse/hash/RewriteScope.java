package com.sysmuse.hash;

/**
 * Which plaintext to digest projection the hashed-input rewriter looks cells up in.
 */
public enum RewriteScope {
    /**
     * One projection over every field. A plaintext recorded under several fields
     * resolves to whichever record was appended last, for all of those fields.
     */
    GLOBAL,

    /**
     * One projection per field; each cell is looked up under its own column.
     */
    PER_FIELD;

    public static RewriteScope fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            return GLOBAL;
        }
        String normalized = name.trim().toUpperCase().replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown rewrite scope: " + name + " (expected global or per_field)", e);
        }
    }
}
