package com.sysmuse.hash;

/**
 * Phases of a hashing run, in the order they execute.
 */
public enum RunPhase {
    CREATING_STORE("Creating temporary database"),
    COLLECTING("Reading and hashing selected fields"),
    SUMMARY_MAPFILE("Creating & writing summary hash mapping file"),
    FIELD_MAPFILES("Creating & writing field mapping file(s)"),
    HASHED_INPUT("Creating & writing hashed input file(s)"),
    ARCHIVING("Archiving mapping files"),
    CLEANUP("Removing temporary database");

    private final String description;

    RunPhase(String description) {
        this.description = description;
    }

    /**
     * Human readable phase name for progress displays
     */
    public String getDescription() {
        return description;
    }
}
