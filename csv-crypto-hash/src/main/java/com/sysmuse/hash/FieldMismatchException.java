package com.sysmuse.hash;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * None of the selected fields is present in a file's header.
 * Informational: recorded in the run report, never thrown out of a run.
 */
public class FieldMismatchException extends HashRunException {

    private final Path file;

    public FieldMismatchException(Path file, Collection<String> selectedFields, List<String> header) {
        super("None of the selected fields " + selectedFields + " found in header " + header + " of " + file);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
