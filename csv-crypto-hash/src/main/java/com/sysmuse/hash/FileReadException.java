package com.sysmuse.hash;

import java.nio.file.Path;

/**
 * An input file could not be read: missing, not permitted, or not decodable.
 * Fatal to that file only.
 */
public class FileReadException extends HashRunException {

    private final Path file;

    public FileReadException(Path file, String message, Throwable cause) {
        super(message + ": " + file, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
