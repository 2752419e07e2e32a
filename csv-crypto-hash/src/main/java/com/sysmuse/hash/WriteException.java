package com.sysmuse.hash;

import java.nio.file.Path;

/**
 * An output artifact could not be written. Artifacts written before it are left in place.
 */
public class WriteException extends HashRunException {

    private final Path artifact;

    public WriteException(Path artifact, String message, Throwable cause) {
        super(message + ": " + artifact, cause);
        this.artifact = artifact;
    }

    public Path getArtifact() {
        return artifact;
    }
}
