package com.sysmuse.hash;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

/**
 * Writes output artifacts through a ".part" sibling that is moved into place only
 * once complete. A failed artifact leaves no file behind; earlier artifacts are untouched.
 */
public final class Artifacts {

    @FunctionalInterface
    public interface RowSink {
        void writeTo(DelimitedWriter writer) throws IOException;
    }

    private Artifacts() {
    }

    /**
     * Write a UTF-8 delimited artifact
     *
     * @throws WriteException if the artifact cannot be written or moved into place
     */
    public static Path write(Path target, DelimitedFormat format, RowSink sink) {
        Path part = target.resolveSibling(target.getFileName() + ".part");
        boolean done = false;
        try {
            try (DelimitedWriter writer = new DelimitedWriter(
                    new OutputStreamWriter(Files.newOutputStream(part), StandardCharsets.UTF_8), format)) {
                sink.writeTo(writer);
            }
            moveIntoPlace(part, target);
            done = true;
            return target;
        } catch (IOException e) {
            throw new WriteException(target, "Failed to write output file", e);
        } finally {
            if (!done) {
                deletePart(part);
            }
        }
    }

    private static void moveIntoPlace(Path part, Path target) throws IOException {
        try {
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deletePart(Path part) {
        try {
            Files.deleteIfExists(part);
        } catch (IOException e) {
            LoggingUtil.warn("Could not remove partial output " + part + " - " + e.getMessage());
        }
    }

    /**
     * Make a field name usable inside a file name
     */
    static String safeFileComponent(String name) {
        String safe = name.replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_");
        return safe.isEmpty() ? "_" : safe;
    }
}
