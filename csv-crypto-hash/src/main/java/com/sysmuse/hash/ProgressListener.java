package com.sysmuse.hash;

import java.nio.file.Path;

/**
 * Receives progress of a run. Callbacks arrive on the thread executing the run;
 * a UI must hand them over to its own thread.
 */
public interface ProgressListener {

    ProgressListener NONE = new ProgressListener() {
    };

    default void phaseStarted(RunPhase phase) {
    }

    default void fileStarted(RunPhase phase, Path file) {
    }

    default void artifactWritten(RunPhase phase, Path artifact) {
    }

    default void finished(RunReport report) {
    }
}
