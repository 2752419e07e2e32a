package com.sysmuse.hash;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a run: the artifacts produced, per-file problems, and the fatal failure if there was one.
 */
public final class RunReport {

    public enum Status {
        /** Every file processed, every artifact written */
        SUCCEEDED,
        /** All artifacts written, but some files could not be read or had none of the fields */
        COMPLETED_WITH_ISSUES,
        /** A store or write failure ended the run */
        FAILED,
        CANCELLED
    }

    /**
     * A problem confined to one input file
     */
    public static final class FileIssue {
        private final Path file;
        private final RunPhase phase;
        private final HashRunException error;

        public FileIssue(Path file, RunPhase phase, HashRunException error) {
            this.file = file;
            this.phase = phase;
            this.error = error;
        }

        public Path getFile() {
            return file;
        }

        public RunPhase getPhase() {
            return phase;
        }

        public HashRunException getError() {
            return error;
        }

        /**
         * Field mismatches are informational, read failures are not
         */
        public boolean isWarning() {
            return error instanceof FieldMismatchException;
        }

        @Override
        public String toString() {
            return phase + " " + file + ": " + error.getMessage();
        }
    }

    private final Status status;
    private final List<Path> artifacts;
    private final List<FileIssue> fileIssues;
    private final RunPhase failedPhase;
    private final HashRunException failure;

    RunReport(Status status, List<Path> artifacts, List<FileIssue> fileIssues,
              RunPhase failedPhase, HashRunException failure) {
        this.status = status;
        this.artifacts = Collections.unmodifiableList(new ArrayList<>(artifacts));
        this.fileIssues = Collections.unmodifiableList(new ArrayList<>(fileIssues));
        this.failedPhase = failedPhase;
        this.failure = failure;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * True unless the run failed or was cancelled
     */
    public boolean isSuccess() {
        return status == Status.SUCCEEDED || status == Status.COMPLETED_WITH_ISSUES;
    }

    public List<Path> getArtifacts() {
        return artifacts;
    }

    public List<FileIssue> getFileIssues() {
        return fileIssues;
    }

    /**
     * Issues that kept a file from being processed, warnings excluded
     */
    public List<FileIssue> getFileFailures() {
        List<FileIssue> failures = new ArrayList<>();
        for (FileIssue issue : fileIssues) {
            if (!issue.isWarning()) {
                failures.add(issue);
            }
        }
        return failures;
    }

    /**
     * Phase that was running when the run failed or was cancelled, null otherwise
     */
    public RunPhase getFailedPhase() {
        return failedPhase;
    }

    public HashRunException getFailure() {
        return failure;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RunReport[").append(status);
        sb.append(", artifacts=").append(artifacts.size());
        sb.append(", fileIssues=").append(fileIssues.size());
        if (failure != null) {
            sb.append(", failed in ").append(failedPhase).append(": ").append(failure.getMessage());
        }
        return sb.append(']').toString();
    }
}
