package com.sysmuse.hash;

import java.nio.file.Path;
import java.util.*;

import com.sysmuse.hash.store.MappingStore;

/**
 * Per-run state shared by the collector and the output generators.
 * Created by the pipeline for one run and discarded with it.
 */
public class RunContext {

    private final RunConfig config;
    private final MappingStore store;
    private final CancellationToken token;
    private final ProgressListener listener;

    // files read successfully, with the selected fields each one has
    private final Map<Path, Set<String>> fieldsByFile = new LinkedHashMap<>();
    private final List<RunReport.FileIssue> fileIssues = new ArrayList<>();
    private final List<Path> artifacts = new ArrayList<>();
    private final Map<Path, RunPhase> artifactPhases = new HashMap<>();

    public RunContext(RunConfig config, MappingStore store, CancellationToken token, ProgressListener listener) {
        this.config = config;
        this.store = store;
        this.token = token;
        this.listener = listener;
    }

    public RunConfig getConfig() {
        return config;
    }

    public MappingStore getStore() {
        return store;
    }

    public CancellationToken getToken() {
        return token;
    }

    public ProgressListener getListener() {
        return listener;
    }

    void recordCollected(Path file, Set<String> fields) {
        fieldsByFile.put(file, Collections.unmodifiableSet(new LinkedHashSet<>(fields)));
    }

    /**
     * Files that were collected, mapped to the selected fields present in each
     */
    public Map<Path, Set<String>> getFieldsByFile() {
        return Collections.unmodifiableMap(fieldsByFile);
    }

    /**
     * Every field present in at least one collected file, in selection order
     */
    public List<String> getCollectedFields() {
        Set<String> present = new HashSet<>();
        for (Set<String> fields : fieldsByFile.values()) {
            present.addAll(fields);
        }
        List<String> ordered = new ArrayList<>();
        for (String field : config.getFields()) {
            if (present.contains(field)) {
                ordered.add(field);
            }
        }
        return ordered;
    }

    public void reportFileIssue(Path file, RunPhase phase, HashRunException error) {
        RunReport.FileIssue issue = new RunReport.FileIssue(file, phase, error);
        fileIssues.add(issue);
        if (issue.isWarning()) {
            LoggingUtil.warn(issue.toString());
        } else {
            LoggingUtil.error(issue.toString(), error.getCause() != null ? error.getCause() : error);
        }
    }

    public List<RunReport.FileIssue> getFileIssues() {
        return fileIssues;
    }

    public void recordArtifact(RunPhase phase, Path artifact) {
        artifacts.add(artifact);
        artifactPhases.put(artifact, phase);
        listener.artifactWritten(phase, artifact);
        LoggingUtil.info("Wrote " + artifact);
    }

    void removeArtifacts(Collection<Path> removed) {
        artifacts.removeAll(removed);
        artifactPhases.keySet().removeAll(removed);
    }

    /**
     * Artifacts written by the given phases, in the order they were written
     */
    public List<Path> getArtifacts(RunPhase... phases) {
        List<RunPhase> wanted = Arrays.asList(phases);
        List<Path> matching = new ArrayList<>();
        for (Path artifact : artifacts) {
            if (wanted.contains(artifactPhases.get(artifact))) {
                matching.add(artifact);
            }
        }
        return matching;
    }

    public List<Path> getArtifacts() {
        return Collections.unmodifiableList(artifacts);
    }

    /**
     * True if an artifact of this run has already been written to the path
     */
    public boolean isArtifact(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        for (Path artifact : artifacts) {
            if (artifact.toAbsolutePath().normalize().equals(normalized)) {
                return true;
            }
        }
        return false;
    }
}
