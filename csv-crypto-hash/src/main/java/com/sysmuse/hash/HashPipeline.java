package com.sysmuse.hash;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.sysmuse.hash.store.MappingStore;
import com.sysmuse.hash.store.MappingStores;

/**
 * Runs the hashing phases in their fixed order:
 * <ol>
 * <li>open the mapping store</li>
 * <li>collect every selected field of every file</li>
 * <li>summary mapfile, then per-field mapfiles, then hashed inputs</li>
 * <li>optionally archive the mapfiles</li>
 * </ol>
 * Generators start only after collection is complete. The store is closed, and any
 * scratch files removed, on every way out of {@link #run}.
 * <p>
 * A file that cannot be read is reported and skipped; the run carries on with the rest.
 * Store and write failures end the run.
 */
public class HashPipeline {

    private final List<OutputGenerator> generators;
    private final MapfileArchiver archiver;

    public HashPipeline() {
        this(List.of(new SummaryMapfileGenerator(), new FieldMapfileGenerator(), new HashedInputGenerator()),
                new MapfileArchiver());
    }

    HashPipeline(List<OutputGenerator> generators, MapfileArchiver archiver) {
        this.generators = generators;
        this.archiver = archiver;
    }

    public RunReport run(RunConfig config) {
        return run(config, ProgressListener.NONE, new CancellationToken());
    }

    public RunReport run(RunConfig config, ProgressListener listener, CancellationToken token) {
        LoggingUtil.info("Starting hashing run: " + config);
        RunPhase phase = RunPhase.CREATING_STORE;
        MappingStore store = null;
        RunContext context = null;
        RunReport report;

        try {
            token.throwIfCancelled("before start");
            listener.phaseStarted(phase);
            store = MappingStores.open(config.getStoreType(), config.getInputFiles(),
                    config.getAutoThresholdBytes(), config.getScratchDirectory());
            context = new RunContext(config, store, token, listener);

            phase = RunPhase.COLLECTING;
            listener.phaseStarted(phase);
            collect(context);

            for (OutputGenerator generator : generators) {
                phase = generator.getPhase();
                token.throwIfCancelled("before " + phase);
                listener.phaseStarted(phase);
                generator.generate(context);
            }

            if (config.isArchiveEnabled()) {
                phase = RunPhase.ARCHIVING;
                token.throwIfCancelled("before " + phase);
                listener.phaseStarted(phase);
                archive(context);
            }

            RunReport.Status status = context.getFileIssues().isEmpty()
                    ? RunReport.Status.SUCCEEDED
                    : RunReport.Status.COMPLETED_WITH_ISSUES;
            report = new RunReport(status, context.getArtifacts(), context.getFileIssues(), null, null);

        } catch (RunCancelledException e) {
            LoggingUtil.warn(e.getMessage());
            report = failedReport(RunReport.Status.CANCELLED, context, phase, e);
        } catch (HashRunException e) {
            LoggingUtil.error("Hashing run failed during " + phase + ": " + e.getMessage(), e);
            report = failedReport(RunReport.Status.FAILED, context, phase, e);
        } catch (RuntimeException e) {
            LoggingUtil.error("Unexpected error during " + phase, e);
            report = failedReport(RunReport.Status.FAILED, context, phase,
                    new HashRunException("Unexpected error during " + phase + ": " + e, e));
        } finally {
            if (store != null) {
                try {
                    notifyListener(() -> listener.phaseStarted(RunPhase.CLEANUP));
                } finally {
                    store.close();
                }
            }
        }

        LoggingUtil.info("Hashing run finished: " + report);
        final RunReport finished = report;
        notifyListener(() -> listener.finished(finished));
        return report;
    }

    // a failing listener must not cost the run its cleanup or its report
    private static void notifyListener(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LoggingUtil.warn("Progress listener failed: " + e, e);
        }
    }

    private void collect(RunContext context) {
        RunConfig config = context.getConfig();
        ValueCollector collector = new ValueCollector(config);

        for (Path file : config.getInputFiles()) {
            context.getToken().throwIfCancelled("before collecting " + file);
            context.getListener().fileStarted(RunPhase.COLLECTING, file);
            try {
                Set<String> fields = collector.collect(file, context.getStore(), context.getToken());
                if (fields.isEmpty()) {
                    List<String> header = DelimitedReader.readHeader(file, config.getInputCharset(),
                            config.getInputFormat());
                    context.reportFileIssue(file, RunPhase.COLLECTING,
                            new FieldMismatchException(file, config.getFields(), header));
                } else {
                    context.recordCollected(file, fields);
                }
            } catch (FileReadException e) {
                context.reportFileIssue(file, RunPhase.COLLECTING, e);
            } catch (IOException e) {
                context.reportFileIssue(file, RunPhase.COLLECTING,
                        new FileReadException(file, "Failed to read header", e));
            }
        }
        context.getStore().flush();
        LoggingUtil.info("Collected " + context.getStore().size() + " mapping records from "
                + context.getFieldsByFile().size() + " of " + config.getInputFiles().size() + " files");
    }

    private void archive(RunContext context) {
        List<Path> mapfiles = context.getArtifacts(RunPhase.SUMMARY_MAPFILE, RunPhase.FIELD_MAPFILES);
        if (mapfiles.isEmpty()) {
            LoggingUtil.warn("No mapfiles to archive");
            return;
        }
        Path zip = archiver.archive(mapfiles, context.getConfig());
        List<Path> removed = new ArrayList<>();
        for (Path mapfile : mapfiles) {
            if (!Files.exists(mapfile)) {
                removed.add(mapfile);
            }
        }
        context.removeArtifacts(removed);
        context.recordArtifact(RunPhase.ARCHIVING, zip);
    }

    private static RunReport failedReport(RunReport.Status status, RunContext context,
                                          RunPhase phase, HashRunException failure) {
        if (context == null) {
            return new RunReport(status, List.of(), List.of(), phase, failure);
        }
        return new RunReport(status, context.getArtifacts(), context.getFileIssues(), phase, failure);
    }
}
