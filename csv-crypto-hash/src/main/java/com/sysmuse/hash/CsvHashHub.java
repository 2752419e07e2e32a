package com.sysmuse.hash;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Command line entry point. Loads the hash configuration, runs the pipeline on a
 * background task and reports the outcome.
 * <p>
 * Usage: CsvHashHub [hash_config_json]
 * <p>
 * Without an argument the configuration is located through the
 * sysconfig.directory and sysconfig.filename entries of application.properties.
 * Exit status is 0 on success, 1 when the run failed or was cancelled, 2 on a configuration error.
 */
public class CsvHashHub {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CONFIG = 2;

    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private Properties properties = new Properties();
    private HashConfig hashConfig;

    public static void main(String[] args) {
        System.exit(new CsvHashHub().execute(args));
    }

    /**
     * Run with the given arguments and return the exit status
     */
    public int execute(String[] args) {
        loadDefaultProperties();

        String configPath;
        if (args.length > 0) {
            configPath = args[0];
        } else {
            String sysConfigDir = properties.getProperty("sysconfig.directory", "");
            String sysConfigFile = properties.getProperty("sysconfig.filename", "hashconfig.json");
            configPath = Paths.get(sysConfigDir, sysConfigFile).toString();
        }

        RunConfig runConfig;
        try {
            hashConfig = new HashConfig(configPath);
            LoggingUtil.initialize(hashConfig);
            hashConfig.printDebug();
            runConfig = hashConfig.toRunConfig();
        } catch (ConfigurationException e) {
            LoggingUtil.error("Invalid hash configuration: " + e.getMessage());
            LoggingUtil.info("Usage: CsvHashHub [hash_config_json]");
            return EXIT_CONFIG;
        } catch (IOException e) {
            LoggingUtil.error("Error loading hash configuration " + configPath + ": " + e.getMessage(), e);
            return EXIT_CONFIG;
        }

        HashTask task = HashTask.start(runConfig, new LoggingProgressListener());
        Thread shutdownHook = new Thread(() -> stopOnShutdown(task, SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS),
                "csv-hash-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            RunReport report = task.awaitReport();
            return report.isSuccess() ? EXIT_OK : EXIT_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel();
            LoggingUtil.warn("Interrupted while waiting for hashing run");
            return EXIT_FAILED;
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                // JVM already shutting down, the hook is running
                LoggingUtil.debug("Shutdown in progress, hook left in place");
            }
        }
    }

    /**
     * Cancel a run and wait for it to finish cleaning up. The worker is a daemon thread,
     * so without the wait the JVM would halt it before the scratch store is removed.
     *
     * @return the final report, or null if the run had already ended or did not stop in time
     */
    static RunReport stopOnShutdown(HashTask task, long timeout, TimeUnit unit) {
        if (task.isDone()) {
            return null;
        }
        LoggingUtil.warn("Shutdown requested, cancelling hashing run");
        task.cancel();
        try {
            return task.awaitReport(timeout, unit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LoggingUtil.warn("Interrupted while waiting for hashing run to stop");
        } catch (TimeoutException e) {
            LoggingUtil.warn("Hashing run did not stop within " + timeout + " " + unit
                    + ", scratch files may remain");
        }
        return null;
    }

    private void loadDefaultProperties() {
        try (InputStream in = CsvHashHub.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null) {
                properties.load(in);
                LoggingUtil.debug("Loaded default properties");
            } else {
                LoggingUtil.info("Default properties file not found, using built-in defaults");
            }
        } catch (IOException e) {
            LoggingUtil.error("Error loading default properties: " + e.getMessage());
        }
    }

    public HashConfig getHashConfig() {
        return hashConfig;
    }

    public Properties getProperties() {
        return properties;
    }

    // Progress goes to the log; summary of the outcome at the end
    static class LoggingProgressListener implements ProgressListener {

        @Override
        public void phaseStarted(RunPhase phase) {
            LoggingUtil.info(phase.getDescription() + "...");
        }

        @Override
        public void fileStarted(RunPhase phase, Path file) {
            LoggingUtil.debug(phase + ": " + file);
        }

        @Override
        public void finished(RunReport report) {
            switch (report.getStatus()) {
                case SUCCEEDED:
                    LoggingUtil.info("Hashing complete, " + report.getArtifacts().size() + " files written");
                    break;
                case COMPLETED_WITH_ISSUES:
                    LoggingUtil.warn("Hashing complete with " + report.getFileIssues().size() + " file issues");
                    for (RunReport.FileIssue issue : report.getFileIssues()) {
                        LoggingUtil.warn("  " + issue);
                    }
                    break;
                case CANCELLED:
                    LoggingUtil.warn("Hashing cancelled during " + report.getFailedPhase());
                    break;
                default:
                    LoggingUtil.error("Hashing failed during " + report.getFailedPhase() + ": "
                            + report.getFailure().getMessage());
            }
        }
    }
}
