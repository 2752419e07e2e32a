package com.sysmuse.hash;

import java.util.concurrent.*;

/**
 * A hashing run executing on its own background thread, so the caller
 * (typically a UI thread) stays responsive.
 */
public class HashTask {

    private final CancellationToken token;
    private final Future<RunReport> future;

    private HashTask(CancellationToken token, Future<RunReport> future) {
        this.token = token;
        this.future = future;
    }

    /**
     * Start a run on a dedicated worker thread that ends with the run
     */
    public static HashTask start(RunConfig config, ProgressListener listener) {
        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "csv-hash-worker");
            thread.setDaemon(true);
            return thread;
        });
        try {
            return start(config, listener, new HashPipeline(), executor);
        } finally {
            // lets the worker finish the submitted run, then exit
            executor.shutdown();
        }
    }

    /**
     * Start a run on the given executor
     */
    public static HashTask start(RunConfig config, ProgressListener listener,
                                 HashPipeline pipeline, ExecutorService executor) {
        CancellationToken token = new CancellationToken();
        Future<RunReport> future = executor.submit(() -> pipeline.run(config, listener, token));
        return new HashTask(token, future);
    }

    /**
     * Ask the run to stop at the next file or field boundary. The run still
     * completes its future, with a CANCELLED report, once it has cleaned up.
     */
    public void cancel() {
        token.cancel();
    }

    public boolean isCancelRequested() {
        return token.isCancelled();
    }

    public boolean isDone() {
        return future.isDone();
    }

    public Future<RunReport> getFuture() {
        return future;
    }

    /**
     * Wait for the run to finish
     */
    public RunReport awaitReport() throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // the pipeline converts its own failures into a report
            throw new HashRunException("Hashing task failed", e.getCause());
        }
    }

    /**
     * Wait at most the given time for the run to finish
     *
     * @throws TimeoutException if the run is still going
     */
    public RunReport awaitReport(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        try {
            return future.get(timeout, unit);
        } catch (ExecutionException e) {
            throw new HashRunException("Hashing task failed", e.getCause());
        }
    }
}
