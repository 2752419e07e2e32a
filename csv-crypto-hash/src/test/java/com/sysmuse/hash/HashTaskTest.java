package com.sysmuse.hash;

import com.sysmuse.hash.store.StoreType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class HashTaskTest {

    @TempDir
    Path tempDir;

    private RunConfig config() throws Exception {
        Path a = tempDir.resolve("a.csv");
        Files.write(a, "name,note\nAl,x\nBo,y\n".getBytes(StandardCharsets.UTF_8));
        return RunConfig.builder()
                .inputFile(a)
                .field("name")
                .algorithm(HashAlgorithm.SHA384)
                .storeType(StoreType.H2)
                .scratchDirectory(tempDir)
                .build();
    }

    @Test
    public void testPhasesRunInOrder() throws Exception {
        List<RunPhase> phases = new CopyOnWriteArrayList<>();
        List<RunReport> finished = new CopyOnWriteArrayList<>();
        ProgressListener listener = new ProgressListener() {
            @Override
            public void phaseStarted(RunPhase phase) {
                phases.add(phase);
            }

            @Override
            public void finished(RunReport report) {
                finished.add(report);
            }
        };

        HashTask task = HashTask.start(config(), listener);
        RunReport report = task.awaitReport(30, TimeUnit.SECONDS);

        assertEquals(RunReport.Status.SUCCEEDED, report.getStatus());
        assertTrue(task.isDone());
        assertEquals(Arrays.asList(
                RunPhase.CREATING_STORE,
                RunPhase.COLLECTING,
                RunPhase.SUMMARY_MAPFILE,
                RunPhase.FIELD_MAPFILES,
                RunPhase.HASHED_INPUT,
                RunPhase.CLEANUP), phases);
        assertEquals(1, finished.size());
        assertSame(report, finished.get(0));
        assertTrue(Files.exists(tempDir.resolve("Hashed_a_sha384.csv")));
    }

    @Test
    public void testCancelWhileRunning() throws Exception {
        CountDownLatch collecting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ProgressListener listener = new ProgressListener() {
            @Override
            public void phaseStarted(RunPhase phase) {
                if (phase == RunPhase.COLLECTING) {
                    collecting.countDown();
                    try {
                        release.await(30, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
        };

        HashTask task = HashTask.start(config(), listener);
        assertTrue(collecting.await(30, TimeUnit.SECONDS));
        task.cancel();
        assertTrue(task.isCancelRequested());
        release.countDown();

        RunReport report = task.awaitReport(30, TimeUnit.SECONDS);
        assertEquals(RunReport.Status.CANCELLED, report.getStatus());
        assertEquals(RunPhase.COLLECTING, report.getFailedPhase());
        assertFalse(Files.exists(tempDir.resolve("Hash_MapFile_sha384.csv")));
    }
}
