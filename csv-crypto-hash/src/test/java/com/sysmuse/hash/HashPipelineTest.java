package com.sysmuse.hash;

import com.sysmuse.hash.store.StoreType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class HashPipelineTest {

    @TempDir
    Path tempDir;

    private Path inputDir;
    private Path outputDir;
    private HashPipeline pipeline;

    @BeforeEach
    public void setUp() throws Exception {
        inputDir = Files.createDirectories(tempDir.resolve("in"));
        outputDir = Files.createDirectories(tempDir.resolve("out"));
        pipeline = new HashPipeline();
    }

    private Path input(String name, String content) throws Exception {
        Path file = inputDir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private RunConfig.Builder baseConfig(Path... files) {
        return RunConfig.builder()
                .inputFiles(Arrays.asList(files))
                .outputDirectory(outputDir)
                .field("name")
                .algorithm(HashAlgorithm.SHA256)
                .storeType(StoreType.MEMORY);
    }

    private List<String> lines(String fileName) throws Exception {
        return Files.readAllLines(outputDir.resolve(fileName), StandardCharsets.UTF_8);
    }

    private static String sha256(String value) {
        return HashEngine.digest(value, HashAlgorithm.SHA256);
    }

    private Set<String> outputNames() throws Exception {
        try (Stream<Path> files = Files.list(outputDir)) {
            return files.map(p -> p.getFileName().toString()).collect(Collectors.toSet());
        }
    }

    @Test
    public void testTwoFileScenario() throws Exception {
        Path a = input("a.csv", "name,note\nAl,x\nBo,y\n");
        Path b = input("b.csv", "name,note\nAl,z\n");

        RunReport report = pipeline.run(baseConfig(a, b).build());

        assertEquals(RunReport.Status.SUCCEEDED, report.getStatus());
        assertEquals(Arrays.asList(
                outputDir.resolve("Hash_MapFile_sha256.csv"),
                outputDir.resolve("name_MapFile_sha256.csv"),
                outputDir.resolve("Hashed_a_sha256.csv"),
                outputDir.resolve("Hashed_b_sha256.csv")), report.getArtifacts());

        List<String> summary = lines("Hash_MapFile_sha256.csv");
        assertEquals(Arrays.asList(
                "Digest,PlainValue,Field",
                sha256("Al") + ",Al,name",
                sha256("Bo") + ",Bo,name"), summary);

        List<String> hashedA = lines("Hashed_a_sha256.csv");
        assertEquals(Arrays.asList(
                "name,note",
                sha256("Al") + ",x",
                sha256("Bo") + ",y"), hashedA);

        List<String> hashedB = lines("Hashed_b_sha256.csv");
        assertEquals(sha256("Al") + ",z", hashedB.get(1));
    }

    @Test
    public void testFieldMapfileOrderedByDigest() throws Exception {
        Path a = input("a.csv", "name,note\nAl,x\nBo,y\nCy,z\nAl,w\n");

        pipeline.run(baseConfig(a).build());

        List<String> mapfile = lines("name_MapFile_sha256.csv");
        assertEquals("name,name_Plaintext", mapfile.get(0));
        assertEquals(4, mapfile.size(), "One row per distinct value");

        List<String> digests = new ArrayList<>();
        for (String line : mapfile.subList(1, mapfile.size())) {
            String[] parts = line.split(",");
            assertEquals(sha256(parts[1]), parts[0]);
            digests.add(parts[0]);
        }
        List<String> sorted = new ArrayList<>(digests);
        Collections.sort(sorted);
        assertEquals(sorted, digests);
    }

    @Test
    public void testRunsAreByteIdentical() throws Exception {
        Path a = input("a.csv", "name,email,note\nAl,al@x.org,\"hi, there\"\nBo,bo@x.org,y\n");
        Path b = input("b.csv", "email,name\ncy@x.org,Cy\n");
        RunConfig.Builder builder = baseConfig(a, b).field("email");

        pipeline.run(builder.build());
        Map<String, byte[]> first = new HashMap<>();
        for (String name : outputNames()) {
            first.put(name, Files.readAllBytes(outputDir.resolve(name)));
        }

        pipeline.run(builder.storeType(StoreType.H2).scratchDirectory(tempDir).build());
        assertEquals(first.keySet(), outputNames());
        for (String name : outputNames()) {
            assertArrayEquals(first.get(name), Files.readAllBytes(outputDir.resolve(name)), name);
        }
    }

    @Test
    public void testValueSharedByTwoFieldsGetsOneDigest() throws Exception {
        Path a = input("a.csv", "name,city\nN/A,Paris\nAl,N/A\n");

        RunReport report = pipeline.run(baseConfig(a).field("city").build());
        assertTrue(report.isSuccess());

        List<String> summary = lines("Hash_MapFile_sha256.csv");
        assertEquals(Arrays.asList(
                "Digest,PlainValue,Field",
                sha256("N/A") + ",N/A,city",
                sha256("Paris") + ",Paris,city",
                sha256("Al") + ",Al,name",
                sha256("N/A") + ",N/A,name"), summary);

        List<String> hashed = lines("Hashed_a_sha256.csv");
        assertEquals(sha256("N/A") + "," + sha256("Paris"), hashed.get(1));
        assertEquals(sha256("Al") + "," + sha256("N/A"), hashed.get(2));
    }

    @Test
    public void testPerFieldRewriteScope() throws Exception {
        Path a = input("a.csv", "name,city\nN/A,Paris\nAl,N/A\n");

        pipeline.run(baseConfig(a).field("city").rewriteScope(RewriteScope.PER_FIELD).build());

        List<String> hashed = lines("Hashed_a_sha256.csv");
        assertEquals(sha256("N/A") + "," + sha256("Paris"), hashed.get(1));
        assertEquals(sha256("Al") + "," + sha256("N/A"), hashed.get(2));
    }

    @Test
    public void testHashedFileRestoresThroughFieldMapfile() throws Exception {
        String original = "id,name\n1,\"Smith, Jo\"\n2,Zoë\n3,\"say \"\"hi\"\"\"\n";
        Path a = input("people.csv", original);

        pipeline.run(baseConfig(a).build());

        Map<String, String> reverse = new HashMap<>();
        try (DelimitedReader reader = new DelimitedReader(outputDir.resolve("name_MapFile_sha256.csv"),
                StandardCharsets.UTF_8, DelimitedFormat.CSV)) {
            reader.readRow();
            List<String> row;
            while ((row = reader.readRow()) != null) {
                reverse.put(row.get(0), row.get(1));
            }
        }

        List<String> restored = new ArrayList<>();
        try (DelimitedReader reader = new DelimitedReader(outputDir.resolve("Hashed_people_sha256.csv"),
                StandardCharsets.UTF_8, DelimitedFormat.CSV)) {
            reader.readRow();
            List<String> row;
            while ((row = reader.readRow()) != null) {
                assertNotEquals(row.get(1), reverse.get(row.get(1)), "Column is hashed");
                restored.add(reverse.get(row.get(1)));
            }
        }
        assertEquals(Arrays.asList("Smith, Jo", "Zoë", "say \"hi\""), restored);
    }

    @Test
    public void testEmptyAndShortCells() throws Exception {
        Path a = input("a.csv", "note,name\nx,\ny\nz,Al\n");

        RunReport report = pipeline.run(baseConfig(a).build());
        assertTrue(report.isSuccess());

        assertEquals(2, lines("Hash_MapFile_sha256.csv").size());
        assertEquals(Arrays.asList(
                "note,name",
                "x,NO_MAPPING",
                "y,NO_MAPPING",
                "z," + sha256("Al")), lines("Hashed_a_sha256.csv"));
    }

    @Test
    public void testAllBlankFieldProducesNoRows() throws Exception {
        Path a = input("a.csv", "name,note\n,x\n,y\n");

        RunReport report = pipeline.run(baseConfig(a).build());

        assertEquals(RunReport.Status.SUCCEEDED, report.getStatus());
        assertEquals(Collections.singletonList("Digest,PlainValue,Field"), lines("Hash_MapFile_sha256.csv"));
        assertEquals(Collections.singletonList("name,name_Plaintext"), lines("name_MapFile_sha256.csv"));
    }

    @Test
    public void testHashEmptyValues() throws Exception {
        Path a = input("a.csv", "name,note\n,x\nAl,y\n");

        pipeline.run(baseConfig(a).hashEmptyValues(true).build());

        assertEquals(sha256("") + ",x", lines("Hashed_a_sha256.csv").get(1));
        assertEquals(sha256("") + ",,name", lines("Hash_MapFile_sha256.csv").get(1));
    }

    @Test
    public void testUnreadableFileIsIsolated() throws Exception {
        Path a = input("a.csv", "name\nAl\n");
        Path missing = inputDir.resolve("missing.csv");
        Path b = input("b.csv", "name\nBo\n");

        RunReport report = pipeline.run(baseConfig(a, missing, b).build());

        assertEquals(RunReport.Status.COMPLETED_WITH_ISSUES, report.getStatus());
        assertTrue(report.isSuccess());
        assertEquals(1, report.getFileFailures().size());
        RunReport.FileIssue issue = report.getFileFailures().get(0);
        assertEquals(missing, issue.getFile());
        assertEquals(RunPhase.COLLECTING, issue.getPhase());
        assertTrue(issue.getError() instanceof FileReadException);

        assertEquals(3, lines("Hash_MapFile_sha256.csv").size());
        assertTrue(Files.exists(outputDir.resolve("Hashed_a_sha256.csv")));
        assertTrue(Files.exists(outputDir.resolve("Hashed_b_sha256.csv")));
        assertFalse(Files.exists(outputDir.resolve("Hashed_missing_sha256.csv")));
    }

    @Test
    public void testFileWithoutSelectedFieldsIsSkipped() throws Exception {
        Path a = input("a.csv", "name\nAl\n");
        Path other = input("other.csv", "id,city\n1,Paris\n");

        RunReport report = pipeline.run(baseConfig(a, other).build());

        assertEquals(RunReport.Status.COMPLETED_WITH_ISSUES, report.getStatus());
        assertTrue(report.getFileFailures().isEmpty());
        assertEquals(1, report.getFileIssues().size());
        assertTrue(report.getFileIssues().get(0).getError() instanceof FieldMismatchException);
        assertFalse(Files.exists(outputDir.resolve("Hashed_other_sha256.csv")));
    }

    @Test
    public void testFieldMapfileOnlyForFieldsFound() throws Exception {
        Path a = input("a.csv", "name\nAl\n");

        pipeline.run(baseConfig(a).field("ssn").build());

        assertTrue(Files.exists(outputDir.resolve("name_MapFile_sha256.csv")));
        assertFalse(Files.exists(outputDir.resolve("ssn_MapFile_sha256.csv")));
    }

    @Test
    public void testCancelledBeforeStart() throws Exception {
        Path a = input("a.csv", "name\nAl\n");
        CancellationToken token = new CancellationToken();
        token.cancel();

        RunReport report = pipeline.run(baseConfig(a).build(), ProgressListener.NONE, token);

        assertEquals(RunReport.Status.CANCELLED, report.getStatus());
        assertFalse(report.isSuccess());
        assertTrue(report.getArtifacts().isEmpty());
        assertTrue(outputNames().isEmpty());
    }

    @Test
    public void testCancelledBetweenPhasesCleansUp() throws Exception {
        Path a = input("a.csv", "name\nAl\n");
        Path scratch = Files.createDirectories(tempDir.resolve("scratch"));
        CancellationToken token = new CancellationToken();
        ProgressListener cancelAfterSummary = new ProgressListener() {
            @Override
            public void artifactWritten(RunPhase phase, Path artifact) {
                token.cancel();
            }
        };

        RunReport report = pipeline.run(baseConfig(a).storeType(StoreType.H2).scratchDirectory(scratch).build(),
                cancelAfterSummary, token);

        assertEquals(RunReport.Status.CANCELLED, report.getStatus());
        assertEquals(RunPhase.FIELD_MAPFILES, report.getFailedPhase());
        assertEquals(Collections.singletonList(outputDir.resolve("Hash_MapFile_sha256.csv")), report.getArtifacts());
        assertEquals(Collections.singleton("Hash_MapFile_sha256.csv"), outputNames());
        try (Stream<Path> left = Files.list(scratch)) {
            assertEquals(0, left.count(), "Scratch database removed");
        }
    }

    @Test
    public void testWriteFailureEndsRun() throws Exception {
        Path a = input("a.csv", "name\nAl\n");
        // a non-empty directory in the way of the summary mapfile
        Path blocker = Files.createDirectories(outputDir.resolve("Hash_MapFile_sha256.csv"));
        Files.write(blocker.resolve("keep"), new byte[]{1});

        RunReport report = pipeline.run(baseConfig(a).build());

        assertEquals(RunReport.Status.FAILED, report.getStatus());
        assertEquals(RunPhase.SUMMARY_MAPFILE, report.getFailedPhase());
        assertTrue(report.getFailure() instanceof WriteException);
        assertEquals(Collections.singleton("Hash_MapFile_sha256.csv"), outputNames(), "No partial files left");
        assertFalse(Files.exists(outputDir.resolve("Hashed_a_sha256.csv")));
    }

    @Test
    public void testOutputDefaultsToInputDirectoryAndExtension() throws Exception {
        Path a = input("a.txt", "name\nAl\n");

        RunConfig config = RunConfig.builder()
                .inputFile(a)
                .field("name")
                .algorithm(HashAlgorithm.RIPEMD160)
                .build();
        assertEquals(inputDir, config.getOutputDirectory());
        assertEquals(".txt", config.getOutputExtension());

        RunReport report = pipeline.run(config);
        assertTrue(report.isSuccess());
        assertTrue(Files.exists(inputDir.resolve("Hash_MapFile_ripemd160.txt")));
        assertTrue(Files.exists(inputDir.resolve("name_MapFile_ripemd160.txt")));
        assertTrue(Files.exists(inputDir.resolve("Hashed_a_ripemd160.txt")));
    }

    @Test
    public void testInvalidConfiguration() throws Exception {
        Path a = input("a.csv", "name\nAl\n");

        assertThrows(ConfigurationException.class,
                () -> baseConfig(a).outputDirectory(tempDir.resolve("nowhere")).build());
        assertThrows(ConfigurationException.class,
                () -> baseConfig(a).algorithm(HashAlgorithm.NONE).build());
        assertThrows(ConfigurationException.class,
                () -> RunConfig.builder().inputFile(a).algorithm(HashAlgorithm.SHA256).build());
        assertThrows(ConfigurationException.class,
                () -> RunConfig.builder().field("name").algorithm(HashAlgorithm.SHA256).build());
    }

    @Test
    public void testEncryptedArchive() throws Exception {
        Path a = input("a.csv", "name\nAl\n");

        RunReport report = pipeline.run(baseConfig(a).archive(true, "_archive", "s3cret", false).build());

        assertEquals(RunReport.Status.SUCCEEDED, report.getStatus());
        Path zip = outputDir.resolve("Hash_MapFiles_sha256_archive.zip");
        assertEquals(Arrays.asList(outputDir.resolve("Hashed_a_sha256.csv"), zip), report.getArtifacts());
        assertEquals(new HashSet<>(Arrays.asList("Hashed_a_sha256.csv", "Hash_MapFiles_sha256_archive.zip")),
                outputNames());
        assertTrue(MapfileArchiver.isPasswordProtected(zip));

        Path extracted = Files.createDirectories(tempDir.resolve("extracted"));
        MapfileArchiver.extract(zip, extracted, "s3cret");
        assertEquals(sha256("Al") + ",Al,name",
                Files.readAllLines(extracted.resolve("Hash_MapFile_sha256.csv")).get(1));
        assertTrue(Files.exists(extracted.resolve("name_MapFile_sha256.csv")));
    }

    @Test
    public void testFailingListenerDoesNotSkipCleanup() throws Exception {
        Path a = input("a.csv", "name\nAl\n");
        Path scratch = Files.createDirectories(tempDir.resolve("scratch"));
        ProgressListener failing = new ProgressListener() {
            @Override
            public void phaseStarted(RunPhase phase) {
                if (phase == RunPhase.CLEANUP) {
                    throw new IllegalStateException("display closed");
                }
            }

            @Override
            public void finished(RunReport report) {
                throw new IllegalStateException("display closed");
            }
        };

        RunReport report = pipeline.run(baseConfig(a).storeType(StoreType.H2).scratchDirectory(scratch).build(),
                failing, new CancellationToken());

        assertEquals(RunReport.Status.SUCCEEDED, report.getStatus());
        try (Stream<Path> left = Files.list(scratch)) {
            assertEquals(0, left.count(), "Scratch database removed");
        }
    }

    @Test
    public void testInputsWithSameStemDoNotOverwrite() throws Exception {
        Path a = input("a.csv", "name\nAl\n");
        Path otherDir = Files.createDirectories(inputDir.resolve("other"));
        Path sameStem = otherDir.resolve("a.csv");
        Files.write(sameStem, "name\nBo\n".getBytes(StandardCharsets.UTF_8));

        RunReport report = pipeline.run(baseConfig(a, sameStem).build());

        assertEquals(RunReport.Status.COMPLETED_WITH_ISSUES, report.getStatus());
        assertEquals(1, report.getFileFailures().size());
        RunReport.FileIssue issue = report.getFileFailures().get(0);
        assertEquals(sameStem, issue.getFile());
        assertEquals(RunPhase.HASHED_INPUT, issue.getPhase());
        assertTrue(issue.getError() instanceof WriteException);
        assertEquals(sha256("Al"), lines("Hashed_a_sha256.csv").get(1), "First input's output kept");
    }

    @Test
    public void testFieldMapfileNameCollisions() throws Exception {
        Path a = input("a.csv", "a/b,a_b,Hash\nx,y,z\n");

        RunReport report = pipeline.run(baseConfig(a).fields(Arrays.asList("a/b", "a_b", "Hash")).build());

        assertEquals(RunReport.Status.COMPLETED_WITH_ISSUES, report.getStatus());
        assertEquals(2, report.getFileFailures().size());
        for (RunReport.FileIssue issue : report.getFileFailures()) {
            assertEquals(RunPhase.FIELD_MAPFILES, issue.getPhase());
        }
        assertEquals(Arrays.asList("a/b,a/b_Plaintext", sha256("x") + ",x"), lines("a_b_MapFile_sha256.csv"));
        assertEquals("Digest,PlainValue,Field", lines("Hash_MapFile_sha256.csv").get(0), "Summary not overwritten");
        assertEquals(4, lines("Hash_MapFile_sha256.csv").size());
    }
}
