package com.sysmuse.hash;

import com.sysmuse.hash.store.InMemoryMappingStore;
import com.sysmuse.hash.store.MappingStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RunContextTest {

    @TempDir
    Path tempDir;

    private RunContext context(MappingStore store) {
        RunConfig config = RunConfig.builder()
                .inputFile(tempDir.resolve("a.csv"))
                .field("name")
                .algorithm(HashAlgorithm.SHA256)
                .build();
        return new RunContext(config, store, new CancellationToken(), ProgressListener.NONE);
    }

    @Test
    public void testArtifactsAreReadOnly() {
        try (MappingStore store = new InMemoryMappingStore()) {
            RunContext context = context(store);
            Path summary = tempDir.resolve("Hash_MapFile_sha256.csv");
            context.recordArtifact(RunPhase.SUMMARY_MAPFILE, summary);

            List<Path> artifacts = context.getArtifacts();
            assertThrows(UnsupportedOperationException.class, () -> artifacts.add(tempDir.resolve("x.csv")));
            assertThrows(UnsupportedOperationException.class, artifacts::clear);
            assertEquals(1, context.getArtifacts().size());
        }
    }

    @Test
    public void testIsArtifactComparesNormalizedPaths() {
        try (MappingStore store = new InMemoryMappingStore()) {
            RunContext context = context(store);
            context.recordArtifact(RunPhase.SUMMARY_MAPFILE, tempDir.resolve("Hash_MapFile_sha256.csv"));

            assertTrue(context.isArtifact(tempDir.resolve("sub").resolve("..").resolve("Hash_MapFile_sha256.csv")));
            assertFalse(context.isArtifact(tempDir.resolve("name_MapFile_sha256.csv")));
            assertEquals(List.of(tempDir.resolve("Hash_MapFile_sha256.csv")),
                    context.getArtifacts(RunPhase.SUMMARY_MAPFILE));
            assertTrue(context.getArtifacts(RunPhase.FIELD_MAPFILES).isEmpty());
        }
    }
}
