package com.sysmuse.hash;

import java.nio.file.Path;

import com.sysmuse.hash.store.RecordCursor;

/**
 * Writes Hash_MapFile_&lt;algorithm&gt;: every record of the run with columns
 * Digest, PlainValue, Field, ordered by field then plaintext, exact duplicates removed.
 */
public class SummaryMapfileGenerator implements OutputGenerator {

    public static final String[] HEADER = {"Digest", "PlainValue", "Field"};

    @Override
    public RunPhase getPhase() {
        return RunPhase.SUMMARY_MAPFILE;
    }

    public static String fileName(RunConfig config) {
        return "Hash_MapFile_" + config.getAlgorithm().getFileToken() + config.getOutputExtension();
    }

    @Override
    public void generate(RunContext context) {
        RunConfig config = context.getConfig();
        Path target = config.getOutputDirectory().resolve(fileName(config));

        Artifacts.write(target, config.getOutputFormat(), writer -> {
            writer.writeRow(HEADER);
            MappingRecord previous = null;
            try (RecordCursor cursor = context.getStore().streamOrderedByFieldThenPlaintext()) {
                while (cursor.hasNext()) {
                    MappingRecord record = cursor.next();
                    // sorted on all three columns, so duplicates are adjacent
                    if (record.equals(previous)) {
                        continue;
                    }
                    writer.writeRow(record.getDigest(), record.getPlaintext(), record.getField());
                    previous = record;
                }
            }
            LoggingUtil.debug("Summary mapfile rows: " + (writer.getRowsWritten() - 1));
        });
        context.recordArtifact(getPhase(), target);
    }
}
