package com.sysmuse.hash;

import java.nio.file.Path;

import com.sysmuse.hash.store.RecordCursor;

/**
 * Writes one &lt;Field&gt;_MapFile_&lt;algorithm&gt; per field found in at least one file,
 * with columns &lt;Field&gt; (digest) and &lt;Field&gt;_Plaintext, ordered by digest.
 */
public class FieldMapfileGenerator implements OutputGenerator {

    @Override
    public RunPhase getPhase() {
        return RunPhase.FIELD_MAPFILES;
    }

    public static String fileName(String field, RunConfig config) {
        return Artifacts.safeFileComponent(field) + "_MapFile_" + config.getAlgorithm().getFileToken()
                + config.getOutputExtension();
    }

    @Override
    public void generate(RunContext context) {
        RunConfig config = context.getConfig();
        for (String field : context.getCollectedFields()) {
            context.getToken().throwIfCancelled("before writing mapfile for field " + field);
            Path target = config.getOutputDirectory().resolve(fileName(field, config));
            if (context.isArtifact(target)) {
                // e.g. fields "a/b" and "a_b", or a field named "Hash"
                context.reportFileIssue(target, getPhase(), new WriteException(target,
                        "Mapfile for field " + field + " would overwrite another output of this run", null));
                continue;
            }

            Artifacts.write(target, config.getOutputFormat(), writer -> {
                writer.writeRow(field, field + "_Plaintext");
                String previousDigest = null;
                String previousPlaintext = null;
                try (RecordCursor cursor = context.getStore().streamOrderedByDigestForField(field)) {
                    while (cursor.hasNext()) {
                        MappingRecord record = cursor.next();
                        if (record.getDigest().equals(previousDigest)
                                && record.getPlaintext().equals(previousPlaintext)) {
                            continue;
                        }
                        writer.writeRow(record.getDigest(), record.getPlaintext());
                        previousDigest = record.getDigest();
                        previousPlaintext = record.getPlaintext();
                    }
                }
            });
            context.recordArtifact(getPhase(), target);
        }
    }
}
