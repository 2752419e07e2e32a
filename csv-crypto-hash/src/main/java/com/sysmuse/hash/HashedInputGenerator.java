package com.sysmuse.hash;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Rewrites every collected input file as Hashed_&lt;stem&gt;_&lt;algorithm&gt;&lt;ext&gt;, replacing the
 * selected fields with their digests and copying all other columns unchanged.
 * <p>
 * With {@link RewriteScope#GLOBAL} cells are looked up in one plaintext to digest
 * projection over all fields, so a plaintext recorded under two fields maps to a single
 * digest for both. Since digests are unsalted that digest is the same one either field
 * would produce. A cell whose value has no mapping (an empty cell when empty values are
 * not hashed) gets the configured no-mapping marker.
 */
public class HashedInputGenerator implements OutputGenerator {

    @Override
    public RunPhase getPhase() {
        return RunPhase.HASHED_INPUT;
    }

    public static String fileName(Path input, RunConfig config) {
        String name = input.getFileName().toString();
        String extension = name.lastIndexOf('.') > 0 ? RunConfig.extensionOf(input) : config.getOutputExtension();
        return "Hashed_" + RunConfig.stemOf(input) + "_" + config.getAlgorithm().getFileToken() + extension;
    }

    @Override
    public void generate(RunContext context) {
        RunConfig config = context.getConfig();
        Map<String, String> global = null;
        Map<String, Map<String, String>> perField = new HashMap<>();

        if (config.getRewriteScope() == RewriteScope.GLOBAL) {
            global = context.getStore().projectPlaintextToDigest();
            LoggingUtil.info("Built global plaintext to digest map with " + global.size() + " entries");
        } else {
            for (String field : context.getCollectedFields()) {
                perField.put(field, context.getStore().projectPlaintextToDigest(field));
            }
        }

        for (Map.Entry<Path, Set<String>> entry : context.getFieldsByFile().entrySet()) {
            Path input = entry.getKey();
            context.getToken().throwIfCancelled("before rewriting " + input);
            context.getListener().fileStarted(getPhase(), input);

            Path target = config.getOutputDirectory().resolve(fileName(input, config));
            if (target.toAbsolutePath().normalize().equals(input.toAbsolutePath().normalize())) {
                context.reportFileIssue(input, getPhase(),
                        new FileReadException(input, "Hashed output would overwrite its input", null));
                continue;
            }
            if (context.isArtifact(target)) {
                context.reportFileIssue(input, getPhase(), new WriteException(target,
                        "Hashed output of " + input + " would overwrite another output of this run", null));
                continue;
            }

            final Map<String, String> globalMap = global;
            try {
                Artifacts.write(target, config.getOutputFormat(),
                        writer -> rewrite(input, entry.getValue(), config, writer,
                                field -> globalMap != null ? globalMap : perField.get(field)));
                context.recordArtifact(getPhase(), target);
            } catch (FileReadException e) {
                context.reportFileIssue(input, getPhase(), e);
            }
        }
    }

    private interface MappingLookup {
        Map<String, String> forField(String field);
    }

    private void rewrite(Path input, Set<String> fields, RunConfig config, DelimitedWriter writer,
                         MappingLookup lookup) throws IOException {
        DelimitedReader reader = openOrFail(input, config);
        try (reader) {
            List<String> header = readOrFail(reader, input);
            if (header == null) {
                return;
            }
            writer.writeRow(header);

            // column index -> mapping of the field in that column
            Map<Integer, Map<String, String>> replaced = new LinkedHashMap<>();
            for (String field : fields) {
                replaced.put(header.indexOf(field), lookup.forField(field));
            }

            List<String> row;
            while ((row = readOrFail(reader, input)) != null) {
                List<String> out = new ArrayList<>(row);
                while (out.size() < header.size()) {
                    out.add("");
                }
                for (Map.Entry<Integer, Map<String, String>> column : replaced.entrySet()) {
                    int index = column.getKey();
                    out.set(index, digestFor(out.get(index), column.getValue(), config));
                }
                writer.writeRow(out);
            }
        }
    }

    private static String digestFor(String value, Map<String, String> mapping, RunConfig config) {
        if (value.isEmpty() && !config.isHashEmptyValues()) {
            return config.getNoMappingMarker();
        }
        String digest = mapping != null ? mapping.get(value) : null;
        return digest != null ? digest : config.getNoMappingMarker();
    }

    private static DelimitedReader openOrFail(Path input, RunConfig config) {
        try {
            return new DelimitedReader(input, config.getInputCharset(), config.getInputFormat());
        } catch (IOException e) {
            throw new FileReadException(input, "Failed to re-open input file", e);
        }
    }

    // read errors belong to the input file, not to the artifact being written
    private static List<String> readOrFail(DelimitedReader reader, Path input) {
        try {
            return reader.readRow();
        } catch (IOException e) {
            throw new FileReadException(input, "Failed to re-read input file", e);
        }
    }
}
