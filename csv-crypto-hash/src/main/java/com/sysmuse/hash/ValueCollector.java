package com.sysmuse.hash;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

import com.sysmuse.hash.store.MappingStore;

/**
 * Reads the selected columns of one file, drops repeated values per field,
 * digests each distinct value and appends the records to the mapping store.
 * <p>
 * The whole file is read before anything is appended, so a file that fails to read
 * contributes no records at all.
 */
public class ValueCollector {

    private final RunConfig config;

    public ValueCollector(RunConfig config) {
        this.config = config;
    }

    /**
     * Collect one file
     *
     * @return the selected fields found in the file's header; empty when none matched,
     *         in which case nothing was appended
     * @throws FileReadException if the file cannot be read or decoded
     * @throws RunCancelledException if cancelled at a field boundary
     */
    public Set<String> collect(Path file, MappingStore store, CancellationToken token) {
        Map<String, Set<String>> distinctByField = readDistinctValues(file);
        if (distinctByField.isEmpty()) {
            return Collections.emptySet();
        }

        HashAlgorithm algorithm = config.getAlgorithm();
        for (Map.Entry<String, Set<String>> entry : distinctByField.entrySet()) {
            token.throwIfCancelled("before hashing field " + entry.getKey() + " of " + file);
            String field = entry.getKey();
            for (String value : entry.getValue()) {
                store.append(new MappingRecord(HashEngine.digest(value, algorithm), value, field));
            }
            LoggingUtil.debug("Field " + field + " of " + file.getFileName() + ": "
                    + entry.getValue().size() + " distinct values");
        }
        return distinctByField.keySet();
    }

    /**
     * Distinct values per resolved field, in first-seen order
     */
    Map<String, Set<String>> readDistinctValues(Path file) {
        try (DelimitedReader reader = new DelimitedReader(file, config.getInputCharset(), config.getInputFormat())) {
            List<String> header = reader.readRow();
            if (header == null) {
                header = Collections.emptyList();
            }
            Set<String> fields = FieldResolver.resolve(header, config.getFields());
            if (fields.isEmpty()) {
                return Collections.emptyMap();
            }

            // first occurrence wins when a header repeats a name
            Map<String, Integer> columns = new LinkedHashMap<>();
            Map<String, Set<String>> distinct = new LinkedHashMap<>();
            for (String field : fields) {
                columns.put(field, header.indexOf(field));
                distinct.put(field, new LinkedHashSet<>());
            }

            List<String> row;
            while ((row = reader.readRow()) != null) {
                for (Map.Entry<String, Integer> column : columns.entrySet()) {
                    int index = column.getValue();
                    String value = index < row.size() ? row.get(index) : "";
                    if (value.isEmpty() && !config.isHashEmptyValues()) {
                        continue;
                    }
                    distinct.get(column.getKey()).add(value);
                }
            }
            LoggingUtil.info("Read " + (reader.getRowNumber() - 1) + " rows from " + file);
            return distinct;
        } catch (IOException e) {
            throw new FileReadException(file, "Failed to read input file", e);
        }
    }
}
