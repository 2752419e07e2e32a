package com.sysmuse.hash.store;

import java.util.*;

import com.sysmuse.hash.MappingRecord;
import com.sysmuse.hash.StoreException;

/**
 * Mapping store held entirely on the heap. Suited to small runs.
 */
public class InMemoryMappingStore implements MappingStore {

    private List<MappingRecord> records = new ArrayList<>();
    private boolean closed = false;

    @Override
    public void append(MappingRecord record) {
        ensureOpen();
        records.add(record);
    }

    @Override
    public void flush() {
        ensureOpen();
    }

    @Override
    public long size() {
        ensureOpen();
        return records.size();
    }

    @Override
    public RecordCursor streamOrderedByFieldThenPlaintext() {
        ensureOpen();
        List<MappingRecord> sorted = new ArrayList<>(records);
        sorted.sort(MappingRecord.BY_FIELD_THEN_PLAINTEXT);
        return new ListCursor(sorted);
    }

    @Override
    public RecordCursor streamOrderedByDigestForField(String field) {
        ensureOpen();
        List<MappingRecord> sorted = new ArrayList<>();
        for (MappingRecord record : records) {
            if (record.getField().equals(field)) {
                sorted.add(record);
            }
        }
        sorted.sort(MappingRecord.BY_DIGEST);
        return new ListCursor(sorted);
    }

    @Override
    public Map<String, String> projectPlaintextToDigest() {
        ensureOpen();
        Map<String, String> projection = new HashMap<>();
        for (MappingRecord record : records) {
            projection.put(record.getPlaintext(), record.getDigest());
        }
        return projection;
    }

    @Override
    public Map<String, String> projectPlaintextToDigest(String field) {
        ensureOpen();
        Map<String, String> projection = new HashMap<>();
        for (MappingRecord record : records) {
            if (record.getField().equals(field)) {
                projection.put(record.getPlaintext(), record.getDigest());
            }
        }
        return projection;
    }

    @Override
    public void close() {
        closed = true;
        records = Collections.emptyList();
    }

    private void ensureOpen() {
        if (closed) {
            throw new StoreException("In-memory mapping store is closed");
        }
    }

    private static class ListCursor implements RecordCursor {
        private final Iterator<MappingRecord> it;

        ListCursor(List<MappingRecord> sorted) {
            this.it = sorted.iterator();
        }

        @Override
        public boolean hasNext() {
            return it.hasNext();
        }

        @Override
        public MappingRecord next() {
            return it.next();
        }

        @Override
        public void close() {
        }
    }
}
