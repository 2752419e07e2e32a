package com.sysmuse.hash.store;

import java.util.Map;

import com.sysmuse.hash.MappingRecord;

/**
 * Append-only accumulator of the (digest, plaintext, field) relation built during one run.
 * <p>
 * Writers and readers never overlap: every append happens before the first query.
 * Implementations are not thread safe. {@link #close()} releases everything the store
 * holds, including any scratch files, and may be called more than once.
 * All failures are reported as {@link com.sysmuse.hash.StoreException}.
 */
public interface MappingStore extends AutoCloseable {

    void append(MappingRecord record);

    /**
     * Make every appended record visible to queries
     */
    void flush();

    long size();

    /**
     * All records ordered by field, then plaintext (then digest)
     */
    RecordCursor streamOrderedByFieldThenPlaintext();

    /**
     * Records of one field ordered by digest (then plaintext)
     */
    RecordCursor streamOrderedByDigestForField(String field);

    /**
     * Plaintext to digest over all records, ignoring the field.
     * When a plaintext was recorded more than once the latest append wins.
     */
    Map<String, String> projectPlaintextToDigest();

    /**
     * Plaintext to digest restricted to one field
     */
    Map<String, String> projectPlaintextToDigest(String field);

    @Override
    void close();
}
