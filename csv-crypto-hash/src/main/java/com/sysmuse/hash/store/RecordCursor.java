package com.sysmuse.hash.store;

import java.util.Iterator;

import com.sysmuse.hash.MappingRecord;

/**
 * Forward-only stream of records out of a mapping store. Must be closed.
 */
public interface RecordCursor extends Iterator<MappingRecord>, AutoCloseable {

    @Override
    void close();
}
