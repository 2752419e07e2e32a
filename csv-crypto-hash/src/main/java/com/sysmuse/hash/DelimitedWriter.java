package com.sysmuse.hash;

import java.io.*;
import java.util.Arrays;
import java.util.List;

/**
 * Writes rows in a delimited format, one line per row terminated by '\n'.
 */
public class DelimitedWriter implements Closeable {

    private final Writer writer;
    private final DelimitedFormat format;
    private long rowsWritten = 0;

    public DelimitedWriter(Writer writer, DelimitedFormat format) {
        this.writer = writer instanceof BufferedWriter ? writer : new BufferedWriter(writer);
        this.format = format;
    }

    public void writeRow(List<String> values) throws IOException {
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                writer.write(format.getDelimiter());
            }
            writer.write(format.escape(values.get(i)));
        }
        writer.write('\n');
        rowsWritten++;
    }

    public void writeRow(String... values) throws IOException {
        writeRow(Arrays.asList(values));
    }

    public long getRowsWritten() {
        return rowsWritten;
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
