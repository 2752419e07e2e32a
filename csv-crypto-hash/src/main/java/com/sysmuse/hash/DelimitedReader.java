package com.sysmuse.hash;

import java.io.*;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Streams rows out of a delimited text file one at a time.
 * <p>
 * Values are returned exactly as they appear between delimiters: nothing is trimmed
 * and nothing is type converted. A value wrapped in the quote character may contain
 * delimiters and line breaks; a doubled quote inside it stands for one quote.
 * Blank lines are skipped. Decoding errors surface as IOExceptions.
 */
public class DelimitedReader implements Closeable {

    private static final char BOM = '\uFEFF';

    private final PushbackReader reader;
    private final DelimitedFormat format;
    private final Path source;
    private boolean firstChar = true;
    private long rowNumber = 0;

    public DelimitedReader(Path source, Charset charset, DelimitedFormat format) throws IOException {
        // Files.newBufferedReader reports malformed input instead of replacing it
        this(Files.newBufferedReader(source, charset), format, source);
    }

    public DelimitedReader(Reader in, DelimitedFormat format) {
        this(in, format, null);
    }

    private DelimitedReader(Reader in, DelimitedFormat format, Path source) {
        this.reader = new PushbackReader(in instanceof BufferedReader ? in : new BufferedReader(in), 1);
        this.format = format;
        this.source = source;
    }

    /**
     * Read just the header row of a file
     */
    public static List<String> readHeader(Path file, Charset charset, DelimitedFormat format) throws IOException {
        try (DelimitedReader reader = new DelimitedReader(file, charset, format)) {
            List<String> header = reader.readRow();
            if (header == null) {
                LoggingUtil.warn("Empty delimited file: " + file);
                return new ArrayList<>();
            }
            return header;
        }
    }

    /**
     * Number of rows returned so far, header included
     */
    public long getRowNumber() {
        return rowNumber;
    }

    /**
     * Read the next non-blank row
     *
     * @return the row's values, or null at end of input
     */
    public List<String> readRow() throws IOException {
        List<String> values = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        boolean quoted = false;      // current value started with a quote
        boolean rowHasContent = false;

        while (true) {
            int c = read();

            if (c == -1) {
                if (inQuotes) {
                    throw new EOFException("Unterminated quoted value at row " + (rowNumber + 1)
                            + (source != null ? " of " + source : ""));
                }
                if (!rowHasContent && values.isEmpty() && current.length() == 0 && !quoted) {
                    return null;
                }
                finishValue(values, current, quoted);
                rowNumber++;
                return values;
            }

            if (inQuotes) {
                if (c == format.getQuote()) {
                    int next = read();
                    if (next == format.getQuote()) {
                        current.append((char) c);
                    } else {
                        inQuotes = false;
                        unread(next);
                    }
                } else {
                    current.append((char) c);
                }
                continue;
            }

            if (c == '\r' || c == '\n') {
                if (c == '\r') {
                    int next = read();
                    if (next != '\n') {
                        unread(next);
                    }
                }
                if (!rowHasContent) {
                    // blank line
                    continue;
                }
                finishValue(values, current, quoted);
                rowNumber++;
                return values;
            }

            if (format.isSeparator(c)) {
                if (format.isWhitespace()) {
                    // runs of blanks collapse, leading blanks are ignored
                    if (current.length() > 0 || quoted) {
                        values.add(current.toString());
                        current.setLength(0);
                        quoted = false;
                    }
                } else {
                    rowHasContent = true;
                    values.add(current.toString());
                    current.setLength(0);
                    quoted = false;
                }
                continue;
            }

            rowHasContent = true;
            if (c == format.getQuote() && current.length() == 0 && !quoted) {
                inQuotes = true;
                quoted = true;
                continue;
            }
            current.append((char) c);
        }
    }

    private void finishValue(List<String> values, StringBuilder current, boolean quoted) {
        if (!format.isWhitespace() || current.length() > 0 || quoted) {
            values.add(current.toString());
        }
    }

    private int read() throws IOException {
        int c = reader.read();
        if (firstChar) {
            firstChar = false;
            if (c == BOM) {
                c = reader.read();
            }
        }
        return c;
    }

    private void unread(int c) throws IOException {
        if (c != -1) {
            reader.unread(c);
        }
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
