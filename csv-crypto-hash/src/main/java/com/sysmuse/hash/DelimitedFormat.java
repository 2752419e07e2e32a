package com.sysmuse.hash;

import java.util.Objects;

/**
 * Delimiter and quote settings of a delimited text file.
 * The delimiter is either a single character or any run of blanks/tabs.
 */
public final class DelimitedFormat {

    public static final char DEFAULT_DELIMITER = ',';
    public static final char DEFAULT_QUOTE = '"';

    public static final DelimitedFormat CSV = new DelimitedFormat(DEFAULT_DELIMITER, false, DEFAULT_QUOTE);

    private final char delimiter;
    private final boolean whitespace;
    private final char quote;

    private DelimitedFormat(char delimiter, boolean whitespace, char quote) {
        this.delimiter = delimiter;
        this.whitespace = whitespace;
        this.quote = quote;
    }

    public static DelimitedFormat of(char delimiter, char quote) {
        if (delimiter == quote) {
            throw new ConfigurationException("Delimiter and quote character must differ: '" + delimiter + "'");
        }
        if (delimiter == '\n' || delimiter == '\r') {
            throw new ConfigurationException("Line breaks cannot be used as a delimiter");
        }
        return new DelimitedFormat(delimiter, false, quote);
    }

    /**
     * Fields separated by one or more blanks or tabs. Written back out tab separated.
     */
    public static DelimitedFormat whitespace(char quote) {
        if (quote == ' ' || quote == '\t') {
            throw new ConfigurationException("Whitespace cannot be used as the quote character");
        }
        return new DelimitedFormat('\t', true, quote);
    }

    /**
     * Parse a delimiter setting as it appears in configuration: a single character,
     * "tab" / "\t", or "whitespace".
     */
    public static DelimitedFormat parse(String delimiterSetting, String quoteSetting) {
        char quote = DEFAULT_QUOTE;
        if (quoteSetting != null && !quoteSetting.isEmpty()) {
            if (quoteSetting.length() != 1) {
                throw new ConfigurationException("Quote character must be a single character: " + quoteSetting);
            }
            quote = quoteSetting.charAt(0);
        }
        if (delimiterSetting == null || delimiterSetting.isEmpty()) {
            return of(DEFAULT_DELIMITER, quote);
        }
        switch (delimiterSetting.toLowerCase()) {
            case "whitespace":
            case "\\s+":
                return whitespace(quote);
            case "tab":
            case "\\t":
                return of('\t', quote);
            default:
                if (delimiterSetting.length() != 1) {
                    throw new ConfigurationException("Delimiter must be a single character, 'tab' or 'whitespace': "
                            + delimiterSetting);
                }
                return of(delimiterSetting.charAt(0), quote);
        }
    }

    public char getDelimiter() {
        return delimiter;
    }

    public boolean isWhitespace() {
        return whitespace;
    }

    public char getQuote() {
        return quote;
    }

    boolean isSeparator(int c) {
        return whitespace ? (c == ' ' || c == '\t') : c == delimiter;
    }

    /**
     * Escape a single value for output, quoting it when it contains the delimiter,
     * the quote character or a line break. Embedded quotes are doubled.
     */
    public String escape(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        boolean needsQuoting = value.indexOf(quote) >= 0 ||
                value.indexOf('\n') >= 0 ||
                value.indexOf('\r') >= 0 ||
                value.indexOf(delimiter) >= 0 ||
                (whitespace && (value.indexOf(' ') >= 0 || value.indexOf('\t') >= 0));

        if (!needsQuoting) {
            return value;
        }
        String q = String.valueOf(quote);
        return q + value.replace(q, q + q) + q;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DelimitedFormat)) {
            return false;
        }
        DelimitedFormat other = (DelimitedFormat) o;
        return delimiter == other.delimiter && whitespace == other.whitespace && quote == other.quote;
    }

    @Override
    public int hashCode() {
        return Objects.hash(delimiter, whitespace, quote);
    }

    @Override
    public String toString() {
        return whitespace ? "whitespace(quote=" + quote + ")" : "delimiter=" + delimiter + ", quote=" + quote;
    }
}
