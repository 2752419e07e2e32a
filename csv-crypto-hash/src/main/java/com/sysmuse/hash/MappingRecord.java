package com.sysmuse.hash;

import java.util.Comparator;
import java.util.Objects;

/**
 * One (digest, plaintext, field) triple of the mapping relation.
 */
public final class MappingRecord {

    /** Summary order: field, then plaintext. Digest breaks ties so duplicates end up adjacent. */
    public static final Comparator<MappingRecord> BY_FIELD_THEN_PLAINTEXT =
            Comparator.comparing(MappingRecord::getField)
                    .thenComparing(MappingRecord::getPlaintext)
                    .thenComparing(MappingRecord::getDigest);

    /** Per-field order: digest, then plaintext. */
    public static final Comparator<MappingRecord> BY_DIGEST =
            Comparator.comparing(MappingRecord::getDigest)
                    .thenComparing(MappingRecord::getPlaintext);

    private final String digest;
    private final String plaintext;
    private final String field;

    public MappingRecord(String digest, String plaintext, String field) {
        this.digest = Objects.requireNonNull(digest, "digest");
        this.plaintext = Objects.requireNonNull(plaintext, "plaintext");
        this.field = Objects.requireNonNull(field, "field");
    }

    public String getDigest() {
        return digest;
    }

    public String getPlaintext() {
        return plaintext;
    }

    public String getField() {
        return field;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MappingRecord)) {
            return false;
        }
        MappingRecord other = (MappingRecord) o;
        return digest.equals(other.digest) && plaintext.equals(other.plaintext) && field.equals(other.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(digest, plaintext, field);
    }

    @Override
    public String toString() {
        // no plaintext, records end up in logs
        return "MappingRecord[field=" + field + ", digest=" + digest + "]";
    }
}
