package com.sysmuse.hash;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Works out which of the selected fields a file actually has.
 * <p>
 * Names match exactly: case sensitive and untrimmed. A header cell carrying stray
 * blanks or quote characters therefore does not match its clean name; such files
 * are skipped for that field rather than guessed at.
 */
public final class FieldResolver {

    private FieldResolver() {
    }

    /**
     * Intersect the selected fields with a header row
     *
     * @return selected fields present in the header, in header order; empty if none match
     */
    public static Set<String> resolve(List<String> header, Collection<String> selectedFields) {
        Set<String> present = new LinkedHashSet<>();
        for (String column : header) {
            if (selectedFields.contains(column)) {
                present.add(column);
            }
        }
        return present;
    }
}
