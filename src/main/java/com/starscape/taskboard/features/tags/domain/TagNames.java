package com.starscape.taskboard.features.tags.domain;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tag name normalization: trim, lowercase, drop blanks, de-duplicate.
 */
public final class TagNames {
    
    private TagNames() {
    }
    
    /**
     * Normalize a single tag name.
     * @return the trimmed lowercase name, or null when the input is null or blank
     */
    public static String normalize(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
    }
    
    /**
     * Normalize a list of tag names, keeping first-seen order.
     * Blank entries are dropped and duplicates collapse into one.
     */
    public static List<String> normalize(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return List.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String name : names) {
            String value = normalize(name);
            if (value != null) {
                normalized.add(value);
            }
        }
        return List.copyOf(normalized);
    }
    
    /**
     * Split a comma-separated filter value such as "work, Urgent" into normalized names.
     */
    public static List<String> fromCsv(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return normalize(Arrays.asList(csv.split(",")));
    }
}
