package io.mycelic.core.memory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class TagNormalizer {

    private TagNormalizer() {
    }

    /**
     * Trims, lower-cases and de-duplicates, keeping the order of first appearance. Blank tags are dropped.
     */
    public static List<String> normalize(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String tag : tags) {
            if (tag == null) {
                continue;
            }
            String normalized = tag.trim().toLowerCase(Locale.ROOT);
            if (!normalized.isEmpty()) {
                seen.add(normalized);
            }
        }
        return List.copyOf(new ArrayList<>(seen));
    }

    /**
     * Splits a comma separated list as typed on a command line.
     */
    public static List<String> parseCsv(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return normalize(List.of(csv.split(",")));
    }
}
