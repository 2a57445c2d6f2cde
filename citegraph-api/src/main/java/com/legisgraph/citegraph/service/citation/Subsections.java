package com.legisgraph.citegraph.service.citation;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Subsection designators of a U.S. Code citation.
 * <p>
 * {@code "(a)(1)(A)"} normalises to {@code "a.1.A"}, and {@code "a.1.A"} splits back into
 * {@code [a, 1, A]}. A grouping that does not split into non-blank parts is kept as written.
 */
public final class Subsections {

    private static final Pattern GROUP_SEPARATOR = Pattern.compile("\\)\\s*\\(");
    private static final Pattern OUTER_PARENS = Pattern.compile("^[()\\s]+|[()\\s]+$");

    private Subsections() {
    }

    public static String normalize(String subsection) {
        if (subsection == null || subsection.isBlank()) {
            return null;
        }
        String stripped = OUTER_PARENS.matcher(subsection).replaceAll("");
        List<String> parts = Arrays.stream(GROUP_SEPARATOR.split(stripped, -1))
                .map(String::trim)
                .toList();
        if (stripped.isEmpty() || parts.stream().anyMatch(String::isEmpty)) {
            return subsection.trim();
        }
        return String.join(".", parts);
    }

    public static List<String> parts(String normalized) {
        if (normalized == null || normalized.isBlank()) {
            return List.of();
        }
        List<String> parts = Arrays.asList(normalized.split("\\.", -1));
        if (parts.stream().anyMatch(String::isBlank)) {
            return List.of(normalized);
        }
        return List.copyOf(parts);
    }
}
