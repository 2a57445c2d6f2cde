package com.legisgraph.citegraph.service.citation;

/**
 * Half-open character range {@code [start, end)} of a match in its source text.
 */
public record CitationSpan(int start, int end) {

    public CitationSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }
}
