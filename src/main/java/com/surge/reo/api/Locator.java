package com.surge.reo.api;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Dot-separated path to an object, e.g. {@code Φ.org.eolang.int} or
 * {@code ρ.x}.
 *
 * The head may be {@code Φ} (or {@code Q}) for the root, {@code ξ} for the
 * current object, {@code ρ} for its parent, {@code νN} for a vertex by id,
 * or a plain name looked up from the current object outwards. A trailing
 * {@code Δ} is allowed and ignored.
 *
 * @param segments non-empty list of non-empty segments
 */
public record Locator(List<String> segments) {

    public Locator {
        if (segments.isEmpty())
            throw new IllegalArgumentException("Empty locator");
        segments = List.copyOf(segments);
    }

    /**
     * @throws IllegalArgumentException if the text is empty or has an empty
     *                                  segment
     */
    public static Locator parse(String text) {
        String t = text.trim();
        if (t.isEmpty())
            throw new IllegalArgumentException("Empty locator");
        String[] parts = t.split("\\.", -1);
        for (String p : parts) {
            if (p.isEmpty())
                throw new IllegalArgumentException("Empty segment in locator '" + text + "'");
        }
        return new Locator(Arrays.asList(parts));
    }

    public String head() {
        return segments.get(0);
    }

    public List<String> tail() {
        return segments.size() == 1 ? Collections.emptyList() : segments.subList(1, segments.size());
    }

    /** True for the two spellings of the root. */
    public static boolean isRoot(String segment) {
        return Attr.PHI.equals(segment) || Attr.Q.equals(segment);
    }

    /** The vertex id of a {@code νN} segment, or -1. */
    public static int vertex(String segment) {
        if (segment.length() < 2 || !segment.startsWith("ν"))
            return -1;
        for (int i = 1; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i)))
                return -1;
        }
        try {
            return Integer.parseInt(segment.substring(1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    @Override
    public String toString() {
        return String.join(".", segments);
    }
}
