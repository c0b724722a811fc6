package com.jreinhal.legaldoc.rag.generation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Parses and filters inline citation markers. Recognized forms are {@code [2]}, {@code [1, 3]}
 * and {@code [Source 2]} (optionally followed by a page note); all are rewritten to the
 * {@code [n]} form.
 */
public final class CitationMarkers {
    private static final Pattern MARKER = Pattern.compile(
            "\\[(?:Source\\s+)?(\\d{1,4}(?:\\s*,\\s*\\d{1,4})*)(?:\\s*[-,]\\s*Page\\s+\\d+)?\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern SPACE_BEFORE_PUNCT = Pattern.compile("\\s+([.,;:!?])");

    private CitationMarkers() {
    }

    /**
     * Distinct citation indexes in order of first appearance.
     */
    public static List<Integer> indexes(String text) {
        Set<Integer> found = new LinkedHashSet<>();
        if (text == null) {
            return List.of();
        }
        Matcher matcher = MARKER.matcher(text);
        while (matcher.find()) {
            for (String part : matcher.group(1).split(",")) {
                found.add(Integer.parseInt(part.trim()));
            }
        }
        return new ArrayList<>(found);
    }

    /**
     * Rewrites markers to {@code [n]} and drops every index not in {@code allowed}. A marker with
     * no allowed index left is removed entirely.
     */
    public static Filtered retainOnly(String text, Set<Integer> allowed) {
        Matcher matcher = MARKER.matcher(text);
        StringBuilder out = new StringBuilder();
        Set<Integer> dropped = new LinkedHashSet<>();
        while (matcher.find()) {
            List<Integer> kept = new ArrayList<>();
            for (String part : matcher.group(1).split(",")) {
                int index = Integer.parseInt(part.trim());
                if (allowed.contains(index)) {
                    if (!kept.contains(index)) {
                        kept.add(index);
                    }
                } else {
                    dropped.add(index);
                }
            }
            String replacement = kept.stream().map(i -> "[" + i + "]").collect(Collectors.joining());
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        String cleaned = dropped.isEmpty() ? out.toString()
                : SPACE_BEFORE_PUNCT.matcher(out.toString().replaceAll("[ \\t]{2,}", " ")).replaceAll("$1");
        return new Filtered(cleaned.trim(), List.copyOf(dropped));
    }

    /**
     * Removes all markers, for comparing claim text with passages.
     */
    public static String strip(String text) {
        if (text == null) {
            return "";
        }
        String stripped = MARKER.matcher(text).replaceAll("").replaceAll("\\s{2,}", " ");
        return SPACE_BEFORE_PUNCT.matcher(stripped).replaceAll("$1").trim();
    }

    public record Filtered(String text, List<Integer> droppedIndexes) {
    }
}
