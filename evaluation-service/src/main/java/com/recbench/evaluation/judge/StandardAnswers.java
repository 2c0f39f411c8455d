package com.recbench.evaluation.judge;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Normalization shared by both judging policies.
 */
public final class StandardAnswers {

    private StandardAnswers() {
    }

    public static String normalize(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Splits a standard answer into its accepted alternatives. Full-width separators are folded,
     * {@code *} markers dropped, and {@code ;} takes precedence over {@code ,}.
     */
    public static List<String> alternatives(String standardAnswer) {
        List<String> items = new ArrayList<>();
        if (standardAnswer == null) {
            return items;
        }
        String folded = standardAnswer
                .replace('；', ';')
                .replace('，', ',')
                .replace('、', ',')
                .replace("*", "")
                .trim();
        if (folded.isEmpty()) {
            return items;
        }
        String separator = folded.indexOf(';') >= 0 ? ";" : ",";
        for (String part : folded.split(separator)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                items.add(trimmed);
            }
        }
        return items;
    }

    public static List<String> normalizedAlternatives(String standardAnswer) {
        List<String> normalized = new ArrayList<>();
        for (String item : alternatives(standardAnswer)) {
            normalized.add(normalize(item));
        }
        return normalized;
    }

    /**
     * Every form of the standard answer a recommendation may equal: the whole answer as written,
     * followed by its split alternatives.
     */
    public static List<String> acceptedAnswers(String standardAnswer) {
        List<String> accepted = new ArrayList<>();
        String whole = normalize(standardAnswer);
        if (!whole.isEmpty()) {
            accepted.add(whole);
        }
        for (String item : normalizedAlternatives(standardAnswer)) {
            if (!accepted.contains(item)) {
                accepted.add(item);
            }
        }
        return accepted;
    }

    static boolean isEmpty(List<List<String>> recommendations) {
        if (recommendations == null) {
            return true;
        }
        for (List<String> list : recommendations) {
            if (list != null && !list.isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
