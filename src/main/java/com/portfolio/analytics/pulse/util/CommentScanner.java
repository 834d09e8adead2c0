package com.portfolio.analytics.pulse.util;

import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Case-insensitive keyword scanning over free-text task comments.
 * Offsets in the returned matches refer to the original (un-lowercased) text.
 */
public final class CommentScanner {

    public static final int CONTEXT_LIMIT = 80;

    private static final String SENTENCE_BOUNDARIES = ".;!?\n\r";
    private static final String LEADING_NOISE = ":- ";

    private CommentScanner() {
    }

    @Value
    public static class KeywordMatch {
        String keyword;
        int start;
        int end;
        String context;
    }

    /**
     * First keyword, in list order, that appears anywhere in the text. The context
     * starts at the keyword itself.
     */
    public static Optional<KeywordMatch> firstMatch(String text, List<String> keywords) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            int pos = lower.indexOf(keyword);
            if (pos != -1) {
                String context = untilBoundary(text.substring(pos));
                return Optional.of(new KeywordMatch(keyword, pos, pos + keyword.length(), context));
            }
        }
        return Optional.empty();
    }

    /**
     * Every non-overlapping keyword occurrence, ordered by position. When two keywords
     * start at the same offset the longer one wins. The context is the text that
     * follows the keyword.
     */
    public static List<KeywordMatch> findAll(String text, List<String> keywords) {
        List<KeywordMatch> matches = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return matches;
        }
        String lower = text.toLowerCase(Locale.ROOT);

        List<int[]> occurrences = new ArrayList<>();
        for (int k = 0; k < keywords.size(); k++) {
            String keyword = keywords.get(k);
            int pos = lower.indexOf(keyword);
            while (pos != -1) {
                occurrences.add(new int[]{pos, pos + keyword.length(), k});
                pos = lower.indexOf(keyword, pos + keyword.length());
            }
        }
        occurrences.sort(Comparator.<int[]>comparingInt(o -> o[0])
                .thenComparing(o -> -(o[1] - o[0])));

        int lastEnd = 0;
        for (int[] occurrence : occurrences) {
            if (occurrence[0] < lastEnd) {
                continue;
            }
            lastEnd = occurrence[1];
            matches.add(new KeywordMatch(keywords.get(occurrence[2]), occurrence[0], occurrence[1],
                    contextAfter(text, occurrence[1])));
        }
        return matches;
    }

    /**
     * Text following {@code offset}, leading punctuation stripped, up to the next
     * sentence boundary or {@link #CONTEXT_LIMIT} characters.
     */
    public static String contextAfter(String text, int offset) {
        return untilBoundary(stripLeadingNoise(text.substring(Math.min(offset, text.length()))));
    }

    /**
     * Leading whitespace and ":- " characters removed, as used before matching
     * project names in the dependency graph window.
     */
    public static String stripLeadingNoise(String text) {
        int i = 0;
        while (i < text.length()
                && (Character.isWhitespace(text.charAt(i)) || LEADING_NOISE.indexOf(text.charAt(i)) >= 0)) {
            i++;
        }
        return text.substring(i);
    }

    private static String untilBoundary(String text) {
        int end = text.length();
        for (int i = 0; i < text.length(); i++) {
            if (SENTENCE_BOUNDARIES.indexOf(text.charAt(i)) >= 0) {
                end = i;
                break;
            }
        }
        String context = text.substring(0, Math.min(end, CONTEXT_LIMIT)).strip();
        return context;
    }
}
