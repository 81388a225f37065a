package com.ableclub.monitor.events.util;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public final class KeywordMatcher {
    private KeywordMatcher() {
    }

    /**
     * Returns the first keyword, in list order, that occurs case-insensitively
     * in any of the given texts. Blank keywords never match.
     */
    public static Optional<String> firstMatch(List<String> keywords, String... texts) {
        if (keywords == null || keywords.isEmpty() || texts == null) {
            return Optional.empty();
        }
        String[] lowered = new String[texts.length];
        for (int i = 0; i < texts.length; i++) {
            lowered[i] = texts[i] == null ? null : texts[i].toLowerCase(Locale.ROOT);
        }
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            String needle = keyword.trim().toLowerCase(Locale.ROOT);
            for (String haystack : lowered) {
                if (haystack != null && haystack.contains(needle)) {
                    return Optional.of(keyword);
                }
            }
        }
        return Optional.empty();
    }
}
