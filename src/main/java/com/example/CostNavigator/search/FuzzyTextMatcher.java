package com.example.CostNavigator.search;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Approximate match of a short procedure phrase against a DRG definition.
 * Every significant query token has to be found among the definition's tokens,
 * either exactly, as a prefix (query tokens of 4+ characters), or within a small
 * edit distance: 1 edit for 4-7 characters, 2 edits for 8 or more.
 */
@Component
public class FuzzyTextMatcher {

    private static final Set<String> IGNORED = Set.of("and", "or", "with", "without", "w", "o", "of", "the", "a", "an");

    public boolean matches(String query, String definition) {
        if (query == null || definition == null) {
            return false;
        }
        List<String> queryTokens = tokens(query).stream()
                .filter(token -> !IGNORED.contains(token))
                .toList();
        if (queryTokens.isEmpty()) {
            return false;
        }
        List<String> definitionTokens = tokens(definition);
        return queryTokens.stream()
                .allMatch(q -> definitionTokens.stream().anyMatch(d -> tokenMatches(q, d)));
    }

    static boolean tokenMatches(String query, String candidate) {
        if (query.equals(candidate)) {
            return true;
        }
        if (query.length() >= 4 && candidate.startsWith(query)) {
            return true;
        }
        int allowed = allowedEdits(query.length());
        return allowed > 0 && withinDistance(query, candidate, allowed);
    }

    static int allowedEdits(int length) {
        if (length >= 8) {
            return 2;
        }
        return length >= 4 ? 1 : 0;
    }

    /**
     * Levenshtein distance check that gives up as soon as a whole row exceeds {@code max}.
     */
    static boolean withinDistance(String a, String b, int max) {
        if (Math.abs(a.length() - b.length()) > max) {
            return false;
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            int rowMin = current[0];
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
                rowMin = Math.min(rowMin, current[j]);
            }
            if (rowMin > max) {
                return false;
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()] <= max;
    }

    private static List<String> tokens(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(token -> !token.isEmpty())
                .toList();
    }
}
