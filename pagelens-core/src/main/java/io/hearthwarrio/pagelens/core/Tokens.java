package io.hearthwarrio.pagelens.core;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the field parser and the resolution strategies.
 */
public final class Tokens {

    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Words that never carry field meaning.
     */
    public static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "of", "and", "or", "for", "to", "in", "on", "at", "with", "from",
            "this", "that", "is", "are", "what", "get", "find", "show", "me", "my", "its", "it"
    );

    private Tokens() {
    }

    /**
     * Lower-cases and splits on anything that is not a letter or digit. Single-character tokens and stop words are
     * dropped, duplicates removed, first occurrence order kept.
     */
    public static List<String> tokenize(String s) {
        if (s == null || s.isBlank()) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String part : NON_ALNUM.split(lower(s))) {
            if (part.length() > 1 && !STOP_WORDS.contains(part)) {
                out.add(part);
            }
        }
        return new ArrayList<>(out);
    }

    /**
     * Like {@link #tokenize(String)} but keeps stop words and repetitions.
     */
    public static List<String> words(String s) {
        if (s == null || s.isBlank()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String part : NON_ALNUM.split(lower(s))) {
            if (!part.isEmpty()) {
                out.add(part);
            }
        }
        return out;
    }

    /**
     * Collapses whitespace runs to one space and trims.
     */
    public static String normalizeWhitespace(String s) {
        if (s == null) {
            return "";
        }
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    public static String truncate(String s, int maxChars) {
        if (s == null) {
            return "";
        }
        return s.length() <= maxChars ? s : s.substring(0, Math.max(0, maxChars));
    }

    /**
     * Word matches token exactly or as a simple plural ({@code prices}, {@code boxes}).
     */
    public static boolean matchesToken(String word, String token) {
        if (word.equals(token)) {
            return true;
        }
        return word.startsWith(token)
                && (word.length() == token.length() + 1 && word.endsWith("s")
                || word.length() == token.length() + 2 && word.endsWith("es"));
    }

    public static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
