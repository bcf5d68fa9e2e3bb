package com.pipekit.core.component.impl.nlp;

import com.pipekit.core.model.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Language-aware text normalization shared by components through the {@code nlp}
 * context key.
 *
 * <p>Normalization only changes letter case and keeps every character offset intact, so
 * spans found in normalized text are valid spans of the original text.
 */
public final class TextNormalizer {

    private final String language;
    private final Locale locale;

    public TextNormalizer(String language) {
        this.language = language;
        this.locale = Locale.forLanguageTag(language);
    }

    public String language() {
        return language;
    }

    /**
     * Lowercases a text without changing its length.
     *
     * @param text input text
     * @return lowercased text of the same length
     */
    public String normalize(String text) {
        String lowered = text.toLowerCase(locale);
        if (lowered.length() == text.length()) {
            return lowered;
        }
        // Some locales expand characters when lowercasing; fall back to per-char mapping
        StringBuilder builder = new StringBuilder(text.length());
        text.chars().forEach(c -> builder.append(Character.toLowerCase((char) c)));
        return builder.toString();
    }

    /**
     * Splits a text on whitespace, keeping offsets.
     *
     * @param text input text
     * @return tokens in order
     */
    public List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int start = -1;
        for (int i = 0; i <= text.length(); i++) {
            boolean boundary = i == text.length() || Character.isWhitespace(text.charAt(i));
            if (boundary && start >= 0) {
                tokens.add(new Token(text.substring(start, i), start, i));
                start = -1;
            } else if (!boundary && start < 0) {
                start = i;
            }
        }
        return tokens;
    }

    /**
     * Normalizes a token for keyword lookups: lowercased, surrounding punctuation removed.
     *
     * @param token token text
     * @return lookup key, possibly empty
     */
    public String keyOf(String token) {
        String normalized = normalize(token);
        int begin = 0;
        int end = normalized.length();
        while (begin < end && !Character.isLetterOrDigit(normalized.charAt(begin))) {
            begin++;
        }
        while (end > begin && !Character.isLetterOrDigit(normalized.charAt(end - 1))) {
            end--;
        }
        return normalized.substring(begin, end);
    }
}
