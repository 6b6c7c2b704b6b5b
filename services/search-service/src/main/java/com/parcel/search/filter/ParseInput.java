package com.parcel.search.filter;

import java.util.Locale;

/**
 * The query text as the extractors see it: the untouched original and a trimmed, lowercased copy.
 */
public final class ParseInput {
    private final String original;
    private final String lowered;

    private ParseInput(String original) {
        this.original = original;
        this.lowered = original.toLowerCase(Locale.ROOT).trim();
    }

    public static ParseInput of(String text) {
        return new ParseInput(text == null ? "" : text);
    }

    public String original() {
        return original;
    }

    public String lowered() {
        return lowered;
    }

    public boolean containsAny(Iterable<String> words) {
        for (String word : words) {
            if (lowered.contains(word)) {
                return true;
            }
        }
        return false;
    }
}
