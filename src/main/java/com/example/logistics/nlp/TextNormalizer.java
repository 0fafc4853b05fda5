package com.example.logistics.nlp;

import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextNormalizer() {}

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) return "";
        String s = text.toLowerCase(Locale.ROOT);
        s = NON_WORD.matcher(s).replaceAll(" ");
        s = WHITESPACE.matcher(s).replaceAll(" ");
        return s.strip();
    }
}
