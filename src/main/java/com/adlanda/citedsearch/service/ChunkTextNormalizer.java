package com.adlanda.citedsearch.service;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Normalizes chunk text before indexing.
 *
 * Applies NFKC (folds ligatures, full-width forms and no-break spaces), removes control and
 * format characters (NUL, soft hyphens, zero-width joiners), collapses every run of Unicode
 * whitespace to a single space and trims. Case is preserved.
 */
public class ChunkTextNormalizer {

    private static final Pattern INVISIBLE = Pattern.compile("[\\p{Cc}\\p{Cf}&&[^\\t\\n\\r\\f\\u000B]]");
    private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");

    private static final String[][] UMLAUTS = {
            {"ä", "ae"}, {"ö", "oe"}, {"ü", "ue"},
            {"Ä", "Ae"}, {"Ö", "Oe"}, {"Ü", "Ue"},
            {"ß", "ss"}
    };

    private final boolean transliterateUmlauts;

    public ChunkTextNormalizer(boolean transliterateUmlauts) {
        this.transliterateUmlauts = transliterateUmlauts;
    }

    /**
     * @return The normalized text; empty when nothing but whitespace or invisible characters remain
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC);
        normalized = INVISIBLE.matcher(normalized).replaceAll("");
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ").strip();

        if (transliterateUmlauts) {
            for (String[] pair : UMLAUTS) {
                normalized = normalized.replace(pair[0], pair[1]);
            }
        }
        return normalized;
    }
}
