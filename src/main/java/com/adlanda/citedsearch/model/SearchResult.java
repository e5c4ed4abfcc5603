package com.adlanda.citedsearch.model;

/**
 * A single search hit, annotated with the page it came from.
 *
 * @param text    The matched chunk text
 * @param source  Source document filename
 * @param page    1-based page number
 * @param score   Index relevance score, higher is more relevant
 */
public record SearchResult(
        String text,
        String source,
        int page,
        double score
) {
    /**
     * Coerces a stored page number to a 1-based integer.
     *
     * Partitioners frequently store pages as floats ({@code 3.0}) or strings. Values are
     * converted to double and truncated. Missing, unparsable or non-positive values map to page 1.
     */
    public static int coercePage(Object raw) {
        if (raw == null) {
            return 1;
        }
        double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else {
            try {
                value = Double.parseDouble(raw.toString().trim());
            } catch (NumberFormatException e) {
                return 1;
            }
        }
        if (Double.isNaN(value) || value < 1) {
            return 1;
        }
        return value >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) value;
    }
}
