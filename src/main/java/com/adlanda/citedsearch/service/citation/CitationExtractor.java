package com.adlanda.citedsearch.service.citation;

import com.adlanda.citedsearch.model.Citation;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts inline page citations from generated text.
 *
 * Recognized markers are {@code [<filename>, Page <N>]} and {@code [<filename>, Seite <N>]}.
 * The keyword is case-sensitive and {@code N} must be a positive integer literal; any other
 * bracketed text is ignored.
 */
@Component
public class CitationExtractor {

    private static final Pattern CITATION = Pattern.compile("\\[([^\\[\\]]+?),\\s*(?:Page|Seite)\\s+([1-9]\\d{0,8})\\]");

    /**
     * @param text Generated text, complete or partial; may be null
     * @return Distinct (filename, page) pairs in order of first appearance
     */
    public List<Citation> extract(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        Set<Citation> citations = new LinkedHashSet<>();
        Matcher matcher = CITATION.matcher(text);
        while (matcher.find()) {
            String filename = matcher.group(1).trim();
            if (!filename.isEmpty()) {
                citations.add(new Citation(filename, Integer.parseInt(matcher.group(2))));
            }
        }
        return List.copyOf(citations);
    }
}
