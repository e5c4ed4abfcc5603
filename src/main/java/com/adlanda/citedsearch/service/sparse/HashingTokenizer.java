package com.adlanda.citedsearch.service.sparse;

import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Vocabulary-free tokenizer that hashes word pieces into a fixed id space.
 *
 * Text is NFKC-normalized and lower-cased, split into runs of letters and digits, and
 * words longer than {@code maxPieceLength} code points are cut into pieces (continuation
 * pieces carry a {@code ##} prefix, as in WordPiece). Each piece maps to
 * {@code RESERVED_IDS + fnv1a(piece) mod (vocabularySize - RESERVED_IDS)}, so ids 0-2
 * are never produced and stay free for special tokens.
 */
public class HashingTokenizer implements Tokenizer {

    public static final int RESERVED_IDS = 3;

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");
    private static final String CONTINUATION_PREFIX = "##";

    private static final int FNV_OFFSET_BASIS = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    private final int vocabularySize;
    private final int maxPieceLength;

    public HashingTokenizer(int vocabularySize, int maxPieceLength) {
        if (vocabularySize <= RESERVED_IDS) {
            throw new IllegalArgumentException("vocabularySize must be > " + RESERVED_IDS);
        }
        if (maxPieceLength < 1) {
            throw new IllegalArgumentException("maxPieceLength must be >= 1");
        }
        this.vocabularySize = vocabularySize;
        this.maxPieceLength = maxPieceLength;
    }

    @Override
    public List<Integer> encode(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        Matcher matcher = WORD.matcher(normalized);

        List<Integer> ids = new ArrayList<>();
        while (matcher.find()) {
            for (String piece : pieces(matcher.group())) {
                ids.add(idFor(piece));
            }
        }
        return ids;
    }

    /**
     * Id of a single piece. Exposed for tests and diagnostics.
     */
    public int idFor(String piece) {
        return RESERVED_IDS + Math.floorMod(fnv1a(piece), vocabularySize - RESERVED_IDS);
    }

    List<String> pieces(String word) {
        int length = word.codePointCount(0, word.length());
        if (length <= maxPieceLength) {
            return List.of(word);
        }

        List<String> pieces = new ArrayList<>();
        int start = 0;
        while (start < word.length()) {
            int remaining = word.codePointCount(start, word.length());
            int end = word.offsetByCodePoints(start, Math.min(maxPieceLength, remaining));
            String piece = word.substring(start, end);
            pieces.add(start == 0 ? piece : CONTINUATION_PREFIX + piece);
            start = end;
        }
        return pieces;
    }

    private static int fnv1a(String piece) {
        int hash = FNV_OFFSET_BASIS;
        for (byte b : piece.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }
}
