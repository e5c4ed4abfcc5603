package com.adlanda.citedsearch.service;

import com.adlanda.citedsearch.model.Chunk;
import com.adlanda.citedsearch.model.SourceDocument;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-document product metadata, used to offer file and category filters.
 *
 * Rebuilt from the loaded chunks on every ingestion run. For each field the first chunk of a
 * document that carries a value wins.
 */
@Service
public class DocumentCatalog {

    private final AtomicReference<Map<String, SourceDocument>> documents = new AtomicReference<>(Map.of());

    public void rebuild(List<Chunk> chunks) {
        Map<String, SourceDocument> byFilename = new LinkedHashMap<>();
        for (Chunk chunk : chunks) {
            String filename = chunk.filename();
            if (filename == null) {
                continue;
            }
            SourceDocument current = byFilename.get(filename);
            if (current == null) {
                byFilename.put(filename, new SourceDocument(filename, chunk.productCategory(),
                        chunk.productId(), chunk.productName(), 1));
            } else {
                byFilename.put(filename, new SourceDocument(
                        filename,
                        current.productCategory() != null ? current.productCategory() : chunk.productCategory(),
                        current.productId() != null ? current.productId() : chunk.productId(),
                        current.productName() != null ? current.productName() : chunk.productName(),
                        current.chunkCount() + 1));
            }
        }
        documents.set(Map.copyOf(byFilename));
    }

    /**
     * @return Known documents sorted by file name
     */
    public List<SourceDocument> documents() {
        return documents.get().values().stream()
                .sorted(Comparator.comparing(SourceDocument::filename))
                .toList();
    }

    /**
     * @return Distinct product categories, sorted
     */
    public List<String> categories() {
        return documents.get().values().stream()
                .map(SourceDocument::productCategory)
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList();
    }
}
