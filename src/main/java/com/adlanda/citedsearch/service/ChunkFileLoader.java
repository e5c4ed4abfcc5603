package com.adlanda.citedsearch.service;

import com.adlanda.citedsearch.model.Chunk;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads chunk files written by the document partitioner.
 *
 * Each {@code *.json} file holds an array of elements:
 * {@code {"element_id": "...", "text": "...", "type": "NarrativeText", "metadata": {"filename": ..., "page_number": ...}}}.
 * The element type may also sit inside {@code metadata}; {@code id} is accepted in place of
 * {@code element_id}.
 */
@Service
public class ChunkFileLoader {

    private static final Logger log = LoggerFactory.getLogger(ChunkFileLoader.class);

    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ChunkFileLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads every chunk file in the directory (non-recursive, in file name order).
     * Files that cannot be parsed are logged and skipped.
     */
    public List<Chunk> loadDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            log.warn("Chunks directory does not exist: {}", directory);
            return List.of();
        }

        List<Path> files;
        try (Stream<Path> paths = Files.list(directory)) {
            files = paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list chunks directory " + directory, e);
        }

        List<Chunk> allChunks = new ArrayList<>();
        for (Path file : files) {
            try {
                List<Chunk> chunks = loadFile(file);
                allChunks.addAll(chunks);
                log.info("Read {} chunks from {}", chunks.size(), file.getFileName());
            } catch (IOException e) {
                log.warn("Skipping unreadable chunk file {}: {}", file.getFileName(), e.getMessage());
            }
        }

        log.info("Total chunks loaded: {}", allChunks.size());
        return allChunks;
    }

    /**
     * Parses a single chunk file. Elements without an id are skipped.
     *
     * @throws IOException if the file is not a JSON array
     */
    public List<Chunk> loadFile(Path file) throws IOException {
        JsonNode root = objectMapper.readTree(file.toFile());
        if (root == null || !root.isArray()) {
            throw new IOException("Expected a JSON array of elements");
        }

        List<Chunk> chunks = new ArrayList<>();
        for (JsonNode element : root) {
            String id = textOrNull(element, "element_id");
            if (id == null) {
                id = textOrNull(element, "id");
            }
            if (id == null) {
                log.debug("Ignoring element without id in {}", file.getFileName());
                continue;
            }

            Map<String, Object> metadata = element.path("metadata").isObject()
                    ? objectMapper.convertValue(element.get("metadata"), METADATA_TYPE)
                    : new LinkedHashMap<>();
            String type = textOrNull(element, "type");
            if (type != null) {
                metadata.putIfAbsent(Chunk.TYPE, type);
            }

            chunks.add(new Chunk(id, element.path("text").asText(""), metadata));
        }
        return chunks;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }
}
