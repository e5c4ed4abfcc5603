package com.adlanda.citedsearch.repository;

import com.adlanda.citedsearch.config.RetrievalProperties;
import com.adlanda.citedsearch.exception.IndexQueryException;
import com.adlanda.citedsearch.exception.IndexUpsertException;
import com.adlanda.citedsearch.model.VectorRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * PostgreSQL-based vector index using the PGVector extension.
 *
 * Records are written with precomputed embeddings through plain JDBC. The lexical half of a
 * hybrid query is scored by PostgreSQL full-text search ({@code ts_rank_cd}) over the stored
 * content, so client-built sparse vectors are not persisted.
 */
@Repository
@ConditionalOnProperty(name = "citedsearch.retrieval.index-type", havingValue = "pgvector")
public class PgVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(PgVectorIndex.class);

    static final String TABLE = "search_vectors";

    static final String UPSERT_SQL = "INSERT INTO " + TABLE + " (id, content, metadata, embedding) "
            + "VALUES (?, ?, ?::jsonb, ?::vector) "
            + "ON CONFLICT (id) DO UPDATE SET content = EXCLUDED.content, "
            + "metadata = EXCLUDED.metadata, embedding = EXCLUDED.embedding";

    static final String COUNT_SQL = "SELECT count(*) FROM " + TABLE;

    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RetrievalProperties retrievalProperties;

    public PgVectorIndex(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, RetrievalProperties retrievalProperties) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.retrievalProperties = retrievalProperties;
    }

    /**
     * Creates the extension, table and full-text index when missing.
     */
    @PostConstruct
    void initializeSchema() {
        if (!retrievalProperties.isInitializeSchema()) {
            return;
        }
        jdbcTemplate.execute("CREATE EXTENSION IF NOT EXISTS vector");
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + TABLE + " ("
                + "id text PRIMARY KEY, "
                + "content text NOT NULL, "
                + "metadata jsonb NOT NULL, "
                + "embedding vector(" + retrievalProperties.getDimensions() + ") NOT NULL, "
                + "seq bigserial)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS " + TABLE + "_content_fts ON " + TABLE
                + " USING gin (to_tsvector('simple', content))");
        log.info("Initialized {} schema with {} dimensions", TABLE, retrievalProperties.getDimensions());
    }

    @Override
    public Set<String> existingIds(Collection<String> ids) {
        if (ids.isEmpty()) {
            return Set.of();
        }
        String placeholders = String.join(", ", Collections.nCopies(ids.size(), "?"));
        try {
            List<String> found = jdbcTemplate.query(
                    "SELECT id FROM " + TABLE + " WHERE id IN (" + placeholders + ")",
                    new ArgumentPreparedStatementSetter(ids.toArray()),
                    (rs, rowNum) -> rs.getString(1));
            return new HashSet<>(found);
        } catch (DataAccessException e) {
            throw new IndexQueryException("Existence check failed for " + ids.size() + " ids", e);
        }
    }

    @Override
    public void upsert(List<VectorRecord> records) {
        if (records.isEmpty()) {
            return;
        }
        for (VectorRecord record : records) {
            if (!record.hasDense()) {
                throw new IllegalArgumentException("Cannot store record " + record.id() + " without dense vector");
            }
        }
        try {
            jdbcTemplate.batchUpdate(UPSERT_SQL, records, records.size(), (ps, record) -> {
                ps.setString(1, record.id());
                ps.setString(2, record.text());
                ps.setString(3, toJson(record.metadata()));
                ps.setString(4, toVectorLiteral(record.dense()));
            });
        } catch (DataAccessException e) {
            throw new IndexUpsertException("Upsert of " + records.size() + " records failed", e);
        }
        log.debug("Upserted {} records into {}", records.size(), TABLE);
    }

    @Override
    public List<IndexMatch> query(IndexQuery query) {
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT id, content, metadata::text AS metadata, (")
                .append("? * (1 - (embedding <=> ?::vector))");
        args.add(query.alpha());
        args.add(toVectorLiteral(query.dense()));

        boolean lexical = query.text() != null && !query.text().isBlank();
        if (lexical) {
            sql.append(" + ? * ts_rank_cd(to_tsvector('simple', content), plainto_tsquery('simple', ?))");
            args.add(1 - query.alpha());
            args.add(query.text());
        }
        sql.append(") AS score FROM ").append(TABLE);

        List<String> conditions = new ArrayList<>();
        for (Map.Entry<String, String> equality : query.filter().equalities().entrySet()) {
            conditions.add("metadata ->> ? = ?");
            args.add(equality.getKey());
            args.add(equality.getValue());
        }
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        sql.append(" ORDER BY score DESC, seq ASC LIMIT ?");
        args.add(query.topK());

        try {
            return jdbcTemplate.query(sql.toString(), new ArgumentPreparedStatementSetter(args.toArray()),
                    (rs, rowNum) -> mapMatch(rs));
        } catch (DataAccessException e) {
            throw new IndexQueryException("Similarity query failed", e);
        }
    }

    @Override
    public LexicalSupport lexicalSupport() {
        return LexicalSupport.INDEX_SIDE;
    }

    @Override
    public long size() {
        try {
            Long count = jdbcTemplate.queryForObject(COUNT_SQL, Long.class);
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            throw new IndexQueryException("Count query failed", e);
        }
    }

    IndexMatch mapMatch(ResultSet rs) throws SQLException {
        Map<String, Object> metadata = fromJson(rs.getString("metadata"));
        metadata.putIfAbsent(VectorRecord.TEXT, rs.getString("content"));
        return new IndexMatch(rs.getString("id"), rs.getDouble("score"), metadata);
    }

    static String toVectorLiteral(List<Double> vector) {
        return vector.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(",", "[", "]"));
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IndexUpsertException("Metadata is not serializable", e);
        }
    }

    private Map<String, Object> fromJson(String json) throws SQLException {
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new SQLException("Stored metadata is not valid JSON", e);
        }
    }
}
