package com.admissionsrag.service.store;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import com.admissionsrag.dto.internal.SearchFilters;
import com.admissionsrag.exception.StoreException;
import com.admissionsrag.model.Chunk;
import com.admissionsrag.model.ChunkMetadata;
import com.admissionsrag.model.ChunkRef;
import com.admissionsrag.model.Page;
import com.admissionsrag.model.PageType;
import com.admissionsrag.model.ScoredChunk;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;

import lombok.extern.slf4j.Slf4j;

/**
 * PostgreSQL + pgvector store. Similarity uses the cosine distance operator
 * {@code <=>}, reported as {@code score = 1 - distance}.
 */
@Slf4j
public class JdbcChunkStore implements ChunkStore {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final String table;
    private final int dimension;

    public JdbcChunkStore(JdbcTemplate jdbcTemplate,
                          TransactionTemplate transactionTemplate,
                          ObjectMapper objectMapper,
                          String table,
                          int dimension) {
        if (!table.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.table = table;
        this.dimension = dimension;
    }

    @Override
    public int replacePage(Page page, List<Chunk> chunks) {
        ChunkBatchValidator.validate(page, chunks, dimension);

        String insertSql = """
                INSERT INTO %s (school_id, page_id, source_url, page_type, chunk_index,
                                chunk_text, embedding, metadata)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb)
                ON CONFLICT (page_id, chunk_index) DO UPDATE SET
                    chunk_text = EXCLUDED.chunk_text,
                    embedding = EXCLUDED.embedding,
                    metadata = EXCLUDED.metadata
                """.formatted(table);

        List<String> metadataJson = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            metadataJson.add(toJson(chunk.getMetadata()));
        }

        try {
            Integer written = transactionTemplate.execute(status -> {
                int deleted = jdbcTemplate.update("DELETE FROM " + table + " WHERE page_id = ?", page.pageId());
                if (chunks.isEmpty()) {
                    return 0;
                }
                jdbcTemplate.batchUpdate(insertSql, chunks, chunks.size(), (ps, chunk) -> {
                    ps.setString(1, chunk.getSchoolId());
                    ps.setString(2, chunk.getPageId());
                    ps.setString(3, page.getUrl());
                    ps.setString(4, chunk.getPageType().code());
                    ps.setInt(5, chunk.getChunkIndex());
                    ps.setString(6, chunk.getText());
                    ps.setObject(7, new PGvector(chunk.getEmbedding()));
                    ps.setString(8, metadataJson.get(chunk.getChunkIndex()));
                });
                log.debug("Replaced page {}: {} old rows, {} new", page.pageId(), deleted, chunks.size());
                return chunks.size();
            });
            return written != null ? written : 0;
        } catch (DataAccessException e) {
            throw new StoreException("Failed to write chunks for " + page.pageId(), e);
        }
    }

    @Override
    public int deletePage(String pageId) {
        try {
            return jdbcTemplate.update("DELETE FROM " + table + " WHERE page_id = ?", pageId);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to delete " + pageId, e);
        }
    }

    @Override
    public List<ScoredChunk> search(float[] queryEmbedding, SearchFilters filters, int limit) {
        SearchFilters f = filters != null ? filters : SearchFilters.none();
        PGvector queryVector = new PGvector(queryEmbedding);

        StringBuilder sql = new StringBuilder("""
                SELECT id, school_id, page_id, source_url, page_type, chunk_index,
                       chunk_text, metadata,
                       1 - (embedding <=> ?) AS score
                FROM %s
                """.formatted(table));

        List<Object> filterValues = new ArrayList<>();
        List<String> conditions = new ArrayList<>();
        if (f.hasSchool()) {
            conditions.add("school_id = ?");
            filterValues.add(f.schoolId());
        }
        if (f.hasPageType()) {
            conditions.add("page_type = ?");
            filterValues.add(f.pageType().code());
        }
        if (!conditions.isEmpty()) {
            sql.append("WHERE ").append(String.join(" AND ", conditions)).append('\n');
        }
        sql.append("ORDER BY embedding <=> ?\nLIMIT ?");

        try {
            return jdbcTemplate.query(sql.toString(), (PreparedStatement ps) -> {
                int i = 1;
                ps.setObject(i++, queryVector);
                for (Object value : filterValues) {
                    ps.setObject(i++, value);
                }
                ps.setObject(i++, queryVector);
                ps.setInt(i, limit);
            }, new ScoredChunkRowMapper());
        } catch (DataAccessException e) {
            throw new StoreException("Vector search failed", e);
        }
    }

    @Override
    public StoreStats stats() {
        String sql = """
                SELECT school_id, page_type, COUNT(*) AS chunks, COUNT(DISTINCT page_id) AS pages
                FROM %s
                GROUP BY school_id, page_type
                """.formatted(table);

        Map<String, Long> bySchool = new TreeMap<>();
        Map<String, Long> byPageType = new TreeMap<>();
        long[] totals = new long[2];

        try {
            jdbcTemplate.query(sql, rs -> {
                long chunks = rs.getLong("chunks");
                bySchool.merge(rs.getString("school_id"), chunks, Long::sum);
                byPageType.merge(rs.getString("page_type"), chunks, Long::sum);
                totals[0] += chunks;
                totals[1] += rs.getLong("pages");
            });
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read store statistics", e);
        }

        return StoreStats.builder()
                .backend("pgvector")
                .totalChunks(totals[0])
                .totalPages(totals[1])
                .chunksBySchool(bySchool)
                .chunksByPageType(byPageType)
                .build();
    }

    private String toJson(ChunkMetadata metadata) {
        if (metadata == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new StoreException("Unserializable chunk metadata", e);
        }
    }

    private class ScoredChunkRowMapper implements RowMapper<ScoredChunk> {
        @Override
        public ScoredChunk mapRow(ResultSet rs, int rowNum) throws SQLException {
            String sourceUrl = rs.getString("source_url");

            ChunkMetadata metadata = ChunkMetadata.forSource(sourceUrl);
            String metadataJson = rs.getString("metadata");
            if (metadataJson != null) {
                try {
                    metadata = objectMapper.readValue(metadataJson, ChunkMetadata.class);
                    if (metadata.getSourceUrl() == null) {
                        metadata.setSourceUrl(sourceUrl);
                    }
                } catch (JsonProcessingException e) {
                    // unreadable metadata must not drop the hit
                    log.warn("Unreadable metadata on chunk {}: {}", rs.getLong("id"), e.getMessage());
                }
            }

            ChunkRef chunk = ChunkRef.builder()
                    .id(String.valueOf(rs.getLong("id")))
                    .schoolId(rs.getString("school_id"))
                    .pageId(rs.getString("page_id"))
                    .chunkIndex(rs.getInt("chunk_index"))
                    .pageType(PageType.fromCode(rs.getString("page_type")))
                    .text(rs.getString("chunk_text"))
                    .metadata(metadata)
                    .build();

            return new ScoredChunk(chunk, rs.getDouble("score"));
        }
    }
}
