package com.ai.codesearch.service.vector;

import com.ai.codesearch.exception.ConfigurationException;
import com.ai.codesearch.exception.UpstreamService;
import com.ai.codesearch.exception.UpstreamUnavailableException;
import com.ai.codesearch.model.IndexEntry;
import com.ai.codesearch.model.MetadataFilter;
import com.ai.codesearch.model.VectorMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * PostgreSQL + pgvector index. One row per entry, keyed by the vector id.
 */
public class PgVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(PgVectorIndex.class);
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final JdbcTemplate jdbcTemplate;
    private final String table;
    private final int dimension;

    public PgVectorIndex(JdbcTemplate jdbcTemplate, String table, int dimension) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new ConfigurationException("Invalid pgvector table name: " + table);
        }
        if (dimension <= 0) {
            throw new ConfigurationException("Embedding dimension must be positive, got " + dimension);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.table = table;
        this.dimension = dimension;
    }

    public void initializeSchema() {
        jdbcTemplate.execute("CREATE EXTENSION IF NOT EXISTS vector");
        jdbcTemplate.execute(String.format("""
                CREATE TABLE IF NOT EXISTS %s (
                    id TEXT PRIMARY KEY,
                    repo_name TEXT NOT NULL,
                    version TEXT NOT NULL,
                    source_file TEXT,
                    original_file TEXT,
                    chunk_id TEXT,
                    content TEXT,
                    model TEXT,
                    embedding vector(%d) NOT NULL
                )
                """, table, dimension));
        jdbcTemplate.execute(String.format(
                "CREATE INDEX IF NOT EXISTS %s_partition_idx ON %s (repo_name, version)", table, table));
        log.info("[PgVectorIndex] Schema ready: table={}, dimension={}", table, dimension);
    }

    @Override
    public void upsert(List<IndexEntry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        String sql = String.format("""
                INSERT INTO %s (id, repo_name, version, source_file, original_file, chunk_id, content, model, embedding)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, cast(? as vector))
                ON CONFLICT (id) DO UPDATE SET
                    source_file = EXCLUDED.source_file,
                    original_file = EXCLUDED.original_file,
                    chunk_id = EXCLUDED.chunk_id,
                    content = EXCLUDED.content,
                    model = EXCLUDED.model,
                    embedding = EXCLUDED.embedding
                """, table);
        try {
            jdbcTemplate.batchUpdate(sql, entries, entries.size(), (ps, entry) -> {
                Map<String, String> metadata = entry.metadata();
                ps.setString(1, entry.id());
                ps.setString(2, metadata.get(MetadataFilter.REPO_NAME));
                ps.setString(3, metadata.get(MetadataFilter.VERSION));
                ps.setString(4, metadata.get(IndexEntry.SOURCE_FILE));
                ps.setString(5, metadata.get(IndexEntry.ORIGINAL_FILE));
                ps.setString(6, metadata.get(IndexEntry.CHUNK_ID));
                ps.setString(7, metadata.get(IndexEntry.TEXT));
                ps.setString(8, metadata.get(IndexEntry.MODEL));
                ps.setString(9, toVectorString(entry.vector()));
            });
        } catch (DataAccessException e) {
            log.error("[PgVectorIndex] Upsert of {} entries failed: {}", entries.size(), e.getMessage());
            throw new UpstreamUnavailableException(UpstreamService.VECTOR_INDEX, "pgvector upsert failed", e);
        }
    }

    @Override
    public List<VectorMatch> query(float[] vector, MetadataFilter filter, int topK) {
        String sql = String.format("""
                SELECT id, repo_name, version, source_file, original_file, chunk_id, content, model,
                       1 - (embedding <=> cast(? as vector)) AS score
                FROM %s
                WHERE repo_name = ? AND version = ?
                ORDER BY embedding <=> cast(? as vector)
                LIMIT ?
                """, table);
        String embedding = toVectorString(vector);
        try {
            return jdbcTemplate.query(sql, (rs, rowNum) -> {
                Map<String, String> metadata = new LinkedHashMap<>();
                metadata.put(MetadataFilter.REPO_NAME, rs.getString("repo_name"));
                metadata.put(MetadataFilter.VERSION, rs.getString("version"));
                metadata.put(IndexEntry.SOURCE_FILE, rs.getString("source_file"));
                metadata.put(IndexEntry.ORIGINAL_FILE, rs.getString("original_file"));
                metadata.put(IndexEntry.CHUNK_ID, rs.getString("chunk_id"));
                metadata.put(IndexEntry.TEXT, rs.getString("content"));
                metadata.put(IndexEntry.MODEL, rs.getString("model"));
                return new VectorMatch(rs.getString("id"), rs.getDouble("score"), metadata);
            }, embedding, filter.repoName(), filter.version(), embedding, topK);
        } catch (DataAccessException e) {
            log.error("[PgVectorIndex] Query failed: {}", e.getMessage());
            throw new UpstreamUnavailableException(UpstreamService.VECTOR_INDEX, "pgvector query failed", e);
        }
    }

    @Override
    public long count(MetadataFilter filter) {
        try {
            Long count = jdbcTemplate.queryForObject(
                    String.format("SELECT count(*) FROM %s WHERE repo_name = ? AND version = ?", table),
                    Long.class, filter.repoName(), filter.version());
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException(UpstreamService.VECTOR_INDEX, "pgvector count failed", e);
        }
    }

    @Override
    public void deleteAll(MetadataFilter filter) {
        try {
            int deleted = jdbcTemplate.update(
                    String.format("DELETE FROM %s WHERE repo_name = ? AND version = ?", table),
                    filter.repoName(), filter.version());
            log.info("[PgVectorIndex] Deleted {} entries for {}:{}", deleted, filter.repoName(), filter.version());
        } catch (DataAccessException e) {
            throw new UpstreamUnavailableException(UpstreamService.VECTOR_INDEX, "pgvector delete failed", e);
        }
    }

    /**
     * Format: [0.1,0.2,0.3,...]
     */
    static String toVectorString(float[] embedding) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0)
                sb.append(",");
            sb.append(embedding[i]);
        }
        sb.append("]");
        return sb.toString();
    }
}
