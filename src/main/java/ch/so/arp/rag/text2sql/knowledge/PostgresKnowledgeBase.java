package ch.so.arp.rag.text2sql.knowledge;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.support.TransactionOperations;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * PostgreSQL backed {@link KnowledgeBase} that stores chunks in a pgvector
 * table and ranks them by cosine distance.
 */
public class PostgresKnowledgeBase implements KnowledgeBase {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresKnowledgeBase.class);

    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {
    };

    private static final String CREATE_EXTENSION_SQL = "CREATE EXTENSION IF NOT EXISTS vector";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS text2sql_chunks (
              id text PRIMARY KEY,
              table_name text,
              content text NOT NULL,
              metadata jsonb NOT NULL DEFAULT '{}'::jsonb,
              embedding vector NOT NULL,
              updated_at timestamptz NOT NULL DEFAULT now()
            )
            """;

    private static final String UPSERT_SQL = """
            INSERT INTO text2sql_chunks (id, table_name, content, metadata, embedding)
            VALUES (:id, :tableName, :content, :metadata::jsonb, :embedding::vector)
            ON CONFLICT (id) DO UPDATE SET
              table_name = EXCLUDED.table_name,
              content = EXCLUDED.content,
              metadata = EXCLUDED.metadata,
              embedding = EXCLUDED.embedding,
              updated_at = now()
            """;

    private static final String SEARCH_SQL = """
            SELECT
              id,
              table_name,
              content,
              metadata::text AS metadata,
              embedding::text AS embedding,
              (1.0 - (embedding <=> :embedding::vector)) AS score
            FROM text2sql_chunks
            WHERE metadata @> :filter::jsonb
            ORDER BY embedding <=> :embedding::vector, id
            LIMIT :limit
            """;

    private static final String SELECT_SQL = """
            SELECT id, table_name, content, metadata::text AS metadata, embedding::text AS embedding
            FROM text2sql_chunks
            """;

    private final JdbcClient jdbcClient;
    private final TransactionOperations transactions;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean initialized = new AtomicBoolean();

    public PostgresKnowledgeBase(JdbcClient jdbcClient, TransactionOperations transactions, ObjectMapper objectMapper) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.transactions = Objects.requireNonNull(transactions, "transactions");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public void initialize() {
        if (initialized.get()) {
            return;
        }
        synchronized (initialized) {
            if (initialized.get()) {
                return;
            }
            try {
                jdbcClient.sql(CREATE_EXTENSION_SQL).update();
                jdbcClient.sql(CREATE_TABLE_SQL).update();
            } catch (DataAccessException ex) {
                throw new KnowledgeBaseException("Could not prepare table text2sql_chunks: " + ex.getMessage(), ex);
            }
            initialized.set(true);
            LOGGER.info("Knowledge base table text2sql_chunks is ready");
        }
    }

    @Override
    public void upsert(Collection<KnowledgeChunk> chunks) {
        KnowledgeBase.requireEmbedded(chunks);
        initialize();
        run(() -> transactions.executeWithoutResult(status -> chunks.forEach(this::upsertOne)));
        LOGGER.debug("Upserted {} chunks", chunks.size());
    }

    @Override
    public int delete(String tableName) {
        initialize();
        return call(() -> jdbcClient.sql("DELETE FROM text2sql_chunks WHERE table_name = :tableName")
                .param("tableName", tableName)
                .update());
    }

    @Override
    public boolean deleteById(String id) {
        initialize();
        return call(() -> jdbcClient.sql("DELETE FROM text2sql_chunks WHERE id = :id")
                .param("id", id)
                .update()) > 0;
    }

    @Override
    public List<ScoredChunk> search(float[] queryVector, int topK, ChunkFilter filter) {
        Objects.requireNonNull(queryVector, "queryVector");
        if (topK <= 0) {
            return List.of();
        }
        initialize();
        Map<String, String> criteria = filter == null ? Map.of() : filter.equalTo();
        return call(() -> jdbcClient.sql(SEARCH_SQL)
                .param("embedding", toPgVectorLiteral(queryVector))
                .param("filter", toJson(criteria))
                .param("limit", topK)
                .query((rs, rowNum) -> new ScoredChunk(mapChunk(rs), rs.getDouble("score")))
                .list());
    }

    @Override
    public Optional<KnowledgeChunk> findById(String id) {
        initialize();
        return call(() -> jdbcClient.sql(SELECT_SQL + " WHERE id = :id")
                .param("id", id)
                .query(chunkMapper())
                .optional());
    }

    @Override
    public List<KnowledgeChunk> list() {
        initialize();
        return call(() -> jdbcClient.sql(SELECT_SQL + " ORDER BY id").query(chunkMapper()).list());
    }

    @Override
    public int count() {
        initialize();
        return call(() -> jdbcClient.sql("SELECT count(*) FROM text2sql_chunks").query(Integer.class).single());
    }

    @Override
    public Set<String> tableNames() {
        initialize();
        return call(() -> new LinkedHashSet<>(jdbcClient
                .sql("SELECT DISTINCT table_name FROM text2sql_chunks WHERE table_name IS NOT NULL ORDER BY table_name")
                .query(String.class)
                .list()));
    }

    @Override
    public void clear() {
        initialize();
        run(() -> jdbcClient.sql("DELETE FROM text2sql_chunks").update());
    }

    @Override
    public void replaceAll(Collection<KnowledgeChunk> chunks) {
        KnowledgeBase.requireEmbedded(chunks);
        initialize();
        run(() -> transactions.executeWithoutResult(status -> {
            jdbcClient.sql("DELETE FROM text2sql_chunks").update();
            chunks.forEach(this::upsertOne);
        }));
        LOGGER.info("Replaced knowledge base content with {} chunks", chunks.size());
    }

    private void upsertOne(KnowledgeChunk chunk) {
        jdbcClient.sql(UPSERT_SQL)
                .param("id", chunk.id())
                .param("tableName", chunk.tableName())
                .param("content", chunk.text())
                .param("metadata", toJson(chunk.metadata()))
                .param("embedding", toPgVectorLiteral(chunk.embedding()))
                .update();
    }

    private RowMapper<KnowledgeChunk> chunkMapper() {
        return (rs, rowNum) -> mapChunk(rs);
    }

    private KnowledgeChunk mapChunk(ResultSet rs) throws SQLException {
        return new KnowledgeChunk(
                rs.getString("id"),
                rs.getString("table_name"),
                rs.getString("content"),
                parsePgVector(rs.getString("embedding")),
                fromJson(rs.getString("metadata")));
    }

    private <T> T call(DataAccess<T> access) {
        try {
            return access.run();
        } catch (DataAccessException ex) {
            throw new KnowledgeBaseException("Knowledge base operation failed: " + ex.getMessage(), ex);
        }
    }

    private void run(Runnable access) {
        call(() -> {
            access.run();
            return null;
        });
    }

    private String toJson(Map<String, String> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException ex) {
            throw new KnowledgeBaseException("Chunk metadata could not be serialised", ex);
        }
    }

    private Map<String, String> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException ex) {
            throw new KnowledgeBaseException("Stored chunk metadata is not valid JSON", ex);
        }
    }

    static String toPgVectorLiteral(float[] embedding) {
        StringBuilder builder = new StringBuilder();
        builder.append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(Float.toString(embedding[i]));
        }
        builder.append(']');
        return builder.toString();
    }

    static float[] parsePgVector(String literal) {
        if (literal == null) {
            return null;
        }
        String body = literal.trim();
        if (body.startsWith("[")) {
            body = body.substring(1);
        }
        if (body.endsWith("]")) {
            body = body.substring(0, body.length() - 1);
        }
        if (body.isBlank()) {
            return new float[0];
        }
        String[] parts = body.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            vector[i] = Float.parseFloat(parts[i].trim());
        }
        return vector;
    }

    @FunctionalInterface
    private interface DataAccess<T> {
        T run();
    }
}
