package eu.virtualparadox.ragservice.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.ragservice.application.config.ApplicationConfig;
import eu.virtualparadox.ragservice.source.model.EmbeddingRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * {@link VectorRecordSource} over the producer's embedding table, read with plain SQL.
 * <p>
 * The table is owned by the producer, so nothing here creates or migrates it. Until the producer
 * has created it, every call fails with {@link SourceUnavailableException}, which the poll loop
 * treats as "not yet".
 *
 * <h3>Expected columns</h3>
 * <ul>
 *   <li>{@code error_id} – record id</li>
 *   <li>{@code embedding} – pgvector, SQL array or bracketed text</li>
 *   <li>{@code error_title} – title</li>
 *   <li>{@code error_metadata} – JSON document (json/jsonb/text), nullable</li>
 *   <li>{@code model_name}, {@code embedding_dim}</li>
 *   <li>optionally the configured recency column (timestamp)</li>
 * </ul>
 *
 * <p><b>Duplicate ids:</b> when a recency column is configured the row with the latest timestamp wins
 * (rows without a timestamp lose against rows with one); otherwise the row read last wins.</p>
 */
@Service
@Slf4j
public class JdbcVectorRecordSource implements VectorRecordSource {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private static final String COLUMNS = "error_id, embedding, error_title, error_metadata, model_name, embedding_dim";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final VectorParser vectorParser;

    private final String table;
    private final String recencyColumn;

    public JdbcVectorRecordSource(final JdbcTemplate jdbcTemplate,
                                  final ObjectMapper objectMapper,
                                  final VectorParser vectorParser,
                                  final ApplicationConfig config) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.vectorParser = vectorParser;

        this.table = requireIdentifier(config.getSource().getTable(), "rag.source.table");
        final String recency = config.getSource().getRecencyColumn();
        this.recencyColumn = StringUtils.isBlank(recency)
                ? null
                : requireIdentifier(recency.trim(), "rag.source.recency-column");
    }

    @Override
    public long countAvailable() {
        try {
            final Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
            return count == null ? 0L : count;
        } catch (DataAccessException e) {
            throw new SourceUnavailableException("Cannot count rows in " + table, e);
        }
    }

    @Override
    public List<EmbeddingRecord> fetchAll() {
        final Map<String, EmbeddingRecord> latestById = new LinkedHashMap<>();
        final int[] counters = new int[3]; // rows, skipped, duplicates

        try {
            jdbcTemplate.query(selectSql(), rs -> {
                counters[0]++;
                final EmbeddingRecord rec;
                try {
                    rec = mapRow(rs);
                } catch (MalformedVectorException e) {
                    counters[1]++;
                    log.warn("Skipping embedding row: {}", e.getMessage());
                    return;
                }

                final EmbeddingRecord previous = latestById.get(rec.id());
                if (previous != null) {
                    counters[2]++;
                    if (!isNewer(rec, previous)) {
                        return;
                    }
                }
                latestById.put(rec.id(), rec);
            });
        } catch (DataAccessException e) {
            throw new SourceUnavailableException("Cannot read rows from " + table, e);
        }

        log.info("Fetched {} embeddings from {} ({} rows, {} skipped, {} duplicate rows collapsed)",
                latestById.size(), table, counters[0], counters[1], counters[2]);

        return List.copyOf(latestById.values());
    }

    private String selectSql() {
        if (recencyColumn == null) {
            return "SELECT " + COLUMNS + " FROM " + table + " ORDER BY error_id";
        }
        return "SELECT " + COLUMNS + ", " + recencyColumn + " AS written_at FROM " + table
                + " ORDER BY error_id, " + recencyColumn;
    }

    private EmbeddingRecord mapRow(final ResultSet rs) throws SQLException {
        final String id = rs.getString("error_id");
        final int dimension = rs.getInt("embedding_dim");
        final float[] vector = vectorParser.parse(id, rs.getObject("embedding"), dimension);

        final String title = rs.getString("error_title");
        final Instant writtenAt;
        if (recencyColumn != null) {
            final Timestamp ts = rs.getTimestamp("written_at");
            writtenAt = ts == null ? null : ts.toInstant();
        } else {
            writtenAt = null;
        }

        return new EmbeddingRecord(
                id,
                vector,
                title == null ? id : title,
                readMetadata(id, rs.getObject("error_metadata")),
                rs.getString("model_name"),
                dimension,
                writtenAt);
    }

    private JsonNode readMetadata(final String id, final Object raw) {
        if (raw == null) {
            return objectMapper.createObjectNode();
        }
        try {
            final JsonNode node = raw instanceof byte[] bytes
                    ? objectMapper.readTree(new String(bytes, StandardCharsets.UTF_8))
                    : objectMapper.readTree(raw.toString());
            return node != null && node.isObject() ? node : objectMapper.createObjectNode();
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable metadata for {}: {}", id, e.getOriginalMessage());
            return objectMapper.createObjectNode();
        }
    }

    private boolean isNewer(final EmbeddingRecord candidate, final EmbeddingRecord current) {
        if (recencyColumn == null) {
            return true;
        }
        if (candidate.writtenAt() == null) {
            return current.writtenAt() == null;
        }
        return current.writtenAt() == null || !candidate.writtenAt().isBefore(current.writtenAt());
    }

    private static String requireIdentifier(final String value, final String property) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException(property + " is not a valid SQL identifier: " + value);
        }
        return value;
    }
}
