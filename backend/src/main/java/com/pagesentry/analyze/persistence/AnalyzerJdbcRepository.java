package com.pagesentry.analyze.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagesentry.analyze.model.DomainStat;
import com.pagesentry.analyze.model.ResultRecord;
import com.pagesentry.analyze.model.UpiHandleSighting;
import com.pagesentry.analyze.model.ValidatedHit;
import com.pagesentry.analyze.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Repository
public class AnalyzerJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(AnalyzerJdbcRepository.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final boolean postgres;

    public AnalyzerJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.postgres = detectPostgres(jdbc);
    }

    /**
     * Inserts {@code hits}, skipping any whose (task, main_url, sub_url, keyword) row already exists.
     * Returns the number of rows actually written.
     */
    public int insertHits(List<ValidatedHit> hits) {
        if (hits == null || hits.isEmpty()) {
            return 0;
        }
        if (postgres) {
            MapSqlParameterSource[] batch = hits.stream()
                .map(this::hitParams)
                .toArray(MapSqlParameterSource[]::new);
            int[] counts = jdbc.batchUpdate(
                """
                    INSERT INTO hits (
                        task_id, main_url, sub_url, category, matched_keyword, snippet,
                        source, confidence, screenshot_path, detected_at, hit_key
                    )
                    VALUES (
                        :taskId, :mainUrl, :subUrl, :category, :keyword, :snippet,
                        :source, :confidence, :screenshotPath, :detectedAt, :hitKey
                    )
                    ON CONFLICT (hit_key) DO NOTHING
                    """,
                batch
            );
            int inserted = 0;
            for (int count : counts) {
                if (count > 0 || count == Statement.SUCCESS_NO_INFO) {
                    inserted++;
                }
            }
            return inserted;
        }

        int inserted = 0;
        for (ValidatedHit hit : hits) {
            MapSqlParameterSource params = hitParams(hit);
            Long existing = jdbc.queryForObject(
                "SELECT COUNT(*) FROM hits WHERE hit_key = :hitKey",
                params,
                Long.class
            );
            if (existing != null && existing > 0) {
                continue;
            }
            inserted += jdbc.update(
                """
                    INSERT INTO hits (
                        task_id, main_url, sub_url, category, matched_keyword, snippet,
                        source, confidence, screenshot_path, detected_at, hit_key
                    )
                    VALUES (
                        :taskId, :mainUrl, :subUrl, :category, :keyword, :snippet,
                        :source, :confidence, :screenshotPath, :detectedAt, :hitKey
                    )
                    """,
                params
            );
        }
        return inserted;
    }

    static String hitKey(ValidatedHit hit) {
        return HashUtils.sha256Hex(
            hit.taskId() + "\u0000" + hit.mainUrl() + "\u0000" + hit.subUrl() + "\u0000" + hit.keyword()
        );
    }

    private MapSqlParameterSource hitParams(ValidatedHit hit) {
        return new MapSqlParameterSource()
            .addValue("taskId", hit.taskId())
            .addValue("mainUrl", hit.mainUrl())
            .addValue("subUrl", hit.subUrl())
            .addValue("category", hit.category())
            .addValue("keyword", hit.keyword())
            .addValue("snippet", hit.snippet())
            .addValue("source", hit.source())
            .addValue("confidence", hit.confidence())
            .addValue("screenshotPath", hit.screenshotPath())
            .addValue("detectedAt", toTimestamp(hit.timestamp() == null ? Instant.now() : hit.timestamp()))
            .addValue("hitKey", hitKey(hit));
    }

    /**
     * Most recently inserted hit for (task, page, keyword) that has no screenshot yet.
     */
    public Long findLatestUnattachedHitId(String taskId, String subUrl, String keyword) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("taskId", taskId)
            .addValue("subUrl", subUrl)
            .addValue("keyword", keyword);
        List<Long> ids = jdbc.query(
            """
                SELECT id
                FROM hits
                WHERE task_id = :taskId
                  AND sub_url = :subUrl
                  AND matched_keyword = :keyword
                  AND (screenshot_path IS NULL OR screenshot_path = '')
                ORDER BY id DESC
                LIMIT 1
                """,
            params,
            (rs, rowNum) -> rs.getLong("id")
        );
        return ids.isEmpty() ? null : ids.get(0);
    }

    public boolean attachScreenshot(long hitId, String screenshotPath) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", hitId)
            .addValue("path", screenshotPath);
        return jdbc.update(
            """
                UPDATE hits
                SET screenshot_path = :path
                WHERE id = :id
                  AND (screenshot_path IS NULL OR screenshot_path = '')
                """,
            params
        ) > 0;
    }

    public List<ValidatedHit> findHitsByMainUrl(String mainUrl) {
        return jdbc.query(
            """
                SELECT task_id, main_url, sub_url, category, matched_keyword, snippet,
                       source, confidence, screenshot_path, detected_at
                FROM hits
                WHERE main_url = :mainUrl
                ORDER BY id
                """,
            new MapSqlParameterSource("mainUrl", mainUrl),
            (rs, rowNum) -> new ValidatedHit(
                rs.getString("task_id"),
                rs.getString("main_url"),
                rs.getString("sub_url"),
                rs.getString("category"),
                rs.getString("matched_keyword"),
                rs.getString("snippet"),
                rs.getString("source"),
                rs.getDouble("confidence"),
                rs.getString("screenshot_path"),
                toInstant(rs.getTimestamp("detected_at"))
            )
        );
    }

    public void upsertResult(ResultRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("mainUrl", record.mainUrl())
            .addValue("taskId", record.taskId())
            .addValue("subUrls", toJson(record.subUrls()))
            .addValue("keywords", toJson(record.keywords()))
            .addValue("categories", toJson(record.categories()))
            .addValue("snippets", record.snippets())
            .addValue("totalPages", record.totalPages())
            .addValue("totalMatches", record.totalMatches())
            .addValue("updatedAt", toTimestamp(record.timestamp() == null ? Instant.now() : record.timestamp()));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO results (
                        main_url, task_id, sub_urls, keyword_match, categories, snippets,
                        total_pages, total_matches, updated_at
                    )
                    VALUES (
                        :mainUrl, :taskId, :subUrls, :keywords, :categories, :snippets,
                        :totalPages, :totalMatches, :updatedAt
                    )
                    ON CONFLICT (main_url)
                    DO UPDATE SET
                        task_id = EXCLUDED.task_id,
                        sub_urls = EXCLUDED.sub_urls,
                        keyword_match = EXCLUDED.keyword_match,
                        categories = EXCLUDED.categories,
                        snippets = EXCLUDED.snippets,
                        total_pages = EXCLUDED.total_pages,
                        total_matches = EXCLUDED.total_matches,
                        updated_at = EXCLUDED.updated_at
                    """,
                params
            );
            return;
        }

        jdbc.update(
            """
                MERGE INTO results (
                    main_url, task_id, sub_urls, keyword_match, categories, snippets,
                    total_pages, total_matches, updated_at
                )
                KEY(main_url)
                VALUES (
                    :mainUrl, :taskId, :subUrls, :keywords, :categories, :snippets,
                    :totalPages, :totalMatches, :updatedAt
                )
                """,
            params
        );
    }

    public ResultRecord findResult(String mainUrl) {
        List<ResultRecord> rows = jdbc.query(
            """
                SELECT main_url, task_id, sub_urls, keyword_match, categories, snippets,
                       total_pages, total_matches, updated_at
                FROM results
                WHERE main_url = :mainUrl
                """,
            new MapSqlParameterSource("mainUrl", mainUrl),
            (rs, rowNum) -> new ResultRecord(
                rs.getString("task_id"),
                rs.getString("main_url"),
                fromJson(rs.getString("sub_urls")),
                fromJson(rs.getString("keyword_match")),
                fromJson(rs.getString("categories")),
                rs.getString("snippets"),
                rs.getInt("total_pages"),
                rs.getInt("total_matches"),
                toInstant(rs.getTimestamp("updated_at"))
            )
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public long countResults(String mainUrl) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM results WHERE main_url = :mainUrl",
            new MapSqlParameterSource("mainUrl", mainUrl),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public DomainStat incrementDomainSeen(String domain) {
        incrementDomainCounter(domain, "seen");
        return findDomainStat(domain);
    }

    public DomainStat incrementRenderSuccess(String domain) {
        incrementDomainCounter(domain, "render_success");
        return findDomainStat(domain);
    }

    private void incrementDomainCounter(String domain, String column) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("domain", domain)
            .addValue("now", toTimestamp(Instant.now()));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO domain_stats (domain, %1$s, updated_at)
                    VALUES (:domain, 1, :now)
                    ON CONFLICT (domain)
                    DO UPDATE SET %1$s = domain_stats.%1$s + 1, updated_at = EXCLUDED.updated_at
                    """.formatted(column),
                params
            );
            return;
        }
        String update = "UPDATE domain_stats SET %1$s = %1$s + 1, updated_at = :now WHERE domain = :domain"
            .formatted(column);
        if (jdbc.update(update, params) > 0) {
            return;
        }
        try {
            jdbc.update(
                "INSERT INTO domain_stats (domain, %s, updated_at) VALUES (:domain, 1, :now)".formatted(column),
                params
            );
        } catch (DataIntegrityViolationException e) {
            // lost the insert race; the row exists now
            jdbc.update(update, params);
        }
    }

    public DomainStat findDomainStat(String domain) {
        List<DomainStat> rows = jdbc.query(
            "SELECT domain, seen, render_success, escalated FROM domain_stats WHERE domain = :domain",
            new MapSqlParameterSource("domain", domain),
            (rs, rowNum) -> new DomainStat(
                rs.getString("domain"),
                rs.getLong("seen"),
                rs.getLong("render_success"),
                rs.getBoolean("escalated")
            )
        );
        return rows.isEmpty() ? DomainStat.empty(domain) : rows.get(0);
    }

    public List<DomainStat> findEscalatedDomainStats() {
        return jdbc.query(
            """
                SELECT rd.domain, COALESCE(ds.seen, 0) AS seen,
                       COALESCE(ds.render_success, 0) AS render_success
                FROM render_domains rd
                LEFT JOIN domain_stats ds ON ds.domain = rd.domain
                ORDER BY rd.domain
                """,
            new MapSqlParameterSource(),
            (rs, rowNum) -> new DomainStat(
                rs.getString("domain"),
                rs.getLong("seen"),
                rs.getLong("render_success"),
                true
            )
        );
    }

    public Set<String> findRenderDomains() {
        return new LinkedHashSet<>(jdbc.query(
            "SELECT domain FROM render_domains ORDER BY domain",
            new MapSqlParameterSource(),
            (rs, rowNum) -> rs.getString("domain")
        ));
    }

    /**
     * Adds {@code domain} to the force-render set. Returns false when it was already present.
     */
    public boolean addRenderDomain(String domain, String origin) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("domain", domain)
            .addValue("origin", origin)
            .addValue("now", toTimestamp(Instant.now()));
        int inserted;
        if (postgres) {
            inserted = jdbc.update(
                """
                    INSERT INTO render_domains (domain, origin, added_at)
                    VALUES (:domain, :origin, :now)
                    ON CONFLICT (domain) DO NOTHING
                    """,
                params
            );
        } else {
            try {
                inserted = jdbc.update(
                    "INSERT INTO render_domains (domain, origin, added_at) VALUES (:domain, :origin, :now)",
                    params
                );
            } catch (DataIntegrityViolationException e) {
                inserted = 0;
            }
        }
        jdbc.update(
            "UPDATE domain_stats SET escalated = TRUE, updated_at = :now WHERE domain = :domain",
            params
        );
        return inserted > 0;
    }

    public void pushDeadLetter(String kind, String payload, Instant expiresAt) {
        Instant now = Instant.now();
        jdbc.update(
            """
                INSERT INTO dead_letters (kind, payload, created_at, expires_at)
                VALUES (:kind, :payload, :createdAt, :expiresAt)
                """,
            new MapSqlParameterSource()
                .addValue("kind", kind)
                .addValue("payload", payload)
                .addValue("createdAt", toTimestamp(now))
                .addValue("expiresAt", toTimestamp(expiresAt))
        );
    }

    /**
     * Removes and returns the oldest unexpired payload of {@code kind}, or null when empty.
     */
    public String popOldestDeadLetter(String kind) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("kind", kind)
            .addValue("now", toTimestamp(Instant.now()));
        for (int attempt = 0; attempt < 3; attempt++) {
            List<DeadLetterRow> rows = jdbc.query(
                """
                    SELECT id, payload
                    FROM dead_letters
                    WHERE kind = :kind
                      AND expires_at > :now
                    ORDER BY id
                    LIMIT 1
                    """,
                params,
                (rs, rowNum) -> new DeadLetterRow(rs.getLong("id"), rs.getString("payload"))
            );
            if (rows.isEmpty()) {
                return null;
            }
            DeadLetterRow row = rows.get(0);
            int deleted = jdbc.update(
                "DELETE FROM dead_letters WHERE id = :id",
                new MapSqlParameterSource("id", row.id())
            );
            if (deleted > 0) {
                return row.payload();
            }
        }
        return null;
    }

    public long countDeadLetters(String kind) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM dead_letters WHERE kind = :kind AND expires_at > :now",
            new MapSqlParameterSource()
                .addValue("kind", kind)
                .addValue("now", toTimestamp(Instant.now())),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public int purgeExpiredDeadLetters() {
        return jdbc.update(
            "DELETE FROM dead_letters WHERE expires_at <= :now",
            new MapSqlParameterSource("now", toTimestamp(Instant.now()))
        );
    }

    public void recordUpiHandle(String handle, String domain, String sampleUrl) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("handle", handle)
            .addValue("domain", domain)
            .addValue("sampleUrl", sampleUrl)
            .addValue("now", toTimestamp(Instant.now()));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO upi_handles (handle, domain, sightings, sample_url, last_seen_at)
                    VALUES (:handle, :domain, 1, :sampleUrl, :now)
                    ON CONFLICT (handle, domain)
                    DO UPDATE SET sightings = upi_handles.sightings + 1,
                                  sample_url = COALESCE(upi_handles.sample_url, EXCLUDED.sample_url),
                                  last_seen_at = EXCLUDED.last_seen_at
                    """,
                params
            );
            return;
        }
        String update = """
            UPDATE upi_handles
            SET sightings = sightings + 1,
                sample_url = COALESCE(sample_url, :sampleUrl),
                last_seen_at = :now
            WHERE handle = :handle AND domain = :domain
            """;
        if (jdbc.update(update, params) > 0) {
            return;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO upi_handles (handle, domain, sightings, sample_url, last_seen_at)
                    VALUES (:handle, :domain, 1, :sampleUrl, :now)
                    """,
                params
            );
        } catch (DataIntegrityViolationException e) {
            jdbc.update(update, params);
        }
    }

    public List<UpiHandleSighting> findUpiHandles(int limit) {
        return jdbc.query(
            """
                SELECT handle, domain, sightings, sample_url, last_seen_at
                FROM upi_handles
                ORDER BY sightings DESC, handle
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", Math.max(1, Math.min(limit, 1000))),
            (rs, rowNum) -> new UpiHandleSighting(
                rs.getString("handle"),
                rs.getString("domain"),
                rs.getLong("sightings"),
                rs.getString("sample_url"),
                toInstant(rs.getTimestamp("last_seen_at"))
            )
        );
    }

    private String toJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values == null ? List.of() : values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise list column", e);
        }
    }

    private List<String> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable list column value, treating as empty: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to portable SQL", e);
            return false;
        }
    }

    private record DeadLetterRow(long id, String payload) {
    }
}
