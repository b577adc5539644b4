package com.hunt.jobtracker.ingest.persistence;

import com.hunt.jobtracker.ingest.model.EmployerStatus;
import com.hunt.jobtracker.ingest.model.ExistingRecordView;
import com.hunt.jobtracker.ingest.model.JobDescription;
import com.hunt.jobtracker.ingest.model.JobSource;
import com.hunt.jobtracker.ingest.model.JobStatus;
import com.hunt.jobtracker.ingest.model.ParsedJob;
import com.hunt.jobtracker.ingest.model.RankingCandidate;
import com.hunt.jobtracker.ingest.model.StoredJob;
import com.hunt.jobtracker.ingest.util.ContentHashes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Repository
public class JobRecordJdbcRepository implements JobRecordStore {
    private static final Logger log = LoggerFactory.getLogger(JobRecordJdbcRepository.class);

    private static final String VIEW_COLUMNS = "j.id, j.title, e.name AS employer_name, j.url";
    private static final String JOB_COLUMNS = """
        j.id, j.title, e.name AS employer_name, j.url, j.source, j.status, j.pay_min, j.pay_max,
        j.job_code, j.no_longer_accepting, j.raw_text, j.created_at, j.updated_at
        """;

    private static final RowMapper<ExistingRecordView> VIEW_MAPPER = (rs, rowNum) -> new ExistingRecordView(
        rs.getLong("id"),
        rs.getString("title"),
        rs.getString("employer_name"),
        rs.getString("url")
    );

    private static final RowMapper<StoredJob> JOB_MAPPER = (rs, rowNum) -> new StoredJob(
        rs.getLong("id"),
        rs.getString("title"),
        rs.getString("employer_name"),
        rs.getString("url"),
        JobSource.fromCode(rs.getString("source")),
        JobStatus.fromCode(rs.getString("status")),
        rs.getObject("pay_min", Long.class),
        rs.getObject("pay_max", Long.class),
        rs.getString("job_code"),
        rs.getBoolean("no_longer_accepting"),
        rs.getString("raw_text"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at"))
    );

    private final NamedParameterJdbcTemplate jdbc;

    public JobRecordJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public List<ExistingRecordView> findByEmployer(String employer) {
        if (employer == null || employer.isBlank()) {
            return List.of();
        }
        return jdbc.query(
            """
                SELECT %s
                FROM jobs j
                JOIN employers e ON e.id = j.employer_id
                WHERE e.name_key = :nameKey
                ORDER BY j.created_at, j.id
                """.formatted(VIEW_COLUMNS),
            new MapSqlParameterSource("nameKey", employerKey(employer)),
            VIEW_MAPPER
        );
    }

    @Override
    public List<ExistingRecordView> findByUrl(String url) {
        if (url == null || url.isBlank()) {
            return List.of();
        }
        return jdbc.query(
            """
                SELECT %s
                FROM jobs j
                LEFT JOIN employers e ON e.id = j.employer_id
                WHERE j.url = :url
                ORDER BY j.created_at, j.id
                """.formatted(VIEW_COLUMNS),
            new MapSqlParameterSource("url", url),
            VIEW_MAPPER
        );
    }

    @Override
    public List<ExistingRecordView> findAllInInsertionOrder() {
        return jdbc.query(
            """
                SELECT %s
                FROM jobs j
                LEFT JOIN employers e ON e.id = j.employer_id
                ORDER BY j.created_at, j.id
                """.formatted(VIEW_COLUMNS),
            new MapSqlParameterSource(),
            VIEW_MAPPER
        );
    }

    @Override
    @Transactional
    public long insert(ParsedJob job) {
        Long employerId = job.employer() == null || job.employer().isBlank() ? null : upsertEmployer(job.employer());
        Instant now = Instant.now();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("employerId", employerId, Types.BIGINT)
            .addValue("title", job.title())
            .addValue("url", job.url(), Types.VARCHAR)
            .addValue("location", job.location(), Types.VARCHAR)
            .addValue("source", job.source() == null ? JobSource.MANUAL.code() : job.source().code())
            .addValue("payMin", job.payMin(), Types.BIGINT)
            .addValue("payMax", job.payMax(), Types.BIGINT)
            .addValue("jobCode", job.jobCode(), Types.VARCHAR)
            .addValue("noLongerAccepting", job.noLongerAccepting())
            .addValue("rawText", job.rawText())
            .addValue("now", Timestamp.from(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO jobs (
                    employer_id, title, url, location, source, pay_min, pay_max, job_code,
                    no_longer_accepting, raw_text, created_at, updated_at
                )
                VALUES (
                    :employerId, :title, :url, :location, :source, :payMin, :payMax, :jobCode,
                    :noLongerAccepting, :rawText, :now, :now
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        long jobId = key == null ? 0L : key.longValue();
        if (!job.rawText().isBlank()) {
            insertSnapshot(jobId, job.rawText());
        }
        log.debug("Stored job {} '{}' at {}", jobId, job.title(), job.employer());
        return jobId;
    }

    @Override
    public List<StoredJob> findMissingDescriptions(int limit, boolean force) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("force", force)
            .addValue("limit", limit > 0 ? limit : Integer.MAX_VALUE);
        return jdbc.query(
            """
                SELECT %s
                FROM jobs j
                LEFT JOIN employers e ON e.id = j.employer_id
                WHERE j.url IS NOT NULL
                  AND (:force = TRUE OR j.description_fetched_at IS NULL)
                ORDER BY j.created_at, j.id
                LIMIT :limit
                """.formatted(JOB_COLUMNS),
            params,
            JOB_MAPPER
        );
    }

    @Override
    public Optional<StoredJob> findById(long id) {
        List<StoredJob> rows = jdbc.query(
            """
                SELECT %s
                FROM jobs j
                LEFT JOIN employers e ON e.id = j.employer_id
                WHERE j.id = :id
                """.formatted(JOB_COLUMNS),
            new MapSqlParameterSource("id", id),
            JOB_MAPPER
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Stores a fetched description. Pay and job code already on the record are kept when the
     * page yields none; a closed flag is never cleared.
     */
    @Override
    @Transactional
    public void updateDescription(long id, JobDescription description) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("rawText", description.text())
            .addValue("payMin", description.payMin(), Types.BIGINT)
            .addValue("payMax", description.payMax(), Types.BIGINT)
            .addValue("jobCode", description.jobCode(), Types.VARCHAR)
            .addValue("closed", description.noLongerAccepting())
            .addValue("now", Timestamp.from(Instant.now()));
        jdbc.update(
            """
                UPDATE jobs
                SET raw_text = :rawText,
                    pay_min = COALESCE(:payMin, pay_min),
                    pay_max = COALESCE(:payMax, pay_max),
                    job_code = COALESCE(:jobCode, job_code),
                    no_longer_accepting = (no_longer_accepting OR :closed),
                    description_fetched_at = :now,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
        String hash = ContentHashes.snapshotHash(description.text());
        if (hash.equals(latestSnapshotHash(id))) {
            log.debug("Job {} description unchanged, no snapshot", id);
            return;
        }
        insertSnapshot(id, description.text());
    }

    @Override
    @Transactional
    public boolean delete(long id) {
        MapSqlParameterSource params = new MapSqlParameterSource("id", id);
        jdbc.update("DELETE FROM job_snapshots WHERE job_id = :id", params);
        return jdbc.update("DELETE FROM jobs WHERE id = :id", params) > 0;
    }

    @Override
    @Transactional
    public boolean updateStatus(long id, JobStatus status) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("status", status.code())
            .addValue("now", Timestamp.from(Instant.now()));
        return jdbc.update("UPDATE jobs SET status = :status, updated_at = :now WHERE id = :id", params) > 0;
    }

    @Override
    @Transactional
    public long setEmployerStatus(String employer, EmployerStatus status) {
        long employerId = upsertEmployer(employer);
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", employerId)
            .addValue("status", status.code());
        jdbc.update("UPDATE employers SET status = :status WHERE id = :id", params);
        log.info("Employer '{}' marked {}", employer.trim(), status.code());
        return employerId;
    }

    @Override
    public List<String> findEmployerNames(EmployerStatus status) {
        if (status == null) {
            return jdbc.queryForList("SELECT name FROM employers ORDER BY name", new MapSqlParameterSource(), String.class);
        }
        return jdbc.queryForList(
            "SELECT name FROM employers WHERE status = :status ORDER BY name",
            new MapSqlParameterSource("status", status.code()),
            String.class
        );
    }

    @Override
    public List<RankingCandidate> findRankingCandidates() {
        return jdbc.query(
            """
                SELECT %s, e.status AS employer_status
                FROM jobs j
                LEFT JOIN employers e ON e.id = j.employer_id
                WHERE j.status NOT IN (:closedStatuses)
                ORDER BY j.created_at, j.id
                """.formatted(JOB_COLUMNS.strip()),
            new MapSqlParameterSource("closedStatuses", List.of(JobStatus.CLOSED.code(), JobStatus.REJECTED.code())),
            (rs, rowNum) -> new RankingCandidate(
                JOB_MAPPER.mapRow(rs, rowNum),
                EmployerStatus.fromCode(rs.getString("employer_status"))
            )
        );
    }

    private long upsertEmployer(String name) {
        String trimmed = name.trim();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("name", trimmed)
            .addValue("nameKey", employerKey(trimmed));
        List<Long> existing = jdbc.queryForList(
            "SELECT id FROM employers WHERE name_key = :nameKey",
            params,
            Long.class
        );
        if (!existing.isEmpty()) {
            return existing.get(0);
        }
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            "INSERT INTO employers (name, name_key) VALUES (:name, :nameKey)",
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    private void insertSnapshot(long jobId, String text) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("hash", ContentHashes.snapshotHash(text))
            .addValue("rawText", text);
        jdbc.update(
            "INSERT INTO job_snapshots (job_id, content_hash, raw_text) VALUES (:jobId, :hash, :rawText)",
            params
        );
    }

    private String latestSnapshotHash(long jobId) {
        List<String> hashes = jdbc.queryForList(
            "SELECT content_hash FROM job_snapshots WHERE job_id = :jobId ORDER BY id DESC LIMIT 1",
            new MapSqlParameterSource("jobId", jobId),
            String.class
        );
        return hashes.isEmpty() ? null : hashes.get(0);
    }

    private static String employerKey(String employer) {
        return employer.trim().toLowerCase(Locale.ROOT);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
