package com.fieldreport.impound.repository;

import com.fieldreport.impound.model.InspectionStatus;
import com.fieldreport.impound.model.ReleaseRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import static com.fieldreport.impound.repository.InspectionRepository.toInstant;
import static com.fieldreport.impound.repository.InspectionRepository.toTimestamp;

/**
 * JDBC access to the append-only {@code release_records} table.
 */
@Repository
@Slf4j
public class ReleaseRecordRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlTemplateLoader sqlLoader;

    public ReleaseRecordRepository(NamedParameterJdbcTemplate jdbcTemplate, SqlTemplateLoader sqlLoader) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlLoader = sqlLoader;
    }

    /**
     * Insert a release record. A duplicate {@code releaseId} raises
     * {@link org.springframework.dao.DuplicateKeyException}.
     */
    public void append(ReleaseRecord record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("releaseId", record.getReleaseId())
                .addValue("inspectionId", record.getInspectionId())
                .addValue("quantity", record.getQuantity())
                .addValue("releaseDate", toTimestamp(record.getReleaseDate()))
                .addValue("clientName", record.getClientName())
                .addValue("telephone", record.getTelephone())
                .addValue("releasedBy", record.getReleasedBy())
                .addValue("note", record.getNote())
                .addValue("createdByUid", record.getCreatedByUid())
                .addValue("createdByEmail", record.getCreatedByEmail())
                .addValue("createdByName", record.getCreatedByName())
                .addValue("createdAt", toTimestamp(record.getCreatedAt()))
                .addValue("remainingAfter", record.getRemainingAfter())
                .addValue("statusAfter", record.getStatusAfter().label());

        jdbcTemplate.update(sqlLoader.load("insertReleaseRecord"), params);
    }

    public Optional<ReleaseRecord> find(String inspectionId, String releaseId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("inspectionId", inspectionId)
                .addValue("releaseId", releaseId);
        try {
            return Optional.ofNullable(jdbcTemplate.queryForObject(sqlLoader.load("findRelease"), params, RELEASE_MAPPER));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        }
    }

    /**
     * Release history of one inspection, newest first.
     */
    public List<ReleaseRecord> findByInspection(String inspectionId) {
        return jdbcTemplate.query(sqlLoader.load("findReleasesByInspection"),
                new MapSqlParameterSource("inspectionId", inspectionId), RELEASE_MAPPER);
    }

    public ReleaseTotals totals(String inspectionId) {
        return jdbcTemplate.queryForObject(sqlLoader.load("sumReleasedByInspection"),
                new MapSqlParameterSource("inspectionId", inspectionId),
                (rs, rowNum) -> new ReleaseTotals(rs.getLong("total_released"), rs.getLong("release_count")));
    }

    public void updateNotificationAudit(String releaseId, boolean attempted, boolean succeeded, String error) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("releaseId", releaseId)
                .addValue("attempted", attempted)
                .addValue("succeeded", succeeded)
                .addValue("error", truncate(error, 1000));
        int updated = jdbcTemplate.update(sqlLoader.load("updateReleaseNotification"), params);
        if (updated == 0) {
            log.warn("No release record {} to stamp with notification outcome", releaseId);
        }
    }

    /**
     * Sum and count of all releases recorded for an inspection.
     */
    public record ReleaseTotals(long totalReleased, long releaseCount) {}

    private static final RowMapper<ReleaseRecord> RELEASE_MAPPER = ReleaseRecordRepository::mapRelease;

    private static ReleaseRecord mapRelease(ResultSet rs, int rowNum) throws SQLException {
        return ReleaseRecord.builder()
                .releaseId(rs.getString("release_id"))
                .inspectionId(rs.getString("inspection_id"))
                .quantity(rs.getInt("quantity"))
                .releaseDate(toInstant(rs.getTimestamp("release_date")))
                .clientName(rs.getString("client_name"))
                .telephone(rs.getString("telephone"))
                .releasedBy(rs.getString("released_by"))
                .note(rs.getString("note"))
                .createdByUid(rs.getString("created_by_uid"))
                .createdByEmail(rs.getString("created_by_email"))
                .createdByName(rs.getString("created_by_name"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .remainingAfter(rs.getInt("remaining_after"))
                .statusAfter(InspectionStatus.fromLabel(rs.getString("status_after")))
                .notificationAttempted(rs.getBoolean("notification_attempted"))
                .notificationSucceeded(rs.getBoolean("notification_succeeded"))
                .notificationError(rs.getString("notification_error"))
                .build();
    }

    private static String truncate(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }
}
