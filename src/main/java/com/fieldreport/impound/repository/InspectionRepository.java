package com.fieldreport.impound.repository;

import com.fieldreport.impound.model.Inspection;
import com.fieldreport.impound.model.InspectionStatus;
import com.fieldreport.impound.model.QuantityRepresentation;
import com.fieldreport.impound.model.ReleaseRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the {@code inspections} table.
 *
 * The remaining quantity is only ever changed through {@link #compareAndSetRelease}, which
 * succeeds only if nobody else has touched the row since it was read.
 */
@Repository
@Slf4j
public class InspectionRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlTemplateLoader sqlLoader;

    public InspectionRepository(NamedParameterJdbcTemplate jdbcTemplate, SqlTemplateLoader sqlLoader) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlLoader = sqlLoader;
    }

    public Optional<Inspection> findById(String inspectionId) {
        String sql = sqlLoader.load("findInspectionById");
        MapSqlParameterSource params = new MapSqlParameterSource("inspectionId", inspectionId);
        try {
            return Optional.ofNullable(jdbcTemplate.queryForObject(sql, params, INSPECTION_MAPPER));
        } catch (EmptyResultDataAccessException e) {
            log.debug("Inspection not found: {}", inspectionId);
            return Optional.empty();
        }
    }

    /**
     * All inspections, newest first. A non-blank filter matches drugshop, serial, status or location.
     */
    public List<Inspection> findAll(String filter) {
        if (filter == null || filter.isBlank()) {
            return jdbcTemplate.query(sqlLoader.load("findAllInspections"), INSPECTION_MAPPER);
        }
        String pattern = "%" + filter.trim().toLowerCase(Locale.ROOT) + "%";
        return jdbcTemplate.query(sqlLoader.load("searchInspections"),
                new MapSqlParameterSource("pattern", pattern), INSPECTION_MAPPER);
    }

    /**
     * Persist a new inspection. The store assigns the id; any id on the argument is ignored.
     */
    public Inspection insert(Inspection inspection) {
        Inspection stored = inspection.toBuilder()
                .id(UUID.randomUUID().toString())
                .version(0L)
                .notificationAttempted(false)
                .notificationSucceeded(false)
                .build();

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("inspectionId", stored.getId())
                .addValue("serialNumber", stored.getSerialNumber())
                .addValue("drugshopName", stored.getDrugshopName())
                .addValue("drugshopContactPhones", joinPhones(stored.getDrugshopContactPhones()))
                .addValue("clientTelephone", stored.getClientTelephone())
                .addValue("impoundedBy", stored.getImpoundedBy())
                .addValue("inspectionDate", toTimestamp(stored.getInspectionDate()))
                .addValue("locationAddress", stored.getLocationAddress())
                .addValue("boxesImpounded", stored.getBoxesImpounded())
                .addValue("boxesRepresentation", stored.getBoxesRepresentation().name())
                .addValue("initialBoxes", stored.getInitialBoxes())
                .addValue("status", stored.getStatus().label())
                .addValue("createdAt", toTimestamp(stored.getCreatedAt()))
                .addValue("createdBy", stored.getCreatedBy());

        jdbcTemplate.update(sqlLoader.load("insertInspection"), params);
        log.debug("Inserted inspection {} (serial={}, boxes={})",
                stored.getId(), stored.getSerialNumber(), stored.getBoxesImpounded());
        return stored;
    }

    /**
     * Apply a release to the row read as {@code expected}, together with the release stamps.
     *
     * @return false if the row changed since {@code expected} was read (nothing written)
     */
    public boolean compareAndSetRelease(Inspection expected, int remaining, InspectionStatus status, ReleaseRecord release) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("inspectionId", expected.getId())
                .addValue("expectedVersion", expected.getVersion())
                .addValue("expectedBoxes", expected.getBoxesImpounded())
                .addValue("remaining", remaining)
                .addValue("status", status.label())
                .addValue("releasedAt", toTimestamp(release.getCreatedAt()))
                .addValue("releasedByUid", release.getCreatedByUid())
                .addValue("releasedByEmail", release.getCreatedByEmail())
                .addValue("releasedByName", release.getCreatedByName())
                .addValue("lastReleaseNote", blankToNull(release.getNote()))
                .addValue("lastReleaseCount", release.getQuantity());

        int updated = jdbcTemplate.update(sqlLoader.load("compareAndSetRelease"), params);
        if (updated == 0) {
            log.debug("Conditional update missed for inspection {} at version {}", expected.getId(), expected.getVersion());
        }
        return updated == 1;
    }

    public void updateNotificationAudit(String inspectionId, boolean attempted, boolean succeeded) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("inspectionId", inspectionId)
                .addValue("attempted", attempted)
                .addValue("succeeded", succeeded);
        jdbcTemplate.update(sqlLoader.load("updateInspectionNotification"), params);
    }

    private static final RowMapper<Inspection> INSPECTION_MAPPER = InspectionRepository::mapInspection;

    private static Inspection mapInspection(ResultSet rs, int rowNum) throws SQLException {
        return Inspection.builder()
                .id(rs.getString("inspection_id"))
                .serialNumber(rs.getString("serial_number"))
                .drugshopName(rs.getString("drugshop_name"))
                .drugshopContactPhones(splitPhones(rs.getString("drugshop_contact_phones")))
                .clientTelephone(rs.getString("client_telephone"))
                .impoundedBy(rs.getString("impounded_by"))
                .inspectionDate(toInstant(rs.getTimestamp("inspection_date")))
                .locationAddress(rs.getString("location_address"))
                .boxesImpounded(rs.getInt("boxes_impounded"))
                .boxesRepresentation(QuantityRepresentation.valueOf(rs.getString("boxes_representation")))
                .initialBoxes(rs.getInt("initial_boxes"))
                .status(InspectionStatus.fromLabel(rs.getString("status")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .createdBy(rs.getString("created_by"))
                .releasedAt(toInstant(rs.getTimestamp("released_at")))
                .releasedByUid(rs.getString("released_by_uid"))
                .releasedByEmail(rs.getString("released_by_email"))
                .releasedByName(rs.getString("released_by_name"))
                .lastReleaseNote(rs.getString("last_release_note"))
                .lastReleaseCount(rs.getObject("last_release_count", Integer.class))
                .notificationAttempted(rs.getBoolean("notification_attempted"))
                .notificationSucceeded(rs.getBoolean("notification_succeeded"))
                .version(rs.getLong("version"))
                .build();
    }

    static String joinPhones(List<String> phones) {
        return phones == null || phones.isEmpty() ? null : String.join(",", phones);
    }

    static List<String> splitPhones(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
