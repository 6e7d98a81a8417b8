package com.fieldreport.impound.repository;

import com.fieldreport.impound.model.RegisterEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;

import static com.fieldreport.impound.repository.InspectionRepository.toInstant;
import static com.fieldreport.impound.repository.InspectionRepository.toTimestamp;

/**
 * JDBC access to the append-only {@code register_entries} table.
 */
@Repository
@Slf4j
public class RegisterEntryRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlTemplateLoader sqlLoader;

    public RegisterEntryRepository(NamedParameterJdbcTemplate jdbcTemplate, SqlTemplateLoader sqlLoader) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlLoader = sqlLoader;
    }

    /**
     * Store a new entry under a fresh id. Any id on the argument is ignored.
     */
    public RegisterEntry append(RegisterEntry entry) {
        RegisterEntry stored = entry.toBuilder().id(UUID.randomUUID().toString()).build();

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("entryId", stored.getId())
                .addValue("entryDate", toTimestamp(stored.getDate()))
                .addValue("inspectors", stored.getInspectors())
                .addValue("purpose", stored.getPurpose())
                .addValue("observations", stored.getObservations())
                .addValue("recommendations", stored.getRecommendations())
                .addValue("signature", stored.getSignature())
                .addValue("serialNo", stored.getSerialNo())
                .addValue("createdAt", toTimestamp(stored.getCreatedAt()))
                .addValue("createdBy", stored.getCreatedBy());

        jdbcTemplate.update(sqlLoader.load("insertRegisterEntry"), params);
        log.debug("Appended register entry {} dated {}", stored.getId(), stored.getDate());
        return stored;
    }

    /**
     * Every entry, most recent visit first.
     */
    public List<RegisterEntry> findAll() {
        return jdbcTemplate.query(sqlLoader.load("findRegisterEntries"), ENTRY_MAPPER);
    }

    private static final RowMapper<RegisterEntry> ENTRY_MAPPER = RegisterEntryRepository::mapEntry;

    private static RegisterEntry mapEntry(ResultSet rs, int rowNum) throws SQLException {
        return RegisterEntry.builder()
                .id(rs.getString("entry_id"))
                .date(toInstant(rs.getTimestamp("entry_date")))
                .inspectors(rs.getString("inspectors"))
                .purpose(rs.getString("purpose"))
                .observations(rs.getString("observations"))
                .recommendations(rs.getString("recommendations"))
                .signature(rs.getString("signature"))
                .serialNo(rs.getString("serial_no"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .createdBy(rs.getString("created_by"))
                .build();
    }
}
