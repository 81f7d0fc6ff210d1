package com.familygraph.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.familygraph.model.RawRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads records from the {@code vault_record} table. Properties and tags are
 * stored as JSON text; a row whose JSON cannot be parsed is skipped.
 */
@Repository
public class JdbcRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcRecordStore.class);

    private static final TypeReference<Map<String, Object>> PROPERTIES_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> TAGS_TYPE = new TypeReference<>() {};

    private record StoredRecord(String path, String properties, String tags) {}

    private static final RowMapper<StoredRecord> STORED_RECORD_MAPPER = (rs, rowNum) -> new StoredRecord(
        rs.getString("path"),
        rs.getString("properties"),
        rs.getString("tags")
    );

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public JdbcRecordStore(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<RawRecord> findAll() {
        List<StoredRecord> rows;
        try {
            rows = jdbc.query("SELECT path, properties, tags FROM vault_record ORDER BY path", STORED_RECORD_MAPPER);
        } catch (DataAccessException e) {
            throw new RecordStoreException("Failed to read records: " + e.getMessage(), e);
        }

        List<RawRecord> records = new ArrayList<>(rows.size());
        for (StoredRecord row : rows) {
            try {
                records.add(new RawRecord(
                    row.path(),
                    readJson(row.properties(), PROPERTIES_TYPE),
                    readJson(row.tags(), TAGS_TYPE)));
            } catch (JsonProcessingException e) {
                log.warn("Skipping record {}: malformed JSON ({})", row.path(), e.getOriginalMessage());
            }
        }
        return records;
    }

    private <T> T readJson(String json, TypeReference<T> type) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return null;
        }
        return objectMapper.readValue(json, type);
    }
}
