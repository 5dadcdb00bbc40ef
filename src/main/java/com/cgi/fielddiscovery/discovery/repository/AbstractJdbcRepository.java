package com.cgi.fielddiscovery.discovery.repository;

import com.cgi.fielddiscovery.common.exception.PersistenceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Base class for the JDBC repositories.
 * Provides standardized error handling and the JSON encoding of list columns.
 */
public abstract class AbstractJdbcRepository {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final NamedParameterJdbcTemplate jdbcTemplate;
    protected final ObjectMapper objectMapper;

    protected AbstractJdbcRepository(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Executes a statement with standardized error handling.
     *
     * @param operationName Operation name for logging
     * @param operation Function that executes the statement
     * @return Statement result
     * @throws PersistenceException On database error
     */
    protected <T> T execute(String operationName, Function<NamedParameterJdbcTemplate, T> operation) {
        try {
            logger.debug("Executing operation: {}", operationName);
            return operation.apply(jdbcTemplate);
        } catch (DataAccessException e) {
            logger.error("Database error executing {}: {}", operationName, e.getMessage());
            throw new PersistenceException("Error during " + operationName, e);
        }
    }

    protected String toJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values != null ? values : List.of());
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot encode list column", e);
        }
    }

    protected List<String> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, STRING_LIST));
        } catch (JsonProcessingException e) {
            logger.warn("Ignoring malformed list column value: {}", json);
            return new ArrayList<>();
        }
    }

    protected static Timestamp toTimestamp(LocalDateTime value) {
        return value != null ? Timestamp.valueOf(value) : null;
    }

    protected static LocalDateTime toLocalDateTime(Timestamp value) {
        return value != null ? value.toLocalDateTime() : null;
    }
}
