package com.studentcrud.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the students table if it does not exist yet.
 * Safe to run on every start; any failure propagates to the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SchemaInitializer {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlTemplateLoader sqlLoader;

    public void initialize() {
        String ddl = sqlLoader.load("createStudentsTable");
        log.debug("Ensuring students table exists");
        // Plain execute: the DDL is not a named-parameter statement.
        jdbcTemplate.getJdbcTemplate().execute(ddl);
        log.info("Students table ready");
    }
}
