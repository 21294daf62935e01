package com.studentcrud.repository;

import com.studentcrud.model.Student;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Single-statement operations on the students table.
 *
 * Every method runs exactly one statement (or none) on its own connection.
 * Update and delete report rows affected; 0 means no row had the given id.
 * Constraint and connectivity problems surface as Spring DataAccessExceptions.
 */
@Repository
@Slf4j
public class StudentRepository {

    private static final String[] ID_COLUMN = {"id"};

    private static final RowMapper<Student> STUDENT_ROW_MAPPER = (rs, rowNum) -> new Student(
            rs.getInt("id"),
            rs.getString("name"),
            rs.getString("email"),
            rs.getObject("created_at", OffsetDateTime.class)
    );

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlTemplateLoader sqlLoader;

    public StudentRepository(NamedParameterJdbcTemplate jdbcTemplate, SqlTemplateLoader sqlLoader) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlLoader = sqlLoader;
    }

    /**
     * Insert a student and return the id the database generated.
     * Values are passed through as-is; the table rejects empty or duplicate data.
     */
    public int create(String name, String email) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("name", name)
                .addValue("email", email);
        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(sqlLoader.load("insertStudent"), params, keyHolder, ID_COLUMN);

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new DataRetrievalFailureException("Insert into students returned no generated id");
        }
        log.debug("Inserted student id={}", key);
        return key.intValue();
    }

    /**
     * All students ordered by id.
     */
    public List<Student> findAll() {
        return jdbcTemplate.query(sqlLoader.load("findAllStudents"), STUDENT_ROW_MAPPER);
    }

    /**
     * Update whichever of name and email is non-null.
     * With neither supplied nothing is sent to the database and 0 is returned.
     */
    public int update(int id, @Nullable String name, @Nullable String email) {
        String queryName;
        if (name != null && email != null) {
            queryName = "updateStudentNameAndEmail";
        } else if (name != null) {
            queryName = "updateStudentName";
        } else if (email != null) {
            queryName = "updateStudentEmail";
        } else {
            log.debug("Update of student {} skipped: no fields supplied", id);
            return 0;
        }

        MapSqlParameterSource params = new MapSqlParameterSource("id", id);
        if (name != null) {
            params.addValue("name", name);
        }
        if (email != null) {
            params.addValue("email", email);
        }

        int rows = jdbcTemplate.update(sqlLoader.load(queryName), params);
        log.debug("{} for student {} affected {} row(s)", queryName, id, rows);
        return rows;
    }

    public int delete(int id) {
        int rows = jdbcTemplate.update(sqlLoader.load("deleteStudent"), new MapSqlParameterSource("id", id));
        log.debug("Delete of student {} affected {} row(s)", id, rows);
        return rows;
    }
}
