package com.studentcrud.repository;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.UncheckedIOException;

import static org.junit.jupiter.api.Assertions.*;

class SqlTemplateLoaderTest {

    @Test
    void load_namedQuery_shouldReturnQueryText() {
        SqlTemplateLoader loader = new SqlTemplateLoader(new DefaultResourceLoader());

        String sql = loader.load("findAllStudents");
        assertNotNull(sql);
        assertTrue(sql.toLowerCase().contains("from students"));
        assertTrue(sql.toLowerCase().endsWith("order by id"));
    }

    @Test
    void load_lastQueryInFile_shouldNotBeLost() {
        SqlTemplateLoader loader = new SqlTemplateLoader(new DefaultResourceLoader());

        assertTrue(loader.load("deleteStudent").toLowerCase().startsWith("delete from students"));
    }

    @Test
    void load_shouldNotIncludeFollowingBlock() {
        SqlTemplateLoader loader = new SqlTemplateLoader(new DefaultResourceLoader());

        String ddl = loader.load("createStudentsTable");
        assertTrue(ddl.startsWith("CREATE TABLE IF NOT EXISTS students"));
        assertFalse(ddl.contains("INSERT"));
        assertFalse(ddl.contains("-- name:"));
    }

    @Test
    void load_missingName_shouldThrow() {
        SqlTemplateLoader loader = new SqlTemplateLoader(new DefaultResourceLoader());
        assertThrows(IllegalArgumentException.class, () -> loader.load("no_such_query"));
    }

    @Test
    void load_missingFile_shouldThrow() {
        SqlTemplateLoader loader = new SqlTemplateLoader(new DefaultResourceLoader(), "classpath:sql/absent.sql");
        assertThrows(UncheckedIOException.class, () -> loader.load("findAllStudents"));
    }

    @Test
    void load_duplicateName_shouldRejectFile() {
        SqlTemplateLoader loader = new SqlTemplateLoader(new DefaultResourceLoader(), "classpath:sql/duplicate-name.sql");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> loader.load("findAllStudents"));
        assertTrue(e.getMessage().contains("defined twice"));
    }

    @Test
    void load_blockWithoutSql_shouldRejectFile() {
        SqlTemplateLoader loader = new SqlTemplateLoader(new DefaultResourceLoader(), "classpath:sql/empty-block.sql");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> loader.load("findAllStudents"));
        assertTrue(e.getMessage().contains("deleteStudent"));
    }
}
