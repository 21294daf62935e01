package com.studentcrud.repository;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named SQL statements read from {@code classpath:sql/students.sql}.
 * A statement starts at a {@code -- name: <queryName>} line and runs until the next one.
 *
 * The file is parsed once, on first use. A repeated name, a marker without a name or a
 * block without SQL makes the whole file unusable.
 */
@Component
public class SqlTemplateLoader {

    static final String DEFAULT_LOCATION = "classpath:sql/students.sql";
    private static final String NAME_MARKER = "-- name:";

    private final ResourceLoader resourceLoader;
    private final String location;
    private Map<String, String> queries;

    public SqlTemplateLoader(ResourceLoader resourceLoader) {
        this(resourceLoader, DEFAULT_LOCATION);
    }

    SqlTemplateLoader(ResourceLoader resourceLoader, String location) {
        this.resourceLoader = resourceLoader;
        this.location = location;
    }

    public synchronized String load(String name) {
        if (queries == null) {
            queries = parse(readLines(resourceLoader.getResource(location)));
        }

        String query = queries.get(name);
        if (query == null) {
            throw new IllegalArgumentException("SQL query not found in " + location + ": " + name);
        }
        return query;
    }

    private List<String> readLines(Resource resource) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            return reader.lines().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load SQL queries file: " + location, e);
        }
    }

    private Map<String, String> parse(List<String> lines) {
        Map<String, String> parsed = new LinkedHashMap<>();
        String blockName = null;
        StringBuilder body = new StringBuilder();

        for (String line : lines) {
            String trimmed = line.trim();
            if (!trimmed.startsWith(NAME_MARKER)) {
                // Text before the first marker is a file header.
                if (blockName != null) {
                    body.append(line).append('\n');
                }
                continue;
            }
            if (blockName != null) {
                register(parsed, blockName, body);
            }
            blockName = trimmed.substring(NAME_MARKER.length()).trim();
            if (blockName.isEmpty()) {
                throw new IllegalStateException("Unnamed query block in " + location);
            }
            body = new StringBuilder();
        }
        if (blockName != null) {
            register(parsed, blockName, body);
        }
        return Map.copyOf(parsed);
    }

    private void register(Map<String, String> parsed, String name, StringBuilder body) {
        String sql = body.toString().trim();
        if (sql.isEmpty()) {
            throw new IllegalStateException("Query '" + name + "' in " + location + " has no SQL");
        }
        if (parsed.putIfAbsent(name, sql) != null) {
            throw new IllegalStateException("Query '" + name + "' is defined twice in " + location);
        }
    }
}
