package com.studentcrud.model;

import java.time.OffsetDateTime;

/**
 * Row of the students table.
 */
public record Student(
    int id,
    String name,
    String email,
    OffsetDateTime createdAt
) {}
