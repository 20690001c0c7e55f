package com.adaptiv.healthservice.exceptions;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void h2EmailIndexViolationIsConflict() {
        SQLException cause = new SQLException("Unique index or primary key violation: "
                + "\"PUBLIC.UK_ACCOUNTS_EMAIL_INDEX_E ON PUBLIC.ACCOUNTS(EMAIL NULLS FIRST) VALUES ( /* 1 */ 'a@b.c' )\"");

        ResponseEntity<ErrorResponse> response = handler.handleIntegrityViolation(
                new DataIntegrityViolationException("could not execute statement", cause));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("EMAIL_ALREADY_REGISTERED", response.getBody().getCode());
    }

    @Test
    void postgresEmailConstraintViolationIsConflict() {
        SQLException cause = new SQLException("ERROR: duplicate key value violates unique constraint "
                + "\"uk_accounts_email\"\n  Detail: Key (email)=(a@b.c) already exists.");

        ResponseEntity<ErrorResponse> response = handler.handleIntegrityViolation(
                new DataIntegrityViolationException("could not execute statement", cause));

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
    }

    @Test
    void otherIntegrityViolationIsStorageFailure() {
        SQLException cause = new SQLException("NULL not allowed for column \"PASSWORD_HASH\"");

        ResponseEntity<ErrorResponse> response = handler.handleIntegrityViolation(
                new DataIntegrityViolationException("could not execute statement", cause));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("STORAGE_UNAVAILABLE", response.getBody().getCode());
    }
}
