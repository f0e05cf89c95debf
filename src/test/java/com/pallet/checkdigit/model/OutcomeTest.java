package com.pallet.checkdigit.model;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeTest {

    @Test
    void okCarriesValue() {
        Outcome<Integer> outcome = Outcome.ok(5);

        assertTrue(outcome.isOk());
        assertFalse(outcome.isRetryable());
        assertEquals(10, outcome.map(v -> v * 2).value());
    }

    @Test
    void failedIsRetryableAndHasNoValue() {
        Outcome<Integer> outcome = Outcome.failed("down", new SQLException("gone"));

        assertTrue(outcome.isRetryable());
        assertTrue(outcome.toOptional().isEmpty());
        assertThrows(IllegalStateException.class, outcome::value);
        assertSame(Outcome.Status.FAILED, outcome.map(v -> "x").status());
    }

    @Test
    void invalidIsNotRetryable() {
        Outcome<String> outcome = Outcome.invalid("bad building");

        assertFalse(outcome.isOk());
        assertFalse(outcome.isRetryable());
        assertEquals("bad building", outcome.message());
    }

    @Test
    void mapKeepsStatusMessageAndCauseOfNonOkOutcomes() {
        SQLException cause = new SQLException("gone");

        Outcome<Integer> invalid = Outcome.<String>invalid("bad building").map(String::length);
        Outcome<Integer> failed = Outcome.<String>failed("down", cause).map(String::length);

        assertEquals(Outcome.Status.INVALID, invalid.status());
        assertEquals("bad building", invalid.message());
        assertEquals(Outcome.Status.FAILED, failed.status());
        assertEquals("down", failed.message());
        assertSame(cause, failed.cause());
    }
}
