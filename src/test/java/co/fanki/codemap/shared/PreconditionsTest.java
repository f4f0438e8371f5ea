package co.fanki.codemap.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for Preconditions utility.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PreconditionsTest {

    @Test
    void whenRequireNonNull_givenNonNullValue_shouldReturnValue() {
        final String value = "test";

        final String result = Preconditions.requireNonNull(value, "message");

        assertEquals(value, result);
    }

    @Test
    void whenRequireNonNull_givenNullValue_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonNull(null, "Value is null"));
    }

    @Test
    void whenRequireNonBlank_givenBlankString_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank("  ", "String is blank"));
    }

    @Test
    void whenRequireNonBlank_givenNullString_shouldThrowException() {
        final IllegalArgumentException ex = assertThrows(
                IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank(null, "Path is required"));

        assertEquals("Path is required", ex.getMessage());
    }

    @Test
    void whenRequire_givenFalseCondition_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.require(false, "Condition is false"));
    }

    @Test
    void whenRequirePositive_givenZero_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requirePositive(0, "Not positive"));
    }

    @Test
    void whenRequireNonNegative_givenZero_shouldReturnZero() {
        assertEquals(0, Preconditions.requireNonNegative(0, "message"));
    }

    @Test
    void whenRequireNonNegative_givenNegative_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonNegative(-1, "Negative"));
    }

    @Test
    void whenCreatingDomainException_givenNoCode_shouldUseDomainError() {
        final DomainException ex = new DomainException("boom");

        assertEquals("DOMAIN_ERROR", ex.getErrorCode());
    }

}
