package co.fanki.routemigrator.shared;

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
    void whenRequire_givenFalseCondition_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.require(false, "Condition is false"));
    }

    @Test
    void whenRequireDomain_givenFalseCondition_shouldThrowDomainException() {
        final DomainException exception = assertThrows(DomainException.class,
                () -> Preconditions.requireDomain(false, "Domain error"));

        assertEquals(DomainException.MODEL_ERROR, exception.getErrorCode());
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
    void whenRequireSpanWithin_givenSpanEndingAtTextEnd_shouldNotThrow() {
        Preconditions.requireSpanWithin(3, 2, 5);
    }

    @Test
    void whenRequireSpanWithin_givenSpanPastTextEnd_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireSpanWithin(3, 3, 5));
    }

}
