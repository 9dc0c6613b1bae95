package org.Aayush.conformity.aggregate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Damping factors")
class DampingFactorTest {

    @ParameterizedTest
    @CsvSource({
            "1.0, 1",
            "2, 2",
            "1.5, 1.5",
            "0.25, 0.25",
            "100.0, 100",
            "1e-7, 0.0000001"
    })
    @DisplayName("Result keys use the plain decimal rendering")
    void testKeyRendering(double alpha, String expectedKey) {
        assertEquals(expectedKey, DampingFactor.keyOf(alpha));
        assertEquals(expectedKey, DampingFactor.of(alpha).key());
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0d, -1.0d, Double.NaN, Double.POSITIVE_INFINITY})
    @DisplayName("Non-positive and non-finite exponents are rejected")
    void testInvalidValues(double alpha) {
        assertFalse(DampingFactor.isValid(alpha));
        assertThrows(IllegalArgumentException.class, () -> DampingFactor.of(alpha));
    }

    @Test
    @DisplayName("Damping is distance to the negative alpha")
    void testDamping() {
        assertEquals(1.0d, DampingFactor.of(3.0d).damping(1), 1e-12);
        assertEquals(0.25d, DampingFactor.of(2.0d).damping(2), 1e-12);
        assertEquals(1.0d / 3.0d, DampingFactor.of(1.0d).damping(3), 1e-12);
    }
}
