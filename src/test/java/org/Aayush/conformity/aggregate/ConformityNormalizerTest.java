package org.Aayush.conformity.aggregate;

import org.Aayush.conformity.core.ConformityCore;
import org.Aayush.conformity.core.ConformityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Per-node normalization")
class ConformityNormalizerTest {

    private final ConformityNormalizer normalizer = new ConformityNormalizer();

    @Test
    @DisplayName("Divisor is the damping mass up to the node's depth")
    void testDivisor() {
        assertEquals(1.0d + 0.5d + 1.0d / 3.0d, ConformityNormalizer.divisor(DampingFactor.of(1.0d), 3), 1e-12);
        assertEquals(1.0d + 0.25d, ConformityNormalizer.divisor(DampingFactor.of(2.0d), 2), 1e-12);
        assertEquals(1.0d, ConformityNormalizer.divisor(DampingFactor.of(5.0d), 1), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> ConformityNormalizer.divisor(DampingFactor.of(1.0d), 0));
    }

    @Test
    @DisplayName("Each alpha slot is divided by its own divisor")
    void testNormalizesPerAlpha() {
        List<DampingFactor> alphas = List.of(DampingFactor.of(1.0d), DampingFactor.of(2.0d));
        NodeAccumulator accumulator = new NodeAccumulator(0, 2, 2);
        accumulator.add(0, 0, 1.5d);
        accumulator.add(0, 1, -0.75d);
        accumulator.add(1, 0, 1.25d);

        normalizer.normalize(accumulator, 2, alphas);

        assertEquals(1.0d, accumulator.value(0, 0), 1e-12);
        assertEquals(-0.5d, accumulator.value(0, 1), 1e-12);
        assertEquals(1.0d, accumulator.value(1, 0), 1e-12);
        assertEquals(0.0d, accumulator.value(1, 1), 1e-12);
    }

    @Test
    @DisplayName("Node with depth 0 keeps its zero scores")
    void testUnreachableNodeUntouched() {
        NodeAccumulator accumulator = new NodeAccumulator(3, 1, 1);

        normalizer.normalize(accumulator, 0, List.of(DampingFactor.of(1.0d)));

        assertEquals(0.0d, accumulator.value(0, 0));
    }

    @Test
    @DisplayName("Non-finite normalized score is a numeric safety breach")
    void testNumericSafety() {
        NodeAccumulator accumulator = new NodeAccumulator(4, 1, 1);
        accumulator.add(0, 0, Double.NaN);

        ConformityException ex = assertThrows(
                ConformityException.class,
                () -> normalizer.normalize(accumulator, 1, List.of(DampingFactor.of(1.0d)))
        );
        assertEquals(ConformityCore.REASON_NUMERIC_SAFETY_BREACH, ex.reasonCode());
        assertEquals(ConformityException.ErrorKind.EXECUTION_FAILURE, ex.errorKind());
    }

    @Test
    @DisplayName("Out-of-range counter honors the tolerance")
    void testOutOfRangeCount() {
        NodeAccumulator accumulator = new NodeAccumulator(0, 1, 3);
        accumulator.add(0, 0, 1.0d + 1e-12);
        accumulator.add(0, 1, -1.5d);
        accumulator.add(0, 2, 0.3d);

        assertEquals(1, accumulator.outOfRangeCount(1e-9));
    }
}
