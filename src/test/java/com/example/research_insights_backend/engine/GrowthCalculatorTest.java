package com.example.research_insights_backend.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GrowthCalculatorTest {

    @Test
    public void testZeroCases() {
        assertEquals(0d, GrowthCalculator.growth(0, 0));
        assertEquals(Double.POSITIVE_INFINITY, GrowthCalculator.growth(0, 3));
        assertEquals(0d, GrowthCalculator.growth(4, 0));
    }

    @Test
    public void testRatio() {
        assertEquals(2d, GrowthCalculator.growth(3, 6));
        assertEquals(0.5d, GrowthCalculator.growth(4, 2));
    }

    @Test
    public void testNeverNegative() {
        for (long a = -2; a <= 5; a++) {
            for (long b = -2; b <= 5; b++) {
                double g = GrowthCalculator.growth(a, b);
                assertTrue(g >= 0d, "growth(" + a + "," + b + ")=" + g);
            }
        }
    }
}
