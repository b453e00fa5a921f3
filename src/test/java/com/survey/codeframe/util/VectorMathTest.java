package com.survey.codeframe.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VectorMathTest {

    @Test
    void testCosineSimilarity() {
        assertEquals(1.0, VectorMath.cosineSimilarity(new float[]{1f, 2f}, new float[]{2f, 4f}), 1e-9);
        assertEquals(0.0, VectorMath.cosineSimilarity(new float[]{1f, 0f}, new float[]{0f, 3f}), 1e-9);
        assertEquals(-1.0, VectorMath.cosineSimilarity(new float[]{1f, 0f}, new float[]{-1f, 0f}), 1e-9);
    }

    @Test
    void testZeroVectorHasNoSimilarity() {
        assertEquals(0.0, VectorMath.cosineSimilarity(new float[]{0f, 0f}, new float[]{1f, 1f}));
    }

    @Test
    void testEuclideanDistance() {
        assertEquals(5.0, VectorMath.euclideanDistance(new float[]{0f, 0f}, new float[]{3f, 4f}), 1e-9);
    }

    @Test
    void testCentroid() {
        assertArrayEquals(new float[]{1f, 2f},
                VectorMath.centroid(List.of(new float[]{0f, 0f}, new float[]{2f, 4f})));
    }

    @Test
    void testDimensionMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> VectorMath.cosineSimilarity(new float[]{1f}, new float[]{1f, 2f}));
        assertThrows(IllegalArgumentException.class, () -> VectorMath.centroid(List.of()));
    }
}
