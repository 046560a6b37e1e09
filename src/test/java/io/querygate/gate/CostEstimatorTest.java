package io.querygate.gate;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class CostEstimatorTest {
    private final CostEstimator estimator = new CostEstimator(5.0);

    @Test
    void estimateScalesWithTextLengthUpToJustAboveHardCap() {
        Assertions.assertEquals(8L * 2048L, estimator.estimateBytes("SELECT 1", 1_000_000L));
        Assertions.assertEquals(0L, estimator.estimateBytes(null, 1_000_000L));
        Assertions.assertEquals(101L, estimator.estimateBytes("SELECT 1", 100L));
        Assertions.assertEquals(8L * 2048L, estimator.estimateBytes("SELECT 1", Long.MAX_VALUE));
    }

    @Test
    void costIsPricedPerTebibyte() {
        long tib = 1024L * 1024L * 1024L * 1024L;
        Assertions.assertEquals(5.0, estimator.costUsd(tib));
        Assertions.assertEquals(2.5, estimator.costUsd(tib / 2));
        Assertions.assertEquals(0.0, estimator.costUsd(0L));
    }

    @Test
    void negativePriceIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new CostEstimator(-1.0));
    }
}
