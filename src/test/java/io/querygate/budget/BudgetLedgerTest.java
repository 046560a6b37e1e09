package io.querygate.budget;

import io.querygate.MutableClock;
import io.querygate.config.TenantLimits;
import io.querygate.config.TenantLimitsProvider;
import io.querygate.model.BudgetStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

final class BudgetLedgerTest {
    private static final long BUDGET = 10_000L;

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    private final BudgetLedger ledger = new BudgetLedger(
            new InMemoryUsageEventStore(),
            TenantLimitsProvider.fixed(new TenantLimits(BUDGET, 1_000L, 5_000L, 3, 10_000, 5, 3)),
            clock
    );

    @Test
    void checkAgainstNearlyExhaustedBudgetIsDenied() {
        ledger.record("acme", BUDGET - 1024L);

        BudgetStatus status = ledger.check("acme", 2048L);
        Assertions.assertFalse(status.allowed());
        Assertions.assertTrue(status.bytesRemaining() <= 1024L);
        Assertions.assertEquals(BUDGET - 1024L, status.bytesUsed());
        Assertions.assertEquals(BudgetLedger.OVER_BUDGET_SUGGESTION, status.suggestion());
    }

    @Test
    void allowedCheckReportsHeadroomAfterTheEstimate() {
        ledger.record("acme", 1_000L);

        BudgetStatus status = ledger.check("acme", 2_000L);
        Assertions.assertTrue(status.allowed());
        Assertions.assertEquals(3_000L, status.bytesUsed());
        Assertions.assertEquals(7_000L, status.bytesRemaining());
        Assertions.assertNull(status.suggestion());
    }

    @Test
    void estimateExactlyAtBudgetIsAllowed() {
        Assertions.assertTrue(ledger.check("acme", BUDGET).allowed());
        Assertions.assertFalse(ledger.check("acme", BUDGET + 1L).allowed());
    }

    @Test
    void checkNeverRecordsUsage() {
        ledger.check("acme", 4_000L);
        ledger.check("acme", 4_000L);
        Assertions.assertEquals(0L, ledger.usage("acme").bytesUsed());
    }

    @Test
    void usageDecaysOnceTheWindowPasses() {
        ledger.record("acme", 4_000L);
        Assertions.assertEquals(4_000L, ledger.usage("acme").bytesUsed());

        clock.advance(Duration.ofMinutes(30));
        ledger.record("acme", 1_000L);
        Assertions.assertEquals(5_000L, ledger.usage("acme").bytesUsed());

        clock.advance(Duration.ofMinutes(30));
        Assertions.assertEquals(1_000L, ledger.usage("acme").bytesUsed());

        clock.advance(Duration.ofMinutes(30));
        Assertions.assertEquals(0L, ledger.usage("acme").bytesUsed());
    }

    @Test
    void tenantsAreAccountedSeparately() {
        ledger.record("acme", 9_000L);
        Assertions.assertFalse(ledger.check("acme", 2_000L).allowed());
        Assertions.assertTrue(ledger.check("globex", 2_000L).allowed());
    }

    @Test
    void invalidArgumentsAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> ledger.check("acme", -1L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> ledger.record("acme", -1L));
        Assertions.assertThrows(IllegalArgumentException.class, () -> ledger.record(" ", 1L));
    }

    @Test
    void concurrentRecordsAreNotLost() throws Exception {
        BudgetLedger big = new BudgetLedger(
                new InMemoryUsageEventStore(),
                TenantLimitsProvider.fixed(TenantLimits.defaults()),
                clock
        );
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        big.record("acme", 1L);
                        big.check("acme", 1L);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }
        Assertions.assertEquals((long) threads * perThread, big.usage("acme").bytesUsed());
    }
}
