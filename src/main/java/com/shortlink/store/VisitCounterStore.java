package com.shortlink.store;

import java.util.Set;

/**
 * Shared, process-independent store of pending visit deltas.
 *
 * <p>Every operation is a single atomic primitive on the server side. Connectivity problems
 * surface as {@link com.shortlink.exception.CounterStoreUnavailableException}.
 */
public interface VisitCounterStore {

    /**
     * Atomically adds {@code by} to the delta of {@code code} and marks it pending.
     * Also used for compensating re-adds after a failed merge.
     *
     * @return the delta after the increment
     */
    long increment(String code, long by);

    /**
     * Atomically reads the delta of {@code code} and resets it to zero.
     * An increment racing with this call lands either in the returned value or in the next delta, never both.
     *
     * @return the delta before the reset, 0 when nothing was pending
     */
    long takeAndReset(String code);

    /** Codes that currently carry a delta. */
    Set<String> pendingCodes();

    /** Non-destructive read of the current delta, 0 when absent. */
    long pendingDelta(String code);
}
