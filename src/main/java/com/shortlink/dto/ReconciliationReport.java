package com.shortlink.dto;

/**
 * Outcome of one reconciliation pass.
 *
 * @param mergedCodes   codes whose delta was added to the durable count
 * @param mergedVisits  sum of those deltas
 * @param deferredCodes codes left for the next pass (counter unreachable or merge failed and was re-added)
 * @param droppedVisits visits that could not be kept: orphaned deltas, or a failed compensation
 */
public record ReconciliationReport(Status status, int mergedCodes, long mergedVisits,
                                   int deferredCodes, long droppedVisits) {

    public enum Status {
        /** Every pending code was visited. */
        COMPLETED,
        /** Another instance holds the lease; nothing was touched. */
        LEASE_DENIED,
        /** The lease expired or was taken over mid-pass; remaining codes wait for the next pass. */
        LEASE_LOST,
        /** Shutdown was requested between two codes. */
        STOPPED,
        /** The pass could not start: counter store unreachable, a pass already running, or shutting down. */
        SKIPPED
    }

    public static ReconciliationReport of(Status status) {
        return new ReconciliationReport(status, 0, 0L, 0, 0L);
    }
}
