package com.shortlink.service;

import com.shortlink.dto.ReconciliationReport;
import com.shortlink.dto.ReconciliationReport.Status;
import com.shortlink.exception.CounterStoreUnavailableException;
import com.shortlink.exception.LinkNotFoundException;
import com.shortlink.store.LinkStore;
import com.shortlink.store.ReconciliationLease;
import com.shortlink.store.VisitCounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodically folds the pending visit deltas from the counter store into the durable visit counts.
 *
 * <p>Per code the unit of work is: atomically take-and-reset the delta, add it to the durable count,
 * and on any merge failure re-add it to the counter store so the next pass retries it. Codes are
 * independent; one failing code never aborts the pass. Only the instance holding the
 * {@link ReconciliationLease} runs a pass.
 *
 * <p>Shutdown is only honoured between two units, so a delta is never left taken but unmerged.
 */
@Service
public class VisitReconciliationService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(VisitReconciliationService.class);

    private static final String MDC_PASS_KEY = "reconcilePass";

    private final LinkStore linkStore;
    private final VisitCounterStore visitCounterStore;
    private final ReconciliationLease lease;
    private final String instanceId;
    private final Duration leaseTtl;
    private final Duration shutdownTimeout;
    private final long pendingWarnThreshold;

    private final ReentrantLock passLock = new ReentrantLock();
    private volatile boolean running;
    private volatile boolean stopping;
    private int consecutiveDeferredPasses;

    public VisitReconciliationService(LinkStore linkStore,
                                      VisitCounterStore visitCounterStore,
                                      ReconciliationLease lease,
                                      @Value("${app.reconciler.instance-id:}") String instanceId,
                                      @Value("${app.reconciler.lease-ttl:PT2M}") Duration leaseTtl,
                                      @Value("${app.reconciler.shutdown-timeout:PT30S}") Duration shutdownTimeout,
                                      @Value("${app.reconciler.pending-warn-threshold:100000}") long pendingWarnThreshold) {
        this.linkStore = linkStore;
        this.visitCounterStore = visitCounterStore;
        this.lease = lease;
        this.instanceId = (instanceId == null || instanceId.isBlank()) ? "reconciler-" + UUID.randomUUID() : instanceId;
        this.leaseTtl = leaseTtl;
        this.shutdownTimeout = shutdownTimeout;
        this.pendingWarnThreshold = pendingWarnThreshold;
    }

    @Scheduled(fixedDelayString = "${app.reconciler.interval:PT5M}",
            initialDelayString = "${app.reconciler.initial-delay:PT1M}")
    public void scheduledReconcile() {
        try {
            reconcile();
        } catch (RuntimeException e) {
            // Keep the schedule alive; the next pass picks up whatever is still pending
            log.error("Unexpected error during visit reconciliation: {}", e.getMessage(), e);
        }
    }

    /**
     * Runs one reconciliation pass over every code with a pending delta.
     */
    public ReconciliationReport reconcile() {
        if (stopping) {
            return ReconciliationReport.of(Status.SKIPPED);
        }
        if (!passLock.tryLock()) {
            log.debug("Reconciliation pass already running in this process, skipping");
            return ReconciliationReport.of(Status.SKIPPED);
        }
        MDC.put(MDC_PASS_KEY, UUID.randomUUID().toString().substring(0, 8));
        try {
            return runPass();
        } finally {
            MDC.remove(MDC_PASS_KEY);
            passLock.unlock();
        }
    }

    private ReconciliationReport runPass() {
        try {
            if (!lease.tryAcquire(instanceId, leaseTtl)) {
                log.debug("Reconciliation lease held by another instance, skipping this cycle");
                return ReconciliationReport.of(Status.LEASE_DENIED);
            }
        } catch (CounterStoreUnavailableException e) {
            log.warn("Could not acquire reconciliation lease, skipping this cycle: {}", e.getMessage());
            return ReconciliationReport.of(Status.SKIPPED);
        }

        try {
            Set<String> codes;
            try {
                codes = visitCounterStore.pendingCodes();
            } catch (CounterStoreUnavailableException e) {
                log.warn("Could not list pending visit counters, skipping this cycle: {}", e.getMessage());
                return ReconciliationReport.of(Status.SKIPPED);
            }

            if (codes.isEmpty()) {
                log.trace("No pending visit deltas");
                consecutiveDeferredPasses = 0;
                return ReconciliationReport.of(Status.COMPLETED);
            }

            log.debug("Reconciling {} pending codes", codes.size());
            PassTally tally = new PassTally();
            Status status = Status.COMPLETED;
            for (String code : codes) {
                if (stopping) {
                    log.info("Shutdown requested, stopping reconciliation pass before {}", code);
                    status = Status.STOPPED;
                    break;
                }
                if (!renewLease()) {
                    status = Status.LEASE_LOST;
                    break;
                }
                reconcileCode(code, tally);
            }

            ReconciliationReport report = new ReconciliationReport(status, tally.mergedCodes, tally.mergedVisits,
                    tally.deferredCodes, tally.droppedVisits);
            logSummary(report);
            return report;
        } finally {
            releaseLease();
        }
    }

    private void reconcileCode(String code, PassTally tally) {
        long delta;
        try {
            delta = visitCounterStore.takeAndReset(code);
        } catch (CounterStoreUnavailableException e) {
            log.warn("Could not drain visits of {}, retrying next cycle: {}", code, e.getMessage());
            tally.deferredCodes++;
            return;
        }

        if (delta == 0) {
            return;
        }
        if (delta < 0) {
            // Only increments write these counters; a negative value cannot be applied to a non-decreasing count
            log.error("Discarding negative visit delta {} for {}", delta, code);
            tally.droppedVisits += -delta;
            return;
        }
        if (delta >= pendingWarnThreshold) {
            log.warn("Large visit delta {} drained for {}; reconciliation may be lagging", delta, code);
        }

        try {
            linkStore.addToVisitCount(code, delta);
            tally.mergedCodes++;
            tally.mergedVisits += delta;
            log.debug("Merged {} visits into {}", delta, code);
        } catch (LinkNotFoundException e) {
            log.warn("Dropping {} visits for {}: no durable link with that code", delta, code);
            tally.droppedVisits += delta;
        } catch (RuntimeException e) {
            log.warn("Failed to merge {} visits into {}, re-adding to counter: {}", delta, code, e.getMessage());
            compensate(code, delta, tally);
        }
    }

    private void compensate(String code, long delta, PassTally tally) {
        try {
            visitCounterStore.increment(code, delta);
            tally.deferredCodes++;
        } catch (RuntimeException e) {
            log.error("LOST {} visits for {}: merge failed and compensating re-add failed", delta, code, e);
            tally.droppedVisits += delta;
        }
    }

    private boolean renewLease() {
        try {
            if (lease.renew(instanceId, leaseTtl)) {
                return true;
            }
            log.warn("Reconciliation lease expired mid-pass, leaving remaining codes for the next holder");
        } catch (CounterStoreUnavailableException e) {
            log.warn("Could not renew reconciliation lease, stopping pass: {}", e.getMessage());
        }
        return false;
    }

    private void releaseLease() {
        try {
            lease.release(instanceId);
        } catch (CounterStoreUnavailableException e) {
            log.warn("Could not release reconciliation lease, it will expire in {}: {}", leaseTtl, e.getMessage());
        }
    }

    private void logSummary(ReconciliationReport report) {
        if (report.deferredCodes() > 0) {
            consecutiveDeferredPasses++;
            if (consecutiveDeferredPasses > 1) {
                log.warn("{} consecutive reconciliation passes left deltas behind; pending visits are accumulating",
                        consecutiveDeferredPasses);
            }
        } else {
            consecutiveDeferredPasses = 0;
        }
        log.info("Reconciliation pass {}: merged {} visits across {} codes, {} codes deferred, {} visits dropped",
                report.status(), report.mergedVisits(), report.mergedCodes(), report.deferredCodes(),
                report.droppedVisits());
    }

    public String getInstanceId() {
        return instanceId;
    }

    @Override
    public void start() {
        stopping = false;
        running = true;
    }

    @Override
    public void stop() {
        stopping = true;
        try {
            // Wait for an in-flight pass to finish its current code
            if (passLock.tryLock(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                passLock.unlock();
            } else {
                log.warn("Reconciliation pass still running after {}", shutdownTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private static final class PassTally {
        int mergedCodes;
        long mergedVisits;
        int deferredCodes;
        long droppedVisits;
    }
}
