package com.shortlink.store;

import java.time.Duration;

/**
 * Time-bounded exclusive right to run a reconciliation pass. A holder that dies simply lets the
 * lease expire; another instance can take it after at most one TTL.
 */
public interface ReconciliationLease {

    /** @return {@code true} if {@code ownerId} now holds the lease */
    boolean tryAcquire(String ownerId, Duration ttl);

    /** @return {@code false} if the lease expired or is held by someone else */
    boolean renew(String ownerId, Duration ttl);

    /** Releases the lease if, and only if, {@code ownerId} still holds it. */
    void release(String ownerId);
}
