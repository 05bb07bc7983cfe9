package com.shortlink.store;

import com.shortlink.exception.CounterStoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Lease kept as a Redis string holding the owner id with a PX expiry.
 * Renew and release compare the owner first, so an instance can never extend or drop a lease it lost.
 */
@Component
public class RedisReconciliationLease implements ReconciliationLease {

    private static final Logger log = LoggerFactory.getLogger(RedisReconciliationLease.class);

    // KEYS[1] = lease key; ARGV[1] = owner id, ARGV[2] = ttl millis
    static final RedisScript<Long> RENEW_SCRIPT = RedisScript.of(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then " +
            "    return redis.call('PEXPIRE', KEYS[1], ARGV[2]) " +
            "end " +
            "return 0", Long.class);

    // KEYS[1] = lease key; ARGV[1] = owner id
    static final RedisScript<Long> RELEASE_SCRIPT = RedisScript.of(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then " +
            "    return redis.call('DEL', KEYS[1]) " +
            "end " +
            "return 0", Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisReconciliationLease(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public boolean tryAcquire(String ownerId, Duration ttl) {
        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(CounterKeys.RECONCILER_LEASE, ownerId, ttl);
            return Boolean.TRUE.equals(acquired);
        } catch (DataAccessException e) {
            throw new CounterStoreUnavailableException("Failed to acquire reconciliation lease for " + ownerId, e);
        }
    }

    @Override
    public boolean renew(String ownerId, Duration ttl) {
        try {
            Long renewed = redisTemplate.execute(RENEW_SCRIPT, List.of(CounterKeys.RECONCILER_LEASE),
                    ownerId, Long.toString(ttl.toMillis()));
            return renewed != null && renewed == 1L;
        } catch (DataAccessException e) {
            throw new CounterStoreUnavailableException("Failed to renew reconciliation lease for " + ownerId, e);
        }
    }

    @Override
    public void release(String ownerId) {
        try {
            Long released = redisTemplate.execute(RELEASE_SCRIPT, List.of(CounterKeys.RECONCILER_LEASE), ownerId);
            if (released == null || released == 0L) {
                log.debug("Reconciliation lease was no longer held by {} at release", ownerId);
            }
        } catch (DataAccessException e) {
            throw new CounterStoreUnavailableException("Failed to release reconciliation lease for " + ownerId, e);
        }
    }
}
