package com.shortlink.store;

import com.shortlink.exception.CounterStoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * {@link VisitCounterStore} on Redis. The counter and the pending index are always changed
 * together inside one Lua script, so a code is listed as pending exactly while it has a delta.
 */
@Component
public class RedisVisitCounterStore implements VisitCounterStore {

    private static final Logger log = LoggerFactory.getLogger(RedisVisitCounterStore.class);

    // KEYS[1] = visits key, KEYS[2] = pending set; ARGV[1] = amount, ARGV[2] = code
    static final RedisScript<Long> INCREMENT_SCRIPT = RedisScript.of(
            "local v = redis.call('INCRBY', KEYS[1], ARGV[1]) " +
            "redis.call('SADD', KEYS[2], ARGV[2]) " +
            "return v", Long.class);

    // KEYS[1] = visits key, KEYS[2] = pending set; ARGV[1] = code
    static final RedisScript<Long> TAKE_AND_RESET_SCRIPT = RedisScript.of(
            "local v = redis.call('GET', KEYS[1]) " +
            "redis.call('DEL', KEYS[1]) " +
            "redis.call('SREM', KEYS[2], ARGV[1]) " +
            "if v then return tonumber(v) end " +
            "return 0", Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisVisitCounterStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public long increment(String code, long by) {
        try {
            Long value = redisTemplate.execute(INCREMENT_SCRIPT,
                    List.of(CounterKeys.visits(code), CounterKeys.PENDING_CODES),
                    Long.toString(by), code);
            return value == null ? 0L : value;
        } catch (DataAccessException e) {
            throw new CounterStoreUnavailableException("Failed to increment visits of " + code + " by " + by, e);
        }
    }

    @Override
    public long takeAndReset(String code) {
        try {
            Long value = redisTemplate.execute(TAKE_AND_RESET_SCRIPT,
                    List.of(CounterKeys.visits(code), CounterKeys.PENDING_CODES),
                    code);
            return value == null ? 0L : value;
        } catch (DataAccessException e) {
            throw new CounterStoreUnavailableException("Failed to drain visits of " + code, e);
        }
    }

    @Override
    public Set<String> pendingCodes() {
        try {
            Set<String> codes = redisTemplate.opsForSet().members(CounterKeys.PENDING_CODES);
            return codes == null ? Set.of() : codes;
        } catch (DataAccessException e) {
            throw new CounterStoreUnavailableException("Failed to list pending visit counters", e);
        }
    }

    @Override
    public long pendingDelta(String code) {
        String raw;
        try {
            raw = redisTemplate.opsForValue().get(CounterKeys.visits(code));
        } catch (DataAccessException e) {
            throw new CounterStoreUnavailableException("Failed to read visits of " + code, e);
        }
        if (raw == null) {
            return 0L;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            // Only INCRBY writes these keys, so this means someone wrote to our namespace by hand
            log.error("Visit counter for {} is not numeric: {}", code, raw);
            return 0L;
        }
    }
}
