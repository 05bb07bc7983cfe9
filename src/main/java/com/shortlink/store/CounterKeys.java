package com.shortlink.store;

/**
 * Redis key layout shared by every process that increments, drains or leases visit counters.
 *
 * <p>All keys carry the same hash tag, so the multi-key Lua scripts stay on one slot in a
 * cluster. Bump {@link #VERSION} when the layout or value encoding changes; processes on
 * different versions then never read each other's counters.
 *
 * <pre>
 * {shortlink:v1}:visits:&lt;code&gt;     - String, pending visit delta for one code
 * {shortlink:v1}:visits:pending    - Set, codes that currently have a delta
 * {shortlink:v1}:reconciler:lease  - String, instance id of the lease holder (PX expiry)
 * </pre>
 */
public final class CounterKeys {

    public static final String VERSION = "v1";

    private static final String PREFIX = "{shortlink:" + VERSION + "}:";
    private static final String VISITS_PREFIX = PREFIX + "visits:";

    public static final String PENDING_CODES = VISITS_PREFIX + "pending";
    public static final String RECONCILER_LEASE = PREFIX + "reconciler:lease";

    private CounterKeys() {
    }

    public static String visits(String code) {
        return VISITS_PREFIX + code;
    }
}
