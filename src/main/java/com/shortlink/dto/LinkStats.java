package com.shortlink.dto;

import java.time.Instant;
import java.util.List;

// committedVisits comes from the durable store, pendingVisits from the counter store
public record LinkStats(String code, String targetUrl, String owner, Instant createdAt,
                        long committedVisits, long pendingVisits, List<RecentVisit> recentVisits) {

    public long totalVisits() {
        return committedVisits + pendingVisits;
    }
}
