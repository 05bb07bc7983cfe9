package com.shortlink.dto;

import java.time.Instant;

public record RecentVisit(Instant visitedAt, String ipAddress, String userAgent, String referrer,
                          String country, String city) {
}
