package com.shortlink.service;

import com.shortlink.dto.RecentVisit;
import com.shortlink.dto.VisitContext;
import com.shortlink.model.Visit;
import com.shortlink.repository.VisitRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Per-visit log written off the redirect path. Losing a log row never affects the visit count,
 * which is kept by the counter store and the reconciler.
 */
@Service
public class VisitLogService {

    private static final Logger log = LoggerFactory.getLogger(VisitLogService.class);

    private final VisitRepository visitRepository;
    private final Clock clock;
    private final int recentLimit;

    public VisitLogService(VisitRepository visitRepository,
                           Clock clock,
                           @Value("${app.visits.recent-limit:10}") int recentLimit) {
        this.visitRepository = visitRepository;
        this.clock = clock;
        this.recentLimit = recentLimit;
    }

    @Async("visitLogExecutor")
    public void record(String code, VisitContext context) {
        try {
            visitRepository.save(toVisit(code, context, Instant.now(clock)));
        } catch (DataAccessException | TransactionException e) {
            log.warn("Failed to log visit for {}: {}", code, e.getMessage());
        }
    }

    /**
     * Latest logged visits for a code, newest first. Empty when the log cannot be read.
     */
    public List<RecentVisit> recentVisits(String code) {
        if (recentLimit <= 0) {
            return List.of();
        }
        try {
            return visitRepository.findByCodeOrderByVisitedAtDesc(code, PageRequest.of(0, recentLimit)).stream()
                    .map(visit -> new RecentVisit(visit.getVisitedAt(), visit.getIpAddress(), visit.getUserAgent(),
                            visit.getReferrer(), visit.getCountry(), visit.getCity()))
                    .toList();
        } catch (DataAccessException | TransactionException e) {
            log.warn("Failed to read recent visits for {}: {}", code, e.getMessage());
            return List.of();
        }
    }

    static Visit toVisit(String code, VisitContext context, Instant visitedAt) {
        return new Visit(code, visitedAt,
                truncate(context.ipAddress(), Visit.MAX_IP_ADDRESS_LENGTH),
                truncate(context.userAgent(), Visit.MAX_USER_AGENT_LENGTH),
                truncate(context.referrer(), Visit.MAX_REFERRER_LENGTH),
                countryCode(context.country()),
                truncate(context.city(), Visit.MAX_CITY_LENGTH));
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    // Only ISO 3166 alpha-2 codes fit the column; anything else is dropped
    private static String countryCode(String country) {
        if (country == null || country.length() != Visit.COUNTRY_LENGTH) {
            return null;
        }
        return country.toUpperCase(Locale.ROOT);
    }
}
