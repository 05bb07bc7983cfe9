package com.shortlink.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.shortlink.dto.LinkStats;
import com.shortlink.dto.VisitContext;
import com.shortlink.exception.CounterStoreUnavailableException;
import com.shortlink.exception.LinkNotFoundException;
import com.shortlink.model.ShortLink;
import com.shortlink.store.LinkStore;
import com.shortlink.store.VisitCounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;

@Service
public class LinkService {

    private static final Logger log = LoggerFactory.getLogger(LinkService.class);

    private final LinkStore linkStore;
    private final VisitCounterStore visitCounterStore;
    private final VisitLogService visitLogService;
    private final Cache<String, String> targetUrlCache;

    public LinkService(LinkStore linkStore, VisitCounterStore visitCounterStore, VisitLogService visitLogService,
                       Cache<String, String> targetUrlCache) {
        this.linkStore = linkStore;
        this.visitCounterStore = visitCounterStore;
        this.visitLogService = visitLogService;
        this.targetUrlCache = targetUrlCache;
    }

    /**
     * Creates a link under a caller-chosen code and warms the redirect cache with it.
     *
     * @throws IllegalArgumentException if the code, the target URL or the owner is malformed
     * @throws com.shortlink.exception.LinkAlreadyExistsException if the code is taken
     */
    public ShortLink createLink(String code, String targetUrl, String owner) {
        validateCode(code);
        if (!isValidUrl(targetUrl)) {
            throw new IllegalArgumentException("Target URL must be an absolute http(s) URL: " + targetUrl);
        }
        if (owner != null && owner.length() > ShortLink.MAX_OWNER_LENGTH) {
            throw new IllegalArgumentException("Owner longer than " + ShortLink.MAX_OWNER_LENGTH + " characters");
        }

        ShortLink link = linkStore.create(code, targetUrl, owner);
        targetUrlCache.put(link.getCode(), link.getTargetUrl());
        log.info("Created short link {} -> {} (owner: {})", link.getCode(), link.getTargetUrl(), owner);
        return link;
    }

    /**
     * Resolves a code to its target URL and records one visit.
     * The visit is best-effort: a counter store failure never fails the resolution.
     *
     * @throws LinkNotFoundException if no link exists for the code
     * @throws com.shortlink.exception.DurableStoreUnavailableException if the link is not cached and the
     *         durable store cannot be reached
     */
    public String resolve(String code) {
        return resolve(code, null);
    }

    /**
     * Same as {@link #resolve(String)}, and also queues a visit log entry with the request details
     * when {@code context} is given.
     */
    public String resolve(String code, VisitContext context) {
        String targetUrl = targetUrlCache.getIfPresent(code);
        if (targetUrl == null) {
            log.debug("Cache miss for {}", code);
            ShortLink link = linkStore.get(code).orElseThrow(() -> new LinkNotFoundException(code));
            targetUrl = link.getTargetUrl();
            targetUrlCache.put(code, targetUrl);
        }

        recordVisit(code);
        if (context != null) {
            logVisit(code, context);
        }
        return targetUrl;
    }

    private void recordVisit(String code) {
        try {
            long delta = visitCounterStore.increment(code, 1L);
            log.trace("Recorded visit for {}, pending delta {}", code, delta);
        } catch (RuntimeException e) {
            // Visit counts are secondary; don't let them break the redirect
            log.warn("Failed to record visit for {}: {}", code, e.getMessage());
        }
    }

    private void logVisit(String code, VisitContext context) {
        try {
            visitLogService.record(code, context);
        } catch (RuntimeException e) {
            log.warn("Failed to queue visit log for {}: {}", code, e.getMessage());
        }
    }

    /**
     * Committed plus still-pending visits for one link, with its latest logged visits.
     * Pending visits read as 0 while the counter store is unreachable.
     *
     * @throws LinkNotFoundException if no link exists for the code
     */
    public LinkStats getLinkStats(String code) {
        ShortLink link = linkStore.get(code).orElseThrow(() -> new LinkNotFoundException(code));
        return toStats(link);
    }

    public List<LinkStats> getOwnerStats(String owner) {
        return linkStore.findByOwner(owner).stream()
                .map(this::toStats)
                .toList();
    }

    private LinkStats toStats(ShortLink link) {
        long pending;
        try {
            pending = visitCounterStore.pendingDelta(link.getCode());
        } catch (CounterStoreUnavailableException e) {
            log.warn("Pending visits of {} unavailable, reporting committed count only: {}",
                    link.getCode(), e.getMessage());
            pending = 0L;
        }
        return new LinkStats(link.getCode(), link.getTargetUrl(), link.getOwner(), link.getCreatedAt(),
                link.getVisitCount(), pending, visitLogService.recentVisits(link.getCode()));
    }

    private static void validateCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Short code must not be blank");
        }
        if (code.length() > ShortLink.MAX_CODE_LENGTH) {
            throw new IllegalArgumentException("Short code longer than " + ShortLink.MAX_CODE_LENGTH + " characters: " + code);
        }
        if (code.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Short code must not contain whitespace: " + code);
        }
    }

    private static boolean isValidUrl(String url) {
        if (url == null || url.length() > ShortLink.MAX_TARGET_URL_LENGTH) {
            return false;
        }
        try {
            URI uri = new URI(url).parseServerAuthority();
            String scheme = uri.getScheme();
            return uri.getHost() != null
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
