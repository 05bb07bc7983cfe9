package com.shortlink.store;

import com.shortlink.model.ShortLink;

import java.util.List;
import java.util.Optional;

/**
 * Authoritative mapping from short code to target URL plus the last committed visit count.
 *
 * <p>Implementations report connectivity problems as
 * {@link com.shortlink.exception.DurableStoreUnavailableException}.
 */
public interface LinkStore {

    Optional<ShortLink> get(String code);

    /**
     * @throws com.shortlink.exception.LinkAlreadyExistsException if the code is taken
     */
    ShortLink create(String code, String targetUrl, String owner);

    /**
     * Applies {@code visit_count = visit_count + delta}.
     *
     * @throws com.shortlink.exception.LinkNotFoundException if the code does not exist
     */
    void addToVisitCount(String code, long delta);

    List<ShortLink> findByOwner(String owner);
}
