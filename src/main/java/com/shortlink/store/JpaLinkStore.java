package com.shortlink.store;

import com.shortlink.exception.DurableStoreUnavailableException;
import com.shortlink.exception.LinkAlreadyExistsException;
import com.shortlink.exception.LinkNotFoundException;
import com.shortlink.model.ShortLink;
import com.shortlink.repository.ShortLinkRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link LinkStore} backed by the {@code short_links} table through Spring Data JPA.
 * Spring data and transaction exceptions are translated here so services only see the domain errors.
 */
@Component
public class JpaLinkStore implements LinkStore {

    private static final Logger log = LoggerFactory.getLogger(JpaLinkStore.class);

    private final ShortLinkRepository repository;
    private final Clock clock;

    public JpaLinkStore(ShortLinkRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public Optional<ShortLink> get(String code) {
        try {
            return repository.findById(code);
        } catch (DataAccessException | TransactionException e) {
            throw new DurableStoreUnavailableException("Failed to load short link " + code, e);
        }
    }

    @Override
    public ShortLink create(String code, String targetUrl, String owner) {
        try {
            if (repository.existsById(code)) {
                throw new LinkAlreadyExistsException(code);
            }
            ShortLink link = new ShortLink(code, targetUrl, owner, Instant.now(clock));
            return repository.saveAndFlush(link);
        } catch (DataIntegrityViolationException e) {
            // Also raised for values the columns reject, so only a row that is now present means a duplicate
            if (existsAfterViolation(code)) {
                log.debug("Lost the race against a concurrent create of {}", code, e);
                throw new LinkAlreadyExistsException(code, e);
            }
            throw new IllegalArgumentException("Short link " + code + " rejected by the link store: "
                    + e.getMostSpecificCause().getMessage(), e);
        } catch (DataAccessException | TransactionException e) {
            throw new DurableStoreUnavailableException("Failed to create short link " + code, e);
        }
    }

    private boolean existsAfterViolation(String code) {
        try {
            return repository.existsById(code);
        } catch (DataAccessException | TransactionException e) {
            throw new DurableStoreUnavailableException("Failed to check short link " + code, e);
        }
    }

    @Override
    public void addToVisitCount(String code, long delta) {
        int updated;
        try {
            updated = repository.addToVisitCount(code, delta);
        } catch (DataAccessException | TransactionException e) {
            throw new DurableStoreUnavailableException("Failed to add " + delta + " visits to " + code, e);
        }
        if (updated == 0) {
            throw new LinkNotFoundException(code);
        }
    }

    @Override
    public List<ShortLink> findByOwner(String owner) {
        try {
            return repository.findByOwnerOrderByCreatedAtDesc(owner);
        } catch (DataAccessException | TransactionException e) {
            throw new DurableStoreUnavailableException("Failed to list short links of owner " + owner, e);
        }
    }
}
