package com.shortlink.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.shortlink.dto.LinkStats;
import com.shortlink.dto.RecentVisit;
import com.shortlink.dto.VisitContext;
import com.shortlink.exception.CounterStoreUnavailableException;
import com.shortlink.exception.DurableStoreUnavailableException;
import com.shortlink.exception.LinkAlreadyExistsException;
import com.shortlink.exception.LinkNotFoundException;
import com.shortlink.model.ShortLink;
import com.shortlink.store.LinkStore;
import com.shortlink.store.VisitCounterStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LinkServiceTest {

    @Mock
    private LinkStore linkStore;

    @Mock
    private VisitCounterStore visitCounterStore;

    @Mock
    private VisitLogService visitLogService;

    private Cache<String, String> targetUrlCache;

    private LinkService linkService;

    private static final String CODE = "abc123";
    private static final String TARGET_URL = "https://example.com/x";

    @BeforeEach
    void setUp() {
        // Real cache: it is a plain in-memory structure and mocking it would hide eviction/put behaviour
        targetUrlCache = Caffeine.newBuilder().maximumSize(100).build();
        linkService = new LinkService(linkStore, visitCounterStore, visitLogService, targetUrlCache);
    }

    private static ShortLink link(String code, String targetUrl, String owner, long visits) {
        ShortLink link = new ShortLink(code, targetUrl, owner, Instant.parse("2024-05-01T10:00:00Z"));
        ReflectionTestUtils.setField(link, "visitCount", visits);
        return link;
    }

    // --- resolve ---

    @Test
    void resolve_whenCacheMiss_shouldLoadFromStoreCacheAndRecordVisit() {
        // Arrange
        when(linkStore.get(CODE)).thenReturn(Optional.of(link(CODE, TARGET_URL, null, 0)));
        when(visitCounterStore.increment(CODE, 1L)).thenReturn(1L);

        // Act
        String resolved = linkService.resolve(CODE);

        // Assert
        assertThat(resolved).isEqualTo(TARGET_URL);
        assertThat(targetUrlCache.getIfPresent(CODE)).isEqualTo(TARGET_URL);
        verify(linkStore, times(1)).get(CODE);
        verify(visitCounterStore, times(1)).increment(CODE, 1L);
    }

    @Test
    void resolve_whenCached_shouldNotTouchDurableStoreButStillRecordVisit() {
        // Arrange
        targetUrlCache.put(CODE, TARGET_URL);

        // Act
        String first = linkService.resolve(CODE);
        String second = linkService.resolve(CODE);

        // Assert
        assertThat(first).isEqualTo(TARGET_URL);
        assertThat(second).isEqualTo(TARGET_URL);
        verify(linkStore, never()).get(anyString());
        verify(visitCounterStore, times(2)).increment(CODE, 1L);
    }

    @Test
    void resolve_whenCodeUnknown_shouldThrowNotFoundAndNotCount() {
        // Arrange
        when(linkStore.get("zzz999")).thenReturn(Optional.empty());

        // Act & Assert
        assertThatThrownBy(() -> linkService.resolve("zzz999"))
                .isInstanceOf(LinkNotFoundException.class)
                .hasMessageContaining("zzz999");

        verifyNoInteractions(visitCounterStore);
        assertThat(targetUrlCache.getIfPresent("zzz999")).isNull();
    }

    @Test
    void resolve_whenCounterStoreDown_shouldStillReturnTarget() {
        // Arrange
        targetUrlCache.put(CODE, TARGET_URL);
        when(visitCounterStore.increment(CODE, 1L))
                .thenThrow(new CounterStoreUnavailableException("timeout", null));

        // Act & Assert
        assertThat(linkService.resolve(CODE)).isEqualTo(TARGET_URL);
        verify(visitCounterStore).increment(CODE, 1L);
    }

    @Test
    void resolve_whenDurableStoreDownOnMiss_shouldSurfaceFailure() {
        // Arrange
        when(linkStore.get(CODE)).thenThrow(new DurableStoreUnavailableException("db down", null));

        // Act & Assert
        assertThatThrownBy(() -> linkService.resolve(CODE))
                .isInstanceOf(DurableStoreUnavailableException.class);
        verify(visitCounterStore, never()).increment(anyString(), anyLong());
    }

    @Test
    void resolve_whenDurableStoreDownButCached_shouldServeFromCache() {
        // Arrange
        targetUrlCache.put(CODE, TARGET_URL);
        lenient().when(linkStore.get(CODE)).thenThrow(new DurableStoreUnavailableException("db down", null));

        // Act & Assert
        assertThat(linkService.resolve(CODE)).isEqualTo(TARGET_URL);
    }

    @Test
    void resolve_withContext_shouldQueueVisitLogEntry() {
        // Arrange
        targetUrlCache.put(CODE, TARGET_URL);
        VisitContext context = new VisitContext("203.0.113.7", "curl/8.5", "https://ref.example", "DE", "Berlin");

        // Act
        String resolved = linkService.resolve(CODE, context);

        // Assert
        assertThat(resolved).isEqualTo(TARGET_URL);
        verify(visitCounterStore).increment(CODE, 1L);
        verify(visitLogService).record(CODE, context);
    }

    @Test
    void resolve_withoutContext_shouldNotLogVisit() {
        targetUrlCache.put(CODE, TARGET_URL);

        linkService.resolve(CODE);

        verify(visitLogService, never()).record(anyString(), any());
    }

    @Test
    void resolve_whenVisitLogRejects_shouldStillReturnTargetAndCount() {
        // Arrange
        targetUrlCache.put(CODE, TARGET_URL);
        VisitContext context = new VisitContext("203.0.113.7", null, null, null, null);
        doThrow(new TaskRejectedException("queue full")).when(visitLogService).record(CODE, context);

        // Act & Assert
        assertThat(linkService.resolve(CODE, context)).isEqualTo(TARGET_URL);
        verify(visitCounterStore).increment(CODE, 1L);
    }

    @Test
    void resolve_withContextForUnknownCode_shouldNotLogVisit() {
        when(linkStore.get("zzz999")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> linkService.resolve("zzz999", new VisitContext("203.0.113.7", null, null, null, null)))
                .isInstanceOf(LinkNotFoundException.class);
        verifyNoInteractions(visitLogService);
    }

    // --- createLink ---

    @Test
    void createLink_whenValid_shouldStoreAndWarmCache() {
        // Arrange
        when(linkStore.create(CODE, TARGET_URL, "owner-1")).thenReturn(link(CODE, TARGET_URL, "owner-1", 0));

        // Act
        ShortLink created = linkService.createLink(CODE, TARGET_URL, "owner-1");

        // Assert
        assertThat(created.getCode()).isEqualTo(CODE);
        assertThat(created.getVisitCount()).isZero();
        assertThat(targetUrlCache.getIfPresent(CODE)).isEqualTo(TARGET_URL);
    }

    @ParameterizedTest
    @ValueSource(strings = {"example.com/x", "ftp://example.com/file", "https://", "not a url", "/relative/path"})
    void createLink_whenUrlInvalid_shouldRejectWithoutTouchingStore(String badUrl) {
        assertThatThrownBy(() -> linkService.createLink(CODE, badUrl, null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(linkStore);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "ab c", "abcdefghijklmnopqrstuvwxyz0123456789"})
    void createLink_whenCodeInvalid_shouldReject(String badCode) {
        assertThatThrownBy(() -> linkService.createLink(badCode, TARGET_URL, null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(linkStore);
    }

    @Test
    void createLink_whenOwnerTooLong_shouldRejectWithoutTouchingStore() {
        String owner = "o".repeat(ShortLink.MAX_OWNER_LENGTH + 45);

        assertThatThrownBy(() -> linkService.createLink(CODE, TARGET_URL, owner))
                .isInstanceOf(IllegalArgumentException.class)
                .isNotInstanceOf(LinkAlreadyExistsException.class)
                .hasMessageContaining("Owner");
        verifyNoInteractions(linkStore);
    }

    @Test
    void createLink_whenOwnerAtLimit_shouldStore() {
        String owner = "o".repeat(ShortLink.MAX_OWNER_LENGTH);
        when(linkStore.create(CODE, TARGET_URL, owner)).thenReturn(link(CODE, TARGET_URL, owner, 0));

        assertThat(linkService.createLink(CODE, TARGET_URL, owner).getOwner()).isEqualTo(owner);
    }

    @Test
    void createLink_whenCodeTaken_shouldPropagateAlreadyExists() {
        // Arrange
        when(linkStore.create(CODE, TARGET_URL, null)).thenThrow(new LinkAlreadyExistsException(CODE));

        // Act & Assert
        assertThatThrownBy(() -> linkService.createLink(CODE, TARGET_URL, null))
                .isInstanceOf(LinkAlreadyExistsException.class);
        assertThat(targetUrlCache.getIfPresent(CODE)).isNull();
    }

    // --- stats ---

    @Test
    void getLinkStats_shouldCombineCommittedAndPendingVisits() {
        // Arrange
        when(linkStore.get(CODE)).thenReturn(Optional.of(link(CODE, TARGET_URL, "owner-1", 15)));
        when(visitCounterStore.pendingDelta(CODE)).thenReturn(4L);

        // Act
        LinkStats stats = linkService.getLinkStats(CODE);

        // Assert
        assertThat(stats.code()).isEqualTo(CODE);
        assertThat(stats.targetUrl()).isEqualTo(TARGET_URL);
        assertThat(stats.committedVisits()).isEqualTo(15L);
        assertThat(stats.pendingVisits()).isEqualTo(4L);
        assertThat(stats.totalVisits()).isEqualTo(19L);
        assertThat(stats.recentVisits()).isEmpty();
        // Stats are not a visit
        verify(visitCounterStore, never()).increment(anyString(), anyLong());
    }

    @Test
    void getLinkStats_shouldIncludeRecentVisits() {
        // Arrange
        RecentVisit visit = new RecentVisit(Instant.parse("2024-05-02T08:00:00Z"), "203.0.113.7", "curl/8.5",
                null, "DE", "Berlin");
        when(linkStore.get(CODE)).thenReturn(Optional.of(link(CODE, TARGET_URL, null, 1)));
        when(visitLogService.recentVisits(CODE)).thenReturn(List.of(visit));

        // Act
        LinkStats stats = linkService.getLinkStats(CODE);

        // Assert
        assertThat(stats.recentVisits()).containsExactly(visit);
    }

    @Test
    void getLinkStats_whenCounterStoreDown_shouldReportCommittedVisitsOnly() {
        // Arrange
        when(linkStore.get(CODE)).thenReturn(Optional.of(link(CODE, TARGET_URL, "owner-1", 15)));
        when(visitCounterStore.pendingDelta(CODE))
                .thenThrow(new CounterStoreUnavailableException("timeout", null));

        // Act
        LinkStats stats = linkService.getLinkStats(CODE);

        // Assert
        assertThat(stats.committedVisits()).isEqualTo(15L);
        assertThat(stats.pendingVisits()).isZero();
        assertThat(stats.totalVisits()).isEqualTo(15L);
    }

    @Test
    void getOwnerStats_whenCounterStoreDown_shouldStillListEveryLink() {
        when(linkStore.findByOwner("owner-1")).thenReturn(List.of(
                link("one111", "https://one.example", "owner-1", 2),
                link("two222", "https://two.example", "owner-1", 5)));
        when(visitCounterStore.pendingDelta(anyString()))
                .thenThrow(new CounterStoreUnavailableException("down", null));

        List<LinkStats> stats = linkService.getOwnerStats("owner-1");

        assertThat(stats).extracting(LinkStats::totalVisits).containsExactly(2L, 5L);
    }

    @Test
    void getLinkStats_whenCodeUnknown_shouldThrowNotFound() {
        when(linkStore.get("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> linkService.getLinkStats("missing"))
                .isInstanceOf(LinkNotFoundException.class);
        verifyNoInteractions(visitCounterStore, visitLogService);
    }

    @Test
    void getOwnerStats_shouldReturnStatsForEveryOwnedLink() {
        // Arrange
        when(linkStore.findByOwner("owner-1")).thenReturn(List.of(
                link("one111", "https://one.example", "owner-1", 2),
                link("two222", "https://two.example", "owner-1", 0)));
        when(visitCounterStore.pendingDelta("one111")).thenReturn(1L);
        when(visitCounterStore.pendingDelta("two222")).thenReturn(0L);

        // Act
        List<LinkStats> stats = linkService.getOwnerStats("owner-1");

        // Assert
        assertThat(stats).extracting(LinkStats::code).containsExactly("one111", "two222");
        assertThat(stats).extracting(LinkStats::totalVisits).containsExactly(3L, 0L);
    }
}
