package com.team.testcaseimport.service.testimport;

import com.team.testcaseimport.config.FieldAliasConfig.FieldAliases;
import com.team.testcaseimport.model.testcase.FieldCatalog;
import com.team.testcaseimport.model.testcase.FieldDefinition;
import com.team.testcaseimport.service.azuredevops.WorkItemFieldService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FieldCatalogCacheTest {

    @Mock
    private WorkItemFieldService fieldService;

    private MutableClock clock;
    private FieldCatalogCache cache;

    private final List<FieldDefinition> fields = List.of(
            FieldDefinition.builder().referenceName("System.Title").name("Title").build());
    private final FieldAliases aliases = new FieldAliases(
            List.of(FieldDefinition.builder().referenceName("System.Title").name("Title").build()), Map.of());

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
        cache = new FieldCatalogCache(fieldService, aliases, Duration.ofMinutes(30), clock);
    }

    @Test
    void secondCallWithinTtlIsServedFromCache() {
        when(fieldService.listFields("Proj", "Test Case")).thenReturn(Mono.just(fields));

        cache.getOrFetch("Proj", "Test Case").block();
        clock.advance(Duration.ofMinutes(29));
        FieldCatalog catalog = cache.getOrFetch("Proj", "Test Case").block();

        assertThat(catalog.fallback()).isFalse();
        assertThat(catalog.defines("system.title")).isTrue();
        verify(fieldService, times(1)).listFields("Proj", "Test Case");
    }

    @Test
    void expiredEntryIsFetchedAgain() {
        when(fieldService.listFields("Proj", "Test Case")).thenReturn(Mono.just(fields));

        cache.getOrFetch("Proj", "Test Case").block();
        clock.advance(Duration.ofMinutes(30));
        cache.getOrFetch("Proj", "Test Case").block();

        verify(fieldService, times(2)).listFields("Proj", "Test Case");
    }

    @Test
    void invalidateForcesRefetch() {
        when(fieldService.listFields("Proj", "Test Case")).thenReturn(Mono.just(fields));

        cache.getOrFetch("Proj", "Test Case").block();
        cache.invalidate("Proj", "Test Case");
        cache.getOrFetch("Proj", "Test Case").block();

        verify(fieldService, times(2)).listFields("Proj", "Test Case");
    }

    @Test
    void fallbackIsReturnedButNotCached() {
        when(fieldService.listFields("Proj", "Test Case"))
                .thenReturn(Mono.error(new IllegalStateException("401 Unauthorized")));

        StepVerifier.create(cache.getOrFetch("Proj", "Test Case"))
                .assertNext(catalog -> {
                    assertThat(catalog.fallback()).isTrue();
                    assertThat(catalog.fields()).extracting(FieldDefinition::getReferenceName)
                            .containsExactly("System.Title");
                })
                .verifyComplete();
        assertThat(cache.size()).isZero();
    }

    @Test
    void evictionRemovesOnlyExpiredEntries() {
        when(fieldService.listFields("Proj", "Test Case")).thenReturn(Mono.just(fields));
        when(fieldService.listFields("Proj", "Bug")).thenReturn(Mono.just(fields));

        cache.getOrFetch("Proj", "Test Case").block();
        clock.advance(Duration.ofMinutes(20));
        cache.getOrFetch("Proj", "Bug").block();
        clock.advance(Duration.ofMinutes(15));
        cache.evictExpired();

        assertThat(cache.size()).isEqualTo(1);

        cache.invalidateAll();
        assertThat(cache.size()).isZero();
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
