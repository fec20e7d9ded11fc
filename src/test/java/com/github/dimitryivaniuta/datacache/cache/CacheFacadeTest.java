package com.github.dimitryivaniuta.datacache.cache;

import com.github.dimitryivaniuta.datacache.cache.codec.RowCodec;
import com.github.dimitryivaniuta.datacache.cache.metrics.CacheMetricsSnapshot;
import com.github.dimitryivaniuta.datacache.cache.metrics.DataCacheMetrics;
import com.github.dimitryivaniuta.datacache.cache.model.Row;
import com.github.dimitryivaniuta.datacache.cache.source.FakeSourceReader;
import com.github.dimitryivaniuta.datacache.cache.store.CacheStoreUnavailableException;
import com.github.dimitryivaniuta.datacache.cache.store.InMemoryKeyValueStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheFacadeTest {

    private InMemoryKeyValueStore store;
    private FakeSourceReader source;
    private DataCacheProperties props;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        source = new FakeSourceReader()
                .with("airlines", FakeSourceReader.numberedRows(14))
                .with("flights", FakeSourceReader.numberedRows(250));
        props = new DataCacheProperties();
        props.setConnectBackoff(Duration.ofMillis(1));
    }

    private CacheFacade facade() {
        return new CacheFacade(store, source, RowCodec.create(), new DataCacheMetrics(new SimpleMeterRegistry()), props);
    }

    @Test
    void unreachableStoreFailsConstructionAfterAllAttempts() {
        store.setReachable(false);

        assertThatThrownBy(this::facade)
                .isInstanceOf(CacheStoreUnavailableException.class)
                .hasMessageContaining("3 attempts");
    }

    @Test
    void storeThatAnswersOnSecondAttemptIsAccepted() {
        AtomicInteger pings = new AtomicInteger();
        store.failWhen(c -> c.equals("PING") && pings.incrementAndGet() == 1);

        CacheFacade facade = facade();

        assertThat(pings).hasValue(2);
        assertThat(facade.ttl()).isEqualTo(Duration.ofSeconds(300));
        assertThat(facade.targetChunkCount()).isEqualTo(100);
    }

    @Test
    void datasetIsPopulatedOnceAndServedFromStoreAfterwards() {
        CacheFacade facade = facade();

        assertThat(facade.dataset("flights")).contains(FakeSourceReader.numberedRows(250));
        assertThat(facade.dataset("flights")).contains(FakeSourceReader.numberedRows(250));

        assertThat(source.reads("flights")).isEqualTo(1);
        assertThat(store.hgetAll("flights_data")).hasSize(125);
    }

    @Test
    void unknownDatasetIsEmptyNotAnError() {
        assertThat(facade().dataset("nope")).isEmpty();
    }

    @Test
    void clearDatasetForcesNextReadFromSource() {
        CacheFacade facade = facade();
        facade.dataset("airlines");

        assertThat(facade.clearDataset("airlines")).isEqualTo(1);
        assertThat(facade.clearDataset("airlines")).isZero();

        facade.dataset("airlines");
        assertThat(source.reads("airlines")).isEqualTo(2);
    }

    @Test
    void queryResultCountsHitsAndMissesInStore() {
        CacheFacade facade = facade();
        List<Row> result = List.of(Row.of("AIRPORT", "ATL", "TOTAL_FLIGHTS", 346836L));

        facade.queryResult("flights", "total_flights_per_airport", "all", () -> result);
        facade.queryResult("flights", "total_flights_per_airport", "all", () -> result);
        facade.queryResult("flights", "total_flights_per_airport", "all", () -> result);

        assertThat(facade.cacheMetrics()).contains(new CacheMetricsSnapshot(2, 1));
    }

    @Test
    void unreadableCountersGiveNoMetricsInsteadOfAnError() {
        CacheFacade facade = facade();
        facade.queryResult("flights", "q", "v", List::of);
        store.failOn("GET");

        assertThat(facade.cacheMetrics()).isEmpty();

        store.failNothing();
        assertThat(facade.cacheMetrics()).contains(new CacheMetricsSnapshot(0, 1));
    }

    @Test
    void knownDatasetsComeFromConfiguration() {
        CacheFacade facade = facade();

        assertThat(facade.knownDatasets()).containsExactlyInAnyOrder("airlines", "airports", "flights");
        assertThat(facade.isKnownDataset("airports")).isTrue();
        assertThat(facade.isKnownDataset("routes")).isFalse();
    }
}
