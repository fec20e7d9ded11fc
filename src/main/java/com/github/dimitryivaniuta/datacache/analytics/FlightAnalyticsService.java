package com.github.dimitryivaniuta.datacache.analytics;

import com.github.dimitryivaniuta.datacache.cache.CacheFacade;
import com.github.dimitryivaniuta.datacache.cache.DatasetUnavailableException;
import com.github.dimitryivaniuta.datacache.cache.model.Row;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Flight-delay reports over the cached flights/airlines/airports datasets.
 * Each report is memoized in the query cache under {@code flights:<report>:all}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlightAnalyticsService {

    public static final String FLIGHTS = "flights";
    public static final String AIRLINES = "airlines";
    public static final String AIRPORTS = "airports";

    public static final String AVG_DELAY_PER_AIRLINE = "avg_delay_per_airline";
    public static final String TOTAL_FLIGHTS_PER_AIRPORT = "total_flights_per_airport";
    static final String ALL = "all";

    private final CacheFacade cache;

    public List<Row> averageDepartureDelayPerAirline() {
        return cache.queryResult(FLIGHTS, AVG_DELAY_PER_AIRLINE, ALL, () -> {
            long t0 = System.nanoTime();
            List<Row> result = FlightAggregations.averageDelayPerAirline(require(FLIGHTS), require(AIRLINES));
            log.info("Computed {} in {} ms", AVG_DELAY_PER_AIRLINE, (System.nanoTime() - t0) / 1_000_000L);
            return result;
        });
    }

    public List<Row> totalFlightsPerAirport() {
        return cache.queryResult(FLIGHTS, TOTAL_FLIGHTS_PER_AIRPORT, ALL, () -> {
            long t0 = System.nanoTime();
            List<Row> result = FlightAggregations.totalFlightsPerAirport(require(FLIGHTS), require(AIRPORTS));
            log.info("Computed {} in {} ms", TOTAL_FLIGHTS_PER_AIRPORT, (System.nanoTime() - t0) / 1_000_000L);
            return result;
        });
    }

    private List<Row> require(String dataset) {
        return cache.dataset(dataset).orElseThrow(() -> new DatasetUnavailableException(dataset));
    }
}
