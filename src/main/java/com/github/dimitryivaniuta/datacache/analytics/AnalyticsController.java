package com.github.dimitryivaniuta.datacache.analytics;

import com.github.dimitryivaniuta.datacache.analytics.dto.AirlineDelayResponse;
import com.github.dimitryivaniuta.datacache.analytics.dto.AirportTrafficResponse;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/analytics")
public class AnalyticsController {

    private final FlightAnalyticsService analytics;

    @GetMapping("/avg-delay-per-airline")
    public List<AirlineDelayResponse> averageDelayPerAirline(
            @RequestParam(defaultValue = "100") @Min(1) @Max(10_000) int limit) {
        return analytics.averageDepartureDelayPerAirline().stream()
                .limit(limit)
                .map(r -> new AirlineDelayResponse(
                        String.valueOf(r.get(FlightAggregations.COL_AIRLINE)),
                        toDouble(r.get(FlightAggregations.COL_AVERAGE_DEPARTURE_DELAY))))
                .toList();
    }

    @GetMapping("/flights-per-airport")
    public List<AirportTrafficResponse> flightsPerAirport(
            @RequestParam(defaultValue = "100") @Min(1) @Max(10_000) int limit) {
        return analytics.totalFlightsPerAirport().stream()
                .limit(limit)
                .map(r -> new AirportTrafficResponse(
                        String.valueOf(r.get(FlightAggregations.COL_AIRPORT)),
                        ((Number) r.get(FlightAggregations.COL_TOTAL_FLIGHTS)).longValue()))
                .toList();
    }

    private static Double toDouble(Object v) {
        return v instanceof Number n ? n.doubleValue() : null;
    }
}
