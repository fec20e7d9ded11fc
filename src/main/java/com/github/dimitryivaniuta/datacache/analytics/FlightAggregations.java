package com.github.dimitryivaniuta.datacache.analytics;

import com.github.dimitryivaniuta.datacache.cache.model.Row;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Left-join + group-by over flight rows. Flights whose join key has no match fall into a
 * null group, which is dropped.
 */
final class FlightAggregations {
    private FlightAggregations() {}

    static final String COL_AIRLINE = "AIRLINE";
    static final String COL_AIRPORT = "AIRPORT";
    static final String COL_IATA_CODE = "IATA_CODE";
    static final String COL_ORIGIN_AIRPORT = "ORIGIN_AIRPORT";
    static final String COL_DEPARTURE_DELAY = "DEPARTURE_DELAY";
    static final String COL_FLIGHT_NUMBER = "FLIGHT_NUMBER";

    static final String COL_AVERAGE_DEPARTURE_DELAY = "AVERAGE_DEPARTURE_DELAY";
    static final String COL_TOTAL_FLIGHTS = "TOTAL_FLIGHTS";

    /**
     * Mean DEPARTURE_DELAY per airline name, highest first. Null delays are skipped; an airline
     * with no delay values at all gets a null average and sorts last.
     */
    static List<Row> averageDelayPerAirline(List<Row> flights, List<Row> airlines) {
        Map<String, String> airlineNames = index(airlines, COL_IATA_CODE, COL_AIRLINE);

        Map<String, double[]> sums = new LinkedHashMap<>(); // name -> {sum, count}
        for (Row f : flights) {
            String name = airlineNames.get(key(f.get(COL_AIRLINE)));
            if (name == null) continue;

            double[] acc = sums.computeIfAbsent(name, k -> new double[2]);
            Double delay = asDouble(f.get(COL_DEPARTURE_DELAY));
            if (delay != null) {
                acc[0] += delay;
                acc[1]++;
            }
        }

        List<Row> out = new ArrayList<>(sums.size());
        sums.forEach((name, acc) -> out.add(Row.of(
                COL_AIRLINE, name,
                COL_AVERAGE_DEPARTURE_DELAY, acc[1] == 0 ? null : acc[0] / acc[1])));
        out.sort(Comparator.comparing(
                (Row r) -> (Double) r.get(COL_AVERAGE_DEPARTURE_DELAY),
                Comparator.nullsLast(Comparator.reverseOrder())));
        return out;
    }

    /**
     * Number of flights (non-null FLIGHT_NUMBER) per origin airport name, busiest first.
     */
    static List<Row> totalFlightsPerAirport(List<Row> flights, List<Row> airports) {
        Map<String, String> airportNames = index(airports, COL_IATA_CODE, COL_AIRPORT);

        Map<String, Long> counts = new LinkedHashMap<>();
        for (Row f : flights) {
            String name = airportNames.get(key(f.get(COL_ORIGIN_AIRPORT)));
            if (name == null) continue;

            long inc = f.get(COL_FLIGHT_NUMBER) != null ? 1 : 0;
            counts.merge(name, inc, Long::sum);
        }

        List<Row> out = new ArrayList<>(counts.size());
        counts.forEach((name, n) -> out.add(Row.of(COL_AIRPORT, name, COL_TOTAL_FLIGHTS, n)));
        out.sort(Comparator.comparing((Row r) -> (Long) r.get(COL_TOTAL_FLIGHTS)).reversed());
        return out;
    }

    private static Map<String, String> index(List<Row> rows, String keyColumn, String valueColumn) {
        Map<String, String> m = new HashMap<>(rows.size() * 2);
        for (Row r : rows) {
            String k = key(r.get(keyColumn));
            Object v = r.get(valueColumn);
            if (k != null && v != null) {
                m.putIfAbsent(k, v.toString());
            }
        }
        return m;
    }

    // codes may come back numeric (e.g. "10397" -> Long); join on the text form
    private static String key(Object v) {
        return v == null ? null : v.toString();
    }

    private static Double asDouble(Object v) {
        if (v instanceof Number n) return n.doubleValue();
        return null;
    }
}
