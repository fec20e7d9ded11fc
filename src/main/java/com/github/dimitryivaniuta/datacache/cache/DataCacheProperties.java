package com.github.dimitryivaniuta.datacache.cache;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Store host/port/database come from the standard {@code spring.data.redis.*} properties.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "datacache")
public class DataCacheProperties {

    // one TTL for dataset and query entries alike
    private Duration ttl = Duration.ofSeconds(300);

    private int targetChunkCount = 100;

    private String sourceDirectory = "data";

    // dataset name -> file name under sourceDirectory
    private Map<String, String> datasets = defaultDatasets();

    // startup PING attempts before giving up for good
    private int connectAttempts = 3;
    private Duration connectBackoff = Duration.ofMillis(500);

    private Warmup warmup = new Warmup();

    @Getter
    @Setter
    public static class Warmup {
        private boolean enabled = false;
        private List<String> datasets = new ArrayList<>();
    }

    private static Map<String, String> defaultDatasets() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("airlines", "airlines.csv");
        m.put("airports", "airports.csv");
        m.put("flights", "flights.csv");
        return m;
    }
}
