package com.github.dimitryivaniuta.datacache.admin;

import com.github.dimitryivaniuta.datacache.admin.dto.ClearDatasetResponse;
import com.github.dimitryivaniuta.datacache.admin.dto.DatasetSummaryResponse;
import com.github.dimitryivaniuta.datacache.cache.CacheFacade;
import com.github.dimitryivaniuta.datacache.cache.DatasetUnavailableException;
import com.github.dimitryivaniuta.datacache.cache.metrics.CacheMetricsSnapshot;
import com.github.dimitryivaniuta.datacache.cache.model.Row;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;

/**
 * Operational endpoints: inspect/warm a dataset, drop it from the store, read hit/miss totals.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class CacheAdminController {

    private final CacheFacade cache;

    @GetMapping("/datasets/{name}")
    public DatasetSummaryResponse dataset(@PathVariable String name) {
        requireKnown(name);
        List<Row> rows = cache.dataset(name).orElseThrow(() -> new DatasetUnavailableException(name));
        List<String> columns = rows.isEmpty() ? List.of() : new ArrayList<>(rows.get(0).columns());
        return new DatasetSummaryResponse(name, rows.size(), columns);
    }

    @DeleteMapping("/datasets/{name}")
    public ClearDatasetResponse clear(@PathVariable String name) {
        requireKnown(name);
        return new ClearDatasetResponse(name, cache.clearDataset(name));
    }

    @GetMapping("/cache/metrics")
    public CacheMetricsSnapshot metrics() {
        return cache.cacheMetrics()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Cache metrics unavailable"));
    }

    private void requireKnown(String name) {
        if (!cache.isKnownDataset(name)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown dataset: " + name);
        }
    }
}
