package com.github.dimitryivaniuta.datacache.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Loads the configured datasets once at startup (from the store, or from source on a miss)
 * and logs how long it took.
 *
 * Enable with {@code datacache.warmup.enabled=true}; an empty {@code datacache.warmup.datasets}
 * means every known dataset.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "datacache.warmup", name = "enabled", havingValue = "true")
public class DatasetWarmupRunner implements ApplicationRunner {

    private final CacheFacade facade;
    private final DataCacheProperties props;

    @Override
    public void run(ApplicationArguments args) {
        List<String> names = props.getWarmup().getDatasets().isEmpty()
                ? List.copyOf(props.getDatasets().keySet())
                : props.getWarmup().getDatasets();

        long t0 = System.nanoTime();
        int loaded = 0;
        for (String name : names) {
            var rows = facade.dataset(name);
            if (rows.isPresent()) {
                loaded++;
                log.info("Warm-up: {} ready ({} rows)", name, rows.get().size());
            } else {
                log.warn("Warm-up: {} could not be loaded", name);
            }
        }
        double seconds = (System.nanoTime() - t0) / 1_000_000_000.0;
        log.info("Warm-up took {} s to load {}/{} datasets", String.format("%.2f", seconds), loaded, names.size());
    }
}
