package com.github.dimitryivaniuta.datacache.config;

import com.github.dimitryivaniuta.datacache.cache.CacheFacade;
import com.github.dimitryivaniuta.datacache.cache.DataCacheProperties;
import com.github.dimitryivaniuta.datacache.cache.codec.RowCodec;
import com.github.dimitryivaniuta.datacache.cache.metrics.DataCacheMetrics;
import com.github.dimitryivaniuta.datacache.cache.source.CsvSourceReader;
import com.github.dimitryivaniuta.datacache.cache.source.SourceReader;
import com.github.dimitryivaniuta.datacache.cache.store.KeyValueStore;
import com.github.dimitryivaniuta.datacache.cache.store.RedisKeyValueStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.file.Path;

/**
 * Wires the cache layer:
 * - Redis (spring.data.redis.*) as the key-value store
 * - CSV files under datacache.source-directory as the slow source
 * - one facade, connectivity-checked at startup (context fails if Redis is down)
 */
@Configuration
@EnableConfigurationProperties(DataCacheProperties.class)
public class DataCacheConfig {

    @Bean
    public KeyValueStore keyValueStore(StringRedisTemplate redisTemplate) {
        return new RedisKeyValueStore(redisTemplate);
    }

    @Bean
    public SourceReader sourceReader(DataCacheProperties props) {
        return new CsvSourceReader(Path.of(props.getSourceDirectory()), props.getDatasets());
    }

    @Bean
    public RowCodec rowCodec() {
        return RowCodec.create();
    }

    @Bean
    public CacheFacade cacheFacade(KeyValueStore store,
                                   SourceReader sourceReader,
                                   RowCodec rowCodec,
                                   DataCacheMetrics metrics,
                                   DataCacheProperties props) {
        return new CacheFacade(store, sourceReader, rowCodec, metrics, props);
    }
}
