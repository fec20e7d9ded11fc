package com.github.dimitryivaniuta.datacache.cache.source;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.dimitryivaniuta.datacache.cache.model.CellValues;
import com.github.dimitryivaniuta.datacache.cache.model.Chunk;
import com.github.dimitryivaniuta.datacache.cache.model.Row;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Reads the known datasets from CSV files (header line first) under one directory.
 *
 * <p>Cells are typed with {@link CellValues#infer(String)}. Row counts are memoized per
 * file fingerprint (path, size, mtime): the count is a full scan and a re-populate of an
 * unchanged file should not pay for it twice.
 */
@Slf4j
public class CsvSourceReader implements SourceReader {

    private final Path sourceDirectory;
    private final Map<String, String> files;
    private final ObjectReader reader;
    private final Cache<SourceFingerprint, Long> rowCounts;

    public CsvSourceReader(Path sourceDirectory, Map<String, String> files) {
        this.sourceDirectory = Objects.requireNonNull(sourceDirectory, "sourceDirectory must not be null");
        this.files = Map.copyOf(files);
        this.reader = new CsvMapper()
                .readerFor(Map.class)
                .with(CsvSchema.emptySchema().withHeader());
        this.rowCounts = Caffeine.newBuilder()
                .maximumSize(256)
                .expireAfterAccess(Duration.ofHours(6))
                .build();
    }

    @Override
    public long countRows(String name) {
        Path path = resolve(name);
        SourceFingerprint fp = fingerprint(path);
        Long cached = rowCounts.get(fp, k -> count(name, path));
        return cached == null ? 0L : cached;
    }

    @Override
    public long readChunks(String name, int chunkSize, Consumer<Chunk> consumer) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        Path path = resolve(name);
        log.info("Reading {} (slow)", path);
        long total = scan(name, path, chunkSize, consumer);
        rowCounts.put(fingerprint(path), total);
        return total;
    }

    private long count(String name, Path path) {
        long total = 0;
        try (MappingIterator<Map<String, String>> it = reader.readValues(path.toFile())) {
            while (it.hasNextValue()) {
                it.nextValue();
                total++;
            }
        } catch (IOException e) {
            throw new SourceReadException("Failed counting rows of dataset '" + name + "' in " + path, e);
        }
        log.debug("Counted {} rows in {}", total, path);
        return total;
    }

    private long scan(String name, Path path, int chunkSize, Consumer<Chunk> consumer) {
        long total = 0;
        int index = 0;
        List<Row> buffer = new ArrayList<>();

        try (MappingIterator<Map<String, String>> it = reader.readValues(path.toFile())) {
            while (it.hasNextValue()) {
                buffer.add(toRow(it.nextValue()));
                total++;
                if (buffer.size() == chunkSize) {
                    consumer.accept(new Chunk(index++, buffer));
                    buffer = new ArrayList<>();
                }
            }
        } catch (IOException e) {
            throw new SourceReadException("Failed reading dataset '" + name + "' from " + path + " at row " + (total + 1), e);
        }

        if (!buffer.isEmpty()) {
            consumer.accept(new Chunk(index, buffer));
        }
        return total;
    }

    private static Row toRow(Map<String, String> raw) {
        Map<String, Object> typed = new LinkedHashMap<>(raw.size() * 2);
        raw.forEach((column, cell) -> typed.put(column, CellValues.infer(cell)));
        return new Row(typed);
    }

    private Path resolve(String name) {
        String file = files.get(name);
        if (file == null) {
            throw new SourceReadException("Unknown dataset '" + name + "', known: " + files.keySet());
        }
        Path path = sourceDirectory.resolve(file);
        if (!Files.isRegularFile(path)) {
            throw new SourceReadException("Source file for dataset '" + name + "' not found: " + path);
        }
        return path;
    }

    private static SourceFingerprint fingerprint(Path path) {
        try {
            return new SourceFingerprint(path.toAbsolutePath().normalize(), Files.size(path),
                    Files.getLastModifiedTime(path).toMillis());
        } catch (IOException e) {
            throw new SourceReadException("Unable to stat " + path, e);
        }
    }

    private record SourceFingerprint(Path path, long size, long lastModifiedMillis) {}
}
