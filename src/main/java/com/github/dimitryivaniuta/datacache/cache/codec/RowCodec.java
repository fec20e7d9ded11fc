package com.github.dimitryivaniuta.datacache.cache.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.github.dimitryivaniuta.datacache.cache.model.Row;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Row list <-> JSON text, the payload format of both dataset chunks and query results.
 *
 * <p>Layout is a JSON array of objects (one per row, keys in column order). Strings, integral
 * and finite fractional numbers and nulls are plain JSON values. Values JSON has no type for
 * are written as a single-key tag object:
 * <ul>
 *   <li>{@code LocalDate}: {@code {"$date":"2015-01-01"}}</li>
 *   <li>{@code LocalDateTime}: {@code {"$datetime":"2015-01-01T05:30"}}</li>
 *   <li>NaN and infinite doubles: {@code {"$double":"Infinity"}}</li>
 * </ul>
 * A string is always decoded as a string, whatever it looks like.
 *
 * <p>Uses its own mapper, not the web {@code ObjectMapper}: keys must keep column order and
 * numbers must decode as {@code Long}/{@code Double}.
 */
public final class RowCodec {

    static final String DATE_TAG = "$date";
    static final String DATE_TIME_TAG = "$datetime";
    static final String DOUBLE_TAG = "$double";

    private static final TypeReference<List<LinkedHashMap<String, Object>>> RECORDS = new TypeReference<>() {};

    private final ObjectMapper mapper;

    RowCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public static RowCodec create() {
        ObjectMapper mapper = JsonMapper.builder()
                .disable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(DeserializationFeature.USE_LONG_FOR_INTS)
                .disable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .build();
        return new RowCodec(mapper);
    }

    public String encode(List<Row> rows) {
        List<Map<String, Object>> records = new ArrayList<>(rows.size());
        for (Row row : rows) {
            Map<String, Object> record = new LinkedHashMap<>(row.values().size() * 2);
            row.values().forEach((column, value) -> record.put(column, tag(value)));
            records.add(record);
        }
        try {
            return mapper.writeValueAsString(records);
        } catch (JsonProcessingException e) {
            throw new RowCodecException("Unable to serialize " + rows.size() + " rows", e);
        }
    }

    public List<Row> decode(String payload) {
        if (payload == null) {
            throw new RowCodecException("Payload is null", null);
        }
        List<LinkedHashMap<String, Object>> records;
        try {
            records = mapper.readValue(payload, RECORDS);
        } catch (JsonProcessingException e) {
            throw new RowCodecException("Unable to deserialize rows payload", e);
        }
        if (records == null) {
            throw new RowCodecException("Rows payload is JSON null", null);
        }

        List<Row> rows = new ArrayList<>(records.size());
        for (LinkedHashMap<String, Object> rec : records) {
            if (rec == null) {
                throw new RowCodecException("Rows payload contains a null record", null);
            }
            rec.replaceAll(RowCodec::untag);
            rows.add(new Row(rec));
        }
        return rows;
    }

    private static Object tag(Object value) {
        if (value instanceof LocalDate d) {
            return Map.of(DATE_TAG, d.toString());
        }
        if (value instanceof LocalDateTime dt) {
            return Map.of(DATE_TIME_TAG, dt.toString());
        }
        if (value instanceof Double d && !Double.isFinite(d)) {
            return Map.of(DOUBLE_TAG, d.toString());
        }
        return value;
    }

    private static Object untag(String column, Object value) {
        if (value instanceof Map<?, ?> tagged) {
            if (tagged.size() != 1 || !(tagged.values().iterator().next() instanceof String text)) {
                throw new RowCodecException("Column " + column + " holds an unsupported object value", null);
            }
            Object tag = tagged.keySet().iterator().next();
            try {
                if (DATE_TAG.equals(tag)) return LocalDate.parse(text);
                if (DATE_TIME_TAG.equals(tag)) return LocalDateTime.parse(text);
                if (DOUBLE_TAG.equals(tag)) return Double.valueOf(text);
            } catch (DateTimeParseException | NumberFormatException e) {
                throw new RowCodecException("Column " + column + " holds a malformed " + tag + " value: " + text, e);
            }
            throw new RowCodecException("Column " + column + " holds an unknown tag " + tag, null);
        }
        if (value instanceof List<?>) {
            throw new RowCodecException("Column " + column + " holds an unsupported array value", null);
        }
        return value;
    }
}
