package com.github.dimitryivaniuta.datacache.cache.codec;

import com.github.dimitryivaniuta.datacache.cache.model.Row;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowCodecTest {

    private final RowCodec codec = RowCodec.create();

    @Test
    void encodesRecordsOrientedJsonWithTaggedDates() {
        String json = codec.encode(List.of(
                Row.of("YEAR", 2015L, "DATE", LocalDate.of(2015, 1, 1), "DELAY", -11.0, "TAIL", null)));

        assertThat(json).isEqualTo(
                "[{\"YEAR\":2015,\"DATE\":{\"$date\":\"2015-01-01\"},\"DELAY\":-11.0,\"TAIL\":null}]");
    }

    @Test
    void decodeRestoresValueTypesAndColumnOrder() {
        Row original = Row.of(
                "Z_FIRST", "text",
                "A_SECOND", 42L,
                "DELAY", 3.5,
                "DAY", LocalDate.of(2015, 2, 28),
                "AT", LocalDateTime.of(2015, 2, 28, 13, 45, 10),
                "EMPTY", null);

        List<Row> decoded = codec.decode(codec.encode(List.of(original)));

        assertThat(decoded).containsExactly(original);
        assertThat(decoded.get(0).columns()).containsExactly("Z_FIRST", "A_SECOND", "DELAY", "DAY", "AT", "EMPTY");
        assertThat(decoded.get(0).get("A_SECOND")).isInstanceOf(Long.class);
        assertThat(decoded.get(0).get("DAY")).isInstanceOf(LocalDate.class);
    }

    @Test
    void integralDoubleStaysDouble() {
        Row r = codec.decode(codec.encode(List.of(Row.of("AVG", 10.0)))).get(0);

        assertThat(r.get("AVG")).isEqualTo(10.0);
    }

    @Test
    void textShapedLikeADateStaysText() {
        Row original = Row.of("LABEL", "2015-01-01", "AT", "2015-01-01T05:30", "CODE", "2015-02-30");

        Row r = codec.decode(codec.encode(List.of(original))).get(0);

        assertThat(r).isEqualTo(original);
        assertThat(r.get("LABEL")).isInstanceOf(String.class);
        assertThat(r.get("AT")).isInstanceOf(String.class);
    }

    @Test
    void nonFiniteDoublesRoundTrip() {
        Row original = Row.of("INF", Double.POSITIVE_INFINITY, "NEG", Double.NEGATIVE_INFINITY, "NAN", Double.NaN);

        Row r = codec.decode(codec.encode(List.of(original))).get(0);

        assertThat(r.get("INF")).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(r.get("NEG")).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat((Double) r.get("NAN")).isNaN();
    }

    @Test
    void unknownOrMalformedTagsAreCodecErrors() {
        assertThatThrownBy(() -> codec.decode("[{\"A\":{\"$uuid\":\"x\"}}]")).isInstanceOf(RowCodecException.class);
        assertThatThrownBy(() -> codec.decode("[{\"A\":{\"$date\":\"2015-02-30\"}}]")).isInstanceOf(RowCodecException.class);
        assertThatThrownBy(() -> codec.decode("[{\"A\":{\"x\":1,\"y\":2}}]")).isInstanceOf(RowCodecException.class);
        assertThatThrownBy(() -> codec.decode("[{\"A\":[1,2]}]")).isInstanceOf(RowCodecException.class);
    }

    @Test
    void malformedPayloadIsACodecError() {
        assertThatThrownBy(() -> codec.decode("{not json")).isInstanceOf(RowCodecException.class);
        assertThatThrownBy(() -> codec.decode("{\"a\":1}")).isInstanceOf(RowCodecException.class);
        assertThatThrownBy(() -> codec.decode("[1,2]")).isInstanceOf(RowCodecException.class);
        assertThatThrownBy(() -> codec.decode("null")).isInstanceOf(RowCodecException.class);
    }

    @Test
    void emptyListRoundTrips() {
        assertThat(codec.decode(codec.encode(List.of()))).isEmpty();
    }
}
