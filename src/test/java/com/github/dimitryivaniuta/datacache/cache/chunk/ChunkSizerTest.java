package com.github.dimitryivaniuta.datacache.cache.chunk;

import com.github.dimitryivaniuta.datacache.cache.source.FakeSourceReader;
import com.github.dimitryivaniuta.datacache.cache.source.SourceReadException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkSizerTest {

    @Test
    void fewerRowsThanTargetGiveSingleRowChunks() {
        var source = new FakeSourceReader().with("airlines", FakeSourceReader.numberedRows(14));

        assertThat(new ChunkSizer(source, 100).computeChunkSize("airlines")).isEqualTo(1);
    }

    @Test
    void divisionIsFloored() {
        assertThat(ChunkSizer.chunkSizeFor(1_000, 100)).isEqualTo(10);
        assertThat(ChunkSizer.chunkSizeFor(1_099, 100)).isEqualTo(10);
        assertThat(ChunkSizer.chunkSizeFor(5_819_079, 100)).isEqualTo(58_190);
    }

    @Test
    void emptySourceStillGivesPositiveSize() {
        assertThat(ChunkSizer.chunkSizeFor(0, 100)).isEqualTo(1);
    }

    @Test
    void nonPositiveTargetIsRejected() {
        var source = new FakeSourceReader();
        assertThatThrownBy(() -> new ChunkSizer(source, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ChunkSizer(source, -5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownDatasetPropagatesSourceFailure() {
        var sizer = new ChunkSizer(new FakeSourceReader().with("a", List.of()), 10);

        assertThatThrownBy(() -> sizer.computeChunkSize("nope")).isInstanceOf(SourceReadException.class);
    }
}
