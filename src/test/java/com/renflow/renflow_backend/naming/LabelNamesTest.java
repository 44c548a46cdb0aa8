package com.renflow.renflow_backend.naming;

import com.renflow.renflow_backend.model.domain.Block;
import com.renflow.renflow_backend.model.domain.BlockType;
import com.renflow.renflow_backend.model.domain.Scene;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LabelNamesTest {

    private final LabelNames labels = new LabelNames("start");

    private static Block block(BlockType type, Map<String, Object> params) {
        return Block.builder().id("b").type(type).params(new LinkedHashMap<>(params)).build();
    }

    @Test
    void entryLabelIsReserved() {
        assertThat(labels.resolve("start")).isEqualTo("start_entry");
        assertThat(labels.resolve(" intro ")).isEqualTo("intro");
        assertThat(labels.resolve(null)).isEmpty();
    }

    @Test
    void entryMarkerUsesItsOwnLabelBeforeTheScenes() {
        Scene scene = new Scene("s1", "Intro", "prologue");

        assertThat(labels.ofEntryMarker(block(BlockType.START, Map.of("label", "cold_open")), scene)).isEqualTo("cold_open");
        assertThat(labels.ofEntryMarker(block(BlockType.START, Map.of()), scene)).isEqualTo("prologue");
        assertThat(labels.ofEntryMarker(block(BlockType.START, Map.of()), new Scene("s2", "Empty", null))).isEmpty();
    }

    @Test
    void labelBlockAcceptsLegacyKey() {
        assertThat(labels.ofLabelBlock(block(BlockType.LABEL, Map.of("label_name", "chapter_2")))).isEqualTo("chapter_2");
        assertThat(labels.ofLabelBlock(block(BlockType.LABEL, Map.of("label", "start")))).isEqualTo("start_entry");
    }
}
