package com.erdforge.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link IdSequence}.
 */
class IdSequenceTest {

    @Test
    void nodeAndEdgeIds_countIndependently() {
        IdSequence ids = new IdSequence();

        assertThat(ids.nextNodeId()).isEqualTo("node_1");
        assertThat(ids.nextEdgeId()).isEqualTo("edge_1");
        assertThat(ids.nextNodeId()).isEqualTo("node_2");
        assertThat(ids.nextEdgeId()).isEqualTo("edge_2");
    }

    @Test
    void separateSequences_restartAtOne() {
        new IdSequence().nextNodeId();

        assertThat(new IdSequence().nextNodeId()).isEqualTo("node_1");
    }
}
