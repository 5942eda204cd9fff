package com.erdforge.core.graph;

import com.erdforge.core.dsl.Parser;
import com.erdforge.core.graph.StructuralDefault.Reason;
import com.erdforge.core.graph.StructuralDefault.Side;
import com.erdforge.core.model.AttributeKind;
import com.erdforge.core.model.AttributeNode;
import com.erdforge.core.model.Cardinality;
import com.erdforge.core.model.ErDiagram;
import com.erdforge.core.model.Participation;
import com.erdforge.core.model.RelationshipNode;
import com.erdforge.core.util.SampleDocuments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DiagramGraphReader}.
 */
class DiagramGraphReaderTest {

    private DiagramGraphBuilder builder;
    private ErDiagram sample;

    @BeforeEach
    void setUp() {
        builder = new DiagramGraphBuilder();
        sample = Parser.parse(SampleDocuments.sample());
    }

    private static DiagramGraph withoutEdge(DiagramGraph graph, String edgeId) {
        List<DiagramEdge> edges = new ArrayList<>(graph.edges());
        edges.removeIf(e -> e.id().equals(edgeId));
        return new DiagramGraph(graph.nodes(), edges);
    }

    @Test
    void read_forwardGraph_reproducesDiagram() {
        ReadResult result = new DiagramGraphReader().read(builder.build(sample));

        assertThat(result.diagram()).isEqualTo(sample);
        assertThat(result.isClean()).isTrue();
    }

    @Test
    void read_ignoresGeometryAndLabelEditsOfAttributes() {
        DiagramGraph graph = builder.build(sample);
        List<DiagramNode> nodes = new ArrayList<>(graph.nodes());
        nodes.set(2, nodes.get(2).withLabel("store_name").withBounds(new Bounds(10, 20, 100, 30)));

        ErDiagram diagram = new DiagramGraphReader().toDiagram(new DiagramGraph(nodes, graph.edges()));

        assertThat(diagram.findEntity("Store").orElseThrow().attributes().get(1).name()).isEqualTo("store_name");
    }

    @Test
    void read_deletedRelationalEdge_yieldsEmptySideAndReportsDefault() {
        // edge_20 connects "sells" to Product
        DiagramGraph graph = withoutEdge(builder.build(sample), "edge_20");

        ReadResult result = new DiagramGraphReader().read(graph);

        RelationshipNode sells = result.diagram().relationships().get(0);
        assertThat(sells.left().entityName()).isEqualTo("Store");
        assertThat(sells.right().entityName()).isEmpty();
        assertThat(result.defaults()).containsExactly(
            new StructuralDefault("sells", Side.RIGHT, Reason.MISSING_SIDE, ""));
    }

    @Test
    void read_strictReader_throwsOnDefault() {
        DiagramGraph graph = withoutEdge(builder.build(sample), "edge_20");

        assertThatThrownBy(() -> new DiagramGraphReader(true).read(graph))
            .isInstanceOf(StructuralDefaultException.class)
            .hasMessageContaining("relationship 'sells' right side is not connected")
            .satisfies(e -> assertThat(((StructuralDefaultException) e).getDefaults()).hasSize(1));
    }

    @Test
    void read_strictReader_acceptsCompleteGraph() {
        assertThat(new DiagramGraphReader(true).toDiagram(builder.build(sample))).isEqualTo(sample);
    }

    @Test
    void read_legacyEdgesWithoutKind_areClassifiedByFields() {
        List<DiagramNode> nodes = List.of(
            new DiagramNode("e1", NodeType.ENTITY, "Person", "Person", null, false, false, null, null, null,
                null, null, null, null),
            new DiagramNode("a1", NodeType.SIMPLE_ATTRIBUTE, "name", null, "e1", false, false, null, "text", null,
                null, null, null, null),
            new DiagramNode("e2", NodeType.ENTITY, "Car", "Car", null, false, false, null, null, null,
                null, null, null, null),
            new DiagramNode("r1", NodeType.RELATIONSHIP, "owns", "owns", null, false, false, null, null, null,
                null, null, null, null));
        List<DiagramEdge> edges = List.of(
            new DiagramEdge("x1", "e1", "a1", null, null, null, null, null, null),
            new DiagramEdge("x2", "e1", "r1", null, null, Cardinality.ONE, null, Participation.TOTAL, null),
            new DiagramEdge("x3", "r1", "e2", null, null, null, Cardinality.MANY, null, Participation.PARTIAL));

        ReadResult result = new DiagramGraphReader().read(new DiagramGraph(nodes, edges));

        ErDiagram diagram = result.diagram();
        assertThat(result.isClean()).isTrue();
        assertThat(diagram.entities().get(0).attributes().get(0).kind()).isEqualTo(AttributeKind.TYPED);
        RelationshipNode owns = diagram.relationships().get(0);
        assertThat(owns.left().entityName()).isEqualTo("Person");
        assertThat(owns.left().participation()).isEqualTo(Participation.TOTAL);
        assertThat(owns.right().entityName()).isEqualTo("Car");
        assertThat(owns.right().cardinality()).isEqualTo(Cardinality.MANY);
    }

    @Test
    void read_edgeWithoutCardinality_defaultsToOne() {
        List<DiagramNode> nodes = List.of(
            new DiagramNode("e1", NodeType.ENTITY, "A", "A", null, false, false, null, null, null,
                null, null, null, null),
            new DiagramNode("r1", NodeType.RELATIONSHIP, "links", "links", null, false, false, null, null, null,
                null, null, null, null),
            new DiagramNode("e2", NodeType.ENTITY, "B", "B", null, false, false, null, null, null,
                null, null, null, null));
        List<DiagramEdge> edges = List.of(
            new DiagramEdge("x1", "e1", "r1", EdgeKind.RELATIONAL, null, null, null, null, null),
            DiagramEdge.toEntity("x2", "r1", "e2", Cardinality.MANY, Participation.TOTAL));

        ReadResult result = new DiagramGraphReader().read(new DiagramGraph(nodes, edges));

        RelationshipNode links = result.diagram().relationships().get(0);
        assertThat(links.left().cardinality()).isEqualTo(Cardinality.ONE);
        assertThat(links.left().participation()).isEqualTo(Participation.PARTIAL);
        assertThat(result.defaults()).extracting(StructuralDefault::reason)
            .containsExactly(Reason.MISSING_CARDINALITY, Reason.MISSING_PARTICIPATION);
    }

    @Test
    void read_duplicateConnection_lastEdgeWins() {
        DiagramGraph graph = builder.build(Parser.parse("""
            Entity A:
            Entity B:
            Entity C:
            Relation A (1) — (M) B: links
            """));
        List<DiagramEdge> edges = new ArrayList<>(graph.edges());
        edges.add(DiagramEdge.fromEntity("extra", "node_3", "node_4", Cardinality.MANY, Participation.TOTAL));

        ReadResult result = new DiagramGraphReader().read(new DiagramGraph(graph.nodes(), edges));

        RelationshipNode links = result.diagram().relationships().get(0);
        assertThat(links.left().entityName()).isEqualTo("C");
        assertThat(links.left().cardinality()).isEqualTo(Cardinality.MANY);
        assertThat(result.defaults()).extracting(StructuralDefault::reason).containsExactly(Reason.DUPLICATE_SIDE);
    }

    @Test
    void read_containmentCycle_terminates() {
        List<DiagramNode> nodes = List.of(
            new DiagramNode("e1", NodeType.ENTITY, "A", "A", null, false, false, null, null, null,
                null, null, null, null),
            new DiagramNode("c1", NodeType.COMPOSITE_ATTRIBUTE, "loop", null, "e1", false, false, null, null, null,
                null, null, null, null));
        List<DiagramEdge> edges = List.of(
            DiagramEdge.containment("x1", "e1", "c1"),
            DiagramEdge.containment("x2", "c1", "c1"));

        ErDiagram diagram = new DiagramGraphReader().toDiagram(new DiagramGraph(nodes, edges));

        AttributeNode loop = diagram.entities().get(0).attributes().get(0);
        assertThat(loop.subAttributes()).hasSize(1);
        assertThat(loop.subAttributes().get(0).subAttributes()).isEmpty();
    }
}
