package com.erdforge.core.json;

import com.erdforge.core.dsl.Parser;
import com.erdforge.core.graph.DiagramGraph;
import com.erdforge.core.graph.DiagramGraphBuilder;
import com.erdforge.core.graph.DiagramGraphReader;
import com.erdforge.core.graph.StructuralDefaultException;
import com.erdforge.core.layout.RowLayoutEngine;
import com.erdforge.core.model.ErDiagram;
import com.erdforge.core.util.SampleDocuments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ErdJson}.
 */
class ErdJsonTest {

    private ErdJson json;
    private ErDiagram sample;
    private DiagramGraph positioned;

    @BeforeEach
    void setUp() {
        json = new ErdJson();
        sample = Parser.parse(SampleDocuments.sample());
        positioned = new RowLayoutEngine().layout(new DiagramGraphBuilder().build(sample));
    }

    @Test
    void writeDiagram_usesWireNames() {
        String text = json.writeDiagram(sample);

        assertThat(text)
            .contains("\"entityType\" : \"weak\"")
            .contains("\"attributeType\" : \"composite\"")
            .contains("\"keyType\" : \"pk\"")
            .contains("\"relationshipType\" : \"identifying\"")
            .contains("\"leftSide\"")
            .contains("\"cardinality\" : \"M\"")
            .contains("\"participation\" : \"total\"")
            .doesNotContain("\"dataType\"");
    }

    @Test
    void diagram_survivesJson() {
        assertThat(json.readDiagram(json.writeDiagram(sample))).isEqualTo(sample);
    }

    @Test
    void writeGraph_usesNodeTypeAndEdgeKindNames() {
        String text = json.writeGraph(positioned);

        assertThat(text)
            .contains("\"type\" : \"weakEntity\"")
            .contains("\"type\" : \"compositeAttribute\"")
            .contains("\"kind\" : \"containment\"")
            .contains("\"kind\" : \"relational\"")
            .contains("\"isPrimaryKey\" : true")
            .contains("\"x\" : 100.0");
        assertThat(json.readGraph(text)).isEqualTo(positioned);
    }

    @Test
    void readGraph_ignoresUnknownProperties() {
        DiagramGraph graph = json.readGraph("""
            {
              "nodes": [ { "id": "n1", "type": "entity", "label": "A", "style": "fill:red" } ],
              "edges": [],
              "viewport": { "zoom": 2 }
            }
            """);

        assertThat(graph.nodes()).hasSize(1);
        assertThat(graph.nodes().get(0).label()).isEqualTo("A");
    }

    @Test
    void importDocument_completeExport_takesAstAndDerivesGraph() {
        ImportedDocument imported = json.importDocument(json.writeExport(sample, positioned));

        assertThat(imported.format()).isEqualTo(ImportedDocument.Format.EXPORT);
        assertThat(imported.diagram()).isEqualTo(sample);
        assertThat(imported.graph()).isEqualTo(new DiagramGraphBuilder().build(sample));
        assertThat(imported.defaults()).isEmpty();
    }

    @Test
    void importDocument_bareAst() {
        ImportedDocument imported = json.importDocument(json.writeDiagram(sample));

        assertThat(imported.format()).isEqualTo(ImportedDocument.Format.AST);
        assertThat(imported.diagram()).isEqualTo(sample);
        assertThat(imported.graph().nodes()).hasSize(28);
    }

    @Test
    void importDocument_bareGraph_readsDiagramBack() {
        ImportedDocument imported = json.importDocument(json.writeGraph(positioned));

        assertThat(imported.format()).isEqualTo(ImportedDocument.Format.GRAPH);
        assertThat(imported.diagram()).isEqualTo(sample);
        assertThat(imported.graph()).isEqualTo(positioned);
    }

    @Test
    void importDocument_legacyGraphWithoutEdgeKinds() {
        ImportedDocument imported = json.importDocument("""
            {
              "nodes": [
                { "id": "a", "type": "entity", "label": "Author" },
                { "id": "b", "type": "entity", "label": "Book" },
                { "id": "r", "type": "relationship", "label": "writes" },
                { "id": "t", "type": "simpleAttribute", "label": "title", "parentId": "b" }
              ],
              "edges": [
                { "id": "e1", "sourceId": "b", "targetId": "t" },
                { "id": "e2", "sourceId": "a", "targetId": "r", "sourceCardinality": "M", "sourceParticipation": "partial" },
                { "id": "e3", "sourceId": "r", "targetId": "b", "targetCardinality": "M", "targetParticipation": "total" }
              ]
            }
            """);

        assertThat(ImportedDocumentText.dsl(imported)).isEqualTo("""
            Entity Author:

            Entity Book:
              title

            Relation Author (M, partial) — (M, total) Book: writes""");
        assertThat(imported.defaults()).isEmpty();
    }

    @Test
    void importDocument_graphMissingSide_reportsDefaults() {
        ImportedDocument imported = json.importDocument("""
            {
              "nodes": [
                { "id": "a", "type": "entity", "label": "A" },
                { "id": "r", "type": "relationship", "label": "orphaned" }
              ],
              "edges": [
                { "id": "e1", "sourceId": "a", "targetId": "r", "kind": "relational", "sourceCardinality": "1", "sourceParticipation": "total" }
              ]
            }
            """);

        assertThat(imported.defaults()).hasSize(1);
        assertThat(imported.diagram().relationships().get(0).right().entityName()).isEmpty();
    }

    @Test
    void importDocument_strictReader_rejectsDefaults() {
        ErdJson strict = new ErdJson(new DiagramGraphReader(true));

        assertThatThrownBy(() -> strict.importDocument("""
            { "nodes": [ { "id": "r", "type": "relationship", "label": "alone" } ], "edges": [] }
            """)).isInstanceOf(StructuralDefaultException.class);
    }

    @Test
    void importDocument_unknownShape_fails() {
        assertThatThrownBy(() -> json.importDocument("{ \"foo\": [] }"))
            .isInstanceOf(ErdJsonException.class)
            .hasMessage("Invalid JSON format. Expected ERD AST, diagram model, or complete export format.");
    }

    @Test
    void importDocument_nonObject_fails() {
        assertThatThrownBy(() -> json.importDocument("[1, 2]"))
            .isInstanceOf(ErdJsonException.class)
            .hasMessageStartingWith("Invalid JSON format");
    }

    @Test
    void importDocument_malformedJson_wrapsParserError() {
        assertThatThrownBy(() -> json.importDocument("{ nodes: "))
            .isInstanceOf(ErdJsonException.class)
            .hasMessageStartingWith("Malformed JSON")
            .hasCauseInstanceOf(com.fasterxml.jackson.core.JsonProcessingException.class);
    }

    @Test
    void importDocument_badEnumValue_fails() {
        assertThatThrownBy(() -> json.importDocument("""
            { "entities": [ { "name": "A", "entityType": "gigantic" } ], "relationships": [] }
            """)).isInstanceOf(ErdJsonException.class);
    }

    /**
     * Prints imported diagrams for comparison.
     */
    private static final class ImportedDocumentText {
        static String dsl(ImportedDocument document) {
            return new com.erdforge.core.dsl.DslPrinter().print(document.diagram());
        }
    }
}
