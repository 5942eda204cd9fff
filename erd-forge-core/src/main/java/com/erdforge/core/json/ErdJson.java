package com.erdforge.core.json;

import com.erdforge.core.graph.DiagramGraph;
import com.erdforge.core.graph.DiagramGraphBuilder;
import com.erdforge.core.graph.DiagramGraphReader;
import com.erdforge.core.graph.ReadResult;
import com.erdforge.core.model.ErDiagram;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * JSON codec for diagrams and graphs.
 *
 * <p>Writes JSON (pretty-printed unless created otherwise) with absent optionals omitted, and ignores unknown properties
 * on read so that payloads carrying renderer-specific fields stay importable.
 *
 * <p>{@link #importDocument(String)} accepts the three shapes the editor exchanges:
 * <ul>
 *   <li>complete export {@code { "ast": ..., "diagram": ... }}; the AST is authoritative and
 *       the graph is derived from it</li>
 *   <li>bare AST {@code { "entities": ..., "relationships": ... }}; the graph is derived</li>
 *   <li>bare graph {@code { "nodes": ..., "edges": ... }}; the AST is read back from it</li>
 * </ul>
 */
public class ErdJson {

    private static final Logger log = LoggerFactory.getLogger(ErdJson.class);

    private static final String INVALID_FORMAT =
        "Invalid JSON format. Expected ERD AST, diagram model, or complete export format.";

    private final ObjectMapper mapper;
    private final DiagramGraphBuilder builder;
    private final DiagramGraphReader reader;

    public ErdJson() {
        this(new DiagramGraphReader());
    }

    public ErdJson(DiagramGraphReader reader) {
        this(reader, true);
    }

    /**
     * Creates a codec that reads bare graphs with the given reader.
     *
     * @param reader reader used for graph payloads
     * @param indent pretty-print written JSON
     */
    public ErdJson(DiagramGraphReader reader, boolean indent) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.builder = new DiagramGraphBuilder();
        this.mapper = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(SerializationFeature.INDENT_OUTPUT, indent)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String writeDiagram(ErDiagram diagram) {
        return write(diagram);
    }

    public ErDiagram readDiagram(String json) {
        return read(json, ErDiagram.class);
    }

    public String writeGraph(DiagramGraph graph) {
        return write(graph);
    }

    public DiagramGraph readGraph(String json) {
        return read(json, DiagramGraph.class);
    }

    /**
     * Writes a complete export of a diagram and its drawn graph.
     *
     * @param diagram diagram
     * @param graph graph with current geometry
     * @return JSON text
     */
    public String writeExport(ErDiagram diagram, DiagramGraph graph) {
        return write(new ExportDocument(diagram, graph));
    }

    /**
     * Imports a payload of any supported shape.
     *
     * @param json JSON text
     * @return imported diagram and graph
     * @throws ErdJsonException if the text is not JSON or matches no supported shape
     */
    public ImportedDocument importDocument(String json) {
        JsonNode root = readTree(json);

        try {
            if (root.has("ast") && root.has("diagram")) {
                ErDiagram diagram = mapper.treeToValue(root.get("ast"), ErDiagram.class);
                log.info("Imported complete export with {} entities and {} relationships",
                    diagram.entities().size(), diagram.relationships().size());
                return new ImportedDocument(ImportedDocument.Format.EXPORT, diagram, builder.build(diagram), null);
            }
            if (root.has("entities") && root.has("relationships")) {
                ErDiagram diagram = mapper.treeToValue(root, ErDiagram.class);
                log.info("Imported AST with {} entities and {} relationships",
                    diagram.entities().size(), diagram.relationships().size());
                return new ImportedDocument(ImportedDocument.Format.AST, diagram, builder.build(diagram), null);
            }
            if (root.has("nodes") && root.has("edges")) {
                DiagramGraph graph = mapper.treeToValue(root, DiagramGraph.class);
                ReadResult result = reader.read(graph);
                if (result.isClean()) {
                    log.info("Imported graph with {} nodes and {} edges", graph.nodes().size(), graph.edges().size());
                } else {
                    log.warn("Imported graph with {} nodes and {} edges; {} structural defaults applied",
                        graph.nodes().size(), graph.edges().size(), result.defaults().size());
                }
                return new ImportedDocument(ImportedDocument.Format.GRAPH, result.diagram(), graph, result.defaults());
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ErdJsonException("Failed to read JSON document: " + e.getMessage(), e);
        }

        throw new ErdJsonException(INVALID_FORMAT);
    }

    private JsonNode readTree(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            JsonNode root = mapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new ErdJsonException(INVALID_FORMAT);
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ErdJsonException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ErdJsonException("Failed to write JSON: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ErdJsonException("Failed to read " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }
}
