package com.erdforge.core.generator.impl;

import com.erdforge.core.generator.DiagramGenerator;
import com.erdforge.core.generator.GeneratedDiagram;
import com.erdforge.core.generator.GeneratorConfig;
import com.erdforge.core.generator.OutputType;
import com.erdforge.core.model.AttributeKind;
import com.erdforge.core.model.AttributeNode;
import com.erdforge.core.model.Cardinality;
import com.erdforge.core.model.EntityKind;
import com.erdforge.core.model.EntityNode;
import com.erdforge.core.model.ErDiagram;
import com.erdforge.core.model.ForeignKeyTarget;
import com.erdforge.core.model.KeyRole;
import com.erdforge.core.model.Participation;
import com.erdforge.core.model.RelationshipKind;
import com.erdforge.core.model.RelationshipNode;
import com.erdforge.core.model.RelationshipSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Generates a Mermaid {@code erDiagram} embedded in Markdown.
 *
 * <h2>Mapping</h2>
 * <ul>
 *   <li><b>Entities:</b> one block each, names upper-cased and sanitised. Weak entities are
 *       preceded by a {@code %%} comment naming their identifying keys.</li>
 *   <li><b>Attributes:</b> {@code type name [PK|FK] ["note"]}; the type is the declared data
 *       type or {@code string}. Composite attributes are flattened to
 *       {@code parent_child}; multivalued and derived attributes carry a note.</li>
 *   <li><b>Relationships:</b> crow's-foot markers from cardinality and participation,
 *       solid line ({@code --}) for identifying relationships, dashed ({@code ..}) otherwise.
 *       Relationship attributes become a {@code %%} comment.</li>
 * </ul>
 *
 * <p>The {@code direction} setting ({@code TB}, {@code BT}, {@code LR}, {@code RL}) adds a
 * {@code direction} line; unknown values are logged and ignored.
 *
 * <pre>{@code
 * erDiagram
 *   STORE |o..o{ PRODUCT : "sells"
 *   ORDER ||--|{ ORDERITEM : "contains"
 * }</pre>
 *
 * @see <a href="https://mermaid.js.org/syntax/entityRelationshipDiagram.html">Mermaid ER diagrams</a>
 */
public class MermaidGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid ER Diagram Generator";
    private static final String FILE_EXTENSION = "md";

    // Markdown formatting
    private static final String MARKDOWN_HEADER_PREFIX = "# ";
    private static final String MARKDOWN_NEWLINE = "\n";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";
    private static final String ER_DIAGRAM = "erDiagram\n";

    private static final String NAME_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";
    private static final String DEFAULT_DATA_TYPE = "string";
    private static final String NO_ENTITIES_COMMENT = "  %% No entities defined\n";

    /** Setting: layout direction, one of {@code TB}, {@code BT}, {@code LR} or {@code RL} */
    static final String DIRECTION_SETTING = "direction";
    private static final Set<String> DIRECTIONS = Set.of("TB", "BT", "LR", "RL");

    private static final String IDENTIFYING_LINE = "--";
    private static final String NON_IDENTIFYING_LINE = "..";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public Set<OutputType> getSupportedOutputTypes() {
        return Set.of(OutputType.MERMAID_ER);
    }

    @Override
    public GeneratedDiagram generate(ErDiagram diagram, OutputType type, GeneratorConfig config) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (!getSupportedOutputTypes().contains(type)) {
            throw new IllegalArgumentException("Unsupported output type: " + type);
        }

        log.debug("Generating Mermaid ER diagram with {} entities", diagram.entities().size());

        StringBuilder sb = new StringBuilder();
        sb.append(MARKDOWN_HEADER_PREFIX).append(config.title()).append(MARKDOWN_NEWLINE.repeat(2));
        sb.append(CODE_BLOCK_START);
        sb.append(ER_DIAGRAM);
        String direction = direction(config);
        if (direction != null) {
            sb.append("  direction ").append(direction).append(MARKDOWN_NEWLINE);
        }

        if (diagram.entities().isEmpty()) {
            sb.append(NO_ENTITIES_COMMENT);
        } else {
            for (EntityNode entity : diagram.entities()) {
                appendEntity(sb, entity);
            }
            for (RelationshipNode relationship : diagram.relationships()) {
                appendRelationship(sb, diagram, relationship);
            }
        }

        sb.append(CODE_BLOCK_END);

        log.info("Generated Mermaid diagram: {}", type.fileStem());
        return new GeneratedDiagram(type.fileStem(), sb.toString(), getFileExtension());
    }

    private static String direction(GeneratorConfig config) {
        Object value = config.getSetting(DIRECTION_SETTING);
        if (value == null) {
            return null;
        }
        String direction = String.valueOf(value).trim().toUpperCase(Locale.ROOT);
        if (!DIRECTIONS.contains(direction)) {
            log.warn("Ignoring unknown Mermaid direction '{}', expected one of {}", value, DIRECTIONS);
            return null;
        }
        return direction;
    }

    private void appendEntity(StringBuilder sb, EntityNode entity) {
        if (entity.kind() == EntityKind.WEAK) {
            sb.append("  %% weak entity");
            if (!entity.identifiedBy().isEmpty()) {
                sb.append(" identified by ").append(entity.identifiedBy().stream()
                    .map(ForeignKeyTarget::toString)
                    .collect(Collectors.joining(" + ")));
            }
            sb.append("\n");
        }

        sb.append("  ").append(sanitizeEntityName(entity.name())).append(" {\n");
        if (entity.attributes().isEmpty()) {
            sb.append("    string placeholder \"No attributes defined\"\n");
        }
        for (AttributeNode attribute : entity.attributes()) {
            appendAttribute(sb, attribute, "");
        }
        sb.append("  }\n");
    }

    private void appendAttribute(StringBuilder sb, AttributeNode attribute, String prefix) {
        String name = prefix + sanitizeName(attribute.name());

        if (attribute.kind() == AttributeKind.COMPOSITE && !attribute.subAttributes().isEmpty()) {
            for (AttributeNode sub : attribute.subAttributes()) {
                appendAttribute(sb, sub, name + "_");
            }
            return;
        }

        String dataType = attribute.dataType() != null && !attribute.dataType().isBlank()
            ? sanitizeName(attribute.dataType())
            : DEFAULT_DATA_TYPE;

        sb.append("    ").append(dataType).append(" ").append(name);
        if (attribute.keyRole() == KeyRole.PRIMARY) {
            sb.append(" PK");
        } else if (attribute.keyRole() == KeyRole.FOREIGN) {
            sb.append(" FK");
        }

        String note = note(attribute, prefix);
        if (note != null) {
            sb.append(" \"").append(escape(note)).append("\"");
        }
        sb.append("\n");
    }

    private static String note(AttributeNode attribute, String prefix) {
        if (attribute.keyRole() == KeyRole.FOREIGN && attribute.foreignKey() != null) {
            return "references " + attribute.foreignKey();
        }
        return switch (attribute.kind()) {
            case MULTIVALUED -> "multivalued";
            case DERIVED -> "derived";
            case COMPOSITE -> "composite";
            default -> prefix.isEmpty() ? null : "part of " + prefix.substring(0, prefix.length() - 1);
        };
    }

    private void appendRelationship(StringBuilder sb, ErDiagram diagram, RelationshipNode relationship) {
        RelationshipSide left = relationship.left();
        RelationshipSide right = relationship.right();

        if (diagram.findEntity(left.entityName()).isEmpty() || diagram.findEntity(right.entityName()).isEmpty()) {
            log.debug("Skipping relationship '{}': side references an undeclared entity", relationship.name());
            return;
        }

        String line = relationship.kind() == RelationshipKind.IDENTIFYING ? IDENTIFYING_LINE : NON_IDENTIFYING_LINE;
        sb.append("  ")
            .append(sanitizeEntityName(left.entityName())).append(" ")
            .append(leftMarker(left)).append(line).append(rightMarker(right)).append(" ")
            .append(sanitizeEntityName(right.entityName()))
            .append(" : \"").append(escape(relationship.verb())).append("\"\n");

        List<AttributeNode> attributes = relationship.attributes();
        if (!attributes.isEmpty()) {
            sb.append("  %% ").append(relationship.verb()).append(" attributes: ")
                .append(attributes.stream().map(AttributeNode::name).collect(Collectors.joining(", ")))
                .append("\n");
        }
    }

    /**
     * Marker on the left entity's end of the line, read outward from the line.
     */
    static String leftMarker(RelationshipSide side) {
        boolean total = side.participation() == Participation.TOTAL;
        if (side.cardinality() == Cardinality.MANY) {
            return total ? "}|" : "}o";
        }
        return total ? "||" : "|o";
    }

    static String rightMarker(RelationshipSide side) {
        boolean total = side.participation() == Participation.TOTAL;
        if (side.cardinality() == Cardinality.MANY) {
            return total ? "|{" : "o{";
        }
        return total ? "||" : "o|";
    }

    private static String sanitizeEntityName(String name) {
        return sanitizeName(name).toUpperCase(Locale.ROOT);
    }

    private static String sanitizeName(String name) {
        if (name == null || name.isEmpty()) {
            return "UNKNOWN";
        }
        return name.replaceAll(NAME_SANITIZATION_PATTERN, "_");
    }

    private static String escape(String text) {
        return text.replace("\"", "'");
    }
}
