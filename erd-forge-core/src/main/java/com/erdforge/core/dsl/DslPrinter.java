package com.erdforge.core.dsl;

import com.erdforge.core.model.AttributeNode;
import com.erdforge.core.model.EntityKind;
import com.erdforge.core.model.EntityNode;
import com.erdforge.core.model.ErDiagram;
import com.erdforge.core.model.ForeignKeyTarget;
import com.erdforge.core.model.KeyRole;
import com.erdforge.core.model.RelationshipKind;
import com.erdforge.core.model.RelationshipNode;
import com.erdforge.core.model.RelationshipSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Prints an {@link ErDiagram} as canonical DSL text.
 *
 * <p>Entities come first, then relationships, one block each separated by a blank line.
 * Attributes are indented two spaces, composite children two more. Parsing the output
 * yields a diagram equal to the input for any diagram the {@link Parser} can produce.
 * A relationship with an unconnected side has no DSL form and is printed as a {@code #} comment.
 *
 * <pre>{@code
 * Entity Store:
 *   store_id PK
 *   address Composite:
 *     street
 *     city
 *
 * Relation Store (1, partial) — (M, total) Product: sells
 * }</pre>
 */
public class DslPrinter {

    private static final Logger log = LoggerFactory.getLogger(DslPrinter.class);

    private static final String INDENT = "  ";
    private static final String SIDE_SEPARATOR = " — ";

    /**
     * Prints a diagram.
     *
     * @param diagram diagram to print
     * @return DSL text without trailing newline
     */
    public String print(ErDiagram diagram) {
        Objects.requireNonNull(diagram, "diagram must not be null");
        List<String> lines = new ArrayList<>();

        for (EntityNode entity : diagram.entities()) {
            appendEntity(lines, entity);
            lines.add("");
        }
        for (RelationshipNode relationship : diagram.relationships()) {
            appendRelationship(lines, relationship);
            lines.add("");
        }

        return String.join("\n", lines).trim();
    }

    private void appendEntity(List<String> lines, EntityNode entity) {
        String keyword = entity.kind() == EntityKind.WEAK ? "Weak Entity " : "Entity ";
        lines.add(keyword + entity.name() + ":");

        for (AttributeNode attribute : entity.attributes()) {
            appendAttribute(lines, attribute, INDENT);
        }

        if (!entity.identifiedBy().isEmpty()) {
            String targets = entity.identifiedBy().stream()
                .map(ForeignKeyTarget::toString)
                .collect(Collectors.joining(" + "));
            lines.add(INDENT + "Identified By " + targets);
        }
    }

    private void appendAttribute(List<String> lines, AttributeNode attribute, String indent) {
        StringBuilder line = new StringBuilder(indent).append(attribute.name());

        if (attribute.keyRole() == KeyRole.PRIMARY) {
            line.append(" PK");
        } else if (attribute.keyRole() == KeyRole.FOREIGN) {
            line.append(" FK");
            if (attribute.foreignKey() != null) {
                line.append(" -> ").append(attribute.foreignKey());
            }
        } else {
            switch (attribute.kind()) {
                case COMPOSITE -> line.append(" Composite:");
                case MULTIVALUED -> line.append(" Multivalued");
                case DERIVED -> line.append(" Derived");
                case TYPED, SIMPLE -> {
                    if (attribute.dataType() != null && !attribute.dataType().isBlank()) {
                        line.append(": ").append(attribute.dataType());
                    }
                }
            }
        }
        lines.add(line.toString());

        if (attribute.keyRole() == KeyRole.NONE) {
            for (AttributeNode sub : attribute.subAttributes()) {
                appendAttribute(lines, sub, indent + INDENT);
            }
        }
    }

    private void appendRelationship(List<String> lines, RelationshipNode relationship) {
        String unconnected = relationship.left().entityName().isEmpty() ? "left"
            : relationship.right().entityName().isEmpty() ? "right" : null;
        if (unconnected != null) {
            log.warn("Not printing relationship '{}': {} side is not connected", relationship.verb(), unconnected);
            lines.add("# relationship '" + relationship.verb() + "' skipped: " + unconnected + " side is not connected");
            return;
        }

        boolean identifying = relationship.kind() == RelationshipKind.IDENTIFYING;
        String keyword = identifying ? "Identifying Relation " : "Relation ";

        lines.add(keyword
            + relationship.left().entityName() + " "
            + side(relationship.left(), identifying)
            + SIDE_SEPARATOR
            + side(relationship.right(), identifying) + " "
            + relationship.right().entityName() + ": "
            + relationship.verb());

        for (AttributeNode attribute : relationship.attributes()) {
            lines.add(INDENT + attribute.name());
        }
    }

    private static String side(RelationshipSide side, boolean identifying) {
        if (identifying) {
            return "(" + side.cardinality().symbol() + ")";
        }
        return "(" + side.cardinality().symbol() + ", " + side.participation().keyword() + ")";
    }
}
