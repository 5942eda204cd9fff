package com.erdforge.core.graph;

import com.erdforge.core.model.ForeignKeyTarget;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Vertex of a {@link DiagramGraph}: one per entity, relationship and attribute.
 *
 * <p>Geometry is stored flat ({@code x}, {@code y}, {@code width}, {@code height}) to match
 * the renderer's JSON; all four are null until layout or the renderer fills them in.
 *
 * @param id unique node id
 * @param type node discriminant
 * @param label display label; the entity, relationship or attribute name
 * @param name original name of entities and relationships, or null
 * @param parentId owning node of an attribute, or null
 * @param primaryKey whether the attribute is part of the primary key
 * @param foreignKey whether the attribute is a foreign key
 * @param fkTarget referenced attribute of a foreign key, or null
 * @param dataType explicit scalar type of an attribute, or null
 * @param identifiedBy identifying foreign keys of a weak entity
 * @param x left coordinate, or null
 * @param y top coordinate, or null
 * @param width width, or null
 * @param height height, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiagramNode(
    @JsonProperty("id") String id,
    @JsonProperty("type") NodeType type,
    @JsonProperty("label") String label,
    @JsonProperty("name") String name,
    @JsonProperty("parentId") String parentId,
    @JsonProperty("isPrimaryKey") boolean primaryKey,
    @JsonProperty("isForeignKey") boolean foreignKey,
    @JsonProperty("fkTarget") ForeignKeyTarget fkTarget,
    @JsonProperty("dataType") String dataType,
    @JsonProperty("identifiedBy") @JsonInclude(JsonInclude.Include.NON_EMPTY) List<ForeignKeyTarget> identifiedBy,
    @JsonProperty("x") Double x,
    @JsonProperty("y") Double y,
    @JsonProperty("width") Double width,
    @JsonProperty("height") Double height
) {
    /**
     * Compact constructor with validation.
     */
    public DiagramNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (label == null) {
            label = name != null ? name : "";
        }
        identifiedBy = identifiedBy == null ? List.of() : List.copyOf(identifiedBy);
    }

    /**
     * Returns the node's rectangle.
     *
     * @return bounds, or null when the node has not been positioned
     */
    @JsonIgnore
    public Bounds bounds() {
        if (x == null || y == null) {
            return null;
        }
        return new Bounds(x, y, width == null ? 0 : width, height == null ? 0 : height);
    }

    @JsonIgnore
    public boolean hasSize() {
        return width != null && height != null;
    }

    public DiagramNode withBounds(Bounds bounds) {
        return new DiagramNode(id, type, label, name, parentId, primaryKey, foreignKey, fkTarget, dataType,
            identifiedBy, bounds.x(), bounds.y(), bounds.width(), bounds.height());
    }

    public DiagramNode withLabel(String newLabel) {
        return new DiagramNode(id, type, newLabel, name, parentId, primaryKey, foreignKey, fkTarget, dataType,
            identifiedBy, x, y, width, height);
    }
}
