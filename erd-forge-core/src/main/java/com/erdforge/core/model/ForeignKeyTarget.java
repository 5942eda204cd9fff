package com.erdforge.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Reference to an attribute of another entity, written {@code Entity.attribute}.
 *
 * @param entityName referenced entity
 * @param attributeName referenced attribute
 */
public record ForeignKeyTarget(
    @JsonProperty("entityName") String entityName,
    @JsonProperty("attributeName") String attributeName
) {
    /**
     * Compact constructor with validation.
     */
    public ForeignKeyTarget {
        Objects.requireNonNull(entityName, "entityName must not be null");
        Objects.requireNonNull(attributeName, "attributeName must not be null");
    }

    @Override
    public String toString() {
        return entityName + "." + attributeName;
    }
}
