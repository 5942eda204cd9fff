package com.erdforge.core.layout;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Spacing and size constants used by {@link RowLayoutEngine}.
 *
 * <p>Loaded from the {@code layout} section of {@code erdforge.yaml} through
 * {@link #of}; any value left out falls back to {@link #defaults()}. Node sizes must be
 * positive, coordinates and spacings may be zero.
 *
 * @param entityRowY y of the entity row
 * @param firstEntityX x of the first entity
 * @param horizontalSpacing step between consecutive entities
 * @param verticalSpacing distance between a parent and its attribute band
 * @param relationshipOffset distance from the entity row to the relationship row
 * @param defaultRelationshipX x of a relationship with no positioned entity
 * @param attributeSpacing step between sibling attributes
 * @param nestedAttributeSpacing step between sibling sub-attributes
 * @param nestedBandOffset distance between an attribute band and its sub-attribute band
 * @param entityWidth entity width
 * @param entityHeight entity height
 * @param relationshipWidth relationship width
 * @param relationshipHeight relationship height
 * @param attributeWidth attribute width
 * @param attributeHeight attribute height
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LayoutSettings(
    double entityRowY,
    double firstEntityX,
    double horizontalSpacing,
    double verticalSpacing,
    double relationshipOffset,
    double defaultRelationshipX,
    double attributeSpacing,
    double nestedAttributeSpacing,
    double nestedBandOffset,
    double entityWidth,
    double entityHeight,
    double relationshipWidth,
    double relationshipHeight,
    double attributeWidth,
    double attributeHeight
) {
    private static final double ENTITY_ROW_Y = 250;
    private static final double FIRST_ENTITY_X = 100;
    private static final double HORIZONTAL_SPACING = 200;
    private static final double VERTICAL_SPACING = 100;
    private static final double RELATIONSHIP_OFFSET = 150;
    private static final double DEFAULT_RELATIONSHIP_X = 400;
    private static final double ATTRIBUTE_SPACING = 50;
    private static final double NESTED_ATTRIBUTE_SPACING = 40;
    private static final double NESTED_BAND_OFFSET = 60;
    private static final double ENTITY_WIDTH = 140;
    private static final double ENTITY_HEIGHT = 40;
    private static final double RELATIONSHIP_WIDTH = 100;
    private static final double RELATIONSHIP_HEIGHT = 60;
    private static final double ATTRIBUTE_WIDTH = 100;
    private static final double ATTRIBUTE_HEIGHT = 30;

    /**
     * Compact constructor with validation.
     */
    public LayoutSettings {
        requirePositive(entityWidth, "entityWidth");
        requirePositive(entityHeight, "entityHeight");
        requirePositive(relationshipWidth, "relationshipWidth");
        requirePositive(relationshipHeight, "relationshipHeight");
        requirePositive(attributeWidth, "attributeWidth");
        requirePositive(attributeHeight, "attributeHeight");
    }

    /**
     * Creates settings from optional values, as bound from YAML. Only absent values fall back
     * to the defaults; an explicit {@code 0} is kept.
     *
     * @return layout settings
     */
    @JsonCreator
    public static LayoutSettings of(
        @JsonProperty("entityRowY") Double entityRowY,
        @JsonProperty("firstEntityX") Double firstEntityX,
        @JsonProperty("horizontalSpacing") Double horizontalSpacing,
        @JsonProperty("verticalSpacing") Double verticalSpacing,
        @JsonProperty("relationshipOffset") Double relationshipOffset,
        @JsonProperty("defaultRelationshipX") Double defaultRelationshipX,
        @JsonProperty("attributeSpacing") Double attributeSpacing,
        @JsonProperty("nestedAttributeSpacing") Double nestedAttributeSpacing,
        @JsonProperty("nestedBandOffset") Double nestedBandOffset,
        @JsonProperty("entityWidth") Double entityWidth,
        @JsonProperty("entityHeight") Double entityHeight,
        @JsonProperty("relationshipWidth") Double relationshipWidth,
        @JsonProperty("relationshipHeight") Double relationshipHeight,
        @JsonProperty("attributeWidth") Double attributeWidth,
        @JsonProperty("attributeHeight") Double attributeHeight
    ) {
        return new LayoutSettings(
            orDefault(entityRowY, ENTITY_ROW_Y),
            orDefault(firstEntityX, FIRST_ENTITY_X),
            orDefault(horizontalSpacing, HORIZONTAL_SPACING),
            orDefault(verticalSpacing, VERTICAL_SPACING),
            orDefault(relationshipOffset, RELATIONSHIP_OFFSET),
            orDefault(defaultRelationshipX, DEFAULT_RELATIONSHIP_X),
            orDefault(attributeSpacing, ATTRIBUTE_SPACING),
            orDefault(nestedAttributeSpacing, NESTED_ATTRIBUTE_SPACING),
            orDefault(nestedBandOffset, NESTED_BAND_OFFSET),
            orDefault(entityWidth, ENTITY_WIDTH),
            orDefault(entityHeight, ENTITY_HEIGHT),
            orDefault(relationshipWidth, RELATIONSHIP_WIDTH),
            orDefault(relationshipHeight, RELATIONSHIP_HEIGHT),
            orDefault(attributeWidth, ATTRIBUTE_WIDTH),
            orDefault(attributeHeight, ATTRIBUTE_HEIGHT));
    }

    /**
     * Creates the default settings.
     *
     * @return default layout settings
     */
    public static LayoutSettings defaults() {
        return of(null, null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    private static double orDefault(Double value, double defaultValue) {
        return value != null ? value : defaultValue;
    }

    private static void requirePositive(double value, String name) {
        if (!(value > 0)) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}
