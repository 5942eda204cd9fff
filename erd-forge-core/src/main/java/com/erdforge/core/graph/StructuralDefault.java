package com.erdforge.core.graph;

import java.util.Locale;
import java.util.Objects;

/**
 * Default applied while reading a relationship back from an edited graph.
 *
 * <p>Not an error: the reader always produces a diagram. Defaults are reported so that callers
 * can tell when an external edit, such as a deleted relational edge, degraded a relationship.
 *
 * @param relationship name of the affected relationship
 * @param side affected side
 * @param reason what was missing or ambiguous
 * @param appliedValue value used in its place
 */
public record StructuralDefault(
    String relationship,
    Side side,
    Reason reason,
    String appliedValue
) {
    public StructuralDefault {
        Objects.requireNonNull(relationship, "relationship must not be null");
        Objects.requireNonNull(side, "side must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    /**
     * Relationship side a default applies to.
     */
    public enum Side {
        LEFT,
        RIGHT
    }

    /**
     * Why a default was applied.
     */
    public enum Reason {
        /** No relational edge connects the side; the entity name is left empty */
        MISSING_SIDE,
        /** The edge carries no cardinality */
        MISSING_CARDINALITY,
        /** The edge carries no participation */
        MISSING_PARTICIPATION,
        /** More than one edge connects the side; the last one wins */
        DUPLICATE_SIDE
    }

    /**
     * Describes the default for logs and CLI output.
     *
     * @return human-readable description
     */
    public String describe() {
        String where = "relationship '" + relationship + "' " + side.name().toLowerCase(Locale.ROOT) + " side";
        return switch (reason) {
            case MISSING_SIDE -> where + " is not connected; using an empty entity reference";
            case MISSING_CARDINALITY -> where + " has no cardinality; using " + appliedValue;
            case MISSING_PARTICIPATION -> where + " has no participation; using " + appliedValue;
            case DUPLICATE_SIDE -> where + " is connected more than once; using " + appliedValue;
        };
    }
}
