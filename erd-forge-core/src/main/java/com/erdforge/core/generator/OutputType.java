package com.erdforge.core.generator;

import java.util.Locale;

/**
 * Kinds of documents a generator can produce from a diagram.
 */
public enum OutputType {
    /** Canonical DSL text */
    DSL,

    /** Diagram AST as JSON */
    AST_JSON,

    /** Laid-out diagram graph as JSON */
    GRAPH_JSON,

    /** AST and laid-out graph in one JSON document */
    EXPORT_JSON,

    /** Mermaid {@code erDiagram} embedded in Markdown */
    MERMAID_ER;

    /**
     * Returns the name used for generated files of this type, e.g. {@code ast-json}.
     *
     * @return lowercase, hyphenated name
     */
    public String fileStem() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
