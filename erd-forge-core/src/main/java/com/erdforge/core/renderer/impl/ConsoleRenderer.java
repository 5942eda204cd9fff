package com.erdforge.core.renderer.impl;

import com.erdforge.core.renderer.GeneratedFile;
import com.erdforge.core.renderer.GeneratedOutput;
import com.erdforge.core.renderer.OutputRenderer;
import com.erdforge.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints generated files to a stream, standard output by default.
 *
 * <p><b>Settings:</b>
 * <ul>
 *   <li>{@code console.colors}: ANSI colours, default {@code true}</li>
 *   <li>{@code console.separator}: separator repeated between files, default {@code ---}</li>
 *   <li>{@code console.showHeaders}: print a header per file, default {@code true}</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String DEFAULT_SEPARATOR = "---";
    private static final int LINE_WIDTH = 80;

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = context.isEnabled("console.colors", true);
        boolean showHeaders = context.isEnabled("console.showHeaders", true);
        String separator = separatorLine(context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR));

        log.debug("Rendering {} files to console (colors: {}, headers: {})",
            output.files().size(), useColors, showHeaders);

        out.println(color(useColors, ANSI_BOLD + ANSI_GREEN, "Generated " + output.files().size() + " file(s)"));

        int total = output.files().size();
        for (int i = 0; i < total; i++) {
            GeneratedFile file = output.files().get(i);
            out.println(color(useColors, ANSI_YELLOW, separator));
            if (showHeaders) {
                printHeader(file, i + 1, total, useColors);
            }
            out.print(file.content());
            if (!file.content().endsWith("\n")) {
                out.println();
            }
        }
        out.println(color(useColors, ANSI_YELLOW, separator));
        out.flush();
    }

    private void printHeader(GeneratedFile file, int index, int total, boolean useColors) {
        out.println(color(useColors, ANSI_BOLD + ANSI_CYAN, "File " + index + "/" + total + ": " + file.relativePath()));
        if (file.contentType() != null && !file.contentType().isEmpty()) {
            out.println(color(useColors, ANSI_YELLOW, "Type: " + file.contentType()));
        }
        out.println();
    }

    private static String separatorLine(String separator) {
        if (separator.isEmpty()) {
            separator = DEFAULT_SEPARATOR;
        }
        return separator.repeat(Math.max(1, LINE_WIDTH / separator.length()));
    }

    private static String color(boolean useColors, String code, String text) {
        return useColors ? code + text + ANSI_RESET : text;
    }
}
