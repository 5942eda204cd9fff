package com.erdforge.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("list command")
class ListCommandTest {

    @Test
    @DisplayName("Should list the built-in generators")
    void shouldListGenerators() {
        CliRun run = CliRun.execute("list", "generators");

        assertThat(run.exitCode()).isZero();
        assertThat(run.out())
            .contains("Available Generators:")
            .contains("  • Canonical DSL Generator (ID: dsl)")
            .contains("  • JSON Interchange Generator (ID: json)")
            .contains("  • Mermaid ER Diagram Generator (ID: mermaid)")
            .contains("Output Types: [AST_JSON, GRAPH_JSON, EXPORT_JSON]");
    }

    @Test
    @DisplayName("Should list the built-in renderers")
    void shouldListRenderers() {
        CliRun run = CliRun.execute("list", "renderers");

        assertThat(run.exitCode()).isZero();
        assertThat(run.out())
            .contains("  • filesystem (FileSystemRenderer)")
            .contains("  • console (ConsoleRenderer)");
    }

    @Test
    @DisplayName("Should accept the type in any case and locale")
    void shouldAcceptTypeInAnyCase() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            CliRun generators = CliRun.execute("list", "GENERATORS");
            CliRun renderers = CliRun.execute("list", "Renderers");

            assertThat(generators.exitCode()).isZero();
            assertThat(generators.out()).contains("Available Generators:");
            assertThat(renderers.exitCode()).isZero();
            assertThat(renderers.out()).contains("  • console (ConsoleRenderer)");
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    @DisplayName("Should reject an unknown type")
    void shouldRejectUnknownType() {
        CliRun run = CliRun.execute("list", "scanners");

        assertThat(run.exitCode()).isEqualTo(1);
        assertThat(run.err()).contains("✗ Unknown type: scanners");
    }

    @Test
    @DisplayName("Should print the banner without a sub-command")
    void shouldPrintBanner() {
        CliRun run = CliRun.execute();

        assertThat(run.exitCode()).isZero();
        assertThat(run.out()).contains("ERD Forge").contains("erdforge --help");
    }
}
