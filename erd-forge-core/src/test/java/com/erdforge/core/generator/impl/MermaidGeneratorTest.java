package com.erdforge.core.generator.impl;

import com.erdforge.core.dsl.Parser;
import com.erdforge.core.generator.GeneratedDiagram;
import com.erdforge.core.generator.GeneratorConfig;
import com.erdforge.core.generator.OutputType;
import com.erdforge.core.model.Cardinality;
import com.erdforge.core.model.ErDiagram;
import com.erdforge.core.model.Participation;
import com.erdforge.core.model.RelationshipSide;
import com.erdforge.core.util.SampleDocuments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MermaidGenerator}.
 */
class MermaidGeneratorTest {

    private MermaidGenerator generator;
    private GeneratorConfig config;

    @BeforeEach
    void setUp() {
        generator = new MermaidGenerator();
        config = GeneratorConfig.defaults();
    }

    @Test
    void getId_returnsMermaid() {
        assertThat(generator.getId()).isEqualTo("mermaid");
        assertThat(generator.getDisplayName()).isEqualTo("Mermaid ER Diagram Generator");
        assertThat(generator.getFileExtension()).isEqualTo("md");
        assertThat(generator.getSupportedOutputTypes()).containsExactly(OutputType.MERMAID_ER);
    }

    @Test
    void generate_withEmptyDiagram_writesPlaceholder() {
        GeneratedDiagram result = generator.generate(ErDiagram.empty(), OutputType.MERMAID_ER, config);

        assertThat(result.name()).isEqualTo("mermaid-er");
        assertThat(result.fileName()).isEqualTo("mermaid-er.md");
        assertThat(result.content()).isEqualTo("""
            # Entity-Relationship Diagram

            ```mermaid
            erDiagram
              %% No entities defined
            ```
            """);
    }

    @Test
    void generate_withSample_mapsEntitiesAndAttributes() {
        ErDiagram sample = Parser.parse(SampleDocuments.sample());

        String content = generator.generate(sample, OutputType.MERMAID_ER, config).content();

        assertThat(content)
            .startsWith("# Entity-Relationship Diagram\n\n```mermaid\nerDiagram\n")
            .endsWith("```\n")
            .contains("""
                  STORE {
                    string store_id PK
                    string name
                    string address_street "part of address"
                    string address_city "part of address"
                    string address_zip "part of address"
                    string phones "multivalued"
                  }
                """)
            .contains("  %% weak entity identified by Order.order_id + Product.product_id\n  ORDERITEM {\n")
            .contains("    string total \"derived\"\n");
    }

    @Test
    void generate_withSample_mapsRelationships() {
        ErDiagram sample = Parser.parse(SampleDocuments.sample());

        String content = generator.generate(sample, OutputType.MERMAID_ER, config).content();

        assertThat(content)
            .contains("  STORE |o..o{ PRODUCT : \"sells\"\n")
            .contains("  ORDER ||--|{ ORDERITEM : \"contains\"\n")
            .contains("  PRODUCT }o..o{ SUPPLIER : \"supplies\"\n")
            .contains("  %% supplies attributes: supply_date, cost\n");
    }

    @Test
    void generate_usesConfiguredTitle() {
        GeneratorConfig titled = new GeneratorConfig("Retail", null, Map.of());

        String content = generator.generate(ErDiagram.empty(), OutputType.MERMAID_ER, titled).content();

        assertThat(content).startsWith("# Retail\n");
    }

    @Test
    void generate_withDirectionSetting_addsDirectionLine() {
        GeneratorConfig leftToRight = new GeneratorConfig(null, null, Map.of("direction", "lr"));

        String content = generator.generate(ErDiagram.empty(), OutputType.MERMAID_ER, leftToRight).content();

        assertThat(content).contains("erDiagram\n  direction LR\n  %% No entities defined\n");
    }

    @Test
    void generate_withUnknownDirection_ignoresSetting() {
        GeneratorConfig sideways = new GeneratorConfig(null, null, Map.of("direction", "diagonal"));

        String content = generator.generate(ErDiagram.empty(), OutputType.MERMAID_ER, sideways).content();

        assertThat(content).doesNotContain("direction");
    }

    @Test
    void generate_entityNames_upperCaseIndependentOfDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            ErDiagram diagram = Parser.parse("Entity invoice:\n  id PK\n");

            String content = generator.generate(diagram, OutputType.MERMAID_ER, config).content();

            assertThat(content).contains("  INVOICE {\n");
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void generate_typedAndForeignKeyAttributes() {
        ErDiagram diagram = Parser.parse("""
            Entity Customer:
              id PK
              full_name: varchar

            Entity Invoice:
              customer_id FK -> Customer.id
              amount

            Entity Empty:
            """);

        String content = generator.generate(diagram, OutputType.MERMAID_ER, config).content();

        assertThat(content)
            .contains("    varchar full_name\n")
            .contains("    string customer_id FK \"references Customer.id\"\n")
            .contains("  EMPTY {\n    string placeholder \"No attributes defined\"\n  }\n");
    }

    @Test
    void generate_skipsRelationshipsToUndeclaredEntities() {
        ErDiagram diagram = Parser.parse("""
            Entity A:
              id PK

            Relation A (1) — (M) Ghost: haunts
            """);

        String content = generator.generate(diagram, OutputType.MERMAID_ER, config).content();

        assertThat(content).doesNotContain("haunts").doesNotContain("GHOST");
    }

    @Test
    void generate_withUnsupportedType_throws() {
        assertThatThrownBy(() -> generator.generate(ErDiagram.empty(), OutputType.DSL, config))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Unsupported output type: DSL");
    }

    @Test
    void generate_withNullDiagram_throws() {
        assertThatThrownBy(() -> generator.generate(null, OutputType.MERMAID_ER, config))
            .isInstanceOf(NullPointerException.class);
    }

    @ParameterizedTest
    @CsvSource({
        "ONE, PARTIAL, |o, o|",
        "ONE, TOTAL, ||, ||",
        "MANY, PARTIAL, }o, o{",
        "MANY, TOTAL, }|, |{"
    })
    void markers_followCardinalityAndParticipation(Cardinality cardinality, Participation participation,
                                                   String left, String right) {
        RelationshipSide side = new RelationshipSide("A", cardinality, participation);

        assertThat(MermaidGenerator.leftMarker(side)).isEqualTo(left);
        assertThat(MermaidGenerator.rightMarker(side)).isEqualTo(right);
    }
}
