package com.erdforge.cli;

import com.erdforge.core.dsl.DslSyntaxException;
import com.erdforge.core.dsl.Parser;
import com.erdforge.core.model.ErDiagram;
import com.erdforge.core.model.RelationshipNode;
import com.erdforge.core.model.RelationshipSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Parses a DSL document and reports its size or the first syntax error.
 *
 * <p>Relationships naming undeclared entities are reported as warnings; they do not fail
 * validation.
 */
@Command(
    name = "validate",
    description = "Check a DSL document for syntax errors",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "DSL file to validate")
    private Path file;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            log.info("Validating DSL document: {}", file);
            ErDiagram diagram = Parser.parse(Files.readString(file, StandardCharsets.UTF_8));

            for (RelationshipNode relationship : diagram.relationships()) {
                warnIfUndeclared(out, diagram, relationship, relationship.left());
                warnIfUndeclared(out, diagram, relationship, relationship.right());
            }

            out.printf("✓ %s is valid: %d entities, %d relationships%n",
                file, diagram.entities().size(), diagram.relationships().size());
            return 0;
        } catch (DslSyntaxException e) {
            log.error("Syntax error in {}: {}", file, e.getMessage());
            err.printf("✗ Syntax error in %s at line %d, column %d: %s%n",
                file, e.getLine(), e.getColumn(), e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Failed to read {}", file, e);
            err.println("✗ Cannot read " + file + ": " + e.getMessage());
            return 1;
        }
    }

    private static void warnIfUndeclared(PrintWriter out, ErDiagram diagram, RelationshipNode relationship,
                                         RelationshipSide side) {
        if (diagram.findEntity(side.entityName()).isEmpty()) {
            out.printf("⚠ Relationship '%s' references undeclared entity '%s'%n",
                relationship.name(), side.entityName());
        }
    }
}
