package com.polygen.cli;

import com.polygen.core.generator.SchemaGenerator;
import com.polygen.core.renderer.OutputRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available generators or renderers.
 *
 * <p>Discovers plugins via the Java Service Provider Interface.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * polygen list generators
 * polygen list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available generators or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Type to list: generators or renderers")
    private String type;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        int exitCode = switch (type.toLowerCase(Locale.ROOT)) {
            case "generators", "generator" -> listGenerators(out);
            case "renderers", "renderer" -> listRenderers(out);
            default -> {
                log.error("Unknown type: {}. Use: generators or renderers", type);
                spec.commandLine().getErr().println("✗ Unknown type: " + type);
                spec.commandLine().getErr().flush();
                yield 1;
            }
        };
        out.flush();
        return exitCode;
    }

    private int listGenerators(PrintWriter out) {
        out.println("Available Generators:");
        out.println();

        boolean found = false;
        for (SchemaGenerator generator : ServiceLoader.load(SchemaGenerator.class)) {
            found = true;
            out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            out.printf("    File Extension: .%s%n", generator.getFileExtension());
            out.printf("    Artifact Types: %s%n", generator.getSupportedArtifactTypes());
            out.println();
        }

        if (!found) {
            out.println("  No generators found.");
        }
        return 0;
    }

    private int listRenderers(PrintWriter out) {
        out.println("Available Renderers:");
        out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            out.printf("  • %s%n", renderer.getId());
        }

        if (!found) {
            out.println("  No renderers found.");
        }
        return 0;
    }
}
