package com.polygen.cli;

import com.polygen.core.config.ConfigLoader;
import com.polygen.core.config.ProjectConfig;
import com.polygen.core.generator.SchemaGenerator;
import com.polygen.core.imports.FileSystemSourceReader;
import com.polygen.core.ir.SchemaIr;
import com.polygen.core.pipeline.CompilationPipeline;
import com.polygen.core.pipeline.CompilationResult;
import com.polygen.core.pipeline.GenerationService;
import com.polygen.core.renderer.GeneratedOutput;
import com.polygen.core.renderer.OutputRenderer;
import com.polygen.core.renderer.RenderContext;
import com.polygen.core.renderer.impl.FileSystemRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to compile a schema and render generated artifacts.
 *
 * <p><b>Workflow:</b>
 * <ol>
 *   <li>Load {@code polygen.yaml} (defaults when absent)</li>
 *   <li>Parse, resolve imports, validate and build IR; print every diagnostic</li>
 *   <li>Stop with exit code 1 if any error was reported</li>
 *   <li>Run the enabled generators and hand the files to a renderer</li>
 * </ol>
 *
 * <p>Command-line options override the configuration file.
 */
@Command(
    name = "compile",
    description = "Compile a schema and generate artifacts",
    mixinStandardHelpOptions = true
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Entry schema file (default: 'schema' from the config)")
    private Path schema;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: nearest polygen.yaml)")
    private Path configFile;

    @Option(names = {"-o", "--output"}, description = "Output directory")
    private Path outputDir;

    @Option(names = {"-g", "--generators"}, split = ",", description = "Generator IDs to run (default: all enabled)")
    private List<String> generatorIds;

    @Option(names = "--dry-run", description = "Print generated files instead of writing them")
    private boolean dryRun;

    @Option(names = "--clean", description = "Empty the output directory before writing")
    private boolean clean;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            Path configPath = configFile != null ? configFile : ConfigSupport.locate();
            ProjectConfig config = ConfigLoader.load(configPath);
            Path entry = schema != null ? schema : ConfigLoader.schemaPath(config, configPath).orElse(null);
            if (entry == null) {
                err.println("✗ No schema given and none configured in " + configPath);
                err.flush();
                return 1;
            }

            CompilationPipeline pipeline =
                new CompilationPipeline(new FileSystemSourceReader(), config.validation().toOptions());
            CompilationResult result = pipeline.compile(entry);
            DiagnosticPrinter.print(result, out, err);
            if (result.hasErrors()) {
                return 1;
            }

            SchemaIr ir = result.schemaIr()
                .orElseThrow(() -> new IllegalStateException("Compilation produced no IR"));
            out.println("✓ Compiled " + entry + ": " + ir.tables().size() + " table(s), "
                + ir.relationships().size() + " relationship(s)");

            List<SchemaGenerator> generators = GenerationService.select(
                GenerationService.discoverGenerators(), enabledGenerators(config));
            GeneratedOutput output = new GenerationService(generators)
                .generate(ir, config.generators().toGeneratorConfig());

            Path directory = outputDir != null ? outputDir : ConfigLoader.outputDirectory(config, configPath);
            boolean cleanOutput = clean || config.output().isClean();
            RenderContext context = new RenderContext(
                directory.toString(), Map.of(FileSystemRenderer.CLEAN_SETTING, String.valueOf(cleanOutput)));

            findRenderer(dryRun ? "console" : "filesystem").render(output, context);
            if (!dryRun) {
                out.println("✓ Wrote " + output.files().size() + " file(s) to " + directory);
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            log.error("Compilation failed", e);
            err.println("✗ Compilation failed: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private List<String> enabledGenerators(ProjectConfig config) {
        if (generatorIds != null && !generatorIds.isEmpty()) {
            return generatorIds;
        }
        return config.generators().enabled();
    }

    private static OutputRenderer findRenderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return renderer;
            }
        }
        throw new IllegalStateException("Renderer not found: " + id);
    }
}
