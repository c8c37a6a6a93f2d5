package com.polygen.cli;

import com.polygen.core.config.ConfigLoader;
import com.polygen.core.config.ProjectConfig;
import com.polygen.core.imports.FileSystemSourceReader;
import com.polygen.core.ir.DataSourceSpec;
import com.polygen.core.ir.DataSourceType;
import com.polygen.core.ir.SchemaIr;
import com.polygen.core.ir.TableIr;
import com.polygen.core.loader.DataLoadException;
import com.polygen.core.loader.DataSourceLoader;
import com.polygen.core.pipeline.CompilationPipeline;
import com.polygen.core.pipeline.CompilationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to check a schema without generating anything.
 *
 * <p>Runs parsing, import resolution and validation and prints every diagnostic.
 * With {@code --check-data} the schema is compiled and every Map data source is loaded,
 * so duplicate primary keys across data files are caught before generation.
 * Exits with 1 when any error is reported.
 */
@Command(
    name = "validate",
    description = "Validate a schema and print diagnostics",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Entry schema file")
    private Path schema;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: nearest polygen.yaml)")
    private Path configFile;

    @Option(names = "--check-data", description = "Also load every @load(type: \"Map\") source and check primary-key uniqueness")
    private boolean checkData;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            ProjectConfig config = ConfigLoader.load(configFile != null ? configFile : ConfigSupport.locate());
            CompilationPipeline pipeline =
                new CompilationPipeline(new FileSystemSourceReader(), config.validation().toOptions());
            CompilationResult result = checkData ? pipeline.compile(schema) : pipeline.validate(schema);

            DiagnosticPrinter.print(result, out, err);
            if (result.hasErrors()) {
                return 1;
            }
            out.println("✓ Schema is valid: " + schema);
            if (checkData && !checkDataSources(result.schemaIr().orElseThrow(), out, err)) {
                return 1;
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            log.error("Validation failed", e);
            err.println("✗ Validation failed: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private boolean checkDataSources(SchemaIr ir, PrintWriter out, PrintWriter err) {
        DataSourceLoader loader = new DataSourceLoader();
        boolean ok = true;
        for (TableIr table : ir.tables().values()) {
            DataSourceSpec source = table.options().load();
            if (source == null || source.type() != DataSourceType.MAP) {
                continue;
            }
            try {
                int rows = loader.load(table).size();
                out.println("✓ " + table.fqn() + ": " + rows + " row(s) from " + source.path());
            } catch (DataLoadException e) {
                log.debug("Data check failed for {}", table.fqn(), e);
                err.println("✗ " + table.fqn() + ": " + e.getMessage());
                ok = false;
            }
        }
        out.flush();
        err.flush();
        return ok;
    }
}
