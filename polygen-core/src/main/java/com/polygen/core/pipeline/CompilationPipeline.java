package com.polygen.core.pipeline;

import com.polygen.core.diagnostic.Diagnostic;
import com.polygen.core.imports.FileSystemSourceReader;
import com.polygen.core.imports.ImportResolver;
import com.polygen.core.imports.MergedSchema;
import com.polygen.core.imports.ResolutionResult;
import com.polygen.core.imports.SchemaSourceReader;
import com.polygen.core.ir.IrBuilder;
import com.polygen.core.ir.SchemaIr;
import com.polygen.core.validation.SchemaValidator;
import com.polygen.core.validation.ValidationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the front end of the compiler: import resolution, validation and IR build.
 *
 * <p>Stages run one after the other on the calling thread. A stage that reports an
 * error stops the run; warnings are collected and passed through.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CompilationPipeline pipeline = new CompilationPipeline(new FileSystemSourceReader(), ValidationOptions.defaults());
 * CompilationResult result = pipeline.compile(Paths.get("schemas/game.poly"));
 * result.schemaIr().ifPresent(ir -> ...);
 * }</pre>
 */
public class CompilationPipeline {

    private static final Logger log = LoggerFactory.getLogger(CompilationPipeline.class);

    private final ImportResolver importResolver;
    private final SchemaValidator validator;
    private final IrBuilder irBuilder;

    public CompilationPipeline() {
        this(new FileSystemSourceReader(), ValidationOptions.defaults());
    }

    public CompilationPipeline(SchemaSourceReader reader, ValidationOptions options) {
        this(new ImportResolver(reader), new SchemaValidator(options), new IrBuilder());
    }

    public CompilationPipeline(ImportResolver importResolver, SchemaValidator validator, IrBuilder irBuilder) {
        this.importResolver = Objects.requireNonNull(importResolver, "importResolver must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.irBuilder = Objects.requireNonNull(irBuilder, "irBuilder must not be null");
    }

    /**
     * Compiles the schema rooted at {@code entry} into IR.
     *
     * @param entry entry schema file
     * @return IR plus warnings, or the diagnostics that stopped the run
     */
    public CompilationResult compile(Path entry) {
        return run(entry, true);
    }

    /**
     * Resolves and validates the schema without building IR.
     *
     * @param entry entry schema file
     * @return diagnostics; the result never carries IR
     */
    public CompilationResult validate(Path entry) {
        return run(entry, false);
    }

    private CompilationResult run(Path entry, boolean buildIr) {
        Objects.requireNonNull(entry, "entry must not be null");
        log.info("Compiling schema: {}", entry);

        ResolutionResult resolution = importResolver.resolve(entry);
        if (!resolution.isSuccess()) {
            log.info("Import resolution failed with {} diagnostics", resolution.diagnostics().size());
            return new CompilationResult(null, resolution.diagnostics());
        }
        MergedSchema merged = resolution.mergedSchema().orElseThrow();

        List<Diagnostic> diagnostics = new ArrayList<>(validator.validate(merged));
        if (Diagnostic.hasErrors(diagnostics)) {
            log.info("Validation failed with {} diagnostics", diagnostics.size());
            return new CompilationResult(null, diagnostics);
        }
        log.info("Validation passed ({} warnings)", diagnostics.size());

        if (!buildIr) {
            return new CompilationResult(null, diagnostics);
        }
        SchemaIr ir = irBuilder.build(merged);
        return new CompilationResult(ir, diagnostics);
    }
}
