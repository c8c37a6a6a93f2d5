package com.polygen.core.pipeline;

import com.polygen.core.generator.ArtifactType;
import com.polygen.core.generator.GeneratedArtifact;
import com.polygen.core.generator.GeneratorConfig;
import com.polygen.core.generator.SchemaGenerator;
import com.polygen.core.ir.SchemaIr;
import com.polygen.core.renderer.GeneratedFile;
import com.polygen.core.renderer.GeneratedOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs generators over a shared, immutable {@link SchemaIr}.
 *
 * <p>Every (generator, artifact type) pair is a separate task on a fixed thread pool.
 * Results are collected in generator order, then artifact type order, regardless of
 * which task finishes first. A failing generator fails the whole run.
 */
public class GenerationService {

    private static final Logger log = LoggerFactory.getLogger(GenerationService.class);

    private final List<SchemaGenerator> generators;
    private final int parallelism;

    public GenerationService(List<SchemaGenerator> generators) {
        this(generators, Math.max(1, Runtime.getRuntime().availableProcessors()));
    }

    public GenerationService(List<SchemaGenerator> generators, int parallelism) {
        this.generators = List.copyOf(Objects.requireNonNull(generators, "generators must not be null"));
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        this.parallelism = parallelism;
    }

    /**
     * Discovers all generators via SPI.
     *
     * @return generators in service-file order
     */
    public static List<SchemaGenerator> discoverGenerators() {
        log.debug("Discovering schema generators via ServiceLoader");
        List<SchemaGenerator> discovered = new ArrayList<>();
        ServiceLoader.load(SchemaGenerator.class).forEach(discovered::add);
        log.info("Discovered {} schema generators", discovered.size());
        return discovered;
    }

    /**
     * Keeps the generators whose id is listed, in discovery order.
     *
     * @param generators available generators
     * @param ids requested ids; empty selects all
     * @return selected generators
     * @throws IllegalArgumentException if an id matches no generator
     */
    public static List<SchemaGenerator> select(List<SchemaGenerator> generators, Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.copyOf(generators);
        }
        for (String id : ids) {
            if (generators.stream().noneMatch(g -> g.getId().equals(id))) {
                throw new IllegalArgumentException("Unknown generator: " + id);
            }
        }
        return generators.stream().filter(g -> ids.contains(g.getId())).toList();
    }

    /**
     * Runs every generator for every artifact type it supports.
     *
     * @param ir resolved schema
     * @param config generator configuration
     * @return generated files under {@code <generatorId>/}
     * @throws IllegalStateException if a generator fails
     */
    public GeneratedOutput generate(SchemaIr ir, GeneratorConfig config) {
        Objects.requireNonNull(ir, "ir must not be null");
        Objects.requireNonNull(config, "config must not be null");

        ExecutorService executor = Executors.newFixedThreadPool(parallelism);
        try {
            List<Task> tasks = new ArrayList<>();
            for (SchemaGenerator generator : generators) {
                List<ArtifactType> types = generator.getSupportedArtifactTypes().stream()
                    .sorted(Comparator.naturalOrder())
                    .toList();
                for (ArtifactType type : types) {
                    log.debug("Scheduling {} for {}", generator.getId(), type);
                    tasks.add(new Task(generator, type, executor.submit(() -> generator.generate(ir, type, config))));
                }
            }

            List<GeneratedFile> files = new ArrayList<>();
            for (Task task : tasks) {
                files.add(GeneratedFile.of(task.generator().getId(), await(task)));
            }
            log.info("Generated {} artifacts with {} generators", files.size(), generators.size());
            return new GeneratedOutput(files);
        } finally {
            executor.shutdownNow();
        }
    }

    private GeneratedArtifact await(Task task) {
        try {
            return task.future().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while generating " + task.type(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Generator " + task.generator().getId() + " failed for "
                + task.type() + ": " + e.getCause().getMessage(), e.getCause());
        }
    }

    private record Task(SchemaGenerator generator, ArtifactType type, Future<GeneratedArtifact> future) {
    }
}
