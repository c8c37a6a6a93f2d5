package com.polygen.core;

import com.polygen.core.imports.ImportResolver;
import com.polygen.core.imports.InMemorySourceReader;
import com.polygen.core.imports.MergedSchema;
import com.polygen.core.imports.ResolutionResult;
import com.polygen.core.ir.IrBuilder;
import com.polygen.core.ir.SchemaIr;
import com.polygen.core.pipeline.CompilationPipeline;
import com.polygen.core.pipeline.CompilationResult;
import com.polygen.core.validation.ValidationOptions;

import java.nio.file.Path;

/**
 * Shared helpers that compile in-memory schema text for tests.
 */
public final class SchemaFixtures {

    public static final String MAIN = "main.poly";

    /** Player, Skill and the PlayerSkill junction between them. */
    public static final String GAME = """
        namespace game {
            /// A player account.
            table Player {
                id: u32 primary_key auto_increment;
                name: string unique max_length(32);
                guild_id: u32? foreign_key(Guild.id);
                element: Element;
            }

            table Guild {
                id: u32 primary_key;
                name: string;
            }

            table Skill {
                id: u32 primary_key;
                name: string;
            }

            table PlayerSkill {
                player_id: u32 foreign_key(Player.id);
                skill_id: u32 foreign_key(target: Skill.id, as: "users");
            }

            enum Element { Fire, Water = 5, Earth }
        }
        """;

    private SchemaFixtures() {
    }

    /**
     * Builds a reader from alternating path/content pairs.
     */
    public static InMemorySourceReader reader(String... pathsAndContents) {
        InMemorySourceReader reader = new InMemorySourceReader();
        for (int i = 0; i < pathsAndContents.length; i += 2) {
            reader.add(pathsAndContents[i], pathsAndContents[i + 1]);
        }
        return reader;
    }

    public static MergedSchema merge(String text) {
        ResolutionResult result = new ImportResolver(reader(MAIN, text)).resolve(Path.of(MAIN));
        return result.mergedSchema()
            .orElseThrow(() -> new AssertionError("Resolution failed: " + result.diagnostics()));
    }

    public static CompilationResult compile(String text) {
        return compile(text, ValidationOptions.defaults());
    }

    public static CompilationResult compile(String text, ValidationOptions options) {
        return new CompilationPipeline(reader(MAIN, text), options).compile(Path.of(MAIN));
    }

    /**
     * Compiles text that is expected to be valid.
     */
    public static SchemaIr ir(String text) {
        CompilationResult result = compile(text);
        return result.schemaIr()
            .orElseThrow(() -> new AssertionError("Compilation failed: " + result.diagnostics()));
    }

    /**
     * Builds IR straight from the merged schema, skipping validation.
     */
    public static SchemaIr irWithoutValidation(String text) {
        return new IrBuilder().build(merge(text));
    }
}
