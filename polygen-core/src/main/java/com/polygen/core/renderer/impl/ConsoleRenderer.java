package com.polygen.core.renderer.impl;

import com.polygen.core.renderer.GeneratedFile;
import com.polygen.core.renderer.GeneratedOutput;
import com.polygen.core.renderer.OutputRenderer;
import com.polygen.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Renderer that prints generated files to the console, used for dry runs.
 *
 * <p>Files are listed in output order under a {@code [generator]} heading taken from
 * the first segment of their relative path.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "true")</li>
 *   <li>{@code console.separator} - Custom separator between files (default: "---")</li>
 *   <li>{@code console.showHeaders} - Show file headers ("true"/"false", default: "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    public static final String COLORS_SETTING = "console.colors";
    public static final String SEPARATOR_SETTING = "console.separator";
    public static final String HEADERS_SETTING = "console.showHeaders";

    private static final String DEFAULT_SEPARATOR = "---";

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
        boolean useColors = context.flag(COLORS_SETTING, true);
        String separator = context.setting(SEPARATOR_SETTING, DEFAULT_SEPARATOR);
        boolean showHeaders = context.flag(HEADERS_SETTING, true);

        logger.info("Rendering {} files to console (colors: {}, headers: {})",
                output.files().size(), useColors, showHeaders);

        String summaryColor = useColors ? ANSI_BOLD + ANSI_GREEN : "";
        out.println(summaryColor + "Generated " + output.files().size() + " file(s)" + reset(useColors));
        out.println();
        printSeparator(separator, useColors);

        String currentGenerator = null;
        for (int i = 0; i < output.files().size(); i++) {
            GeneratedFile file = output.files().get(i);
            String generator = generatorOf(file);
            if (showHeaders && !generator.equals(currentGenerator)) {
                out.println();
                out.println(summaryColor + "[" + generator + "]" + reset(useColors));
                currentGenerator = generator;
            }
            out.println();
            if (showHeaders) {
                printFileHeader(file, i + 1, output.files().size(), useColors);
            }
            out.println(file.content());
            printSeparator(separator, useColors);
        }

        out.flush();
        logger.info("Successfully rendered {} files to console", output.files().size());
    }

    /**
     * Generator id of a file, taken from the first path segment.
     */
    private static String generatorOf(GeneratedFile file) {
        int slash = file.relativePath().indexOf('/');
        return slash > 0 ? file.relativePath().substring(0, slash) : ".";
    }

    private void printFileHeader(GeneratedFile file, int index, int total, boolean useColors) {
        String pathColor = useColors ? ANSI_BOLD + ANSI_CYAN : "";
        String metaColor = useColors ? ANSI_YELLOW : "";

        out.println(pathColor + "File " + index + "/" + total + ": " + file.relativePath() + reset(useColors));
        if (file.contentType() != null && !file.contentType().isEmpty()) {
            out.println(metaColor + "Type: " + file.contentType() + reset(useColors));
        }
        out.println(metaColor + "Size: " + file.content().getBytes(StandardCharsets.UTF_8).length + " bytes" + reset(useColors));
        out.println();
    }

    /**
     * Prints a separator line of about 80 characters.
     */
    private void printSeparator(String separator, boolean useColors) {
        String color = useColors ? ANSI_YELLOW : "";
        int repeatCount = Math.max(1, 80 / Math.max(1, separator.length()));
        out.println(color + separator.repeat(repeatCount) + reset(useColors));
    }

    private static String reset(boolean useColors) {
        return useColors ? ANSI_RESET : "";
    }
}
