package com.polygen.core.renderer;

/**
 * Interface for delivering generated artifacts to their destination.
 *
 * <p>Renderers take the files produced by generators and write them somewhere: the
 * filesystem, the console, etc. They are discovered via SPI like generators.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.polygen.core.renderer.OutputRenderer}
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer (e.g., "filesystem", "console").
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Renders the generated output.
     *
     * @param output files to render
     * @param context output directory and renderer settings
     * @throws IllegalStateException if rendering fails
     */
    void render(GeneratedOutput output, RenderContext context);
}
