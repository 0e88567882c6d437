package dev.automata.render;

/**
 * Output formats available on the command line.
 */
public enum OutputFormat {
    TABLE(new TransitionTableRenderer()),
    MERMAID(new MermaidRenderer()),
    JSON(new JsonRenderer());

    private final AutomatonRenderer renderer;

    OutputFormat(AutomatonRenderer renderer) {
        this.renderer = renderer;
    }

    public AutomatonRenderer renderer() {
        return renderer;
    }
}
