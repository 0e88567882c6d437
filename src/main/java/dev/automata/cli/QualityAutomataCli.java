package dev.automata.cli;

import ch.qos.logback.classic.Level;
import dev.automata.engine.AutomatonGenerator;
import dev.automata.engine.DefinitionLoader;
import dev.automata.engine.DefinitionValidator;
import dev.automata.model.AutomatonException;
import dev.automata.model.CanonicalAutomaton;
import dev.automata.model.GenerationRequest;
import dev.automata.model.GeneratorLimits;
import dev.automata.model.Quality;
import dev.automata.render.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point: builds the automaton for a set of qualities and prints it.
 *
 * <pre>{@code
 * quality-automata --alphabet ab --starts-with a --ends-with b --test ab --test ba
 * quality-automata --file definition.json --format mermaid
 * }</pre>
 */
@Command(
    name = "quality-automata",
    mixinStandardHelpOptions = true,
    version = "quality-automata 0.1.0",
    description = "Build the deterministic automaton accepting every string that satisfies all given qualities."
)
public class QualityAutomataCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(QualityAutomataCli.class);

    static final String ENGINE_LOGGER = "dev.automata";

    @Spec
    private CommandSpec spec;

    @Option(names = {"-a", "--alphabet"}, description = "Alphabet symbols, e.g. 'ab' (overrides the definition file)")
    private String alphabet;

    @Option(names = "--starts-with", paramLabel = "PATTERN", description = "Accepted strings start with PATTERN")
    private List<String> startsWith = new ArrayList<>();

    @Option(names = "--ends-with", paramLabel = "PATTERN", description = "Accepted strings end with PATTERN")
    private List<String> endsWith = new ArrayList<>();

    @Option(names = "--contains", paramLabel = "PATTERN", description = "Accepted strings contain PATTERN")
    private List<String> contains = new ArrayList<>();

    @Option(names = {"-f", "--file"}, description = "JSON definition with alphabet, qualities and limits")
    private Path file;

    @Option(names = "--format", defaultValue = "TABLE",
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private OutputFormat format;

    @Option(names = {"-t", "--test"}, paramLabel = "WORD", description = "Report whether WORD is accepted")
    private List<String> testWords = new ArrayList<>();

    @Option(names = "--max-states", description = "Override the maxStates limit")
    private Integer maxStates;

    @Option(names = {"-v", "--verbose"}, description = "Log construction details (DEBUG level)")
    private boolean verbose;

    /**
     * Command line configured the way {@link dev.automata.Main} runs it.
     */
    public static CommandLine commandLine() {
        return new CommandLine(new QualityAutomataCli()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        var engineLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(ENGINE_LOGGER);
        Level previous = engineLogger.getLevel();
        if (verbose) {
            engineLogger.setLevel(Level.DEBUG);
        }
        try {
            return generate();
        } finally {
            engineLogger.setLevel(previous);
        }
    }

    private int generate() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        GenerationRequest request;
        try {
            request = buildRequest();
        } catch (IOException e) {
            err.println("Error: failed to read definition " + file + ": " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        List<String> errors = DefinitionValidator.validate(request);
        if (!errors.isEmpty()) {
            errors.forEach(e -> err.println("Error: " + e));
            return 1;
        }

        CanonicalAutomaton automaton;
        try {
            automaton = AutomatonGenerator.generate(request);
        } catch (AutomatonException e) {
            log.debug("Generation failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }

        out.print(format.renderer().render(automaton));
        for (String word : testWords) {
            out.println("%s \"%s\"".formatted(automaton.accepts(word) ? "ACCEPT" : "REJECT", word));
        }
        out.flush();
        return 0;
    }

    private GenerationRequest buildRequest() throws IOException {
        GenerationRequest base = file != null
            ? DefinitionLoader.loadFromFile(file)
            : new GenerationRequest(null, List.of(), null);

        var qualities = new ArrayList<>(base.qualities());
        startsWith.forEach(p -> qualities.add(Quality.startsWith(p)));
        endsWith.forEach(p -> qualities.add(Quality.endsWith(p)));
        contains.forEach(p -> qualities.add(Quality.contains(p)));

        return new GenerationRequest(
            alphabet != null ? alphabet : base.alphabet(),
            qualities,
            maxStates != null ? new GeneratorLimits(maxStates) : base.limits()
        );
    }
}
