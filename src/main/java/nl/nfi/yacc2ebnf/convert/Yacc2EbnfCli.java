package nl.nfi.yacc2ebnf.convert;

import nl.nfi.yacc2ebnf.grammar.GrammarException;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

import static java.nio.charset.StandardCharsets.UTF_8;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;

@Command(name = "yacc2ebnf", description = "Converts a YACC grammar to W3C EBNF, e.g. for drawing syntax diagrams")
public class Yacc2EbnfCli implements Callable<Integer> {

    @Option(names = {"--input"}, description = "The YACC grammar file to convert", required = true)
    private String inputPath;

    @Option(names = {"--terminals"}, description = "EBNF file defining terminals used by the grammar")
    private String terminalsPath = null;

    @Option(names = {"--output"}, description = "The file to write the EBNF grammar to")
    private String outputPath = "-";

    @Option(names = {"--config"}, description = "INI file with settings, overridden by the other options")
    private String configPath = null;

    @Option(names = {"--width"}, description = "Maximum width of the output lines")
    private Integer width = null;

    @Option(names = {"--no_optimize"}, description = "Print the grammar as converted, without inlining trivial productions")
    private boolean noOptimize = false;

    @Option(names = {"--log_directory_path"}, description = "Directory where to store live and archived log files")
    private String logPath;

    @Option(names = {"--verbose"}, description = "Log debug information to standard error")
    private boolean verbose = false;

    @Override
    public Integer call() throws Exception {
        // must happen before the first logger is created
        if (logPath != null) {
            System.setProperty("LOG_DIRECTORY_PATH", logPath);
        }
        if (verbose) {
            System.setProperty("LOG_LEVEL", "DEBUG");
        }

        try {
            ConverterSettings settings = configPath != null
                ? ConverterSettings.loadFrom(Paths.get(configPath))
                : ConverterSettings.DEFAULT;
            if (width != null) {
                settings = settings.width(width);
            }
            if (noOptimize) {
                settings = settings.optimize(false);
            }

            GrammarConverter converter = GrammarConverter.forGrammar(Paths.get(inputPath)).settings(settings);
            if (terminalsPath != null) {
                converter = converter.terminals(Paths.get(terminalsPath));
            }

            // nothing is written unless the whole conversion succeeded
            final String ebnf = converter.render();
            if (outputPath.equals("-")) {
                System.out.println(ebnf);
                return ExitCode.OK;
            }
            try (final PrintStream output = new PrintStream(new BufferedOutputStream(new FileOutputStream(Paths.get(outputPath).toFile())), false, UTF_8)) {
                output.println(ebnf);
            }
        }
        catch (final GrammarException e) {
            LoggerFactory.getLogger(Yacc2EbnfCli.class).debug("Failed to parse {}", e.sourceName(), e);
            System.err.println("Failed to parse " + e.getMessage());
            return ExitCode.SOFTWARE;
        }
        catch (final IOException | IllegalArgumentException e) {
            LoggerFactory.getLogger(Yacc2EbnfCli.class).debug("Fatal error", e);
            System.err.println("Fatal error: " + e.getMessage());
            return ExitCode.SOFTWARE;
        }

        return ExitCode.OK;
    }
}
