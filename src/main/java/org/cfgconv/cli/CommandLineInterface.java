package org.cfgconv.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.cfgconv.ConfigConverter;
import org.cfgconv.api.IConverter;
import org.cfgconv.api.SyntaxException;
import org.cfgconv.config.ConfigLoader;
import org.cfgconv.config.LoggingConfigurator;
import org.cfgconv.model.Document;
import org.cfgconv.output.JsonDocumentWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "cfgconv",
    mixinStandardHelpOptions = true,
    version = "cfgconv 1.0",
    description = "Converts a configuration file into JSON."
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);
    private static final String STDIN_NAME = "<stdin>";

    @Parameters(
        index = "0",
        arity = "0..1",
        paramLabel = "INPUT",
        description = "Configuration file to convert (default: standard input)"
    )
    private File inputFile;

    @Option(
        names = {"-o", "--output"},
        paramLabel = "PATH",
        description = "Output JSON file, parent directories are created (default: output.json)"
    )
    private Path outputPath;

    @Option(
        names = {"-c", "--config"},
        description = "Path to an additional HOCON configuration file"
    )
    private File configFile;

    @Option(
        names = {"-q", "--quiet"},
        description = "Do not print the JSON to standard output"
    )
    private boolean quiet;

    @Spec
    private CommandSpec spec;

    private final IConverter converter;
    private final InputStream stdin;

    public CommandLineInterface() {
        this(new ConfigConverter(), System.in);
    }

    /**
     * Creates the command with an explicit converter and standard input stream.
     * @param converter The converter to run.
     * @param stdin The stream read when no input file is given.
     */
    public CommandLineInterface(IConverter converter, InputStream stdin) {
        this.converter = converter;
        this.stdin = stdin;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        final Config config;
        try {
            config = ConfigLoader.load(configFile);
        } catch (ConfigException e) {
            spec.commandLine().getErr().println("Failed to load or parse configuration: " + e.getMessage());
            return 1;
        }
        LoggingConfigurator.configure(config);

        final String sourceName;
        final String source;
        try {
            if (inputFile != null && inputFile.isFile()) {
                sourceName = inputFile.getPath();
                source = Files.readString(inputFile.toPath(), StandardCharsets.UTF_8);
                LOGGER.info("Loaded {}", sourceName);
            } else {
                if (inputFile != null) {
                    LOGGER.warn("Input file {} not found, reading standard input instead.", inputFile.getPath());
                }
                sourceName = STDIN_NAME;
                source = new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
                if (source.isBlank()) {
                    spec.commandLine().getErr().println("Input is empty.");
                    return 1;
                }
            }
        } catch (IOException e) {
            spec.commandLine().getErr().println("Failed to read input: " + e.getMessage());
            return 1;
        }

        LOGGER.info("Parsing {}", sourceName);
        final Document document;
        try {
            document = converter.convert(source, sourceName);
        } catch (SyntaxException e) {
            spec.commandLine().getErr().println("Syntax error: " + e.getMessage());
            return 1;
        }

        final Path target = outputPath != null ? outputPath : Path.of(config.getString("converter.output.default-path"));
        final JsonDocumentWriter writer = new JsonDocumentWriter(config.getInt("converter.output.indent"));
        try {
            writer.write(document, target);
            LOGGER.info("Saved {}", target);
            if (!quiet && config.getBoolean("converter.output.echo")) {
                spec.commandLine().getOut().println(writer.toJson(document));
            }
        } catch (IOException e) {
            spec.commandLine().getErr().println("Failed to write " + target + ": " + e.getMessage());
            return 1;
        }
        return 0;
    }
}
