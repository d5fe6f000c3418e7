package ircube.convert;

import ch.qos.logback.classic.Level;
import ircube.convert.model.BatchReport;
import ircube.convert.model.ConversionResult;
import ircube.convert.preferences.ConverterSettings;
import ircube.convert.service.BatchConverter;
import ircube.convert.service.CubeConversionService;
import ircube.convert.source.CubeSourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line entry point.
 *
 * <pre>
 * java -jar ircube-convert.jar [--config settings.yml] [--log-level LEVEL] &lt;file-or-directory&gt;...
 * </pre>
 *
 * <p>A file argument is converted to {@code <file>-converted.csv}; a directory argument
 * converts every eligible file inside it to {@code <name>_converted.csv}. The exit status is
 * 0 when everything converted, 1 when any conversion failed and 2 for invalid arguments.</p>
 */
@Command(
    name = "ircube-convert",
    mixinStandardHelpOptions = true,
    versionProvider = CubeConvertCli.VersionProvider.class,
    description = "Converts FPA infrared spectral cubes into per-pixel spectral CSV tables."
)
public class CubeConvertCli implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(CubeConvertCli.class);

    private final CubeSourceRegistry registry;
    private final PrintStream out;

    @Option(
        names = "--config",
        paramLabel = "FILE",
        description = "YAML settings overriding the bundled defaults"
    )
    private Path configFile;

    @Option(
        names = "--log-level",
        paramLabel = "LEVEL",
        description = "Converter log level: OFF, ERROR, WARN, INFO, DEBUG or TRACE"
    )
    private String logLevel;

    @Parameters(
        arity = "1..*",
        paramLabel = "PATH",
        description = "Cube files, or directories whose eligible files are converted"
    )
    private List<Path> inputs;

    public CubeConvertCli(CubeSourceRegistry registry, PrintStream out) {
        this.registry = registry;
        this.out = out;
    }

    public static void main(String[] args) {
        int status = new CubeConvertCli(CubeSourceRegistry.withDefaults(), System.out).run(args);
        System.exit(status);
    }

    /**
     * Parses {@code args} and runs the converter, printing usage and errors to this
     * instance's stream.
     *
     * @return process exit status
     */
    public int run(String[] args) {
        PrintWriter writer = new PrintWriter(out, true);
        return new CommandLine(this)
                .setOut(writer)
                .setErr(writer)
                .execute(args);
    }

    @Override
    public Integer call() {
        if (logLevel != null) {
            Logger converterLogger = LoggerFactory.getLogger("ircube.convert");
            if (converterLogger instanceof ch.qos.logback.classic.Logger) {
                ((ch.qos.logback.classic.Logger) converterLogger).setLevel(Level.toLevel(logLevel, Level.INFO));
            } else {
                logger.warn("--log-level needs Logback, ignoring '{}'", logLevel);
            }
        }

        ConverterSettings settings;
        try {
            settings = configFile == null ? ConverterSettings.defaults() : ConverterSettings.load(configFile);
        } catch (IOException e) {
            logger.error("Cannot load settings from {}", configFile, e);
            out.println("Cannot load settings: " + e.getMessage());
            return 1;
        }

        CubeConversionService service = new CubeConversionService(registry, settings);
        BatchConverter batch = new BatchConverter(service);

        boolean ok = true;
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                ok &= runBatch(batch, input);
            } else {
                ok &= runSingle(service, input);
            }
        }
        return ok ? 0 : 1;
    }

    private boolean runSingle(CubeConversionService service, Path input) {
        out.println(input);
        try {
            Path output = service.convert(input);
            out.println("Written " + output);
            return true;
        } catch (IOException | RuntimeException e) {
            logger.error("Conversion of {} failed", input, e);
            out.println("Failed " + input + ": " + e.getMessage());
            return false;
        }
    }

    private boolean runBatch(BatchConverter batch, Path directory) {
        try {
            BatchReport report = batch.convertDirectory(directory);
            for (ConversionResult result : report.getResults()) {
                out.println(result.isSuccess()
                        ? "Written " + result.output()
                        : "Failed " + result.source() + ": " + result.failureMessage());
            }
            out.printf("%d converted, %d failed in %s%n",
                    report.getSuccessCount(), report.getFailureCount(), directory);
            return !report.hasFailures();
        } catch (IOException e) {
            logger.error("Cannot convert directory {}", directory, e);
            out.println("Failed " + directory + ": " + e.getMessage());
            return false;
        }
    }

    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = CubeConvertCli.class.getPackage().getImplementationVersion();
            return new String[]{"ircube-convert " + (version != null ? version : "development")};
        }
    }
}
