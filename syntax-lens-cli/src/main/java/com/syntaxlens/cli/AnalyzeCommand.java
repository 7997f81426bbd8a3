package com.syntaxlens.cli;

import com.syntaxlens.core.analyzer.AnalysisContext;
import com.syntaxlens.core.analyzer.AnalysisReport;
import com.syntaxlens.core.analyzer.SourceAnalyzer;
import com.syntaxlens.core.config.AnalyzerConfig;
import com.syntaxlens.core.config.ConfigLoader;
import com.syntaxlens.core.renderer.RenderContext;
import com.syntaxlens.core.renderer.ReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to analyze one source file and print its report.
 *
 * <p>The analyzer is picked by file extension from the analyzers registered via SPI;
 * the renderer by {@code --format}, falling back to {@code output.format} from the
 * configuration file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * syntaxlens analyze src/app.js
 * syntaxlens analyze styles.css --format json --config syntaxlens.yaml
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze a CSS or JavaScript file and print a report",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Source file to analyze")
    private Path file;

    @Option(names = {"-f", "--format"}, description = "Output format: console or json (default: from config)")
    private String format;

    @Option(names = {"-c", "--config"}, description = "Configuration file", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Override
    public Integer call() {
        AnalyzerConfig config = ConfigLoader.load(configFile);

        Optional<SourceFile> source = SourceFile.read(file);
        if (source.isEmpty()) {
            return ExitCodes.UNSUPPORTED;
        }
        AnalysisContext context = new AnalysisContext(file, source.get().content(), config);

        Optional<SourceAnalyzer> analyzer = findAnalyzer(context);
        if (analyzer.isEmpty()) {
            log.error("No analyzer supports {}", file);
            return ExitCodes.UNSUPPORTED;
        }

        String rendererId = format != null ? format : config.output().format();
        Optional<ReportRenderer> renderer = findRenderer(rendererId);
        if (renderer.isEmpty()) {
            log.error("Unknown output format: {}. Use 'syntaxlens list renderers'", rendererId);
            return ExitCodes.UNSUPPORTED;
        }

        log.info("Analyzing {} with {}", file, analyzer.get().getDisplayName());
        AnalysisReport report = analyzer.get().analyze(context);
        renderer.get().render(report, new RenderContext(spec.commandLine().getOut(), config.rendererSettings()));

        return report.success() ? ExitCodes.OK : ExitCodes.INVALID;
    }

    private static Optional<SourceAnalyzer> findAnalyzer(AnalysisContext context) {
        for (SourceAnalyzer analyzer : ServiceLoader.load(SourceAnalyzer.class)) {
            if (analyzer.appliesTo(context)) {
                return Optional.of(analyzer);
            }
        }
        return Optional.empty();
    }

    private static Optional<ReportRenderer> findRenderer(String id) {
        for (ReportRenderer renderer : ServiceLoader.load(ReportRenderer.class)) {
            if (renderer.getId().equalsIgnoreCase(id)) {
                return Optional.of(renderer);
            }
        }
        return Optional.empty();
    }
}
