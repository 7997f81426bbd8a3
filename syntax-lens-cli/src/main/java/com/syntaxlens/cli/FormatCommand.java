package com.syntaxlens.cli;

import com.syntaxlens.core.config.AnalyzerConfig;
import com.syntaxlens.core.config.ConfigLoader;
import com.syntaxlens.core.css.CssFormatter;
import com.syntaxlens.core.css.CssGrammar;
import com.syntaxlens.core.model.SourceLanguage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to minify or prettify a stylesheet.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * syntaxlens format styles.css
 * syntaxlens format styles.css --indent "    "
 * syntaxlens format styles.css --minify
 * }</pre>
 */
@Command(
    name = "format",
    description = "Minify or prettify a CSS file",
    mixinStandardHelpOptions = true
)
public class FormatCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FormatCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Stylesheet to format")
    private Path file;

    @Option(names = {"-m", "--minify"}, description = "Write compact output instead of one declaration per line")
    private boolean minify;

    @Option(names = {"-i", "--indent"}, description = "Declaration indent (default: from config)")
    private String indent;

    @Option(names = {"-c", "--config"}, description = "Configuration file", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Override
    public Integer call() {
        Optional<SourceFile> source = SourceFile.read(file);
        if (source.isEmpty()) {
            return ExitCodes.UNSUPPORTED;
        }
        if (!source.get().is(SourceLanguage.CSS)) {
            log.error("Only CSS files can be formatted: {}", file);
            return ExitCodes.UNSUPPORTED;
        }

        AnalyzerConfig config = ConfigLoader.load(configFile);
        CssFormatter formatter = new CssFormatter(new CssGrammar(config.css().browserCompliant()));
        String content = source.get().content();

        PrintWriter out = spec.commandLine().getOut();
        if (minify) {
            out.println(formatter.minify(content));
        } else {
            out.print(formatter.prettify(content, indent != null ? indent : config.css().indent()));
        }
        out.flush();
        return ExitCodes.OK;
    }
}
