package com.syntaxlens;

import ch.qos.logback.classic.Level;
import com.syntaxlens.cli.AnalyzeCommand;
import com.syntaxlens.cli.AstCommand;
import com.syntaxlens.cli.FormatCommand;
import com.syntaxlens.cli.ListCommand;
import com.syntaxlens.cli.TokensCommand;
import com.syntaxlens.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;

/**
 * Main CLI entry point for syntax-lens.
 *
 * <p>syntax-lens parses CSS and JavaScript sources and reports their structure:
 * selectors, declarations, media queries and colors for stylesheets; functions,
 * variables, classes, imports, exports, dependencies and complexity for scripts.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyze a source file and print a report</li>
 *   <li>{@code validate} - Check the syntax of a source file</li>
 *   <li>{@code format} - Minify or prettify a stylesheet</li>
 *   <li>{@code ast} - Print the syntax tree of a script as JSON</li>
 *   <li>{@code tokens} - Print the tokens of a script</li>
 *   <li>{@code list} - List available analyzers or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * syntaxlens analyze app.js --format json
 * syntaxlens validate styles.css
 * syntaxlens format styles.css --minify
 * syntaxlens -v ast app.js --module
 * }</pre>
 */
@Command(
    name = "syntaxlens",
    mixinStandardHelpOptions = true,
    version = "syntax-lens 1.0.0-SNAPSHOT",
    description = "Structural analysis of CSS and JavaScript sources",
    subcommands = {
        AnalyzeCommand.class,
        ValidateCommand.class,
        FormatCommand.class,
        AstCommand.class,
        TokensCommand.class,
        ListCommand.class
    }
)
public class SyntaxLensCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SyntaxLensCLI.class);

    @Spec
    private CommandSpec spec;

    private boolean verbose;
    private boolean quiet;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    void setVerbose(boolean verbose) {
        this.verbose = verbose;
        configureLogging();
    }

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    void setQuiet(boolean quiet) {
        this.quiet = quiet;
        configureLogging();
    }

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        PrintWriter out = spec.commandLine().getOut();
        out.println("syntax-lens - Structural analysis of CSS and JavaScript sources");
        out.println("Version: 1.0.0-SNAPSHOT");
        out.println();
        out.println("Use 'syntaxlens --help' to see available commands");
        out.println("Use 'syntaxlens <command> --help' for command-specific help");
        out.flush();
    }

    /**
     * Configures logging level based on global options.
     *
     * <p>Runs as the options are parsed, so the level also applies to subcommands.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new SyntaxLensCLI()).execute(args);
        System.exit(exitCode);
    }
}
