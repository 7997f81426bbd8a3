package com.syntaxlens.cli;

import com.syntaxlens.core.analyzer.SourceAnalyzer;
import com.syntaxlens.core.renderer.ReportRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Command to list available analyzers or renderers.
 *
 * <p>Discovers plugins via Java Service Provider Interface (SPI) and displays
 * their capabilities.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * syntaxlens list analyzers
 * syntaxlens list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available analyzers or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: analyzers or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "analyzers", "analyzer" -> listAnalyzers();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: analyzers or renderers", type);
                yield 1;
            }
        };
    }

    private int listAnalyzers() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Analyzers:");
        out.println();

        boolean found = false;
        for (SourceAnalyzer analyzer : ServiceLoader.load(SourceAnalyzer.class)) {
            found = true;
            out.printf("  • %s (ID: %s)%n", analyzer.getDisplayName(), analyzer.getId());
            out.printf("    Extensions: %s%n", new TreeSet<>(analyzer.getSupportedExtensions()));
            out.println();
        }

        if (!found) {
            out.println("  No analyzers found.");
        }
        out.flush();
        return 0;
    }

    private int listRenderers() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Renderers:");
        out.println();

        boolean found = false;
        for (ReportRenderer renderer : ServiceLoader.load(ReportRenderer.class)) {
            found = true;
            out.printf("  • %s%n", renderer.getId());
        }

        if (!found) {
            out.println("  No renderers found.");
        }
        out.flush();
        return 0;
    }
}
