package com.syntaxlens.cli;

import com.syntaxlens.core.javascript.JsParseException;
import com.syntaxlens.core.javascript.JsTreeWalker;
import com.syntaxlens.core.javascript.ParseResult;
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
 * Command to print the ESTree syntax tree of a JavaScript file as JSON.
 */
@Command(
    name = "ast",
    description = "Print the syntax tree of a JavaScript file as JSON",
    mixinStandardHelpOptions = true
)
public class AstCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AstCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "JavaScript file")
    private Path file;

    @Option(names = "--module", description = "Parse as an ES module")
    private boolean module;

    @Option(names = "--jsx", description = "Accept JSX")
    private boolean jsx;

    @Option(names = "--indent", description = "Spaces per level, 0 for one line (default: ${DEFAULT-VALUE})", defaultValue = "2")
    private int indent;

    @Override
    public Integer call() {
        Optional<SourceFile> source = SourceFile.read(file);
        if (source.isEmpty()) {
            return ExitCodes.UNSUPPORTED;
        }
        if (!source.get().is(SourceLanguage.JAVASCRIPT)) {
            log.error("Not a JavaScript file: {}", file);
            return ExitCodes.UNSUPPORTED;
        }

        try (JsTreeWalker walker = new JsTreeWalker()) {
            String content = source.get().content();
            ParseResult result = module
                ? walker.parseModule(content, jsx)
                : walker.parse(content, jsx, true);

            PrintWriter out = spec.commandLine().getOut();
            out.println(walker.toJson(result, indent));
            out.flush();
            return ExitCodes.OK;
        } catch (JsParseException e) {
            log.error("{}: {}", file, e.getMessage());
            return ExitCodes.INVALID;
        }
    }
}
