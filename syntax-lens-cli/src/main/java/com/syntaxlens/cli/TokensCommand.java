package com.syntaxlens.cli;

import com.syntaxlens.core.javascript.JsParseException;
import com.syntaxlens.core.javascript.JsTreeWalker;
import com.syntaxlens.core.model.JsToken;
import com.syntaxlens.core.model.SourceLanguage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to print the tokens of a JavaScript file, one per line as
 * {@code line:column<TAB>type<TAB>value}.
 */
@Command(
    name = "tokens",
    description = "Print the tokens of a JavaScript file",
    mixinStandardHelpOptions = true
)
public class TokensCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TokensCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "JavaScript file")
    private Path file;

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

        List<JsToken> tokens;
        try (JsTreeWalker walker = new JsTreeWalker()) {
            tokens = walker.tokenize(source.get().content());
        } catch (JsParseException e) {
            log.error("{}: {}", file, e.getMessage());
            return ExitCodes.INVALID;
        }

        PrintWriter out = spec.commandLine().getOut();
        for (JsToken token : tokens) {
            String position = token.loc() != null && token.loc().start() != null
                ? token.loc().start().line() + ":" + token.loc().start().column()
                : "?";
            out.println(position + "\t" + token.type() + "\t" + token.value());
        }
        out.flush();
        return ExitCodes.OK;
    }
}
