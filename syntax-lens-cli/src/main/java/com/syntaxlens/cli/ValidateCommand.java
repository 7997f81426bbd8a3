package com.syntaxlens.cli;

import com.syntaxlens.core.css.CssRuleWalker;
import com.syntaxlens.core.javascript.JsTreeWalker;
import com.syntaxlens.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to check the syntax of a CSS or JavaScript file.
 *
 * <p>JavaScript is parsed strictly as a script. Exit codes: 0 valid, 1 invalid,
 * 2 unreadable or unsupported.
 */
@Command(
    name = "validate",
    description = "Check the syntax of a CSS or JavaScript file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Source file to validate")
    private Path file;

    @Override
    public Integer call() {
        Optional<SourceFile> source = SourceFile.read(file);
        if (source.isEmpty()) {
            return ExitCodes.UNSUPPORTED;
        }

        ValidationResult result = validate(source.get());
        if (result == null) {
            log.error("Unsupported file type: {}", file);
            return ExitCodes.UNSUPPORTED;
        }

        PrintWriter out = spec.commandLine().getOut();
        if (result.valid()) {
            out.println("VALID: " + file);
        } else {
            out.println("INVALID: " + file + ": " + result.message());
        }
        out.flush();
        return result.valid() ? ExitCodes.OK : ExitCodes.INVALID;
    }

    private static ValidationResult validate(SourceFile source) {
        switch (source.language()) {
            case CSS:
                return new CssRuleWalker().validateCss(source.content());
            case JAVASCRIPT:
                try (JsTreeWalker walker = new JsTreeWalker()) {
                    return walker.validateSyntax(source.content());
                }
            default:
                return null;
        }
    }
}
