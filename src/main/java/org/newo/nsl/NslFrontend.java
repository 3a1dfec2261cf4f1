package org.newo.nsl;

import org.newo.nsl.api.ITemplateFrontend;
import org.newo.nsl.api.ParseResult;
import org.newo.nsl.config.LintOptions;
import org.newo.nsl.diagnostics.Diagnostic;
import org.newo.nsl.frontend.lexer.Lexer;
import org.newo.nsl.frontend.parser.Parser;
import org.newo.nsl.frontend.parser.ast.Program;
import org.newo.nsl.frontend.printer.AstPrinter;
import org.newo.nsl.lint.NslLinter;
import org.newo.nsl.metadata.DeclaredParameters;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The main entry point of the NSL template front end. It wires the lexer, parser, printer and
 * linter together. Instances hold only immutable configuration and are thread-safe.
 */
public class NslFrontend implements ITemplateFrontend {

    private final LintOptions options;
    private final NslLinter linter;

    /**
     * Constructs a front end with the options from {@code reference.conf}.
     */
    public NslFrontend() {
        this(LintOptions.defaults());
    }

    /**
     * Constructs a new front end.
     * @param options The lint options.
     */
    public NslFrontend(LintOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.linter = new NslLinter(options);
    }

    @Override
    public ParseResult parse(String content) {
        Parser parser = new Parser(new Lexer(content), options.maxNestingDepth());
        Program program = parser.parseProgram();
        return new ParseResult(program, parser.getErrors());
    }

    @Override
    public Optional<String> format(String content) {
        ParseResult result = parse(content);
        if (!result.isSuccessful()) {
            return Optional.empty();
        }
        return Optional.of(new AstPrinter().print(result.program()));
    }

    @Override
    public List<Diagnostic> lint(String fileName, String content, DeclaredParameters parameters) {
        return linter.lint(fileName, content, parameters);
    }
}
