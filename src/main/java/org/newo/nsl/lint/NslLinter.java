package org.newo.nsl.lint;

import org.newo.nsl.config.LintOptions;
import org.newo.nsl.diagnostics.Diagnostic;
import org.newo.nsl.diagnostics.DiagnosticsEngine;
import org.newo.nsl.frontend.lexer.Lexer;
import org.newo.nsl.frontend.parser.Parser;
import org.newo.nsl.frontend.parser.ast.Program;
import org.newo.nsl.frontend.semantics.SemanticAnalyzer;
import org.newo.nsl.metadata.DeclaredParameters;
import org.newo.nsl.metadata.IParameterSource;
import org.newo.nsl.metadata.SkillMetadataLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs all lint stages on templates and collects their diagnostics.
 * <p>
 * For each template the text-level checks of the {@link LintCheckRegistry} run first. Only if
 * none of them reported an error is the template parsed; if it parses cleanly and declared
 * parameters are available, the {@link SemanticAnalyzer} looks for undefined variables.
 * Syntax errors are not reported here, they surface through the structural checks or when the
 * template is formatted.
 * <p>
 * The linter holds no per-run state and may be shared between threads.
 */
public class NslLinter {

    private static final Logger LOG = LoggerFactory.getLogger(NslLinter.class);

    private final LintOptions options;
    private final IParameterSource parameterSource;
    private final LintCheckRegistry checkRegistry;

    /**
     * Constructs a linter that reads skill metadata next to the templates.
     * @param options The lint options.
     */
    public NslLinter(LintOptions options) {
        this(options, new SkillMetadataLoader(options.fileExtension(), options.metadataSuffixes()));
    }

    /**
     * Constructs a new linter.
     * @param options The lint options.
     * @param parameterSource The source of declared parameters for {@link #lintFile(Path)}.
     */
    public NslLinter(LintOptions options, IParameterSource parameterSource) {
        this.options = Objects.requireNonNull(options, "options");
        this.parameterSource = Objects.requireNonNull(parameterSource, "parameterSource");
        this.checkRegistry = LintCheckRegistry.initialize();
    }

    /**
     * Lints template text.
     * @param fileName The name used in diagnostics.
     * @param content The template text.
     * @param parameters The declared parameters; {@link DeclaredParameters#absent()} skips the variable analysis.
     * @return The diagnostics in report order.
     */
    public List<Diagnostic> lint(String fileName, String content, DeclaredParameters parameters) {
        Objects.requireNonNull(parameters, "parameters");
        return run(fileName, content, () -> parameters);
    }

    /**
     * Lints a template file, loading its declared parameters from the parameter source.
     * A file that cannot be read, or whose metadata is broken, yields a single error.
     * @param file The template file.
     * @return The diagnostics in report order.
     */
    public List<Diagnostic> lintFile(Path file) {
        String fileName = file.toString();
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warn("Cannot read {}: {}", file, e.getMessage());
            return List.of(new Diagnostic(Diagnostic.Type.ERROR, "failed to read file: " + e.getMessage(), fileName, 1));
        }
        return run(fileName, content, () -> parameterSource.load(file));
    }

    /**
     * Lints every template below a directory, using a thread pool of the configured parallelism.
     * @param root The directory to walk.
     * @return The diagnostics of all files, ordered by file path and then by report order.
     * @throws IOException if the directory cannot be walked, or the calling thread is interrupted.
     */
    public List<Diagnostic> lintDirectory(Path root) throws IOException {
        List<Path> files = findTemplates(root);
        LOG.debug("Linting {} template(s) under {}", files.size(), root);
        if (files.isEmpty()) {
            return List.of();
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(options.parallelism(), files.size()));
        try {
            List<Future<List<Diagnostic>>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(executor.submit(() -> lintFile(file)));
            }

            List<Diagnostic> all = new ArrayList<>();
            for (int i = 0; i < files.size(); i++) {
                try {
                    all.addAll(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    LOG.error("Linting {} failed", files.get(i), cause);
                    all.add(new Diagnostic(Diagnostic.Type.ERROR, "lint failed: " + cause, files.get(i).toString(), 1));
                }
            }
            LOG.info("Linted {} template(s): {} diagnostic(s)", files.size(), all.size());
            return all;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while linting " + root, e);
        } finally {
            executor.shutdownNow();
        }
    }

    private List<Path> findTemplates(Path root) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(options.fileExtension()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private List<Diagnostic> run(String fileName, String content, ParameterLookup parameters) {
        SourceFile source = SourceFile.of(fileName, content);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        for (ILintCheck check : checkRegistry.getChecks()) {
            check.check(source, diagnostics);
        }
        if (diagnostics.hasErrors()) {
            return diagnostics.getDiagnostics();
        }

        Parser parser = new Parser(new Lexer(content), options.maxNestingDepth());
        Program program = parser.parseProgram();
        if (!parser.getErrors().isEmpty()) {
            LOG.debug("Skipping variable analysis of {}: {} syntax error(s), first: {}",
                    fileName, parser.getErrors().size(), parser.getErrors().get(0));
            return diagnostics.getDiagnostics();
        }

        DeclaredParameters declared;
        try {
            declared = parameters.get();
        } catch (IOException e) {
            diagnostics.reportError("failed to get declared parameters: " + e.getMessage(), fileName, 1);
            return diagnostics.getDiagnostics();
        }
        if (declared.isPresent()) {
            new SemanticAnalyzer(fileName, declared.names(), diagnostics).analyze(program);
        }
        return diagnostics.getDiagnostics();
    }

    /**
     * Defers metadata loading until the analysis actually needs it.
     */
    @FunctionalInterface
    private interface ParameterLookup {
        DeclaredParameters get() throws IOException;
    }
}
