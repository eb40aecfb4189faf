package com.latexformatter.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.latexformatter.api.DocumentDiff;
import com.latexformatter.api.FormatResult;
import com.latexformatter.api.LatexFormatter;
import com.latexformatter.api.error.Diagnostic;
import com.latexformatter.api.error.DiagnosticKind;
import com.latexformatter.api.error.InternalConsistencyException;
import com.latexformatter.api.error.Severity;
import com.latexformatter.config.FormatterConfig;
import com.latexformatter.passes.PassContext;
import com.latexformatter.passes.PassId;
import com.latexformatter.passes.PassPipeline;
import com.latexformatter.patterns.PatternSet;
import com.latexformatter.patterns.PatternStore;
import com.latexformatter.protect.ProtectedText;
import com.latexformatter.protect.Protector;
import com.latexformatter.syntax.CrossReferenceChecker;
import com.latexformatter.syntax.SyntaxChecker;
import com.latexformatter.util.LoggerUtil;

/**
 * Thread-safe implementation of the LaTeX formatter.
 * This class orchestrates protection, the pass pipeline and restoration for one
 * document at a time; any number of documents may be formatted concurrently.
 */
public class LatexFormatterEngine implements LatexFormatter, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(LatexFormatterEngine.class);

    private final FormatterConfig config;
    private final PatternStore patternStore;
    private final PassPipeline pipeline;
    private final SyntaxChecker syntaxChecker;
    private final CrossReferenceChecker crossReferenceChecker;

    private final AtomicInteger processedCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    /**
     * Creates a formatter with the standard pipeline, loading patterns from the
     * configured pattern directory or the built-in defaults.
     */
    public LatexFormatterEngine(FormatterConfig config) {
        this(config, new PatternStore(config.getPatternConfigDir()), PassPipeline.standard());
    }

    public LatexFormatterEngine(FormatterConfig config, PatternStore patternStore, PassPipeline pipeline) {
        this.config = config;
        this.patternStore = patternStore;
        this.pipeline = pipeline;
        this.syntaxChecker = new SyntaxChecker(config.getOpaqueEnvironments());
        this.crossReferenceChecker = new CrossReferenceChecker(config.getOpaqueEnvironments());
        logger.info("LaTeX formatter initialized with passes " + config.getEnabledPasses());
    }

    @Override
    public FormatResult format(String text) {
        return format(text, config.getEnabledPasses());
    }

    /**
     * Formats a document running only the given passes, in pipeline order.
     */
    public FormatResult format(String text, Set<PassId> passes) {
        processedCount.incrementAndGet();
        // One snapshot per document, so a pattern reload never affects a running format
        PatternSet patterns = patternStore.current();

        try {
            ProtectedText protectedText = new Protector(patterns).protect(text);
            List<Diagnostic> diagnostics = _checkProtected(protectedText);

            PassContext context = new PassContext(config, patterns.getMathPatterns(), protectedText);
            PassPipeline.Result result = pipeline.run(protectedText.getText(), context, passes);
            String output = Protector.restore(result.getText(), protectedText);
            diagnostics.addAll(context.getNotes());

            successCount.incrementAndGet();
            return FormatResult.builder()
                    .successful(true)
                    .outputText(output)
                    .changed(!output.equals(text))
                    .diagnostics(diagnostics)
                    .appliedChanges(result.getChanges())
                    .build();
        } catch (InternalConsistencyException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Internal consistency failure, document left unchanged", e);
            return _failure(text, "Internal consistency failure: " + e.getMessage());
        } catch (Exception e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error formatting document", e);
            return _failure(text, "Unexpected error: " + e.getMessage());
        }
    }

    @Override
    public boolean check(String text) {
        FormatResult result = format(text);
        return result.isSuccessful() && !result.isChanged();
    }

    @Override
    public DocumentDiff diff(String documentName, String text) {
        FormatResult result = format(text);
        return UnifiedDiff.compute(documentName, text, result.getOutputText());
    }

    @Override
    public List<Diagnostic> checkSyntax(String text) {
        ProtectedText protectedText = new Protector(patternStore.current()).protect(text);
        return _checkProtected(protectedText);
    }

    private List<Diagnostic> _checkProtected(ProtectedText protectedText) {
        List<Diagnostic> diagnostics = new ArrayList<>(syntaxChecker.check(protectedText));
        if (config.isValidateCrossReferences()) {
            diagnostics.addAll(crossReferenceChecker.check(protectedText));
        }
        return diagnostics;
    }

    /**
     * Reloads the pattern files if they changed on disk. Documents already being
     * formatted keep the patterns they started with.
     */
    public boolean reloadPatterns() {
        return patternStore.reloadIfChanged();
    }

    private static FormatResult _failure(String text, String message) {
        return FormatResult.builder()
                .successful(false)
                .outputText(text)
                .changed(false)
                .addDiagnostic(new Diagnostic(Severity.FATAL, DiagnosticKind.INTERNAL_CONSISTENCY, message, 1, 1))
                .build();
    }

    public FormatterConfig getConfig() {
        return config;
    }

    public PatternStore getPatternStore() {
        return patternStore;
    }

    /**
     * Gets the number of documents processed.
     */
    public int getProcessedCount() {
        return processedCount.get();
    }

    /**
     * Gets the number of successfully formatted documents.
     */
    public int getSuccessCount() {
        return successCount.get();
    }

    /**
     * Gets the number of documents that could not be formatted.
     */
    public int getErrorCount() {
        return errorCount.get();
    }

    @Override
    public void close() {
        logger.info("Closing formatter: processed=" + processedCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());
    }
}
