package com.latexformatter.core;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.latexformatter.api.DocumentDiff;
import com.latexformatter.api.FormatMode;
import com.latexformatter.api.FormatResult;
import com.latexformatter.api.LatexFormatter;
import com.latexformatter.api.error.Diagnostic;
import com.latexformatter.api.error.DiagnosticKind;
import com.latexformatter.api.error.Severity;
import com.latexformatter.util.LoggerUtil;

/**
 * Applies a formatter to a set of documents, optionally on a fixed thread pool.
 * Documents share nothing but the formatter's read-only patterns, and a failure in one
 * document never stops the others.
 */
public class BatchRunner {
    private static final Logger logger = LoggerUtil.getLogger(BatchRunner.class);

    private final LatexFormatter formatter;
    private final int threadCount;

    public BatchRunner(LatexFormatter formatter) {
        this(formatter, Runtime.getRuntime().availableProcessors());
    }

    public BatchRunner(LatexFormatter formatter, int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1, got " + threadCount);
        }
        this.formatter = formatter;
        this.threadCount = threadCount;
    }

    /**
     * Processes every document and returns the outcomes in input order.
     */
    public BatchResult run(List<LatexDocument> documents, FormatMode mode, boolean parallel) {
        logger.info("Processing " + documents.size() + " documents in " + mode + " mode"
                + (parallel ? " with " + threadCount + " threads" : ""));

        List<DocumentOutcome> outcomes = parallel && documents.size() > 1
                ? _runParallel(documents, mode)
                : _runSequential(documents, mode);

        BatchResult result = new BatchResult(outcomes);
        logger.info("Processed " + outcomes.size() + " documents, " + result.getFailureCount() + " unsuccessful");
        return result;
    }

    private List<DocumentOutcome> _runSequential(List<LatexDocument> documents, FormatMode mode) {
        List<DocumentOutcome> outcomes = new ArrayList<>(documents.size());
        for (LatexDocument document : documents) {
            outcomes.add(_processSafely(document, mode));
        }
        return outcomes;
    }

    private List<DocumentOutcome> _runParallel(List<LatexDocument> documents, FormatMode mode) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threadCount, documents.size()));
        List<DocumentOutcome> outcomes = new ArrayList<>(documents.size());
        try {
            List<Future<DocumentOutcome>> futures = new ArrayList<>(documents.size());
            for (LatexDocument document : documents) {
                futures.add(executor.submit(() -> _process(document, mode)));
            }

            for (int i = 0; i < futures.size(); i++) {
                LatexDocument document = documents.get(i);
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    logger.log(Level.WARNING, "Failed to process " + document.getId(), e.getCause());
                    outcomes.add(_failed(document, mode, "Unexpected error: " + e.getCause()));
                } catch (InterruptedException e) {
                    logger.log(Level.WARNING, "Processing interrupted", e);
                    Thread.currentThread().interrupt();
                    outcomes.add(_failed(document, mode, "Processing interrupted"));
                }
            }
        } finally {
            // Shutdown executor and wait for all tasks to complete
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.MINUTES)) {
                    logger.warning("Timeout waiting for document processing to complete");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                logger.log(Level.WARNING, "Processing interrupted", e);
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }
        return outcomes;
    }

    private DocumentOutcome _processSafely(LatexDocument document, FormatMode mode) {
        try {
            return _process(document, mode);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to process " + document.getId(), e);
            return _failed(document, mode, "Unexpected error: " + e);
        }
    }

    private DocumentOutcome _process(LatexDocument document, FormatMode mode) {
        FormatResult result = formatter.format(document.getText());
        DocumentDiff diff = mode == FormatMode.DIFF
                ? UnifiedDiff.compute(document.getId(), document.getText(), result.getOutputText())
                : null;
        boolean successful = result.isSuccessful() && (mode != FormatMode.CHECK || !result.isChanged());

        if (result.isSuccessful()) {
            logger.fine("Processed " + document.getId() + (result.isChanged() ? " (changed)" : " (unchanged)"));
        } else {
            logger.warning("Failed to format " + document.getId());
        }
        return new DocumentOutcome(document.getId(), mode, result, diff, successful);
    }

    private static DocumentOutcome _failed(LatexDocument document, FormatMode mode, String message) {
        FormatResult result = FormatResult.builder()
                .successful(false)
                .outputText(document.getText())
                .changed(false)
                .addDiagnostic(new Diagnostic(Severity.FATAL, DiagnosticKind.INTERNAL_CONSISTENCY, message, 1, 1))
                .build();
        return new DocumentOutcome(document.getId(), mode, result, null, false);
    }
}
