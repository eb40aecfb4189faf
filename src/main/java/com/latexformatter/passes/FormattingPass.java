package com.latexformatter.passes;

/**
 * One rewrite stage of the pipeline. Implementations are stateless: the output depends
 * only on the input text and the context, and must be a fixed point of the same pass.
 */
public interface FormattingPass {
    /**
     * Identifier used in configuration and change reports.
     */
    PassId getId();

    /**
     * Rewrites the whole document text.
     */
    String apply(String text, PassContext context);
}
