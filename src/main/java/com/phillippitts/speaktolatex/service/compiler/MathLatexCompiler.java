package com.phillippitts.speaktolatex.service.compiler;

import com.phillippitts.speaktolatex.domain.Token;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Default {@link LatexCompiler}: tokenizes, runs a fresh {@link MathTransducer} over the
 * tokens and joins the resulting fragments.
 *
 * <p>Holds only immutable collaborators, so a single instance serves concurrent callers.
 */
public final class MathLatexCompiler implements LatexCompiler {

    private static final Logger LOG = LogManager.getLogger(MathLatexCompiler.class);

    private final MathTokenizer tokenizer;
    private final Set<String> fillerWords;
    private final LatexGenerator generator = new LatexGenerator();

    public MathLatexCompiler(MathTokenizer tokenizer, Set<String> fillerWords) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.fillerWords = Set.copyOf(Objects.requireNonNull(fillerWords, "fillerWords"));
    }

    @Override
    public String compile(String text) {
        List<Token> tokens = tokenizer.tokenize(text);
        if (tokens.isEmpty()) {
            return "";
        }
        MathTransducer transducer = new MathTransducer(fillerWords);
        for (Token token : tokens) {
            transducer.accept(token);
        }
        String latex = generator.generate(transducer.finish());
        LOG.debug("Compiled {} tokens into {} LaTeX chars", tokens.size(), latex.length());
        return latex;
    }
}
