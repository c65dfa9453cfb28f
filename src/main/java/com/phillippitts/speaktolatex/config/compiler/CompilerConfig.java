package com.phillippitts.speaktolatex.config.compiler;

import com.phillippitts.speaktolatex.config.properties.CompilerProperties;
import com.phillippitts.speaktolatex.service.compiler.LatexCompiler;
import com.phillippitts.speaktolatex.service.compiler.MathLatexCompiler;
import com.phillippitts.speaktolatex.service.compiler.MathTokenizer;
import com.phillippitts.speaktolatex.service.lexicon.Lexicon;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the lexicon, tokenizer and compiler. All three are immutable singletons.
 */
@Configuration
public class CompilerConfig {

    private static final Logger LOG = LogManager.getLogger(CompilerConfig.class);

    @Bean
    public Lexicon lexicon() {
        return Lexicon.standard();
    }

    @Bean
    public MathTokenizer mathTokenizer(Lexicon lexicon, CompilerProperties props) {
        return new MathTokenizer(lexicon, props.getMaxPhraseWords());
    }

    @Bean
    public LatexCompiler latexCompiler(MathTokenizer tokenizer, CompilerProperties props) {
        LOG.info("LaTeX compiler ready: maxPhraseWords={}, fillerWords={}",
                props.getMaxPhraseWords(), props.getFillerWords());
        return new MathLatexCompiler(tokenizer, props.fillerWordSet());
    }
}
