/**
 * Natural-language math to LaTeX compiler.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>{@link com.phillippitts.speaktolatex.service.compiler.MathTokenizer} - greedy
 *       longest-phrase tokenization against the lexicon</li>
 *   <li>{@link com.phillippitts.speaktolatex.service.compiler.MathTransducer} - one-pass state
 *       machine with a context stack and a bounds accumulator</li>
 *   <li>{@link com.phillippitts.speaktolatex.service.compiler.ConstructFinalizer} - closes
 *       whatever is still open at end of input</li>
 *   <li>{@link com.phillippitts.speaktolatex.service.compiler.LatexGenerator} - joins fragments</li>
 * </ol>
 *
 * <p>The compiler is total: malformed input degrades into best-effort LaTeX with balanced
 * delimiters, never an exception.
 */
package com.phillippitts.speaktolatex.service.compiler;
