/**
 * Vocabulary of spoken mathematics.
 *
 * <p>{@link com.phillippitts.speaktolatex.service.lexicon.Lexicon} maps phrases to token
 * categories and canonical LaTeX. Overlapping phrases are resolved by
 * {@link com.phillippitts.speaktolatex.service.lexicon.CategoryPriority}, an explicit ordered
 * list, never by map iteration order.
 */
package com.phillippitts.speaktolatex.service.lexicon;
