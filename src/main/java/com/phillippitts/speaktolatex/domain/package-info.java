/**
 * Immutable domain types shared by the compiler and the translation service.
 *
 * <ul>
 *   <li>{@link com.phillippitts.speaktolatex.domain.Token} and
 *       {@link com.phillippitts.speaktolatex.domain.TokenKind} - lexical output of the tokenizer</li>
 *   <li>{@link com.phillippitts.speaktolatex.domain.TranslationResult} - what a client receives
 *       after a speech or text translation</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.speaktolatex.domain;
