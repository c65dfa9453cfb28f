/**
 * Service layer: the LaTeX compiler and the translation services built around it.
 *
 * <p>Service sub-packages:
 * <ul>
 *   <li>{@code service.lexicon} - phrase tables and category priority</li>
 *   <li>{@code service.compiler} - tokenizer, transducer, finalizer and generator</li>
 *   <li>{@code service.stt} - speech engine contract</li>
 *   <li>{@code service.translation} - text and audio translation entry points</li>
 *   <li>{@code service.metrics}, {@code service.health} - operational concerns</li>
 * </ul>
 *
 * <p>Services use constructor injection and throw domain exceptions, never HTTP ones.
 *
 * @since 1.0
 */
package com.phillippitts.speaktolatex.service;
