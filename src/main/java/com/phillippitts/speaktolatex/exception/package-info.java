/**
 * Application exception hierarchy.
 *
 * <ul>
 *   <li>{@link com.phillippitts.speaktolatex.exception.SpeakToLatexException} - base type</li>
 *   <li>{@link com.phillippitts.speaktolatex.exception.InvalidInputException} - blank text request</li>
 *   <li>{@link com.phillippitts.speaktolatex.exception.InvalidAudioException} - missing, empty
 *       or oversized recording</li>
 *   <li>{@link com.phillippitts.speaktolatex.exception.TranscriptionException} - speech
 *       recognition unavailable or failed</li>
 * </ul>
 *
 * <p>The compiler itself never throws; these cover the request edges around it. HTTP status
 * mapping lives in {@code GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.speaktolatex.exception;
