/**
 * Log4j2 ThreadContext setup for HTTP requests.
 *
 * <p>MDC keys:
 * <ul>
 *   <li>{@code requestId} - set by {@link com.phillippitts.speaktolatex.config.logging.MdcFilter}</li>
 *   <li>{@code translationId} - set by the translation service for one translation</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.speaktolatex.config.logging;
