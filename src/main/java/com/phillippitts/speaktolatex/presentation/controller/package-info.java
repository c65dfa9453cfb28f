/**
 * REST controllers.
 *
 * <p>Controllers extract request data, delegate to
 * {@link com.phillippitts.speaktolatex.service.translation.LatexTranslationService} and leave
 * exception mapping to {@code GlobalExceptionHandler}.
 *
 * @since 1.0
 */
package com.phillippitts.speaktolatex.presentation.controller;
