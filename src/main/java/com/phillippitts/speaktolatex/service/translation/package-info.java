/**
 * Request-level orchestration around the compiler: input cleaning, audio validation,
 * speech recognition, logging context and metrics.
 */
package com.phillippitts.speaktolatex.service.translation;
