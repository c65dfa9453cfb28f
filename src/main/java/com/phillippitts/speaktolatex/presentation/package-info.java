/**
 * REST surface. Controllers delegate to services; errors are shaped by the global handler.
 */
package com.phillippitts.speaktolatex.presentation;
