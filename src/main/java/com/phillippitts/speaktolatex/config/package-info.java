/**
 * Spring configuration: bound properties, compiler wiring and the logging filter.
 */
package com.phillippitts.speaktolatex.config;
