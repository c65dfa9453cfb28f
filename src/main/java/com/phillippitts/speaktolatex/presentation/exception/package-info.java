/**
 * REST exception mapping.
 *
 * <table>
 *   <caption>Status codes</caption>
 *   <tr><th>Exception</th><th>Status</th></tr>
 *   <tr><td>InvalidInputException, bean validation, unreadable JSON</td><td>400</td></tr>
 *   <tr><td>InvalidAudioException</td><td>400</td></tr>
 *   <tr><td>TranscriptionException</td><td>503</td></tr>
 *   <tr><td>anything else</td><td>500</td></tr>
 * </table>
 */
package com.phillippitts.speaktolatex.presentation.exception;
