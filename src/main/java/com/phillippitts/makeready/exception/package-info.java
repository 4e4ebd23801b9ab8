/**
 * Make-ready exception hierarchy.
 *
 * <ul>
 *   <li>{@link com.phillippitts.makeready.exception.MakeReadyException} - base for all
 *       engine errors</li>
 *   <li>{@link com.phillippitts.makeready.exception.InvalidSourceDocumentException} - a source
 *       document is unusable; fatal for the whole batch</li>
 *   <li>{@link com.phillippitts.makeready.exception.PoleProcessingException} - one pole failed;
 *       skipped or fatal depending on the configured failure policy</li>
 * </ul>
 *
 * <p>Per-wire and per-attribute extraction problems never raise exceptions; the offending
 * value is treated as absent.
 *
 * @see com.phillippitts.makeready.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.makeready.exception;
