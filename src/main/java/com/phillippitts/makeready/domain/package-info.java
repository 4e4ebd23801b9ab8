/**
 * Immutable domain model of the make-ready report.
 *
 * <p>All heights are inches. Records validate themselves in their compact constructors and
 * render to the list-of-mappings shape consumed by report renderers through {@code toMap()}.
 *
 * <ul>
 *   <li>{@link com.phillippitts.makeready.domain.AttachmentRecord} - a wire or equipment item
 *       with existing/proposed heights and a midspan value</li>
 *   <li>{@link com.phillippitts.makeready.domain.SpanHeader} - header row of a backspan or
 *       reference-span block</li>
 *   <li>{@link com.phillippitts.makeready.domain.PoleReport} - the final per-pole record</li>
 *   <li>{@link com.phillippitts.makeready.domain.ConflictStrategy} - survey/engineering
 *       conflict resolution selector</li>
 * </ul>
 */
package com.phillippitts.makeready.domain;
