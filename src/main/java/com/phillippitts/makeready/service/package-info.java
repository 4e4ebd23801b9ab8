/**
 * Service layer of the make-ready reconciliation engine.
 *
 * <p>Sub-packages, in pipeline order:
 * <ul>
 *   <li>{@code source} - document parsing, validation and shared indices</li>
 *   <li>{@code survey} - trace and wire access over the survey document</li>
 *   <li>{@code attribute}, {@code reconcile} - pole attributes and conflict strategies</li>
 *   <li>{@code attachment} - per-source attachment extraction and consolidation</li>
 *   <li>{@code neutral} - governing neutral and below-neutral filtering</li>
 *   <li>{@code span} - connections, reference spans and the backspan</li>
 *   <li>{@code midspan} - proposed midspan clearance</li>
 *   <li>{@code equipment} - proposed riser and guy counts</li>
 *   <li>{@code report} - batch entry point and report assembly</li>
 *   <li>{@code metrics} - Micrometer instrumentation</li>
 * </ul>
 */
package com.phillippitts.makeready.service;
