/**
 * Presentation layer: the JSON report endpoint and its exception mapping.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers for API endpoints</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; loading files, sessions and spreadsheet rendering live
 * outside this application.
 */
package com.phillippitts.makeready.presentation;
