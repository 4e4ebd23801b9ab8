/**
 * Spring configuration for the report engine.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - {@code makeready.report.*} settings</li>
 *   <li>{@code config.reconcile} - conflict strategy registry</li>
 *   <li>{@code config.report} - report pipeline wiring</li>
 *   <li>{@code config.logging} - per-batch ThreadContext entries</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.makeready.config;
