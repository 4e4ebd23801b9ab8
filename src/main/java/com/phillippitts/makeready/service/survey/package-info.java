/**
 * Read access to the survey document: trace lookup, wire metadata and heights, pole labels and
 * the wires photographed at poles and on spans.
 *
 * <p>Nothing in this package throws on a malformed wire or attribute; unreadable values are
 * treated as absent and logged at DEBUG.
 */
package com.phillippitts.makeready.service.survey;
