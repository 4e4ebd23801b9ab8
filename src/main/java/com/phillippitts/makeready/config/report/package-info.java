/**
 * Wires the extraction, neutral, midspan and classification components into the report service.
 */
package com.phillippitts.makeready.config.report;
