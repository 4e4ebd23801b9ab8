/**
 * Neutral conductor detection and below-neutral filtering.
 */
package com.phillippitts.makeready.service.neutral;
