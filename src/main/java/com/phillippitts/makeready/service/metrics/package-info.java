/**
 * Micrometer metrics for report batches.
 */
package com.phillippitts.makeready.service.metrics;
