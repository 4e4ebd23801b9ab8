/**
 * Connection traversal: primary-span heights, reference spans, the backspan and per-span
 * mid-span clearances.
 */
package com.phillippitts.makeready.service.span;
