/**
 * Proposed riser and guy counts.
 */
package com.phillippitts.makeready.service.equipment;
