/**
 * Proposed midspan clearance.
 */
package com.phillippitts.makeready.service.midspan;
