/**
 * Report assembly: the batch entry point, the per-pole pipeline and the final attacher list.
 */
package com.phillippitts.makeready.service.report;
