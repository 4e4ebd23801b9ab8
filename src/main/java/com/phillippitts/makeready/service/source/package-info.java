/**
 * Document validation and the per-batch lookup index.
 */
package com.phillippitts.makeready.service.source;
