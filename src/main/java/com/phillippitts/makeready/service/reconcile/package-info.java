/**
 * Conflict strategies for attribute values reported by both documents.
 */
package com.phillippitts.makeready.service.reconcile;
