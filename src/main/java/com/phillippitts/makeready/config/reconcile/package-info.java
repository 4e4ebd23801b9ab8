/**
 * Registers one attribute reconciler per conflict strategy.
 */
package com.phillippitts.makeready.config.reconcile;
