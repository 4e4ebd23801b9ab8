/**
 * Stateless helpers for heights, owners, pole ids and JSON tree traversal.
 */
package com.phillippitts.makeready.util;
